package com.costguard.service;

import com.costguard.model.CostLineItem;
import com.costguard.model.QueryKeyParams;

import java.util.List;

/**
 * Supplies priced resources for a query. Called only on a cache miss.
 */
public interface CostSource {

    List<CostLineItem> fetchCosts(QueryKeyParams params);
}
