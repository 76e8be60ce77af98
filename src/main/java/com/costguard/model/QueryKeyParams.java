package com.costguard.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Structured description of a cost query, used to derive its cache key.
 *
 * Operation and provider casing, resource type order, filter insertion order
 * and sort order casing do not affect the generated key.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class QueryKeyParams {

    /**
     * Query operation, e.g. "projected_cost", "actual_cost", "recommendations".
     */
    private String operation;

    private String provider;

    private List<String> resourceTypes;

    private Map<String, String> filters;

    /**
     * Optional; null means the query is not paginated.
     */
    private PaginationKeyParams pagination;
}
