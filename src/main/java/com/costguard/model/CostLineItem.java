package com.costguard.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Raw priced resource as supplied by the provider layer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CostLineItem {

    private String resourceId;

    /**
     * Full resource type, e.g. "aws:ec2/instance".
     */
    private String resourceType;

    private double monthlyCost;

    private Map<String, String> tags;
}
