package com.costguard.model.budget;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Attribution of one resource's cost to every scope it matched.
 * The cost is counted in full against each scope; this is a fan-out, not a partition.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BudgetAllocation {

    private String resourceId;

    private String resourceType;

    /**
     * Provider extracted from the resource type.
     */
    private String provider;

    private double cost;

    /**
     * "global", "provider:aws", "tag:team:platform", "type:aws:ec2/instance".
     */
    @Builder.Default
    private List<String> allocatedScopes = new ArrayList<>();

    /**
     * Every tag selector that matched, highest priority first.
     */
    @Builder.Default
    private List<String> matchedTags = new ArrayList<>();

    /**
     * Selector that received the cost, null if none matched.
     */
    private String selectedTagBudget;

    @Builder.Default
    private List<String> warnings = new ArrayList<>();
}
