package com.costguard.model.budget;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Category of a budget scope.
 */
public enum ScopeType {
    /**
     * Budget every resource counts toward.
     */
    GLOBAL("global"),

    /**
     * Per cloud provider (aws, gcp, azure).
     */
    PROVIDER("provider"),

    /**
     * Tag selector budget with priority ordering.
     */
    TAG("tag"),

    /**
     * Exact resource type, e.g. "aws:ec2/instance".
     */
    TYPE("type");

    private final String prefix;

    ScopeType(String prefix) {
        this.prefix = prefix;
    }

    @JsonValue
    public String getPrefix() {
        return prefix;
    }

    /**
     * Scope identifier: "global", or "provider:aws", "tag:team:platform", "type:aws:ec2/instance".
     */
    public String identifier(String scopeKey) {
        if (this == GLOBAL) {
            return prefix;
        }
        return prefix + ":" + scopeKey;
    }
}
