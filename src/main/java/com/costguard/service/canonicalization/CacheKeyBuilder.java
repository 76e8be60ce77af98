package com.costguard.service.canonicalization;

import com.costguard.model.PaginationKeyParams;
import com.costguard.model.QueryKeyParams;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fluent builder for query key parameters.
 *
 * Filters merge across calls; a later value for the same key replaces the earlier one.
 */
public class CacheKeyBuilder {

    private final CacheKeyGenerator generator;
    private final String operation;
    private final String provider;
    private final List<String> resourceTypes = new ArrayList<>();
    private final Map<String, String> filters = new LinkedHashMap<>();
    private PaginationKeyParams pagination;

    CacheKeyBuilder(CacheKeyGenerator generator, String operation, String provider) {
        this.generator = generator;
        this.operation = operation;
        this.provider = provider;
    }

    public CacheKeyBuilder withResourceTypes(String... types) {
        resourceTypes.addAll(Arrays.asList(types));
        return this;
    }

    public CacheKeyBuilder withFilter(String key, String value) {
        filters.put(key, value);
        return this;
    }

    public CacheKeyBuilder withFilters(Map<String, String> values) {
        if (values != null) {
            filters.putAll(values);
        }
        return this;
    }

    public CacheKeyBuilder withPagination(int limit, int offset, String sortField, String sortOrder) {
        this.pagination = PaginationKeyParams.builder()
                .limit(limit)
                .offset(offset)
                .sortField(sortField)
                .sortOrder(sortOrder)
                .build();
        return this;
    }

    /**
     * Snapshot of the accumulated parameters.
     */
    public QueryKeyParams buildParams() {
        return QueryKeyParams.builder()
                .operation(operation)
                .provider(provider)
                .resourceTypes(new ArrayList<>(resourceTypes))
                .filters(new LinkedHashMap<>(filters))
                .pagination(pagination)
                .build();
    }

    public String build() {
        return generator.generateKey(buildParams());
    }
}
