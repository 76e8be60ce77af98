package com.costguard.service.canonicalization;

import com.costguard.model.PaginationKeyParams;
import com.costguard.model.QueryKeyParams;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Canonicalizes query key parameters for stable cache keys.
 *
 * Steps:
 * 1. Trim and lower-case operation and provider
 * 2. Sort (and de-duplicate) resource types
 * 3. Sort filters by key
 * 4. Lower-case pagination sort order; omit pagination when absent
 * 5. Serialize as JSON with keys in sorted order
 *
 * Target: Same logical query → same canonical form → same hash
 */
@Slf4j
@Service
public class QueryKeyCanonicalizer {

    private final ObjectMapper objectMapper;

    public QueryKeyCanonicalizer() {
        // Own mapper: the canonical form must not change with application-wide mapper settings
        this.objectMapper = new ObjectMapper();
        this.objectMapper.configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
    }

    /**
     * Generate canonical JSON string for query parameters.
     *
     * @param params query key parameters
     * @return canonical JSON string
     * @throws JsonProcessingException if serialization fails
     */
    public String canonicalize(QueryKeyParams params) throws JsonProcessingException {
        return objectMapper.writeValueAsString(toCanonicalMap(params));
    }

    /**
     * Build the canonical tree. TreeMaps keep every level in key order.
     */
    Map<String, Object> toCanonicalMap(QueryKeyParams params) {
        Map<String, Object> canonical = new TreeMap<>();

        canonical.put("operation", normalize(params.getOperation()));
        canonical.put("provider", normalize(params.getProvider()));

        Set<String> resourceTypes = sortedTypes(params.getResourceTypes());
        if (!resourceTypes.isEmpty()) {
            canonical.put("resource_types", resourceTypes);
        }

        Map<String, String> filters = sortedFilters(params.getFilters());
        if (!filters.isEmpty()) {
            canonical.put("filters", filters);
        }

        PaginationKeyParams pagination = params.getPagination();
        if (pagination != null) {
            Map<String, Object> page = new TreeMap<>();
            page.put("limit", pagination.getLimit());
            page.put("offset", pagination.getOffset());
            page.put("sort_field", pagination.getSortField() == null ? "" : pagination.getSortField());
            page.put("sort_order", pagination.getSortOrder() == null
                    ? "" : pagination.getSortOrder().toLowerCase(Locale.ROOT));
            canonical.put("pagination", page);
        }

        return canonical;
    }

    /**
     * Null entries carry no key material and are dropped.
     */
    private static Set<String> sortedTypes(Collection<String> types) {
        Set<String> sorted = new TreeSet<>();
        if (types != null) {
            types.stream().filter(Objects::nonNull).forEach(sorted::add);
        }
        return sorted;
    }

    /**
     * Filters with a null key are dropped.
     */
    private static Map<String, String> sortedFilters(Map<String, String> filters) {
        Map<String, String> sorted = new TreeMap<>();
        if (filters != null) {
            filters.forEach((key, value) -> {
                if (key != null) {
                    sorted.put(key, value);
                }
            });
        }
        return sorted;
    }

    private String normalize(String value) {
        if (value == null) {
            return "";
        }
        return value.trim().toLowerCase(Locale.ROOT);
    }
}
