package com.costguard.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Pagination part of a cache key. Only included in the key when present.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaginationKeyParams {
    private int limit;
    private int offset;
    private String sortField;
    private String sortOrder;
}
