package com.nosota.flywheel.api.dto;

import java.util.List;

/**
 * One page of a longer result list.
 *
 * @param content       Items of the current page
 * @param page          Zero-based page number
 * @param size          Requested page size
 * @param totalElements Total number of items across all pages
 */
public record PagedResponse<T>(
        List<T> content,
        int page,
        int size,
        long totalElements
) {}
