package com.newsinsight.refresh.dto;

import jakarta.validation.constraints.Size;

import java.util.Map;

/**
 * Partial update; null fields are left unchanged. Health fields are not updatable.
 */
public record NewsSourceUpdateRequest(
        @Size(max = 255) String name,
        @Size(max = 50) String type,
        String url,
        @Size(max = 100) String category,
        Boolean enabled,
        Map<String, Object> customConfig,
        String notes
) {
}
