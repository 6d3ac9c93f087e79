package com.newsinsight.refresh.dto;

import java.util.List;

/**
 * Body of POST /api/v1/refresh. Empty or missing sourceIds means all enabled sources.
 */
public record RefreshRequest(List<Long> sourceIds) {
    public RefreshRequest {
        sourceIds = sourceIds == null ? List.of() : List.copyOf(sourceIds);
    }
}
