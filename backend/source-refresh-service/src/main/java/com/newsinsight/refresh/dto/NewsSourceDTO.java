package com.newsinsight.refresh.dto;

import com.newsinsight.refresh.entity.SourceStatus;

import java.time.LocalDateTime;
import java.util.Map;

public record NewsSourceDTO(
        Long id,
        String name,
        String type,
        String url,
        String category,
        Boolean enabled,
        Map<String, Object> customConfig,
        String notes,
        Boolean userAdded,
        SourceStatus status,
        String lastError,
        LocalDateTime lastCheckedTime,
        Integer consecutiveErrorCount,
        LocalDateTime lastRefreshedAt,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
    public NewsSourceDTO {
        customConfig = customConfig == null ? Map.of() : Map.copyOf(customConfig);
    }
}
