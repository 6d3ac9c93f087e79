package com.newsinsight.refresh.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.Map;

public record NewsSourceCreateRequest(
        @NotBlank(message = "Name is required") @Size(max = 255) String name,
        @NotBlank(message = "Source type is required") @Size(max = 50) String type,
        String url,
        @Size(max = 100) String category,
        Boolean enabled,
        Map<String, Object> customConfig,
        String notes
) {
    public NewsSourceCreateRequest {
        enabled = enabled == null ? Boolean.TRUE : enabled;
        customConfig = customConfig == null ? Map.of() : Map.copyOf(customConfig);
    }
}
