package com.newsinsight.refresh.collector;

import com.newsinsight.refresh.entity.SourceStatus;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only view of a news source, taken at the start of a round.
 * Rounds and collectors never see the managed entity itself.
 */
public record SourceSnapshot(
        Long id,
        String name,
        String type,
        String url,
        String category,
        boolean enabled,
        Map<String, Object> customConfig,
        SourceStatus status,
        String lastError,
        LocalDateTime lastCheckedTime,
        int consecutiveErrorCount
) {
    public SourceSnapshot {
        // config values may legitimately be null, so Map.copyOf is not usable here
        customConfig = customConfig == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(customConfig));
        status = status == null ? SourceStatus.UNCHECKED : status;
    }

    public static SourceSnapshot of(Long id, String name, String type, String url) {
        return new SourceSnapshot(id, name, type, url, null, true, Map.of(),
                SourceStatus.UNCHECKED, null, null, 0);
    }

    public boolean hasUrl() {
        return url != null && !url.isBlank();
    }

    public String configString(String key, String defaultValue) {
        Object value = customConfig.get(key);
        if (value == null) {
            return defaultValue;
        }
        String text = value.toString();
        return text.isBlank() ? defaultValue : text;
    }

    public int configInt(String key, int defaultValue) {
        Object value = customConfig.get(key);
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Integer.parseInt(text.trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    public SourceSnapshot withConsecutiveErrorCount(int count) {
        return new SourceSnapshot(id, name, type, url, category, enabled, customConfig,
                status, lastError, lastCheckedTime, count);
    }
}
