package com.newsinsight.refresh.dto;

import java.util.Set;

public record RefreshStateDTO(
        boolean refreshing,
        boolean checkingStatus,
        long totalSources,
        long enabledSources,
        Set<String> collectorTypes,
        int eventSubscribers
) {
}
