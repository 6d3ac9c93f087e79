package com.newsinsight.refresh.mapper;

import com.newsinsight.refresh.dto.NewsSourceCreateRequest;
import com.newsinsight.refresh.dto.NewsSourceDTO;
import com.newsinsight.refresh.dto.NewsSourceUpdateRequest;
import com.newsinsight.refresh.entity.NewsSource;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Locale;

@Component
public class EntityMapper {

    public NewsSourceDTO toDTO(NewsSource source) {
        return new NewsSourceDTO(
                source.getId(),
                source.getName(),
                source.getType(),
                source.getUrl(),
                source.getCategory(),
                source.getEnabled(),
                source.getCustomConfig(),
                source.getNotes(),
                source.getUserAdded(),
                source.getStatus(),
                source.getLastError(),
                source.getLastCheckedTime(),
                source.getConsecutiveErrorCount(),
                source.getLastRefreshedAt(),
                source.getCreatedAt(),
                source.getUpdatedAt()
        );
    }

    public NewsSource toEntity(NewsSourceCreateRequest request) {
        NewsSource.NewsSourceBuilder builder = NewsSource.builder()
                .name(request.name().trim())
                .type(normalizeType(request.type()))
                .url(blankToNull(request.url()))
                .enabled(request.enabled())
                .customConfig(new HashMap<>(request.customConfig()))
                .notes(request.notes())
                .userAdded(true);

        if (request.category() != null && !request.category().isBlank()) {
            builder.category(request.category());
        }
        return builder.build();
    }

    public void updateEntity(NewsSource source, NewsSourceUpdateRequest request) {
        if (request.name() != null && !request.name().isBlank()) {
            source.setName(request.name().trim());
        }
        if (request.type() != null && !request.type().isBlank()) {
            source.setType(normalizeType(request.type()));
        }
        if (request.url() != null) {
            source.setUrl(blankToNull(request.url()));
        }
        if (request.category() != null) {
            source.setCategory(request.category());
        }
        if (request.enabled() != null) {
            source.setEnabled(request.enabled());
        }
        if (request.customConfig() != null) {
            source.setCustomConfig(new HashMap<>(request.customConfig()));
        }
        if (request.notes() != null) {
            source.setNotes(request.notes());
        }
    }

    public static String normalizeType(String type) {
        return type == null ? null : type.trim().toLowerCase(Locale.ROOT);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
