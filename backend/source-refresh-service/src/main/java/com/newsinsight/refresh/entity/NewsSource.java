package com.newsinsight.refresh.entity;

import com.newsinsight.refresh.collector.SourceSnapshot;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

@Entity
@Table(name = "news_sources", indexes = {
    @Index(name = "idx_news_source_type", columnList = "source_type"),
    @Index(name = "idx_news_source_enabled", columnList = "enabled")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NewsSource {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "name", nullable = false, unique = true, length = 255)
    private String name;

    /**
     * Collector type key, e.g. "rss" or "web". Stored lower-case.
     */
    @Column(name = "source_type", nullable = false, length = 50)
    private String type;

    /**
     * Optional: some collector types are not URL based.
     */
    @Column(name = "url", columnDefinition = "TEXT")
    private String url;

    @Column(name = "category", length = 100)
    @Builder.Default
    private String category = "uncategorized";

    @Column(name = "enabled", nullable = false)
    @Builder.Default
    private Boolean enabled = true;

    @Convert(converter = CustomConfigConverter.class)
    @Column(name = "custom_config", columnDefinition = "TEXT")
    @Builder.Default
    private Map<String, Object> customConfig = new HashMap<>();

    @Column(name = "notes", columnDefinition = "TEXT")
    private String notes;

    @Column(name = "user_added", nullable = false)
    @Builder.Default
    private Boolean userAdded = true;

    // Health state. Written only by status-check rounds through JdbcSourceHealthStore;
    // Hibernate inserts the initial values and never updates these columns.

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20, updatable = false)
    @Builder.Default
    private SourceStatus status = SourceStatus.UNCHECKED;

    @Column(name = "last_error", columnDefinition = "TEXT", updatable = false)
    private String lastError;

    @Column(name = "last_checked_time", updatable = false)
    private LocalDateTime lastCheckedTime;

    @Column(name = "consecutive_error_count", nullable = false, updatable = false)
    @Builder.Default
    private Integer consecutiveErrorCount = 0;

    /**
     * Last time a refresh round delivered a batch for this source.
     */
    @Column(name = "last_refreshed_at")
    private LocalDateTime lastRefreshedAt;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    /**
     * Immutable copy handed to a refresh or status-check round.
     */
    public SourceSnapshot toSnapshot() {
        return new SourceSnapshot(
                id,
                name,
                type,
                url,
                category,
                Boolean.TRUE.equals(enabled),
                customConfig,
                status,
                lastError,
                lastCheckedTime,
                consecutiveErrorCount != null ? consecutiveErrorCount : 0
        );
    }
}
