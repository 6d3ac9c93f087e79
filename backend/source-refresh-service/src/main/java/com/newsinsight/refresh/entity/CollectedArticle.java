package com.newsinsight.refresh.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

@Entity
@Table(name = "collected_articles", indexes = {
    @Index(name = "idx_article_source_name", columnList = "source_name"),
    @Index(name = "idx_article_content_hash", columnList = "content_hash", unique = true),
    @Index(name = "idx_article_published_at", columnList = "published_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CollectedArticle {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * Null when the batch came from a source that was never persisted.
     */
    @Column(name = "source_id")
    private Long sourceId;

    @Column(name = "source_name", nullable = false, length = 255)
    private String sourceName;

    @Column(name = "title", columnDefinition = "TEXT")
    private String title;

    @Column(name = "link", columnDefinition = "TEXT")
    private String link;

    @Column(name = "summary", columnDefinition = "TEXT")
    private String summary;

    @Column(name = "content", columnDefinition = "TEXT")
    private String content;

    @Column(name = "category", length = 100)
    private String category;

    @Column(name = "published_at")
    private LocalDateTime publishedAt;

    @Column(name = "content_hash", nullable = false, length = 64)
    private String contentHash;

    @CreationTimestamp
    @Column(name = "collected_at", nullable = false, updatable = false)
    private LocalDateTime collectedAt;
}
