package com.newsinsight.refresh.collector;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * One item produced by a collector. Rounds only count and forward these.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RawArticle {

    String title;

    String link;

    String summary;

    LocalDateTime publishTime;

    String content;

    String sourceName;

    String category;

    /**
     * Collector specific extras (author, tags, scrape method, ...)
     */
    @Builder.Default
    Map<String, Object> attributes = Map.of();
}
