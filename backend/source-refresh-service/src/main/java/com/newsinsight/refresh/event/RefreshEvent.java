package com.newsinsight.refresh.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.newsinsight.refresh.collector.RawArticle;
import com.newsinsight.refresh.collector.StatusResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * 갱신 라운드 이벤트.
 * 리스너와 SSE 클라이언트에 그대로 전달된다. 필드는 타입에 따라 채워진다.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RefreshEvent {

    private RefreshEventType eventType;

    @Builder.Default
    private Instant timestamp = Instant.now();

    private String sourceName;

    private String message;

    private Boolean success;

    /**
     * SOURCE_REFRESHED batch. Not serialized; clients get {@link #itemCount}.
     */
    @JsonIgnore
    private List<RawArticle> articles;

    private Integer itemCount;

    private Integer percent;

    private Integer totalSources;

    private Integer processed;

    private Integer done;

    private Integer total;

    private StatusResult statusResult;

    private List<StatusResult> statusResults;

    public static RefreshEvent refreshStarted() {
        return RefreshEvent.builder()
                .eventType(RefreshEventType.REFRESH_STARTED)
                .message("Refresh started")
                .build();
    }

    public static RefreshEvent refreshBusy() {
        return RefreshEvent.builder()
                .eventType(RefreshEventType.REFRESH_BUSY)
                .message("A refresh is already running")
                .build();
    }

    public static RefreshEvent sourceRefreshed(String sourceName, List<RawArticle> articles) {
        List<RawArticle> batch = articles == null ? List.of() : List.copyOf(articles);
        return RefreshEvent.builder()
                .eventType(RefreshEventType.SOURCE_REFRESHED)
                .sourceName(sourceName)
                .articles(batch)
                .itemCount(batch.size())
                .build();
    }

    public static RefreshEvent refreshProgress(String sourceName, int percent, int totalSources, int processed) {
        return RefreshEvent.builder()
                .eventType(RefreshEventType.SOURCE_REFRESH_PROGRESS)
                .sourceName(sourceName)
                .percent(percent)
                .totalSources(totalSources)
                .processed(processed)
                .build();
    }

    public static RefreshEvent itemProgress(String sourceName, int done, int total) {
        return RefreshEvent.builder()
                .eventType(RefreshEventType.SOURCE_ITEM_PROGRESS)
                .sourceName(sourceName)
                .done(done)
                .total(total)
                .build();
    }

    public static RefreshEvent sourceError(String sourceName, String message) {
        return RefreshEvent.builder()
                .eventType(RefreshEventType.SOURCE_ERROR)
                .sourceName(sourceName)
                .message(message)
                .success(false)
                .build();
    }

    public static RefreshEvent sourceCancelled(String sourceName) {
        return RefreshEvent.builder()
                .eventType(RefreshEventType.SOURCE_CANCELLED)
                .sourceName(sourceName)
                .message("Cancelled before completion")
                .build();
    }

    public static RefreshEvent refreshCompleted(boolean success, String message) {
        return RefreshEvent.builder()
                .eventType(RefreshEventType.REFRESH_COMPLETED)
                .success(success)
                .message(message)
                .build();
    }

    public static RefreshEvent statusCheckStarted() {
        return RefreshEvent.builder()
                .eventType(RefreshEventType.STATUS_CHECK_STARTED)
                .message("Status check started")
                .build();
    }

    public static RefreshEvent statusCheckBusy() {
        return RefreshEvent.builder()
                .eventType(RefreshEventType.STATUS_CHECK_BUSY)
                .message("A status check is already running")
                .build();
    }

    public static RefreshEvent sourceStatusChecked(StatusResult result) {
        return RefreshEvent.builder()
                .eventType(RefreshEventType.SOURCE_STATUS_CHECKED)
                .sourceName(result.getSourceName())
                .success(result.isSuccess())
                .message(result.getMessage())
                .statusResult(result)
                .build();
    }

    public static RefreshEvent allStatusesChecked(List<StatusResult> results) {
        return RefreshEvent.builder()
                .eventType(RefreshEventType.ALL_STATUSES_CHECKED)
                .statusResults(List.copyOf(results))
                .message("Checked " + results.size() + " sources")
                .build();
    }

    public static RefreshEvent statusCheckFinished() {
        return RefreshEvent.builder()
                .eventType(RefreshEventType.STATUS_CHECK_FINISHED)
                .message("Status check finished")
                .build();
    }
}
