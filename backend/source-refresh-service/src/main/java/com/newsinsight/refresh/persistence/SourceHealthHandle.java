package com.newsinsight.refresh.persistence;

import com.newsinsight.refresh.entity.SourceStatus;

import java.time.LocalDateTime;

/**
 * Per-worker writer for source health. Confined to the thread that opened it.
 */
public interface SourceHealthHandle extends AutoCloseable {

    /**
     * Records the outcome of one probe.
     *
     * @throws com.newsinsight.refresh.exception.HealthPersistenceException if the row could not be written
     */
    void updateSourceHealth(Long sourceId, SourceStatus status, String lastError,
                            LocalDateTime checkedAt, int consecutiveErrors);

    @Override
    void close();
}
