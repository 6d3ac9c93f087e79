package com.newsinsight.refresh.persistence;

/**
 * Opens handles for writing source health records.
 */
public interface SourceHealthStore {

    /**
     * Opens a handle owned by the calling worker. Handles are not shared between threads.
     *
     * @throws com.newsinsight.refresh.exception.HealthPersistenceException if no connection can be obtained
     */
    SourceHealthHandle open();
}
