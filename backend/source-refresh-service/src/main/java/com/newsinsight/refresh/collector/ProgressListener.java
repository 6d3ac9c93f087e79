package com.newsinsight.refresh.collector;

/**
 * Receives item-level progress from a collector.
 * {@code done} never decreases within one call to collect.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (done, total) -> { };

    void onProgress(int done, int total);
}
