package com.newsinsight.refresh.entity;

/**
 * Health state of a news source.
 *
 * - UNCHECKED: never probed since it was added
 * - OK: last status check succeeded
 * - ERROR: last status check failed, or its result could not be recorded
 */
public enum SourceStatus {
    UNCHECKED,
    OK,
    ERROR
}
