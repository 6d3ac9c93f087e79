package com.newsinsight.refresh.exception;

/**
 * A source health record could not be written to the database.
 */
public class HealthPersistenceException extends SourceRefreshException {

    public HealthPersistenceException(String message) {
        super("HEALTH_PERSISTENCE_ERROR", message);
    }

    public HealthPersistenceException(String message, Throwable cause) {
        super("HEALTH_PERSISTENCE_ERROR", message, cause);
    }
}
