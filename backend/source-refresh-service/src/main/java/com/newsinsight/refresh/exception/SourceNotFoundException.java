package com.newsinsight.refresh.exception;

public class SourceNotFoundException extends SourceRefreshException {

    public SourceNotFoundException(Long id) {
        super("SOURCE_NOT_FOUND", "News source not found: " + id);
    }
}
