package com.newsinsight.refresh.exception;

public class DuplicateSourceException extends SourceRefreshException {

    public DuplicateSourceException(String name) {
        super("DUPLICATE_SOURCE", "A source named '" + name + "' already exists");
    }
}
