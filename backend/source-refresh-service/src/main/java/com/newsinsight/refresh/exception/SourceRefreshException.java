package com.newsinsight.refresh.exception;

/**
 * 소스 갱신 서비스 예외 기본 클래스
 */
public class SourceRefreshException extends RuntimeException {

    private final String errorCode;

    public SourceRefreshException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public SourceRefreshException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
