package com.newsinsight.refresh.exception;

/**
 * A collector could not fetch or probe its source.
 */
public class CollectorException extends SourceRefreshException {

    private final String sourceName;

    public CollectorException(String sourceName, String message) {
        super("COLLECTOR_ERROR", message);
        this.sourceName = sourceName;
    }

    public CollectorException(String sourceName, String message, Throwable cause) {
        super("COLLECTOR_ERROR", message, cause);
        this.sourceName = sourceName;
    }

    public String getSourceName() {
        return sourceName;
    }

    /**
     * 원격 서버가 2xx 이외의 응답을 반환
     */
    public static CollectorException httpStatus(String sourceName, String url, int statusCode) {
        return new CollectorException(sourceName, "HTTP " + statusCode + " from " + url);
    }

    /**
     * 응답 본문 파싱 실패
     */
    public static CollectorException unparseable(String sourceName, String url, Throwable cause) {
        return new CollectorException(sourceName, "Could not parse content from " + url + ": " + cause.getMessage(), cause);
    }
}
