package com.newsinsight.refresh.dto;

/**
 * Answer to a start or cancel request.
 *
 * @param accepted false when the round was busy, rejected or not running
 */
public record RoundResponse(
        String round,
        boolean accepted,
        String message
) {
}
