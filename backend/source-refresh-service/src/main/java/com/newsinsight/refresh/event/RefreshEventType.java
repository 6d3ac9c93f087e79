package com.newsinsight.refresh.event;

/**
 * 갱신/상태 점검 라운드 이벤트 타입
 */
public enum RefreshEventType {
    REFRESH_STARTED,
    REFRESH_BUSY,            // 다른 갱신 라운드가 이미 실행 중
    SOURCE_REFRESHED,        // 소스 한 개의 수집 결과
    SOURCE_REFRESH_PROGRESS, // 라운드 진행률
    SOURCE_ITEM_PROGRESS,    // 수집기 내부 진행률
    SOURCE_ERROR,
    SOURCE_CANCELLED,
    REFRESH_COMPLETED,

    STATUS_CHECK_STARTED,
    STATUS_CHECK_BUSY,
    SOURCE_STATUS_CHECKED,
    ALL_STATUSES_CHECKED,
    STATUS_CHECK_FINISHED
}
