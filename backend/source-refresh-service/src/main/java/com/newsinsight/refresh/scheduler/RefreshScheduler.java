package com.newsinsight.refresh.scheduler;

import com.newsinsight.refresh.orchestration.RefreshOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 주기적 갱신/상태 점검 스케줄러.
 * 라운드가 이미 실행 중이면 이번 주기는 건너뛴다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RefreshScheduler {

    private final RefreshOrchestrator refreshOrchestrator;

    @Value("${refresh.scheduling.enabled:false}")
    private boolean schedulingEnabled;

    /**
     * 정기 갱신. 기본값: 매 시 정각
     */
    @Scheduled(cron = "${refresh.scheduling.refresh-cron:0 0 * * * ?}")
    public void scheduledRefresh() {
        if (!schedulingEnabled) {
            log.debug("Scheduled refresh is disabled");
            return;
        }
        if (refreshOrchestrator.isRefreshing()) {
            log.info("Skipping scheduled refresh: a refresh is already running");
            return;
        }

        log.info("Starting scheduled refresh of all enabled sources");
        if (!refreshOrchestrator.refreshAll()) {
            log.warn("Scheduled refresh was not started");
        }
    }

    /**
     * 정기 상태 점검. 기본값: 매 시 30분
     */
    @Scheduled(cron = "${refresh.scheduling.status-check-cron:0 30 * * * ?}")
    public void scheduledStatusCheck() {
        if (!schedulingEnabled) {
            log.debug("Scheduled status check is disabled");
            return;
        }
        if (refreshOrchestrator.isCheckingStatus()) {
            log.info("Skipping scheduled status check: one is already running");
            return;
        }

        log.info("Starting scheduled status check of all enabled sources");
        if (!refreshOrchestrator.checkAllStatuses()) {
            log.warn("Scheduled status check was not started");
        }
    }
}
