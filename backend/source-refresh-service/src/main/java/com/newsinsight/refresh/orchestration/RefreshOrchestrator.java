package com.newsinsight.refresh.orchestration;

import com.newsinsight.refresh.collector.CollectorRegistry;
import com.newsinsight.refresh.collector.SourceSnapshot;
import com.newsinsight.refresh.config.RefreshProperties;
import com.newsinsight.refresh.event.RefreshEvent;
import com.newsinsight.refresh.event.RefreshEventPublisher;
import com.newsinsight.refresh.persistence.SourceHealthStore;
import com.newsinsight.refresh.service.SourceService;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * 갱신/상태 점검 라운드 진입점.
 *
 * <p>라운드 종류마다 단일 실행 가드와 취소 플래그를 따로 가지므로, 갱신과 상태 점검은
 * 동시에 실행될 수 있지만 같은 종류의 라운드는 한 번에 하나만 실행된다.
 * 이미 실행 중일 때의 호출은 BUSY 이벤트만 발행하고 false를 반환한다 (대기열 없음).
 *
 * <p>라운드 조정은 {@code refreshTaskExecutor}에서 실행되며, 가드는 종료 이벤트를 발행한
 * 같은 경로에서 항상 해제된다.
 */
@Service
@Slf4j
public class RefreshOrchestrator {

    private final CollectorRegistry collectorRegistry;
    private final SourceHealthStore healthStore;
    private final SourceService sourceService;
    private final RefreshEventPublisher eventPublisher;
    private final Executor roundExecutor;
    private final int maxWorkers;

    private final SingleFlightGuard refreshGuard = new SingleFlightGuard("refresh");
    private final CancellationFlag refreshCancellation = new CancellationFlag();

    private final SingleFlightGuard statusCheckGuard = new SingleFlightGuard("status-check");
    private final CancellationFlag statusCheckCancellation = new CancellationFlag();

    public RefreshOrchestrator(CollectorRegistry collectorRegistry,
                               SourceHealthStore healthStore,
                               SourceService sourceService,
                               RefreshEventPublisher eventPublisher,
                               @Qualifier("refreshTaskExecutor") Executor roundExecutor,
                               RefreshProperties refreshProperties) {
        this.collectorRegistry = collectorRegistry;
        this.healthStore = healthStore;
        this.sourceService = sourceService;
        this.eventPublisher = eventPublisher;
        this.roundExecutor = roundExecutor;
        this.maxWorkers = refreshProperties.getMaxWorkers();
    }

    // ========== Refresh ==========

    /**
     * 활성화된 모든 소스를 갱신
     *
     * @return true if a round was started (or finished immediately), false if busy or rejected
     */
    public boolean refreshAll() {
        return startRefresh(sourceService::snapshotEnabled);
    }

    /**
     * 지정한 소스만 갱신. 비활성 소스는 제외된다.
     */
    public boolean refreshAll(List<SourceSnapshot> sources) {
        return startRefresh(() -> sources);
    }

    private boolean startRefresh(Supplier<List<SourceSnapshot>> sourceSupplier) {
        if (!refreshGuard.tryAcquire()) {
            log.info("Refresh requested while another refresh is running, ignoring");
            eventPublisher.publish(RefreshEvent.refreshBusy());
            return false;
        }

        try {
            refreshCancellation.clear();
            eventPublisher.publish(RefreshEvent.refreshStarted());

            List<SourceSnapshot> sources = enabledOnly(sourceSupplier.get());
            if (sources.isEmpty()) {
                log.info("Refresh requested but no enabled sources are configured");
                eventPublisher.publish(RefreshEvent.refreshCompleted(true, "No enabled sources to refresh"));
                refreshGuard.release();
                return true;
            }

            RefreshTask task = new RefreshTask(sources, collectorRegistry, refreshCancellation,
                    eventPublisher, maxWorkers);
            roundExecutor.execute(() -> {
                try {
                    task.run();
                } catch (Error e) {
                    log.error("Refresh round died: {}", e.toString(), e);
                    throw e;
                } finally {
                    try {
                        if (!task.isCompleted()) {
                            eventPublisher.publish(RefreshEvent.refreshCompleted(false,
                                    "Refresh failed: round ended without a result"));
                        }
                    } finally {
                        refreshGuard.release();
                        log.debug("Refresh guard released");
                    }
                }
            });
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to start refresh round: {}", e.getMessage(), e);
            eventPublisher.publish(RefreshEvent.refreshCompleted(false,
                    "Refresh could not be started: " + RefreshTask.describe(e)));
            refreshGuard.release();
            return false;
        }
    }

    /**
     * 실행 중인 갱신 라운드에 취소를 요청. 실행 중이 아니면 아무것도 하지 않는다.
     *
     * @return true if a running round was signalled
     */
    public boolean cancelRefresh() {
        if (!refreshGuard.isRunning()) {
            log.debug("Cancel requested but no refresh is running");
            return false;
        }
        log.info("Cancelling refresh round");
        refreshCancellation.set();
        return true;
    }

    public boolean isRefreshing() {
        return refreshGuard.isRunning();
    }

    // ========== Status check ==========

    /**
     * 활성화된 모든 소스의 상태를 점검하고 결과를 저장
     */
    public boolean checkAllStatuses() {
        return startStatusCheck(sourceService::snapshotEnabled);
    }

    public boolean checkAllStatuses(List<SourceSnapshot> sources) {
        return startStatusCheck(() -> sources);
    }

    private boolean startStatusCheck(Supplier<List<SourceSnapshot>> sourceSupplier) {
        if (!statusCheckGuard.tryAcquire()) {
            log.info("Status check requested while another status check is running, ignoring");
            eventPublisher.publish(RefreshEvent.statusCheckBusy());
            return false;
        }

        try {
            statusCheckCancellation.clear();
            eventPublisher.publish(RefreshEvent.statusCheckStarted());

            List<SourceSnapshot> sources = enabledOnly(sourceSupplier.get());
            if (sources.isEmpty()) {
                log.info("Status check requested but no enabled sources are configured");
                eventPublisher.publish(RefreshEvent.statusCheckFinished());
                statusCheckGuard.release();
                return true;
            }

            StatusCheckTask task = new StatusCheckTask(sources, collectorRegistry, healthStore,
                    statusCheckCancellation, eventPublisher, maxWorkers);
            roundExecutor.execute(() -> {
                try {
                    task.run();
                } finally {
                    try {
                        eventPublisher.publish(RefreshEvent.statusCheckFinished());
                    } finally {
                        statusCheckGuard.release();
                        log.debug("Status check guard released");
                    }
                }
            });
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to start status check: {}", e.getMessage(), e);
            eventPublisher.publish(RefreshEvent.statusCheckFinished());
            statusCheckGuard.release();
            return false;
        }
    }

    public boolean cancelStatusCheck() {
        if (!statusCheckGuard.isRunning()) {
            log.debug("Cancel requested but no status check is running");
            return false;
        }
        log.info("Cancelling status check round");
        statusCheckCancellation.set();
        return true;
    }

    public boolean isCheckingStatus() {
        return statusCheckGuard.isRunning();
    }

    /**
     * 종료 시 실행 중인 라운드가 빨리 끝나도록 취소 신호를 보낸다
     */
    @PreDestroy
    public void shutdown() {
        boolean refreshing = cancelRefresh();
        boolean checking = cancelStatusCheck();
        if (refreshing || checking) {
            log.info("Shutdown requested, running rounds signalled to stop");
        }
    }

    private static List<SourceSnapshot> enabledOnly(List<SourceSnapshot> sources) {
        if (sources == null) {
            return List.of();
        }
        return sources.stream()
                .filter(SourceSnapshot::enabled)
                .toList();
    }
}
