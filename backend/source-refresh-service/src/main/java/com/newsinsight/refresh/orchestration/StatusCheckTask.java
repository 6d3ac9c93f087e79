package com.newsinsight.refresh.orchestration;

import com.newsinsight.refresh.collector.CollectorRegistry;
import com.newsinsight.refresh.collector.SourceCollector;
import com.newsinsight.refresh.collector.SourceSnapshot;
import com.newsinsight.refresh.collector.StatusResult;
import com.newsinsight.refresh.entity.SourceStatus;
import com.newsinsight.refresh.event.RefreshEvent;
import com.newsinsight.refresh.event.RefreshEventPublisher;
import com.newsinsight.refresh.exception.HealthPersistenceException;
import com.newsinsight.refresh.persistence.SourceHealthHandle;
import com.newsinsight.refresh.persistence.SourceHealthStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 상태 점검 라운드 한 번.
 *
 * <p>워커 루프마다 {@link SourceHealthHandle}을 하나씩 열어 가져간 모든 소스에 사용하고,
 * 루프가 끝나면 닫는다. 핸들은 워커 간에 공유하지 않는다.
 *
 * <p>연속 오류 횟수는 여기서 계산한다: 성공 시 0, 실패 시 이전 값 + 1.
 * 결과를 저장하지 못한 점검은 실패로 보고한다.
 */
@Slf4j
public class StatusCheckTask implements Runnable {

    private final List<SourceSnapshot> sources;
    private final CollectorRegistry collectorRegistry;
    private final SourceHealthStore healthStore;
    private final CancellationFlag cancellation;
    private final RefreshEventPublisher eventPublisher;
    private final int maxWorkers;

    public StatusCheckTask(List<SourceSnapshot> sources,
                           CollectorRegistry collectorRegistry,
                           SourceHealthStore healthStore,
                           CancellationFlag cancellation,
                           RefreshEventPublisher eventPublisher,
                           int maxWorkers) {
        this.sources = List.copyOf(sources);
        this.collectorRegistry = collectorRegistry;
        this.healthStore = healthStore;
        this.cancellation = cancellation;
        this.eventPublisher = eventPublisher;
        this.maxWorkers = maxWorkers;
    }

    @Override
    public void run() {
        int workers = RefreshTask.workerCount(sources.size(), maxWorkers);
        log.info("Status check started: {} sources, {} workers", sources.size(), workers);

        Queue<SourceSnapshot> queue = new ConcurrentLinkedQueue<>(sources);
        List<StatusResult> results = Collections.synchronizedList(new ArrayList<>());
        AtomicInteger skipped = new AtomicInteger();

        ExecutorService pool = Executors.newFixedThreadPool(workers, workerThreadFactory());
        try {
            List<Future<?>> loops = new ArrayList<>(workers);
            for (int i = 0; i < workers; i++) {
                loops.add(pool.submit(() -> drain(queue, results, skipped)));
            }
            for (Future<?> loop : loops) {
                try {
                    loop.get();
                } catch (ExecutionException e) {
                    log.error("Status check worker failed: {}", RefreshTask.describe(e.getCause()), e.getCause());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Status check interrupted, reporting {} results gathered so far", results.size());
        } finally {
            pool.shutdownNow();
        }

        List<StatusResult> snapshot;
        synchronized (results) {
            snapshot = List.copyOf(results);
        }
        long failed = snapshot.stream().filter(result -> !result.isSuccess()).count();
        log.info("Status check finished: checked={}, failed={}, skipped={}",
                snapshot.size(), failed, skipped.get());
        eventPublisher.publish(RefreshEvent.allStatusesChecked(snapshot));
    }

    /**
     * One worker loop. Owns its handle for its whole lifetime.
     */
    private void drain(Queue<SourceSnapshot> queue, List<StatusResult> results, AtomicInteger skipped) {
        SourceHealthHandle handle = openHandle();
        try {
            SourceSnapshot source;
            while ((source = queue.poll()) != null) {
                if (cancellation.isSet()) {
                    log.debug("Skipping status check of '{}': cancelled", source.name());
                    skipped.incrementAndGet();
                    continue;
                }
                StatusResult result = checkOne(source, handle);
                results.add(result);
                eventPublisher.publish(RefreshEvent.sourceStatusChecked(result));
            }
        } finally {
            if (handle != null) {
                handle.close();
            }
        }
    }

    private SourceHealthHandle openHandle() {
        try {
            return healthStore.open();
        } catch (RuntimeException e) {
            // The loop still probes; every result it produces is reported as not persisted
            log.error("Could not open health store handle: {}", e.getMessage(), e);
            return null;
        }
    }

    StatusResult checkOne(SourceSnapshot source, SourceHealthHandle handle) {
        StatusResult probed = probe(source);

        int consecutiveErrors = probed.isSuccess() ? 0 : source.consecutiveErrorCount() + 1;
        LocalDateTime checkedAt = probed.getCheckedAt() != null ? probed.getCheckedAt() : LocalDateTime.now();
        StatusResult result = probed.toBuilder()
                .sourceName(source.name())
                .sourceId(source.id())
                .checkedAt(checkedAt)
                .consecutiveErrorCount(consecutiveErrors)
                .build();

        try {
            if (handle == null) {
                throw new HealthPersistenceException("No health store connection available");
            }
            handle.updateSourceHealth(source.id(),
                    result.isSuccess() ? SourceStatus.OK : SourceStatus.ERROR,
                    result.errorText(),
                    checkedAt,
                    consecutiveErrors);
        } catch (RuntimeException e) {
            log.warn("Failed to persist health of '{}': {}", source.name(), e.getMessage());
            result = result.withPersistenceFailure(RefreshTask.describe(e));
        }

        if (result.isSuccess()) {
            log.debug("Source '{}' is healthy: {}", source.name(), result.getMessage());
        } else {
            log.info("Source '{}' failed status check ({} in a row): {}",
                    source.name(), consecutiveErrors, result.errorText());
        }
        return result;
    }

    private StatusResult probe(SourceSnapshot source) {
        Optional<SourceCollector> collector = collectorRegistry.resolve(source.type());
        if (collector.isEmpty()) {
            return StatusResult.failure(source, "No collector registered for type '" + source.type() + "'", null);
        }
        if (!collector.get().supportsStatusCheck()) {
            return StatusResult.failure(source,
                    "Collector for type '" + source.type() + "' does not support status checks", null);
        }

        try {
            StatusResult result = collector.get().checkStatus(source);
            if (result == null) {
                return StatusResult.failure(source, "Status check returned no result", null);
            }
            return result;
        } catch (RuntimeException e) {
            log.warn("Status check of '{}' raised: {}", source.name(), e.getMessage());
            return StatusResult.failure(source, "Status check failed", RefreshTask.describe(e));
        }
    }

    private static CustomizableThreadFactory workerThreadFactory() {
        CustomizableThreadFactory factory = new CustomizableThreadFactory("status-worker-");
        factory.setDaemon(true);
        return factory;
    }
}
