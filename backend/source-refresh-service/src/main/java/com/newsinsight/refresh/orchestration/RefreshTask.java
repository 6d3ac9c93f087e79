package com.newsinsight.refresh.orchestration;

import com.newsinsight.refresh.collector.CollectorRegistry;
import com.newsinsight.refresh.collector.RawArticle;
import com.newsinsight.refresh.collector.SourceCollector;
import com.newsinsight.refresh.collector.SourceSnapshot;
import com.newsinsight.refresh.event.RefreshEvent;
import com.newsinsight.refresh.event.RefreshEventPublisher;
import com.newsinsight.refresh.exception.CollectorException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

/**
 * 갱신 라운드 한 번.
 *
 * <p>소스마다 수집기를 제한된 워커 풀에서 실행하고, 완료 순서대로 소스당 정확히 하나의
 * 종료 이벤트(SOURCE_REFRESHED, SOURCE_ERROR, SOURCE_CANCELLED)와 진행률 이벤트를 발행한다.
 * 마지막으로 REFRESH_COMPLETED를 한 번 발행한다.
 *
 * <p>Runs on the coordinator thread handed to it by {@link RefreshOrchestrator}; never throws.
 */
@Slf4j
public class RefreshTask implements Runnable {

    private final List<SourceSnapshot> sources;
    private final CollectorRegistry collectorRegistry;
    private final CancellationFlag cancellation;
    private final RefreshEventPublisher eventPublisher;
    private final int maxWorkers;

    private volatile boolean completed;

    public RefreshTask(List<SourceSnapshot> sources,
                       CollectorRegistry collectorRegistry,
                       CancellationFlag cancellation,
                       RefreshEventPublisher eventPublisher,
                       int maxWorkers) {
        this.sources = List.copyOf(sources);
        this.collectorRegistry = collectorRegistry;
        this.cancellation = cancellation;
        this.eventPublisher = eventPublisher;
        this.maxWorkers = maxWorkers;
    }

    /**
     * 워커 수 = min(max(1, N), ceiling)
     */
    public static int workerCount(int sourceCount, int ceiling) {
        return Math.min(Math.max(1, sourceCount), Math.max(1, ceiling));
    }

    /**
     * Whether REFRESH_COMPLETED has been published for this round.
     */
    public boolean isCompleted() {
        return completed;
    }

    @Override
    public void run() {
        try {
            execute();
        } catch (RuntimeException e) {
            log.error("Refresh round aborted unexpectedly: {}", e.getMessage(), e);
            publishCompleted(false, "Refresh failed: " + describe(e));
        }
    }

    private void execute() {
        int total = sources.size();
        int workers = workerCount(total, maxWorkers);
        log.info("Refresh round started: {} sources, {} workers", total, workers);

        RoundTally tally = new RoundTally(total);
        ExecutorService pool = Executors.newFixedThreadPool(workers, workerThreadFactory());
        CompletionService<SourceOutcome> completionService = new ExecutorCompletionService<>(pool);
        Map<Integer, SourceSnapshot> pending = new LinkedHashMap<>();
        Map<Future<SourceOutcome>, Integer> submitted = new HashMap<>();

        try {
            for (int i = 0; i < total; i++) {
                SourceSnapshot source = sources.get(i);

                if (cancellation.isSet()) {
                    tally.cancelObserved = true;
                    reportCancelled(source, tally);
                    continue;
                }

                Optional<SourceCollector> collector = collectorRegistry.resolve(source.type());
                if (collector.isEmpty()) {
                    reportError(source, "No collector registered for type '" + source.type() + "'", tally);
                    continue;
                }

                int index = i;
                SourceCollector resolved = collector.get();
                submitted.put(completionService.submit(() -> collectOne(index, source, resolved)), index);
                pending.put(index, source);
            }

            while (!pending.isEmpty()) {
                SourceOutcome outcome = awaitNext(completionService, submitted);
                SourceSnapshot source = pending.remove(outcome.index());

                if (outcome.cancelled() || cancellation.isSet()) {
                    tally.cancelObserved = true;
                    reportCancelled(source, tally);
                } else if (outcome.error() != null) {
                    reportError(source, outcome.error(), tally);
                } else {
                    reportRefreshed(source, outcome.articles(), tally);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Refresh round interrupted with {} sources outstanding", pending.size());
            tally.cancelObserved = true;
            pending.values().forEach(source -> reportCancelled(source, tally));
            pending.clear();
        } finally {
            pool.shutdownNow();
        }

        if (cancellation.isSet()) {
            tally.cancelObserved = true;
        }
        finish(tally);
    }

    /**
     * Worker body. Never throws: every failure becomes an outcome.
     */
    private SourceOutcome collectOne(int index, SourceSnapshot source, SourceCollector collector) {
        // No fresh work once the round is cancelled
        if (cancellation.isSet()) {
            log.debug("Skipping '{}': refresh cancelled before it started", source.name());
            return SourceOutcome.cancelled(index);
        }

        long start = System.currentTimeMillis();
        try {
            List<RawArticle> articles = collector.collect(
                    source,
                    (done, total) -> eventPublisher.publish(RefreshEvent.itemProgress(source.name(), done, total)),
                    cancellation.asPredicate());
            List<RawArticle> batch = articles == null ? List.of() : articles;
            log.debug("Collected {} items from '{}' in {}ms", batch.size(), source.name(),
                    System.currentTimeMillis() - start);
            return SourceOutcome.success(index, batch);
        } catch (CollectorException e) {
            log.warn("Collector failed for source '{}': {}", source.name(), e.getMessage());
            return SourceOutcome.failure(index, describe(e));
        } catch (RuntimeException e) {
            log.error("Unexpected error collecting source '{}': {}", source.name(), e.getMessage(), e);
            return SourceOutcome.failure(index, describe(e));
        }
    }

    private SourceOutcome awaitNext(CompletionService<SourceOutcome> completionService,
                                    Map<Future<SourceOutcome>, Integer> submitted) throws InterruptedException {
        Future<SourceOutcome> future = completionService.take();
        try {
            return future.get();
        } catch (ExecutionException e) {
            // Only Errors get here; collectOne converts exceptions itself
            int index = submitted.get(future);
            log.error("Refresh worker died: {}", e.getCause() != null ? e.getCause().toString() : e.toString(), e);
            return SourceOutcome.failure(index, describe(e.getCause() != null ? e.getCause() : e));
        }
    }

    private void reportRefreshed(SourceSnapshot source, List<RawArticle> articles, RoundTally tally) {
        tally.newItems += articles.size();
        eventPublisher.publish(RefreshEvent.sourceRefreshed(source.name(), articles));
        reportProgress(source, tally);
    }

    private void reportError(SourceSnapshot source, String message, RoundTally tally) {
        tally.failures.put(source.name(), message);
        eventPublisher.publish(RefreshEvent.sourceError(source.name(), message));
        reportProgress(source, tally);
    }

    private void reportCancelled(SourceSnapshot source, RoundTally tally) {
        tally.cancelledCount++;
        eventPublisher.publish(RefreshEvent.sourceCancelled(source.name()));
        reportProgress(source, tally);
    }

    private void reportProgress(SourceSnapshot source, RoundTally tally) {
        tally.processed++;
        int percent = tally.processed * 100 / tally.total;
        eventPublisher.publish(RefreshEvent.refreshProgress(source.name(), percent, tally.total, tally.processed));
    }

    private void finish(RoundTally tally) {
        boolean success = !tally.cancelObserved && tally.failures.isEmpty();
        String message;
        if (tally.cancelObserved) {
            message = String.format("Refresh cancelled by user (%d new items, %d of %d sources skipped)",
                    tally.newItems, tally.cancelledCount, tally.total);
            if (!tally.failures.isEmpty()) {
                message += "; errors: " + formatFailures(tally.failures);
            }
        } else if (!tally.failures.isEmpty()) {
            message = "Refresh finished with errors: " + formatFailures(tally.failures);
        } else {
            message = String.format("Refresh complete (%d new items)", tally.newItems);
        }

        log.info("Refresh round finished: success={}, sources={}, failed={}, cancelled={}, newItems={}",
                success, tally.total, tally.failures.size(), tally.cancelledCount, tally.newItems);
        publishCompleted(success, message);
    }

    private void publishCompleted(boolean success, String message) {
        eventPublisher.publish(RefreshEvent.refreshCompleted(success, message));
        completed = true;
    }

    private static String formatFailures(Map<String, String> failures) {
        return failures.entrySet().stream()
                .map(entry -> entry.getKey() + ": " + entry.getValue())
                .collect(Collectors.joining("; "));
    }

    static String describe(Throwable e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }

    private static CustomizableThreadFactory workerThreadFactory() {
        CustomizableThreadFactory factory = new CustomizableThreadFactory("refresh-worker-");
        factory.setDaemon(true);
        return factory;
    }

    /**
     * Coordinator-thread bookkeeping for one round.
     */
    private static final class RoundTally {
        private final int total;
        private final Map<String, String> failures = new LinkedHashMap<>();
        private int processed;
        private int newItems;
        private int cancelledCount;
        private boolean cancelObserved;

        private RoundTally(int total) {
            this.total = total;
        }
    }

    private record SourceOutcome(int index, List<RawArticle> articles, String error, boolean cancelled) {

        static SourceOutcome success(int index, List<RawArticle> articles) {
            return new SourceOutcome(index, articles, null, false);
        }

        static SourceOutcome failure(int index, String error) {
            return new SourceOutcome(index, List.of(), error, false);
        }

        static SourceOutcome cancelled(int index) {
            return new SourceOutcome(index, List.of(), null, true);
        }
    }
}
