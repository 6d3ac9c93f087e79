package com.newsinsight.refresh.orchestration;

import com.newsinsight.refresh.collector.ProgressListener;
import com.newsinsight.refresh.collector.RawArticle;
import com.newsinsight.refresh.collector.SourceCollector;
import com.newsinsight.refresh.collector.SourceSnapshot;
import com.newsinsight.refresh.collector.StatusResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

/**
 * Scriptable collector. Behaviour is chosen per source name; unscripted sources
 * return {@link #itemsPerSource} items and report healthy.
 */
class FakeCollector implements SourceCollector {

    interface CollectBehaviour {
        List<RawArticle> collect(SourceSnapshot source, ProgressListener progress, BooleanSupplier isCancelled)
                throws Exception;
    }

    interface StatusBehaviour {
        StatusResult check(SourceSnapshot source);
    }

    private final String type;
    private final Map<String, CollectBehaviour> collectScripts = new ConcurrentHashMap<>();
    private final Map<String, StatusBehaviour> statusScripts = new ConcurrentHashMap<>();
    private final List<String> collectCalls = new CopyOnWriteArrayList<>();
    private final List<String> statusCalls = new CopyOnWriteArrayList<>();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();
    private volatile int itemsPerSource = 2;
    private volatile long delayMillis;
    private volatile boolean statusSupported = true;

    FakeCollector(String type) {
        this.type = type;
    }

    FakeCollector onCollect(String sourceName, CollectBehaviour behaviour) {
        collectScripts.put(sourceName, behaviour);
        return this;
    }

    FakeCollector onCheck(String sourceName, StatusBehaviour behaviour) {
        statusScripts.put(sourceName, behaviour);
        return this;
    }

    FakeCollector failingFor(String sourceName, String message) {
        return onCollect(sourceName, (source, progress, cancelled) -> {
            throw new IllegalStateException(message);
        });
    }

    FakeCollector withDelay(long millis) {
        this.delayMillis = millis;
        return this;
    }

    FakeCollector withItemsPerSource(int items) {
        this.itemsPerSource = items;
        return this;
    }

    FakeCollector withoutStatusCheck() {
        this.statusSupported = false;
        return this;
    }

    List<String> collectCalls() {
        return List.copyOf(collectCalls);
    }

    List<String> statusCalls() {
        return List.copyOf(statusCalls);
    }

    int maxInFlight() {
        return maxInFlight.get();
    }

    @Override
    public String getType() {
        return type;
    }

    @Override
    public List<RawArticle> collect(SourceSnapshot source, ProgressListener progress, BooleanSupplier isCancelled) {
        collectCalls.add(source.name());
        maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
        try {
            if (delayMillis > 0) {
                Thread.sleep(delayMillis);
            }
            CollectBehaviour script = collectScripts.get(source.name());
            if (script != null) {
                return script.collect(source, progress, isCancelled);
            }
            return articles(source, itemsPerSource);
        } catch (RuntimeException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted", e);
        } catch (Exception e) {
            throw new IllegalStateException(e);
        } finally {
            inFlight.decrementAndGet();
        }
    }

    @Override
    public StatusResult checkStatus(SourceSnapshot source) {
        statusCalls.add(source.name());
        StatusBehaviour script = statusScripts.get(source.name());
        if (script != null) {
            return script.check(source);
        }
        return StatusResult.ok(source, "reachable");
    }

    @Override
    public boolean supportsStatusCheck() {
        return statusSupported;
    }

    static List<RawArticle> articles(SourceSnapshot source, int count) {
        List<RawArticle> articles = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            articles.add(RawArticle.builder()
                    .title(source.name() + " headline " + i)
                    .link("https://example.com/" + source.name() + "/" + i)
                    .sourceName(source.name())
                    .build());
        }
        return articles;
    }
}
