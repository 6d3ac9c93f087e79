package com.newsinsight.refresh.collector;

import com.newsinsight.refresh.exception.CollectorException;

import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Fetch and health-check strategy for one source type.
 *
 * Implementations are shared across worker threads and must not keep
 * per-call state in fields.
 */
public interface SourceCollector {

    /**
     * Type key matched against {@link SourceSnapshot#type()}, case-insensitive.
     */
    String getType();

    /**
     * Fetches the source's current items.
     *
     * @param source      snapshot of the source to fetch
     * @param progress    item-level progress sink, may be called any number of times
     * @param isCancelled advisory cancellation hint; poll between expensive steps and
     *                    return what has been gathered so far once it reports true
     * @return collected items, possibly empty
     */
    List<RawArticle> collect(SourceSnapshot source, ProgressListener progress, BooleanSupplier isCancelled)
            throws CollectorException;

    /**
     * Lightweight liveness probe. Failures are normally reported in the result;
     * an exception means the probe itself broke.
     */
    StatusResult checkStatus(SourceSnapshot source) throws CollectorException;

    default boolean supportsStatusCheck() {
        return true;
    }
}
