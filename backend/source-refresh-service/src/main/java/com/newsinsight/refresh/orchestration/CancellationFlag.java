package com.newsinsight.refresh.orchestration;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

/**
 * 협조적 취소 신호.
 * 작업자는 작업 단위 사이에 {@link #isSet()}을 폴링한다. 실행 중인 호출을 강제로 중단하지 않는다.
 */
public class CancellationFlag {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void set() {
        cancelled.set(true);
    }

    public void clear() {
        cancelled.set(false);
    }

    public boolean isSet() {
        return cancelled.get();
    }

    /**
     * Predicate view handed to collectors.
     */
    public BooleanSupplier asPredicate() {
        return cancelled::get;
    }
}
