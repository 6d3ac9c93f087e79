package com.newsinsight.refresh.orchestration;

import java.util.concurrent.atomic.AtomicReference;

/**
 * At most one round of a given kind at a time.
 * Owned by one orchestrator instance; a second instance has its own guard.
 */
public class SingleFlightGuard {

    private final String name;
    private final AtomicReference<RoundState> state = new AtomicReference<>(RoundState.IDLE);

    public SingleFlightGuard(String name) {
        this.name = name;
    }

    /**
     * @return true if the caller now owns the round and must call {@link #release()}
     */
    public boolean tryAcquire() {
        return state.compareAndSet(RoundState.IDLE, RoundState.RUNNING);
    }

    public void release() {
        state.set(RoundState.IDLE);
    }

    public boolean isRunning() {
        return state.get() == RoundState.RUNNING;
    }

    public RoundState getState() {
        return state.get();
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return name + "[" + state.get() + "]";
    }
}
