package com.newsinsight.refresh.orchestration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * CancellationFlag 단위 테스트
 */
class CancellationFlagTest {

    @Test
    @DisplayName("새 플래그는 설정되지 않은 상태")
    void startsCleared() {
        assertThat(new CancellationFlag().isSet()).isFalse();
    }

    @Test
    @DisplayName("set/clear 반복 호출 시 마지막 호출 상태를 따른다")
    void lastCallWins() {
        CancellationFlag flag = new CancellationFlag();

        flag.set();
        flag.set();
        assertThat(flag.isSet()).isTrue();

        flag.clear();
        flag.clear();
        assertThat(flag.isSet()).isFalse();

        flag.clear();
        flag.set();
        assertThat(flag.isSet()).isTrue();
    }

    @Test
    @DisplayName("predicate 뷰는 플래그의 현재 값을 반영")
    void predicateTracksFlag() {
        CancellationFlag flag = new CancellationFlag();
        BooleanSupplier predicate = flag.asPredicate();

        assertThat(predicate.getAsBoolean()).isFalse();
        flag.set();
        assertThat(predicate.getAsBoolean()).isTrue();
        flag.clear();
        assertThat(predicate.getAsBoolean()).isFalse();
    }

    @Test
    @DisplayName("다른 스레드의 set이 폴링 중인 작업자에게 보인다")
    void setIsVisibleToConcurrentReaders() throws Exception {
        CancellationFlag flag = new CancellationFlag();
        ExecutorService readers = Executors.newFixedThreadPool(4);
        CountDownLatch started = new CountDownLatch(4);
        try {
            List<Future<Long>> polls = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                polls.add(readers.submit(() -> {
                    started.countDown();
                    long spins = 0;
                    while (!flag.isSet()) {
                        spins++;
                        Thread.onSpinWait();
                    }
                    return spins;
                }));
            }
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

            flag.set();

            for (Future<Long> poll : polls) {
                assertThat(poll.get(5, TimeUnit.SECONDS)).isGreaterThanOrEqualTo(0L);
            }
        } finally {
            readers.shutdownNow();
        }
    }
}
