package com.newsinsight.refresh.persistence;

import com.newsinsight.refresh.entity.NewsSource;
import com.newsinsight.refresh.entity.SourceStatus;
import com.newsinsight.refresh.exception.HealthPersistenceException;
import com.newsinsight.refresh.repository.NewsSourceRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * JdbcSourceHealthStore 통합 테스트 (H2 임베디드 DB)
 * 핸들은 별도 커넥션으로 쓰므로 테스트 트랜잭션 없이 실행한다.
 */
@DataJpaTest
@Import(JdbcSourceHealthStore.class)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class JdbcSourceHealthStoreTest {

    @Autowired
    private JdbcSourceHealthStore healthStore;

    @Autowired
    private NewsSourceRepository newsSourceRepository;

    @AfterEach
    void tearDown() {
        newsSourceRepository.deleteAll();
    }

    @Test
    @DisplayName("점검 결과를 소스 행에 기록")
    void updatesHealthColumns() {
        // given
        NewsSource source = newsSourceRepository.save(source("연합뉴스"));
        LocalDateTime checkedAt = LocalDateTime.now().truncatedTo(ChronoUnit.SECONDS);

        // when
        try (SourceHealthHandle handle = healthStore.open()) {
            handle.updateSourceHealth(source.getId(), SourceStatus.ERROR, "HTTP status 503", checkedAt, 3);
        }

        // then
        NewsSource stored = newsSourceRepository.findById(source.getId()).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(SourceStatus.ERROR);
        assertThat(stored.getLastError()).isEqualTo("HTTP status 503");
        assertThat(stored.getLastCheckedTime()).isEqualTo(checkedAt);
        assertThat(stored.getConsecutiveErrorCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("성공 기록은 오류 메시지를 지우고 횟수를 0으로")
    void successClearsError() {
        // given
        NewsSource source = source("한겨레");
        source.setStatus(SourceStatus.ERROR);
        source.setLastError("timeout");
        source.setConsecutiveErrorCount(4);
        NewsSource saved = newsSourceRepository.save(source);

        // when
        try (SourceHealthHandle handle = healthStore.open()) {
            handle.updateSourceHealth(saved.getId(), SourceStatus.OK, null, LocalDateTime.now(), 0);
        }

        // then
        NewsSource stored = newsSourceRepository.findById(saved.getId()).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(SourceStatus.OK);
        assertThat(stored.getLastError()).isNull();
        assertThat(stored.getConsecutiveErrorCount()).isZero();
    }

    @Test
    @DisplayName("없는 소스나 ID 없는 소스는 HealthPersistenceException")
    void missingRowFails() {
        try (SourceHealthHandle handle = healthStore.open()) {
            assertThatThrownBy(() -> handle.updateSourceHealth(999_999L, SourceStatus.OK, null, LocalDateTime.now(), 0))
                    .isInstanceOf(HealthPersistenceException.class)
                    .hasMessageContaining("no longer exists");
            assertThatThrownBy(() -> handle.updateSourceHealth(null, SourceStatus.OK, null, LocalDateTime.now(), 0))
                    .isInstanceOf(HealthPersistenceException.class);
        }
    }

    @Test
    @DisplayName("여러 핸들을 동시에 열어 각자 기록할 수 있다")
    void handlesAreIndependent() {
        // given
        NewsSource first = newsSourceRepository.save(source("경향신문"));
        NewsSource second = newsSourceRepository.save(source("BBC News"));

        // when
        try (SourceHealthHandle a = healthStore.open(); SourceHealthHandle b = healthStore.open()) {
            a.updateSourceHealth(first.getId(), SourceStatus.OK, null, LocalDateTime.now(), 0);
            b.updateSourceHealth(second.getId(), SourceStatus.ERROR, "HTTP status 404", LocalDateTime.now(), 1);
        }

        // then
        assertThat(newsSourceRepository.findById(first.getId()).orElseThrow().getStatus()).isEqualTo(SourceStatus.OK);
        assertThat(newsSourceRepository.findById(second.getId()).orElseThrow().getConsecutiveErrorCount()).isEqualTo(1);
    }

    private static NewsSource source(String name) {
        return NewsSource.builder()
                .name(name)
                .type("rss")
                .url("https://example.com/" + name.hashCode() + "/rss")
                .build();
    }
}
