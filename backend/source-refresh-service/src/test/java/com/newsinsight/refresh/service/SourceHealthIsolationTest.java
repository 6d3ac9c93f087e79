package com.newsinsight.refresh.service;

import com.newsinsight.refresh.dto.NewsSourceUpdateRequest;
import com.newsinsight.refresh.entity.NewsSource;
import com.newsinsight.refresh.entity.SourceStatus;
import com.newsinsight.refresh.persistence.SourceHealthHandle;
import com.newsinsight.refresh.persistence.SourceHealthStore;
import com.newsinsight.refresh.repository.NewsSourceRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 관리 API의 소스 수정이 상태 점검이 기록한 헬스 값을 덮어쓰지 않는지 확인
 */
@SpringBootTest
class SourceHealthIsolationTest {

    @Autowired
    private SourceService sourceService;

    @Autowired
    private NewsSourceRepository newsSourceRepository;

    @Autowired
    private SourceHealthStore healthStore;

    @Autowired
    private PlatformTransactionManager transactionManager;

    private TransactionTemplate transactionTemplate;

    private Long sourceId;

    @BeforeEach
    void setUp() {
        transactionTemplate = new TransactionTemplate(transactionManager);
        sourceId = newsSourceRepository.save(NewsSource.builder()
                .name("연합뉴스")
                .type("rss")
                .url("https://www.yna.co.kr/rss/news.xml")
                .build()).getId();
    }

    @AfterEach
    void tearDown() {
        newsSourceRepository.deleteAll();
    }

    @Test
    @DisplayName("엔티티를 읽은 뒤 기록된 헬스 값은 같은 트랜잭션의 수정 커밋 후에도 유지")
    void entityEditKeepsConcurrentHealthWrite() {
        // given
        LocalDateTime checkedAt = LocalDateTime.now().truncatedTo(ChronoUnit.SECONDS);

        // when
        transactionTemplate.executeWithoutResult(status -> {
            NewsSource loaded = newsSourceRepository.findById(sourceId).orElseThrow();
            writeHealth(SourceStatus.ERROR, "HTTP status 503", checkedAt, 3);
            loaded.setNotes("edited");
        });

        // then
        NewsSource stored = newsSourceRepository.findById(sourceId).orElseThrow();
        assertThat(stored.getNotes()).isEqualTo("edited");
        assertThat(stored.getStatus()).isEqualTo(SourceStatus.ERROR);
        assertThat(stored.getLastError()).isEqualTo("HTTP status 503");
        assertThat(stored.getLastCheckedTime()).isEqualTo(checkedAt);
        assertThat(stored.getConsecutiveErrorCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("SourceService 수정과 비활성화는 헬스 컬럼을 건드리지 않는다")
    void serviceUpdateKeepsHealth() {
        // given
        LocalDateTime checkedAt = LocalDateTime.now().truncatedTo(ChronoUnit.SECONDS);

        // when: 서비스 트랜잭션이 헬스 기록 이전에 읽은 엔티티를 재사용
        transactionTemplate.executeWithoutResult(status -> {
            newsSourceRepository.findById(sourceId).orElseThrow();
            writeHealth(SourceStatus.ERROR, "Feed could not be parsed", checkedAt, 2);
            sourceService.update(sourceId, new NewsSourceUpdateRequest(null, null, null, "politics", null, null, null));
            sourceService.setEnabled(sourceId, false);
        });

        // then
        NewsSource stored = newsSourceRepository.findById(sourceId).orElseThrow();
        assertThat(stored.getCategory()).isEqualTo("politics");
        assertThat(stored.getEnabled()).isFalse();
        assertThat(stored.getStatus()).isEqualTo(SourceStatus.ERROR);
        assertThat(stored.getLastError()).isEqualTo("Feed could not be parsed");
        assertThat(stored.getConsecutiveErrorCount()).isEqualTo(2);
    }

    private void writeHealth(SourceStatus status, String lastError, LocalDateTime checkedAt, int consecutiveErrors) {
        try (SourceHealthHandle handle = healthStore.open()) {
            handle.updateSourceHealth(sourceId, status, lastError, checkedAt, consecutiveErrors);
        }
    }
}
