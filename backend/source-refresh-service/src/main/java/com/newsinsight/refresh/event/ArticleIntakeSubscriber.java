package com.newsinsight.refresh.event;

import com.newsinsight.refresh.service.ArticleIntakeService;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.scheduler.Schedulers;

/**
 * SOURCE_REFRESHED 이벤트를 받아 기사 배치를 저장.
 * 저장은 발행 스레드가 아닌 boundedElastic 스케줄러에서 실행된다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ArticleIntakeSubscriber {

    private final RefreshEventPublisher eventPublisher;
    private final ArticleIntakeService articleIntakeService;

    private Disposable subscription;

    @PostConstruct
    public void subscribe() {
        subscription = eventPublisher.events()
                .filter(event -> event.getEventType() == RefreshEventType.SOURCE_REFRESHED)
                .onBackpressureBuffer()
                .publishOn(Schedulers.boundedElastic())
                .subscribe(this::handle,
                        error -> log.error("Article intake subscription terminated: {}", error.getMessage(), error));
        log.info("Article intake subscribed to refresh events");
    }

    void handle(RefreshEvent event) {
        try {
            articleIntakeService.storeBatch(event.getSourceName(), event.getArticles());
        } catch (RuntimeException e) {
            // one bad batch must not end the subscription
            log.error("Failed to store articles from '{}': {}", event.getSourceName(), e.getMessage(), e);
        }
    }

    @PreDestroy
    public void unsubscribe() {
        if (subscription != null) {
            subscription.dispose();
        }
    }
}
