package com.newsinsight.refresh.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * 라운드 이벤트 허브.
 * 워커 스레드 여러 개가 동시에 발행하므로 emit은 직렬화한다.
 * 구독자가 없을 때 발행된 이벤트는 버려진다.
 */
@Component
@Slf4j
public class RefreshEventPublisher {

    private final Sinks.Many<RefreshEvent> eventSink = Sinks.many().multicast().directBestEffort();

    /**
     * 이벤트 스트림을 구독합니다.
     * 느린 구독자는 {@code publishOn}으로 발행 스레드에서 분리해야 한다.
     */
    public Flux<RefreshEvent> events() {
        return eventSink.asFlux()
                .doOnSubscribe(sub -> log.debug("New subscriber connected to refresh event stream"))
                .doOnCancel(() -> log.debug("Subscriber disconnected from refresh event stream"));
    }

    public synchronized void publish(RefreshEvent event) {
        Sinks.EmitResult result = eventSink.tryEmitNext(event);
        if (result == Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.debug("No subscribers for event {}", event.getEventType());
        } else if (result.isFailure()) {
            log.warn("Failed to publish event {}: {}", event.getEventType(), result);
        } else {
            log.debug("Published event: {} {}", event.getEventType(),
                    event.getSourceName() != null ? event.getSourceName() : "");
        }
    }

    public int subscriberCount() {
        return eventSink.currentSubscriberCount();
    }
}
