package com.newsinsight.refresh.controller;

import com.newsinsight.refresh.collector.CollectorRegistry;
import com.newsinsight.refresh.collector.SourceSnapshot;
import com.newsinsight.refresh.dto.RefreshRequest;
import com.newsinsight.refresh.dto.RefreshStateDTO;
import com.newsinsight.refresh.dto.RoundResponse;
import com.newsinsight.refresh.event.RefreshEvent;
import com.newsinsight.refresh.event.RefreshEventPublisher;
import com.newsinsight.refresh.orchestration.RefreshOrchestrator;
import com.newsinsight.refresh.service.SourceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * 갱신/상태 점검 라운드 제어 및 이벤트 스트리밍.
 * 시작 요청은 라운드를 띄우기만 하고 바로 응답한다. 진행 상황은 SSE로 받는다.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Slf4j
public class RefreshController {

    private static final Duration HEARTBEAT_INTERVAL = Duration.ofSeconds(30);

    private final RefreshOrchestrator refreshOrchestrator;
    private final RefreshEventPublisher eventPublisher;
    private final SourceService sourceService;
    private final CollectorRegistry collectorRegistry;

    /**
     * POST /api/v1/refresh - 갱신 라운드 시작 (sourceIds가 비어 있으면 활성 소스 전체)
     */
    @PostMapping("/refresh")
    public ResponseEntity<RoundResponse> startRefresh(@RequestBody(required = false) RefreshRequest request) {
        boolean started;
        if (request == null || request.sourceIds().isEmpty()) {
            started = refreshOrchestrator.refreshAll();
        } else {
            List<SourceSnapshot> sources = sourceService.snapshotsFor(request.sourceIds());
            started = refreshOrchestrator.refreshAll(sources);
        }
        return started
                ? ResponseEntity.status(HttpStatus.ACCEPTED).body(new RoundResponse("refresh", true, "Refresh started"))
                : ResponseEntity.status(HttpStatus.CONFLICT).body(new RoundResponse("refresh", false, "A refresh is already running"));
    }

    /**
     * POST /api/v1/refresh/cancel - 실행 중인 갱신 라운드 취소 요청
     */
    @PostMapping("/refresh/cancel")
    public ResponseEntity<RoundResponse> cancelRefresh() {
        boolean signalled = refreshOrchestrator.cancelRefresh();
        return ResponseEntity.ok(new RoundResponse("refresh", signalled,
                signalled ? "Cancellation requested" : "No refresh is running"));
    }

    /**
     * POST /api/v1/status-checks - 상태 점검 라운드 시작
     */
    @PostMapping("/status-checks")
    public ResponseEntity<RoundResponse> startStatusCheck() {
        boolean started = refreshOrchestrator.checkAllStatuses();
        return started
                ? ResponseEntity.status(HttpStatus.ACCEPTED).body(new RoundResponse("status-check", true, "Status check started"))
                : ResponseEntity.status(HttpStatus.CONFLICT).body(new RoundResponse("status-check", false, "A status check is already running"));
    }

    /**
     * POST /api/v1/status-checks/cancel - 실행 중인 상태 점검 취소 요청
     */
    @PostMapping("/status-checks/cancel")
    public ResponseEntity<RoundResponse> cancelStatusCheck() {
        boolean signalled = refreshOrchestrator.cancelStatusCheck();
        return ResponseEntity.ok(new RoundResponse("status-check", signalled,
                signalled ? "Cancellation requested" : "No status check is running"));
    }

    /**
     * GET /api/v1/refresh/state - 라운드 실행 여부와 소스 현황
     */
    @GetMapping("/refresh/state")
    public ResponseEntity<RefreshStateDTO> getState() {
        return ResponseEntity.ok(new RefreshStateDTO(
                refreshOrchestrator.isRefreshing(),
                refreshOrchestrator.isCheckingStatus(),
                sourceService.countAll(),
                sourceService.countEnabled(),
                collectorRegistry.registeredTypes(),
                eventPublisher.subscriberCount()
        ));
    }

    /**
     * GET /api/v1/refresh/events - 라운드 이벤트 스트림 (SSE).
     * 연결 직후 connected 이벤트, 이후 30초마다 heartbeat.
     */
    @GetMapping(value = "/refresh/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<RefreshEvent>> streamEvents() {
        log.info("New SSE client connected to refresh event stream");

        Flux<ServerSentEvent<RefreshEvent>> connected = Flux.just(
                ServerSentEvent.<RefreshEvent>builder()
                        .event("connected")
                        .comment("refresh events")
                        .build()
        );

        Flux<ServerSentEvent<RefreshEvent>> heartbeat = Flux.interval(HEARTBEAT_INTERVAL)
                .map(tick -> ServerSentEvent.<RefreshEvent>builder()
                        .event("heartbeat")
                        .comment("keep-alive")
                        .build());

        // 워커 스레드에서 분리하고, 느린 클라이언트는 버퍼로 흡수
        Flux<ServerSentEvent<RefreshEvent>> events = eventPublisher.events()
                .onBackpressureBuffer(1024)
                .publishOn(Schedulers.boundedElastic())
                .map(event -> ServerSentEvent.<RefreshEvent>builder()
                        .event(event.getEventType().name().toLowerCase(Locale.ROOT))
                        .data(event)
                        .build());

        return Flux.concat(connected, Flux.merge(heartbeat, events))
                .doOnCancel(() -> log.info("SSE client disconnected from refresh event stream"))
                .doOnError(e -> log.error("SSE stream error", e));
    }
}
