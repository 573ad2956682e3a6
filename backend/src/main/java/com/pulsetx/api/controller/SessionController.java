package com.pulsetx.api.controller;

import com.pulsetx.api.dto.EnrichedRecordResponse;
import com.pulsetx.api.dto.ErrorBody;
import com.pulsetx.api.dto.FetchErrorResponse;
import com.pulsetx.api.dto.InitialFetchRequest;
import com.pulsetx.api.dto.PageOutcomeResponse;
import com.pulsetx.api.dto.PipelineStatusResponse;
import com.pulsetx.api.dto.SessionCreatedResponse;
import com.pulsetx.domain.FetchErrorKind;
import com.pulsetx.domain.PageOutcome;
import com.pulsetx.pipeline.CorrelationPipeline;
import com.pulsetx.pipeline.PipelineSessionRegistry;
import com.pulsetx.pipeline.PipelineSnapshot;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.function.Function;

/**
 * Per-session pipeline API: create, initial-fetch, load-more, status, delete.
 */
@RestController
@RequestMapping("/api/v1/sessions")
@RequiredArgsConstructor
public class SessionController {

    private final PipelineSessionRegistry sessionRegistry;

    @PostMapping
    public ResponseEntity<SessionCreatedResponse> create() {
        return ResponseEntity.status(HttpStatus.CREATED).body(new SessionCreatedResponse(sessionRegistry.create()));
    }

    @GetMapping("/{sessionId}")
    public ResponseEntity<?> status(@PathVariable String sessionId) {
        return sessionRegistry.find(sessionId)
                .<ResponseEntity<?>>map(p -> ResponseEntity.ok(toStatusResponse(sessionId, p.snapshot())))
                .orElseGet(() -> notFound(sessionId));
    }

    @PostMapping("/{sessionId}/initial-fetch")
    public Mono<ResponseEntity<?>> initialFetch(@PathVariable String sessionId,
                                                @Valid @RequestBody InitialFetchRequest request) {
        return withSession(sessionId, p -> p.initialFetch(request.address()));
    }

    @PostMapping("/{sessionId}/load-more")
    public Mono<ResponseEntity<?>> loadMore(@PathVariable String sessionId) {
        return withSession(sessionId, CorrelationPipeline::loadMore);
    }

    @DeleteMapping("/{sessionId}")
    public ResponseEntity<?> delete(@PathVariable String sessionId) {
        return sessionRegistry.remove(sessionId) ? ResponseEntity.noContent().build() : notFound(sessionId);
    }

    private Mono<ResponseEntity<?>> withSession(String sessionId, Function<CorrelationPipeline, Mono<PageOutcome>> op) {
        return sessionRegistry.find(sessionId)
                .map(p -> op.apply(p).<ResponseEntity<?>>map(SessionController::toOutcomeResponse))
                .orElseGet(() -> Mono.just(notFound(sessionId)));
    }

    static ResponseEntity<?> toOutcomeResponse(PageOutcome outcome) {
        HttpStatus status = switch (outcome.status()) {
            case APPENDED, EXHAUSTED, NO_CURSOR -> HttpStatus.OK;
            case REJECTED_BUSY -> HttpStatus.CONFLICT;
            case FAILED -> outcome.error() != null && outcome.error().kind() == FetchErrorKind.TIMEOUT
                    ? HttpStatus.GATEWAY_TIMEOUT
                    : HttpStatus.BAD_GATEWAY;
        };
        return ResponseEntity.status(status).body(PageOutcomeResponse.from(outcome));
    }

    private static PipelineStatusResponse toStatusResponse(String sessionId, PipelineSnapshot s) {
        return new PipelineStatusResponse(
                sessionId,
                s.address(),
                s.records().stream()
                        .map(r -> new EnrichedRecordResponse(
                                r.id(),
                                r.signature(),
                                r.slot(),
                                r.timestamp(),
                                r.timestampEstimated(),
                                r.failedOnChain(),
                                r.memo(),
                                r.confirmationStatus(),
                                r.heartRateBpm()))
                        .toList(),
                s.cursor(),
                s.isLoadingInitial(),
                s.isLoadingMore(),
                s.exhausted(),
                FetchErrorResponse.from(s.lastError()));
    }

    private static ResponseEntity<?> notFound(String sessionId) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ErrorBody.of("SESSION_NOT_FOUND", "No session " + sessionId));
    }
}
