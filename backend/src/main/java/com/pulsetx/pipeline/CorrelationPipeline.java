package com.pulsetx.pipeline;

import com.pulsetx.domain.EnrichedRecord;
import com.pulsetx.domain.FetchError;
import com.pulsetx.domain.FetchErrorKind;
import com.pulsetx.domain.LoadingState;
import com.pulsetx.domain.PageOutcome;
import com.pulsetx.domain.SignatureInfo;
import com.pulsetx.heartrate.HeartRateWindowResolver;
import com.pulsetx.ingestion.adapter.RpcException;
import com.pulsetx.ingestion.adapter.solana.LedgerSignatureClient;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Fetch-and-correlate pipeline for one session: pages signatures for an address, enriches each record with the
 * heart-rate window average and appends in server order.
 * <p>
 * Only one page operation runs at a time; a call made while another is in flight completes immediately with
 * {@link PageOutcome.Status#REJECTED_BUSY}. Records of a page are enriched one after another, with at most one
 * heart-rate query outstanding.
 */
@Slf4j
public class CorrelationPipeline {

    private final LedgerSignatureClient ledgerClient;
    private final HeartRateWindowResolver heartRateResolver;
    private final Clock clock;
    private final int pageLimit;
    private final Duration pageTimeout;
    private final PipelineState state = new PipelineState();

    public CorrelationPipeline(LedgerSignatureClient ledgerClient,
                               HeartRateWindowResolver heartRateResolver,
                               Clock clock,
                               int pageLimit,
                               Duration pageTimeout) {
        if (pageLimit <= 0) {
            throw new IllegalArgumentException("pageLimit must be positive");
        }
        this.ledgerClient = ledgerClient;
        this.heartRateResolver = heartRateResolver;
        this.clock = clock;
        this.pageLimit = pageLimit;
        this.pageTimeout = pageTimeout;
    }

    /**
     * Clears the current history and loads the newest page for {@code address}.
     */
    public Mono<PageOutcome> initialFetch(String address) {
        return Mono.defer(() -> {
            if (address == null || address.isBlank()) {
                return Mono.error(new IllegalArgumentException("address is required"));
            }
            long ticket = state.tryAcquire(LoadingState.LOADING_INITIAL);
            if (ticket < 0) {
                log.debug("initialFetch rejected: pipeline busy ({})", state.loadingState());
                return Mono.just(PageOutcome.rejectedBusy(state.cursor()));
            }
            String trimmed = address.trim();
            state.reset(trimmed);
            return fetchAndAppend(trimmed, null, ticket);
        });
    }

    /**
     * Loads the page older than the cursor. No-op when busy, when no page has been fetched yet, or once an
     * empty page has marked the history as exhausted.
     */
    public Mono<PageOutcome> loadMore() {
        return Mono.defer(() -> {
            long ticket = state.tryAcquire(LoadingState.LOADING_MORE);
            if (ticket < 0) {
                log.debug("loadMore rejected: pipeline busy ({})", state.loadingState());
                return Mono.just(PageOutcome.rejectedBusy(state.cursor()));
            }
            String cursor = state.cursor();
            if (cursor == null) {
                state.release(ticket);
                return Mono.just(PageOutcome.noCursor());
            }
            if (state.exhausted()) {
                state.release(ticket);
                return Mono.just(PageOutcome.exhausted(cursor));
            }
            return fetchAndAppend(state.address(), cursor, ticket);
        });
    }

    public PipelineSnapshot snapshot() {
        return state.snapshot();
    }

    private Mono<PageOutcome> fetchAndAppend(String address, String before, long ticket) {
        Mono<List<EnrichedRecord>> page = ledgerClient.fetchPage(address, pageLimit, before)
                .flatMap(this::enrichSequentially);
        if (pageTimeout != null && !pageTimeout.isZero() && !pageTimeout.isNegative()) {
            page = page.timeout(pageTimeout);
        }
        return page
                .map(records -> {
                    if (!state.appendPage(ticket, records)) {
                        log.debug("Dropped page for {} before {}: hold was released", address, before);
                        return PageOutcome.rejectedBusy(state.cursor());
                    }
                    state.release(ticket);
                    String cursor = state.cursor();
                    if (records.isEmpty()) {
                        log.info("No more signatures for {} before {}", address, before);
                        return PageOutcome.exhausted(cursor);
                    }
                    log.info("Appended {} records for {} (cursor {})", records.size(), address, cursor);
                    return PageOutcome.appended(records.size(), cursor);
                })
                .onErrorResume(e -> {
                    FetchError error = toFetchError(e, clock.instant());
                    state.recordFailure(ticket, error);
                    state.release(ticket);
                    log.warn("Page fetch failed for {} before {}: {} {}", address, before, error.kind(), error.message());
                    return Mono.just(PageOutcome.failed(error, state.cursor()));
                })
                .doFinally(signal -> state.release(ticket));
    }

    /**
     * One heart-rate query at a time, in page order. A record without a reading keeps a null heart rate.
     */
    private Mono<List<EnrichedRecord>> enrichSequentially(List<SignatureInfo> page) {
        return Flux.fromIterable(page)
                .map(info -> EnrichedRecord.pending(info, clock.instant()))
                .concatMap(record -> heartRateResolver.averageAround(record.timestamp())
                        .map(record::withHeartRate)
                        .defaultIfEmpty(record)
                        .onErrorReturn(record))
                .collectList();
    }

    static FetchError toFetchError(Throwable e, Instant occurredAt) {
        if (e instanceof RpcException rpc) {
            return rpc.toFetchError(occurredAt);
        }
        if (e instanceof TimeoutException) {
            return FetchError.of(FetchErrorKind.TIMEOUT, null, "Page operation timed out", occurredAt);
        }
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return FetchError.of(FetchErrorKind.TRANSPORT, null, message, occurredAt);
    }
}
