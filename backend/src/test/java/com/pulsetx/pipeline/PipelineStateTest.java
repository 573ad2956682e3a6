package com.pulsetx.pipeline;

import com.pulsetx.domain.EnrichedRecord;
import com.pulsetx.domain.FetchError;
import com.pulsetx.domain.FetchErrorKind;
import com.pulsetx.domain.LoadingState;
import com.pulsetx.domain.SignatureInfo;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PipelineStateTest {

    private static EnrichedRecord record(String signature) {
        return EnrichedRecord.pending(new SignatureInfo(signature, 1L, 1_700_000_000L, null, null, null), Instant.EPOCH);
    }

    @Test
    void tryAcquire_secondHolderRefused() {
        PipelineState state = new PipelineState();

        long ticket = state.tryAcquire(LoadingState.LOADING_INITIAL);

        assertThat(ticket).isPositive();
        assertThat(state.tryAcquire(LoadingState.LOADING_MORE)).isEqualTo(-1);
        assertThat(state.loadingState()).isEqualTo(LoadingState.LOADING_INITIAL);
    }

    @Test
    void release_staleTicket_doesNotFreeNewerHold() {
        PipelineState state = new PipelineState();
        long first = state.tryAcquire(LoadingState.LOADING_INITIAL);
        assertThat(state.release(first)).isTrue();
        long second = state.tryAcquire(LoadingState.LOADING_MORE);

        assertThat(state.release(first)).isFalse();
        assertThat(state.loadingState()).isEqualTo(LoadingState.LOADING_MORE);
        assertThat(state.release(second)).isTrue();
        assertThat(state.release(second)).isFalse();
    }

    @Test
    void tryAcquire_idle_rejected() {
        assertThatThrownBy(() -> new PipelineState().tryAcquire(LoadingState.IDLE))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void appendPage_cursorFromLastElementOnly() {
        PipelineState state = new PipelineState();
        long ticket = state.tryAcquire(LoadingState.LOADING_INITIAL);

        assertThat(state.appendPage(ticket, List.of(record("A"), record("B")))).isTrue();
        assertThat(state.appendPage(ticket, List.of())).isTrue();

        assertThat(state.cursor()).isEqualTo("B");
        assertThat(state.exhausted()).isTrue();
        assertThat(state.snapshot().records()).extracting(EnrichedRecord::signature).containsExactly("A", "B");
    }

    @Test
    @DisplayName("a page from a released hold is not appended into the next fetch's state")
    void appendPage_staleTicket_ignored() {
        PipelineState state = new PipelineState();
        long cancelled = state.tryAcquire(LoadingState.LOADING_INITIAL);
        state.release(cancelled);
        long current = state.tryAcquire(LoadingState.LOADING_INITIAL);
        state.reset("addr2");

        assertThat(state.appendPage(cancelled, List.of(record("OLD")))).isFalse();
        assertThat(state.recordFailure(cancelled, FetchError.of(FetchErrorKind.TIMEOUT, null, "late", Instant.EPOCH))).isFalse();

        PipelineSnapshot snapshot = state.snapshot();
        assertThat(snapshot.records()).isEmpty();
        assertThat(snapshot.cursor()).isNull();
        assertThat(snapshot.lastError()).isNull();
        assertThat(state.appendPage(current, List.of(record("NEW")))).isTrue();
        assertThat(state.cursor()).isEqualTo("NEW");
    }

    @Test
    void appendPage_afterRelease_ignored() {
        PipelineState state = new PipelineState();
        long ticket = state.tryAcquire(LoadingState.LOADING_MORE);
        state.release(ticket);

        assertThat(state.appendPage(ticket, List.of(record("A")))).isFalse();
        assertThat(state.snapshot().records()).isEmpty();
    }

    @Test
    void snapshot_isImmutableCopy() {
        PipelineState state = new PipelineState();
        long ticket = state.tryAcquire(LoadingState.LOADING_INITIAL);
        state.appendPage(ticket, List.of(record("A")));
        PipelineSnapshot before = state.snapshot();

        state.appendPage(ticket, List.of(record("B")));

        assertThat(before.records()).hasSize(1);
        assertThatThrownBy(() -> before.records().add(record("C")))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void reset_clearsRecordsCursorAndExhaustion() {
        PipelineState state = new PipelineState();
        long ticket = state.tryAcquire(LoadingState.LOADING_INITIAL);
        state.appendPage(ticket, List.of(record("A")));
        state.appendPage(ticket, List.of());

        state.reset("addr");

        PipelineSnapshot snapshot = state.snapshot();
        assertThat(snapshot.records()).isEmpty();
        assertThat(snapshot.cursor()).isNull();
        assertThat(snapshot.exhausted()).isFalse();
        assertThat(snapshot.address()).isEqualTo("addr");
    }
}
