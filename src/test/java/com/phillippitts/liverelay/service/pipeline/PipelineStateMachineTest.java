package com.phillippitts.liverelay.service.pipeline;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PipelineStateMachineTest {

    @Test
    void fullCycleReturnsToIdle() {
        PipelineStateMachine sm = new PipelineStateMachine();

        assertThat(sm.beginStart()).isTrue();
        assertThat(sm.current()).isEqualTo(PipelineState.STARTING);
        sm.markRunning();
        assertThat(sm.beginStop()).isTrue();
        assertThat(sm.current()).isEqualTo(PipelineState.STOPPING);
        sm.markIdle();

        assertThat(sm.current()).isEqualTo(PipelineState.IDLE);
    }

    @Test
    void onlyOneStartWins() {
        PipelineStateMachine sm = new PipelineStateMachine();

        assertThat(sm.beginStart()).isTrue();
        assertThat(sm.beginStart()).isFalse();
        sm.markRunning();
        assertThat(sm.beginStart()).isFalse();
    }

    @Test
    void onlyOneStopWins() {
        PipelineStateMachine sm = new PipelineStateMachine();
        sm.beginStart();
        sm.markRunning();

        assertThat(sm.beginStop()).isTrue();
        assertThat(sm.beginStop()).isFalse();
    }

    @Test
    void failedStartReturnsToIdle() {
        PipelineStateMachine sm = new PipelineStateMachine();
        sm.beginStart();

        sm.abortStart();

        assertThat(sm.current()).isEqualTo(PipelineState.IDLE);
        assertThat(sm.beginStart()).isTrue();
    }

    @Test
    void illegalTransitionsThrow() {
        PipelineStateMachine sm = new PipelineStateMachine();

        assertThatThrownBy(sm::markRunning).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(sm::markIdle).isInstanceOf(IllegalStateException.class);
        assertThat(sm.beginStop()).isFalse();
    }

    @Test
    void awaitSettledWaitsForStartToFinish() throws Exception {
        PipelineStateMachine sm = new PipelineStateMachine();
        sm.beginStart();
        CompletableFuture<PipelineState> waiter = CompletableFuture.supplyAsync(() -> {
            try {
                return sm.awaitSettled();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return null;
            }
        });
        Thread.sleep(50);
        assertThat(waiter).isNotDone();

        sm.markRunning();

        assertThat(waiter.get(2, TimeUnit.SECONDS)).isEqualTo(PipelineState.RUNNING);
    }
}
