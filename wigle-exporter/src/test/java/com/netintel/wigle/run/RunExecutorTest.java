package com.netintel.wigle.run;

import com.netintel.wigle.exception.RunInProgressException;
import com.netintel.wigle.model.RunStatus;
import com.netintel.wigle.model.RunSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RunExecutorTest {

    private final List<Runnable> pending = new ArrayList<>();
    private final List<String> completions = new ArrayList<>();
    private RunExecutor executor;

    @BeforeEach
    void setUp() {
        TaskExecutor deferred = pending::add;
        RunListener listener = new RunListener() {
            @Override
            public void onEvent(String runId, String message) {
            }

            @Override
            public void onComplete(String runId, String summary) {
                completions.add(summary);
            }
        };
        executor = new RunExecutor(deferred, Optional.of(listener));
    }

    private void drain() {
        List<Runnable> tasks = new ArrayList<>(pending);
        pending.clear();
        tasks.forEach(Runnable::run);
    }

    private static RunSummary succeeded(RunReporter reporter) {
        reporter.complete("Search complete");
        return RunSummary.builder().runId(reporter.getRunId()).status(RunStatus.SUCCEEDED).build();
    }

    @Nested
    @DisplayName("single active run")
    class SingleActiveRun {

        @Test
        void shouldRejectSecondRunWhileFirstIsActive() {
            // Given
            RunHandle first = executor.submit("wifi-basic", (reporter, token) -> succeeded(reporter));

            // When / Then
            assertThatThrownBy(() -> executor.submit("bt-basic", (reporter, token) -> succeeded(reporter)))
                    .isInstanceOf(RunInProgressException.class)
                    .hasMessageContaining(first.runId());
            assertThat(pending).hasSize(1);
        }

        @Test
        void shouldAcceptNewRunOnceActiveRunFinishes() {
            // Given
            executor.submit("wifi-basic", (reporter, token) -> succeeded(reporter));
            drain();

            // When
            RunHandle second = executor.submit("bt-basic", (reporter, token) -> succeeded(reporter));

            // Then
            assertThat(second.runId()).startsWith("bt-basic-");
            assertThat(executor.current()).contains(second);
        }

        @Test
        void shouldReleaseSlotWhenWorkerRejectsTask() {
            // Given
            executor = new RunExecutor(task -> {
                throw new TaskRejectedException("pool saturated");
            }, Optional.empty());

            // When / Then
            assertThatThrownBy(() -> executor.submit("wifi-basic", (reporter, token) -> succeeded(reporter)))
                    .isInstanceOf(RunInProgressException.class)
                    .hasMessageContaining("worker busy");
            assertThat(executor.current()).isEmpty();
        }
    }

    @Test
    void shouldCompleteResultWithTaskSummary() {
        // Given
        RunHandle handle = executor.submit("wifi-basic", (reporter, token) -> succeeded(reporter));

        // When
        drain();

        // Then
        assertThat(handle.isDone()).isTrue();
        assertThat(handle.result().join().getStatus()).isEqualTo(RunStatus.SUCCEEDED);
        assertThat(completions).containsExactly("Search complete");
        assertThat(executor.current()).contains(handle);
    }

    @Test
    void shouldEmitTerminalEventWhenTaskThrows() {
        // Given
        RunHandle handle = executor.submit("wifi-basic", (reporter, token) -> {
            reporter.event("Page 1: 10 results saved");
            throw new IllegalStateException("boom");
        });

        // When
        drain();

        // Then
        assertThat(handle.result()).isCompletedExceptionally();
        assertThat(handle.reporter().terminalMessage()).contains("Run failed: boom");
        assertThat(completions).containsExactly("Run failed: boom");
    }

    @Test
    void shouldEmitTerminalEventWhenTaskReturnsWithoutCompleting() {
        // Given
        RunHandle handle = executor.submit("wifi-basic", (reporter, token) -> null);

        // When
        drain();

        // Then
        assertThat(handle.reporter().terminalMessage()).contains("Run failed: no summary");
        assertThat(completions).hasSize(1);
    }

    @Test
    void shouldSignalCancellationToActiveRun() {
        // Given
        assertThat(executor.cancelCurrent()).isFalse();
        RunHandle handle = executor.submit("wifi-basic", (reporter, token) -> succeeded(reporter));

        // When
        boolean requested = executor.cancelCurrent();

        // Then
        assertThat(requested).isTrue();
        assertThat(handle.token().isCancelled()).isTrue();
    }
}
