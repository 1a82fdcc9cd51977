package com.netintel.wigle.run;

import com.netintel.wigle.exception.RunInProgressException;
import com.netintel.wigle.model.RunSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs export work off the caller's thread, one run at a time.
 *
 * The caller gets a {@link RunHandle} immediately and follows the run through its reporter.
 * Whatever the task does, the reporter receives exactly one terminal event.
 */
@Component
@Slf4j
public class RunExecutor {

    @FunctionalInterface
    public interface RunTask {
        RunSummary run(RunReporter reporter, CancellationToken token);
    }

    private final TaskExecutor taskExecutor;
    private final RunListener listener;
    private final AtomicReference<RunHandle> active = new AtomicReference<>();
    private final AtomicReference<RunHandle> last = new AtomicReference<>();

    public RunExecutor(@Qualifier("runTaskExecutor") TaskExecutor taskExecutor,
                       Optional<RunListener> listener) {
        this.taskExecutor = taskExecutor;
        this.listener = listener.orElse(RunListener.NOOP);
    }

    /**
     * @throws RunInProgressException if another run has not finished yet
     */
    public RunHandle submit(String label, RunTask task) {
        String runId = label + "-" + UUID.randomUUID().toString().substring(0, 8);
        RunHandle handle = new RunHandle(runId, label, new CancellationToken(),
                new RunReporter(runId, listener), new CompletableFuture<>());

        if (!active.compareAndSet(null, handle)) {
            RunHandle running = active.get();
            throw new RunInProgressException(running != null ? running.runId() : "unknown");
        }
        try {
            taskExecutor.execute(() -> execute(handle, task));
        } catch (TaskRejectedException e) {
            active.compareAndSet(handle, null);
            throw new RunInProgressException("worker busy");
        }
        log.info("Run {} submitted", runId);
        return handle;
    }

    /** The active run, or the most recently finished one. */
    public Optional<RunHandle> current() {
        RunHandle running = active.get();
        return Optional.ofNullable(running != null ? running : last.get());
    }

    /**
     * Requests cancellation of the active run. The run stops at its next page or identifier.
     *
     * @return false when nothing is running
     */
    public boolean cancelCurrent() {
        RunHandle running = active.get();
        if (running == null) {
            return false;
        }
        log.info("Cancellation requested for run {}", running.runId());
        running.token().cancel();
        return true;
    }

    private void execute(RunHandle handle, RunTask task) {
        RunSummary summary = null;
        RuntimeException failure = null;
        try {
            summary = task.run(handle.reporter(), handle.token());
        } catch (RuntimeException e) {
            log.error("Run {} failed: {}", handle.runId(), e.getMessage(), e);
            failure = e;
        } finally {
            if (!handle.reporter().isComplete()) {
                handle.reporter().complete("Run failed: " + (failure != null ? failure.getMessage() : "no summary"));
            }
            last.set(handle);
            active.compareAndSet(handle, null);
        }

        if (failure != null) {
            handle.result().completeExceptionally(failure);
        } else {
            handle.result().complete(summary);
        }
    }
}
