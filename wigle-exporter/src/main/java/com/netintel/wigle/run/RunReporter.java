package com.netintel.wigle.run;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Progress channel for one run. Keeps the event history, mirrors it to the log and
 * forwards it to a listener. Accepts at most one terminal event.
 */
@Slf4j
public class RunReporter {

    private final String runId;
    private final RunListener listener;
    private final List<String> events = new CopyOnWriteArrayList<>();
    private final AtomicReference<String> terminal = new AtomicReference<>();

    public RunReporter(String runId, RunListener listener) {
        this.runId = runId;
        this.listener = listener == null ? RunListener.NOOP : listener;
    }

    public RunReporter(String runId) {
        this(runId, RunListener.NOOP);
    }

    public String getRunId() {
        return runId;
    }

    public void event(String message) {
        log.info("[{}] {}", runId, message);
        events.add(message);
        listener.onEvent(runId, message);
    }

    /**
     * Emits the terminal summary. Returns false, and emits nothing, if the run already completed.
     */
    public boolean complete(String summary) {
        if (!terminal.compareAndSet(null, summary)) {
            log.warn("[{}] Ignoring second terminal event: {}", runId, summary);
            return false;
        }
        log.info("[{}] {}", runId, summary);
        events.add(summary);
        listener.onComplete(runId, summary);
        return true;
    }

    public boolean isComplete() {
        return terminal.get() != null;
    }

    public Optional<String> terminalMessage() {
        return Optional.ofNullable(terminal.get());
    }

    public List<String> events() {
        return List.copyOf(events);
    }
}
