package com.netintel.wigle.run;

/**
 * Receives the human-readable progress stream of a run.
 */
public interface RunListener {

    RunListener NOOP = new RunListener() {
        @Override
        public void onEvent(String runId, String message) {
        }
    };

    void onEvent(String runId, String message);

    /** Called exactly once per run, after the last event. */
    default void onComplete(String runId, String summary) {
    }
}
