package com.netintel.wigle.run;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RunReporterTest {

    @Test
    void shouldForwardEventsInOrderAndAcceptOneTerminalEvent() {
        // Given
        List<String> seen = new ArrayList<>();
        RunReporter reporter = new RunReporter("run-7", new RunListener() {
            @Override
            public void onEvent(String runId, String message) {
                seen.add("event:" + message);
            }

            @Override
            public void onComplete(String runId, String summary) {
                seen.add("done:" + summary);
            }
        });

        // When
        reporter.event("Output folder: /tmp/x");
        reporter.event("Page 1: 3 results saved");
        boolean first = reporter.complete("Search complete");
        boolean second = reporter.complete("Search failed");

        // Then
        assertThat(first).isTrue();
        assertThat(second).isFalse();
        assertThat(reporter.isComplete()).isTrue();
        assertThat(reporter.terminalMessage()).contains("Search complete");
        assertThat(seen).containsExactly(
                "event:Output folder: /tmp/x", "event:Page 1: 3 results saved", "done:Search complete");
        assertThat(reporter.events()).endsWith("Search complete");
    }

    @Test
    void shouldTolerateMissingListener() {
        RunReporter reporter = new RunReporter("run-8", null);

        reporter.event("hello");

        assertThat(reporter.isComplete()).isFalse();
        assertThat(reporter.terminalMessage()).isEmpty();
        assertThat(reporter.events()).containsExactly("hello");
    }
}
