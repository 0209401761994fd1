package de.mirkosertic.docconsolidator.pipeline;

import java.time.Clock;

/**
 * Mutable counters a stage fills while it runs.
 */
final class StageCounters {

    private final String stage;
    private final Clock clock;
    private final long startMs;
    private int processed;
    private int changed;
    private int failed;

    StageCounters(final String stage, final Clock clock) {
        this.stage = stage;
        this.clock = clock;
        this.startMs = clock.millis();
    }

    void processed() {
        processed++;
    }

    void changed() {
        changed++;
    }

    void changed(final int count) {
        changed += count;
    }

    void failed() {
        failed++;
    }

    StageResult result() {
        return new StageResult(stage, processed, changed, failed, clock.millis() - startMs);
    }
}
