package com.mediavault.service;

import java.util.function.LongSupplier;

/**
 * Decides when a progress event is worth sending: every N files, after T milliseconds,
 * and always for the last file.
 */
public class ProgressThrottle {

    private final int everyFiles;
    private final long intervalMillis;
    private final LongSupplier clock;
    private long lastEmitMillis;
    private int lastEmitCount;

    public ProgressThrottle(int everyFiles, long intervalMillis) {
        this(everyFiles, intervalMillis, System::currentTimeMillis);
    }

    public ProgressThrottle(int everyFiles, long intervalMillis, LongSupplier clock) {
        this.everyFiles = Math.max(1, everyFiles);
        this.intervalMillis = intervalMillis;
        this.clock = clock;
        this.lastEmitMillis = clock.getAsLong();
    }

    /**
     * @param current Number of files handled so far (1-based).
     * @param total   Number of files in the run.
     */
    public boolean shouldEmit(int current, int total) {
        long now = clock.getAsLong();
        boolean emit = current >= total
                || current - lastEmitCount >= everyFiles
                || now - lastEmitMillis >= intervalMillis;
        if (emit) {
            lastEmitMillis = now;
            lastEmitCount = current;
        }
        return emit;
    }
}
