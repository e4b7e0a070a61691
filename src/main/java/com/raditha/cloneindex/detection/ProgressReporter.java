package com.raditha.cloneindex.detection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Time-throttled progress logging for long scans.
 * Small workloads and silenced reporters log nothing.
 */
public class ProgressReporter {

    private static final Logger logger = LoggerFactory.getLogger(ProgressReporter.class);

    public static final int MIN_ITEMS_FOR_DISPLAY = 50;
    private static final long DEFAULT_INTERVAL_NANOS = TimeUnit.SECONDS.toNanos(5);

    private final String task;
    private final int total;
    private final boolean enabled;
    private final long intervalNanos;
    private final long startNanos;
    private long lastReportNanos;
    private int reports;

    public ProgressReporter(String task, int total, boolean silent) {
        this(task, total, silent, DEFAULT_INTERVAL_NANOS);
    }

    ProgressReporter(String task, int total, boolean silent, long intervalNanos) {
        this.task = task;
        this.total = total;
        this.enabled = !silent && total >= MIN_ITEMS_FOR_DISPLAY;
        this.intervalNanos = intervalNanos;
        this.startNanos = System.nanoTime();
        this.lastReportNanos = startNanos;
    }

    /**
     * Record that {@code current} items (1-based) are done.
     */
    public void update(int current) {
        if (!enabled) {
            return;
        }
        long now = System.nanoTime();
        if (current == 1 || current == total || now - lastReportNanos >= intervalNanos) {
            lastReportNanos = now;
            reports++;
            double elapsed = (now - startNanos) / 1e9;
            logger.info("{}: {}/{} ({}%) after {}s",
                    task, current, total, Math.round(100.0 * current / total), String.format("%.1f", elapsed));
        }
    }

    public void finish() {
        if (enabled) {
            logger.info("{}: done in {}s", task, String.format("%.1f", (System.nanoTime() - startNanos) / 1e9));
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    int reportCount() {
        return reports;
    }
}
