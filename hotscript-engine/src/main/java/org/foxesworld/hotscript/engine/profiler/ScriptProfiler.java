package org.foxesworld.hotscript.engine.profiler;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Rolling profiler for script execution.
 *
 * Tracks per script id:
 * - initialize / tick / event calls and total time
 * - failures
 *
 * Logs the top N scripts every report window (default 2s). Safe to record from worker threads.
 */
public final class ScriptProfiler {

    private static final Logger log = LogManager.getLogger(ScriptProfiler.class);

    public enum Phase { INIT, TICK, EVENT }

    public static final class ScriptStats {
        public final String scriptId;

        // totals
        public final AtomicLong initCalls = new AtomicLong();
        public final AtomicLong initTimeNanos = new AtomicLong();
        public final AtomicLong tickCalls = new AtomicLong();
        public final AtomicLong tickTimeNanos = new AtomicLong();
        public final AtomicLong eventCalls = new AtomicLong();
        public final AtomicLong eventTimeNanos = new AtomicLong();
        public final AtomicLong errors = new AtomicLong();

        // last window (since last report)
        final AtomicLong wInitCalls = new AtomicLong();
        final AtomicLong wInitTimeNanos = new AtomicLong();
        final AtomicLong wTickCalls = new AtomicLong();
        final AtomicLong wTickTimeNanos = new AtomicLong();
        final AtomicLong wErrors = new AtomicLong();

        ScriptStats(String scriptId) {
            this.scriptId = scriptId;
        }
    }

    private final Map<String, ScriptStats> scripts = new ConcurrentHashMap<>();

    private volatile long reportEveryNanos = 2_000_000_000L; // 2s
    private volatile int topN = 8;
    private volatile boolean enabled = true;

    private volatile long lastReportNanos = System.nanoTime();

    public ScriptProfiler setEnabled(boolean enabled) {
        this.enabled = enabled;
        return this;
    }

    public ScriptProfiler setReportEveryNanos(long nanos) {
        this.reportEveryNanos = Math.max(250_000_000L, nanos); // min 250ms
        return this;
    }

    public ScriptProfiler setTopN(int topN) {
        this.topN = Math.max(1, Math.min(32, topN));
        return this;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public long begin() {
        return enabled ? System.nanoTime() : 0L;
    }

    public void end(String scriptId, Phase phase, long t0Nanos, boolean ok) {
        if (!enabled || scriptId == null || t0Nanos == 0L) return;
        long dt = Math.max(0L, System.nanoTime() - t0Nanos);

        ScriptStats s = scripts.computeIfAbsent(scriptId, ScriptStats::new);

        if (!ok) {
            s.errors.incrementAndGet();
            s.wErrors.incrementAndGet();
        }

        switch (phase) {
            case INIT -> {
                s.initCalls.incrementAndGet();
                s.initTimeNanos.addAndGet(dt);
                s.wInitCalls.incrementAndGet();
                s.wInitTimeNanos.addAndGet(dt);
            }
            case TICK -> {
                s.tickCalls.incrementAndGet();
                s.tickTimeNanos.addAndGet(dt);
                s.wTickCalls.incrementAndGet();
                s.wTickTimeNanos.addAndGet(dt);
            }
            case EVENT -> {
                s.eventCalls.incrementAndGet();
                s.eventTimeNanos.addAndGet(dt);
            }
        }
    }

    /** Failure that happened before any hook ran (e.g. instance resolution). */
    public void recordError(String scriptId) {
        if (!enabled || scriptId == null) return;
        ScriptStats s = scripts.computeIfAbsent(scriptId, ScriptStats::new);
        s.errors.incrementAndGet();
        s.wErrors.incrementAndGet();
    }

    /** Totals for one script, null if nothing was recorded. */
    public ScriptStats stats(String scriptId) {
        return scripts.get(scriptId);
    }

    public void reset() {
        scripts.clear();
    }

    /** Call once per tick; logs when the report window elapsed. */
    public void tick() {
        if (!enabled) return;
        long now = System.nanoTime();
        if (now - lastReportNanos < reportEveryNanos) return;
        lastReportNanos = now;

        List<ScriptRow> rows = new ArrayList<>(scripts.size());
        for (ScriptStats s : scripts.values()) {
            long tCalls = s.wTickCalls.getAndSet(0);
            long tTime = s.wTickTimeNanos.getAndSet(0);
            long iCalls = s.wInitCalls.getAndSet(0);
            long iTime = s.wInitTimeNanos.getAndSet(0);
            long errs = s.wErrors.getAndSet(0);

            if (tCalls == 0 && iCalls == 0 && errs == 0) continue;

            rows.add(new ScriptRow(s.scriptId, tCalls, tTime, iCalls, iTime, errs));
        }
        if (rows.isEmpty()) return;

        rows.sort(Comparator.comparingLong(ScriptRow::sortKey).reversed());

        StringBuilder sb = new StringBuilder(512);
        sb.append("[ScriptProfiler] window=")
                .append(reportEveryNanos / 1_000_000_000.0).append("s")
                .append(" scripts=").append(rows.size());

        int n = Math.min(topN, rows.size());
        for (int i = 0; i < n; i++) {
            ScriptRow r = rows.get(i);
            sb.append("\n  #").append(i + 1).append(" ").append(r.scriptId)
                    .append(" tick=").append(r.tickCalls).append(" (").append(ms(r.tickTimeNanos)).append("ms)")
                    .append(" init=").append(r.initCalls).append(" (").append(ms(r.initTimeNanos)).append("ms)")
                    .append(" err=").append(r.errors);
        }

        log.info(sb.toString());
    }

    private static double ms(long nanos) {
        return nanos / 1_000_000.0;
    }

    private record ScriptRow(String scriptId, long tickCalls, long tickTimeNanos,
                             long initCalls, long initTimeNanos, long errors) {
        long sortKey() {
            // tick time first, then init time, then errors
            return tickTimeNanos * 2 + initTimeNanos + errors * 1_000_000L;
        }
    }
}
