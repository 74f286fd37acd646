package org.foxesworld.hotscript.engine.hotreload;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters of the reload pipeline. Safe to update from any thread.
 */
public final class HotReloadStatistics {

    private final AtomicLong total = new AtomicLong();
    private final AtomicLong successful = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong rollbacks = new AtomicLong();
    private final AtomicLong debounced = new AtomicLong();
    private final AtomicLong unchangedSkipped = new AtomicLong();
    private final AtomicLong compileNanos = new AtomicLong();
    private final AtomicLong reloadNanos = new AtomicLong();

    void recordSuccess(long compileNanos, long reloadNanos) {
        total.incrementAndGet();
        successful.incrementAndGet();
        this.compileNanos.addAndGet(compileNanos);
        this.reloadNanos.addAndGet(reloadNanos);
    }

    void recordFailure(long compileNanos) {
        total.incrementAndGet();
        failed.incrementAndGet();
        this.compileNanos.addAndGet(compileNanos);
    }

    void recordRollback() { rollbacks.incrementAndGet(); }

    void recordDebounced() { debounced.incrementAndGet(); }

    void recordUnchanged() { unchangedSkipped.incrementAndGet(); }

    public long totalReloads() { return total.get(); }

    public long successfulReloads() { return successful.get(); }

    public long failedReloads() { return failed.get(); }

    public long rollbacks() { return rollbacks.get(); }

    /** Change notifications folded into a later one by the debounce window. */
    public long debouncedChanges() { return debounced.get(); }

    public long unchangedSkipped() { return unchangedSkipped.get(); }

    /** Average over all attempts, successful or not. */
    public double averageCompileMillis() {
        long n = total.get();
        return n == 0 ? 0.0 : compileNanos.get() / 1_000_000.0 / n;
    }

    /** Average compile + install time of successful reloads. */
    public double averageReloadMillis() {
        long n = successful.get();
        return n == 0 ? 0.0 : reloadNanos.get() / 1_000_000.0 / n;
    }

    /** 0..1, 0 when nothing was reloaded yet. */
    public double successRate() {
        long n = total.get();
        return n == 0 ? 0.0 : (double) successful.get() / n;
    }

    public void reset() {
        total.set(0);
        successful.set(0);
        failed.set(0);
        rollbacks.set(0);
        debounced.set(0);
        unchangedSkipped.set(0);
        compileNanos.set(0);
        reloadNanos.set(0);
    }

    @Override
    public String toString() {
        return String.format(java.util.Locale.ROOT,
                "HotReloadStatistics{total=%d, ok=%d, failed=%d, rollbacks=%d, debounced=%d, unchanged=%d, avgCompile=%.2fms, avgReload=%.2fms, successRate=%.1f%%}",
                totalReloads(), successfulReloads(), failedReloads(), rollbacks(), debouncedChanges(),
                unchangedSkipped(), averageCompileMillis(), averageReloadMillis(), successRate() * 100.0);
    }
}
