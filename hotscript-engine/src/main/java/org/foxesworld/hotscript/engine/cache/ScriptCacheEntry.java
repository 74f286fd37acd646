package org.foxesworld.hotscript.engine.cache;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.hotscript.core.behavior.ScriptBehavior;
import org.foxesworld.hotscript.core.compile.CompileService;
import org.foxesworld.hotscript.core.compile.CompiledUnit;
import org.foxesworld.hotscript.core.error.ScriptInstantiationException;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One version of one script: compiled unit, lazy instance slot and the link to its predecessor.
 *
 * <p>Everything except the instance slot is final. History nodes are copies with an empty slot,
 * so a predecessor reinstated by rollback always materializes a fresh instance.</p>
 */
public final class ScriptCacheEntry {

    private static final Logger log = LogManager.getLogger(ScriptCacheEntry.class);

    /** Serial numbers for materialized instances, unique for the JVM lifetime. */
    private static final AtomicLong INSTANCE_SERIALS = new AtomicLong();

    private final String scriptId;
    private final long version;
    private final CompiledUnit unit;
    private final Instant lastUpdated;
    private final ScriptCacheEntry previous;

    private final Object instanceLock = new Object();
    private volatile Materialized materialized;
    private boolean retired; // guarded by instanceLock

    record Materialized(long serial, ScriptBehavior behavior) {}

    ScriptCacheEntry(String scriptId, long version, CompiledUnit unit, ScriptCacheEntry previous) {
        this(scriptId, version, unit, previous, Instant.now());
    }

    private ScriptCacheEntry(String scriptId, long version, CompiledUnit unit,
                             ScriptCacheEntry previous, Instant lastUpdated) {
        this.scriptId = Objects.requireNonNull(scriptId, "scriptId");
        this.version = version;
        this.unit = Objects.requireNonNull(unit, "unit");
        this.previous = previous;
        this.lastUpdated = lastUpdated;
    }

    public String scriptId() { return scriptId; }
    public long version() { return version; }
    public CompiledUnit unit() { return unit; }
    public Instant lastUpdated() { return lastUpdated; }
    public ScriptCacheEntry previous() { return previous; }

    public boolean isInstantiated() {
        return materialized != null;
    }

    /** Current instance or null, never creates. */
    public ScriptBehavior instance() {
        Materialized m = materialized;
        return m != null ? m.behavior() : null;
    }

    /** Number of predecessors reachable from this entry. */
    public int historyDepth() {
        int depth = 0;
        for (ScriptCacheEntry e = previous; e != null; e = e.previous) depth++;
        return depth;
    }

    /**
     * Returns the instance, creating it through {@code compiler.execute} on first access.
     * Concurrent first callers block on this entry only; exactly one of them executes the unit.
     * A failed execution leaves the slot empty so the next call retries.
     *
     * @return null once the entry is retired; the caller must look up the current entry again
     */
    Materialized materialize(CompileService compiler) {
        Materialized m = materialized;
        if (m != null) return m;

        synchronized (instanceLock) {
            m = materialized;
            if (m != null) return m;
            if (retired) return null;

            ScriptBehavior created;
            try {
                created = compiler.execute(unit);
            } catch (ScriptInstantiationException e) {
                throw new ScriptInstantiationException(scriptId, version,
                        "Failed to instantiate " + unit.name() + " (v" + version + "): " + e.getMessage(), e);
            } catch (RuntimeException e) {
                throw new ScriptInstantiationException(scriptId, version,
                        "Failed to instantiate " + unit.name() + " (v" + version + "): " + e, e);
            }
            if (created == null) {
                throw new ScriptInstantiationException(scriptId, version,
                        "Compile service returned no instance for " + unit.name() + " (v" + version + ")", null);
            }

            // retire() takes instanceLock, so the entry cannot have been retired during execute
            Materialized fresh = new Materialized(INSTANCE_SERIALS.incrementAndGet(), created);
            materialized = fresh;
            log.debug("Instantiated {} v{} (serial {})", scriptId, version, fresh.serial());
            return fresh;
        }
    }

    /** Empties the slot. Returns the dropped instance so the caller can unload it. */
    ScriptBehavior clearInstance() {
        synchronized (instanceLock) {
            Materialized m = materialized;
            materialized = null;
            return m != null ? m.behavior() : null;
        }
    }

    /** Marks the entry as no longer current and empties the slot. */
    ScriptBehavior retire() {
        synchronized (instanceLock) {
            retired = true;
            Materialized m = materialized;
            materialized = null;
            return m != null ? m.behavior() : null;
        }
    }

    /**
     * Copy of this entry (and up to {@code depth - 1} of its predecessors) for use as history.
     * Copies carry no instance. Returns null when {@code depth <= 0}.
     */
    ScriptCacheEntry toHistory(int depth) {
        if (depth <= 0) return null;
        ScriptCacheEntry prevCopy = previous != null ? previous.toHistory(depth - 1) : null;
        return new ScriptCacheEntry(scriptId, version, unit, prevCopy, lastUpdated);
    }

    @Override
    public String toString() {
        return "ScriptCacheEntry{" + scriptId + " v" + version + ", unit=" + unit.name()
                + ", instantiated=" + isInstantiated() + ", history=" + historyDepth() + '}';
    }
}
