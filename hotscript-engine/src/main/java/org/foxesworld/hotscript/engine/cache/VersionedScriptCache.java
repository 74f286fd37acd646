package org.foxesworld.hotscript.engine.cache;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.hotscript.core.ScriptIds;
import org.foxesworld.hotscript.core.behavior.ScriptBehavior;
import org.foxesworld.hotscript.core.compile.CompileService;
import org.foxesworld.hotscript.core.compile.CompiledUnit;
import org.foxesworld.hotscript.core.error.ScriptInstantiationException;
import org.foxesworld.hotscript.core.error.ScriptNotFoundException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;

/**
 * Thread-safe versioned store of compiled scripts with bounded history and rollback.
 *
 * <p>Writers (hot reload, rollback) are serialized per script id through
 * {@link ConcurrentMap#compute}; different ids never contend. Readers (the simulation tick,
 * possibly on several worker threads) only do a map lookup of an immutable entry, then
 * materialize the instance through that entry's own guard.</p>
 *
 * <p>Version numbers come from one global counter, so every normal install returns a number
 * greater than any install before it. {@link #updateVersion(String, CompiledUnit, long)} is
 * the single exception and exists to restore known snapshots.</p>
 *
 * <p>Instances dropped by the cache (superseded, cleared, rolled back from, removed) are
 * {@linkplain ScriptBehavior#unload() unloaded}; unload failures are logged only. With
 * {@link #setDeferredUnload(boolean) deferred unload} on, they are queued instead and unloaded by
 * {@link #drainRetired()} on the thread that runs the hooks.</p>
 */
public final class VersionedScriptCache {

    private static final Logger log = LogManager.getLogger(VersionedScriptCache.class);

    /** Current + 2 previous. */
    public static final int DEFAULT_MAX_HISTORY_DEPTH = 3;

    private final CompileService compiler;
    private final int maxHistoryDepth;

    private final ConcurrentMap<String, ScriptCacheEntry> entries = new ConcurrentHashMap<>();
    private final AtomicLong currentVersion = new AtomicLong();
    private final List<ScriptCacheListener> listeners = new CopyOnWriteArrayList<>();

    // writers hold the read side, clear() the write side: no install straddles a counter reset
    private final ReentrantReadWriteLock structureLock = new ReentrantReadWriteLock();
    private final Lock writeGuard = structureLock.readLock();
    private final Lock clearGuard = structureLock.writeLock();

    private final Queue<RetiredInstance> retiredInstances = new ConcurrentLinkedQueue<>();
    private volatile boolean deferUnload;

    private record RetiredInstance(String scriptId, ScriptBehavior behavior) {}

    public VersionedScriptCache(CompileService compiler) {
        this(compiler, DEFAULT_MAX_HISTORY_DEPTH);
    }

    public VersionedScriptCache(CompileService compiler, int maxHistoryDepth) {
        this.compiler = Objects.requireNonNull(compiler, "compiler");
        if (maxHistoryDepth < 1) throw new IllegalArgumentException("maxHistoryDepth must be >= 1");
        this.maxHistoryDepth = maxHistoryDepth;
    }

    public int maxHistoryDepth() { return maxHistoryDepth; }

    public void addListener(ScriptCacheListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(ScriptCacheListener listener) {
        listeners.remove(listener);
    }

    /**
     * When on, dropped instances are queued for {@link #drainRetired()} instead of being unloaded
     * by the writer. Turning it off unloads whatever is queued.
     */
    public void setDeferredUnload(boolean defer) {
        this.deferUnload = defer;
        if (!defer) drainRetired();
    }

    /**
     * Unloads every queued retired instance on the calling thread.
     *
     * @return number of instances unloaded
     */
    public int drainRetired() {
        int n = 0;
        RetiredInstance r;
        while ((r = retiredInstances.poll()) != null) {
            unloadQuietly(r.scriptId(), r.behavior());
            n++;
        }
        if (n > 0) log.debug("Unloaded {} retired instance(s)", n);
        return n;
    }

    /** Retired instances waiting for {@link #drainRetired()}. */
    public int pendingUnloadCount() {
        return retiredInstances.size();
    }

    /** Last version handed out by the global counter, 0 after {@link #clear()}. */
    public long currentVersion() {
        return currentVersion.get();
    }

    public int cachedScriptCount() {
        return entries.size();
    }

    // ---------------------------------------------------------------------
    // Install / rollback
    // ---------------------------------------------------------------------

    /**
     * Installs {@code unit} as the new current version of {@code scriptId}.
     * The instance is created lazily on the next {@link #getOrCreateInstance}.
     *
     * @return the new version number
     */
    public long updateVersion(String scriptId, CompiledUnit unit) {
        ScriptIds.require(scriptId);
        Objects.requireNonNull(unit, "unit");

        ScriptCacheEntry[] replaced = new ScriptCacheEntry[1];
        ScriptCacheEntry installed;
        writeGuard.lock();
        try {
            installed = entries.compute(scriptId, (id, old) -> {
                long v = currentVersion.incrementAndGet();
                replaced[0] = old;
                ScriptCacheEntry history = old != null ? old.toHistory(maxHistoryDepth - 1) : null;
                return new ScriptCacheEntry(id, v, unit, history);
            });
        } finally {
            writeGuard.unlock();
        }

        release(scriptId, replaced[0] != null ? replaced[0].retire() : null);

        if (replaced[0] != null) {
            log.info("Script updated: {} v{} -> v{} ({}), history={}",
                    scriptId, replaced[0].version(), installed.version(), unit.name(), installed.historyDepth());
        } else {
            log.info("Script installed: {} v{} ({})", scriptId, installed.version(), unit.name());
        }
        long previousVersion = replaced[0] != null ? replaced[0].version() : -1L;
        notifyListeners(l -> l.installed(scriptId, installed.version(), previousVersion));
        return installed.version();
    }

    /**
     * Installs {@code unit} under a caller supplied version without touching the global counter.
     * The replaced entry is discarded and its history kept, which is what restoring a backup of
     * that same history needs. Version numbers installed this way may collide with numbers of
     * other scripts or go backwards for this one; both cases are logged.
     */
    public void updateVersion(String scriptId, CompiledUnit unit, long explicitVersion) {
        ScriptIds.require(scriptId);
        Objects.requireNonNull(unit, "unit");
        if (explicitVersion < 0) throw new IllegalArgumentException("explicitVersion must be >= 0");

        ScriptCacheEntry[] replaced = new ScriptCacheEntry[1];
        writeGuard.lock();
        try {
            entries.compute(scriptId, (id, old) -> {
                replaced[0] = old;
                ScriptCacheEntry history = old != null && old.previous() != null
                        ? old.previous().toHistory(maxHistoryDepth - 1)
                        : null;
                return new ScriptCacheEntry(id, explicitVersion, unit, history);
            });
        } finally {
            writeGuard.unlock();
        }

        ScriptCacheEntry old = replaced[0];
        release(scriptId, old != null ? old.retire() : null);

        if (old != null && explicitVersion <= old.version()) {
            log.warn("Script {} restored to explicit v{} (was v{}): version went backwards",
                    scriptId, explicitVersion, old.version());
        } else if (explicitVersion > 0 && explicitVersion <= currentVersion.get()) {
            log.debug("Script {} restored to explicit v{} (global counter at {})",
                    scriptId, explicitVersion, currentVersion.get());
        }
        log.info("Script restored: {} v{} ({})", scriptId, explicitVersion, unit.name());
        long previousVersion = old != null ? old.version() : -1L;
        notifyListeners(l -> l.installed(scriptId, explicitVersion, previousVersion));
    }

    /**
     * Makes the predecessor of the current entry current again. The predecessor comes back
     * uninstantiated, so the next lookup creates a fresh instance from its compiled unit.
     *
     * @return false when the id is unknown or has no predecessor
     */
    public boolean rollback(String scriptId) {
        ScriptIds.require(scriptId);

        ScriptCacheEntry[] rolledBack = new ScriptCacheEntry[1];
        writeGuard.lock();
        try {
            entries.computeIfPresent(scriptId, (id, cur) -> {
                if (cur.previous() == null) return cur;
                rolledBack[0] = cur;
                return cur.previous();
            });
        } finally {
            writeGuard.unlock();
        }

        ScriptCacheEntry from = rolledBack[0];
        if (from == null) {
            log.debug("Rollback unavailable for {}", scriptId);
            return false;
        }
        release(scriptId, from.retire());
        long toVersion = from.previous().version();
        log.warn("Script rolled back: {} v{} -> v{}", scriptId, from.version(), toVersion);
        notifyListeners(l -> l.rolledBack(scriptId, from.version(), toVersion));
        return true;
    }

    // ---------------------------------------------------------------------
    // Lookup
    // ---------------------------------------------------------------------

    /**
     * Current instance of {@code scriptId}, created on first access after an install.
     *
     * @throws ScriptNotFoundException      if the id is unknown
     * @throws ScriptInstantiationException if the unit cannot be executed; retry is allowed
     */
    public ScriptBehavior getOrCreateInstance(String scriptId) {
        return resolve(scriptId).behavior();
    }

    /**
     * Like {@link #getOrCreateInstance} but also reports which version and which instance
     * serial the behavior belongs to, taken from one consistent entry.
     */
    public ResolvedScript resolve(String scriptId) {
        ScriptIds.require(scriptId);

        while (true) {
            ScriptCacheEntry entry = entries.get(scriptId);
            if (entry == null) throw new ScriptNotFoundException(scriptId);

            ScriptCacheEntry.Materialized m = entry.materialize(compiler);
            if (m != null) {
                return new ResolvedScript(scriptId, entry.version(), m.serial(), m.behavior());
            }
            log.debug("Entry {} v{} was replaced during lookup, retrying", scriptId, entry.version());
        }
    }

    /** Peek without creating. */
    public VersionedInstance getInstance(String scriptId) {
        ScriptIds.require(scriptId);
        ScriptCacheEntry entry = entries.get(scriptId);
        if (entry == null) return VersionedInstance.ABSENT;
        return new VersionedInstance(entry.version(), entry.instance());
    }

    /** @return version or -1 if not found */
    public long getVersion(String scriptId) {
        ScriptIds.require(scriptId);
        ScriptCacheEntry entry = entries.get(scriptId);
        return entry != null ? entry.version() : -1L;
    }

    /** @return compiled unit of the current version, or null if not found */
    public CompiledUnit getScriptType(String scriptId) {
        ScriptIds.require(scriptId);
        ScriptCacheEntry entry = entries.get(scriptId);
        return entry != null ? entry.unit() : null;
    }

    /** Blank ids are simply not contained. */
    public boolean contains(String scriptId) {
        if (!ScriptIds.isValid(scriptId)) return false;
        return entries.containsKey(scriptId);
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    /**
     * Drops the current instance; the version stays, the next lookup re-creates it.
     *
     * @return false if the id is unknown
     */
    public boolean clearInstance(String scriptId) {
        ScriptIds.require(scriptId);
        ScriptCacheEntry entry = entries.get(scriptId);
        if (entry == null) return false;
        release(scriptId, entry.clearInstance());
        return true;
    }

    /** Removes the id and its whole history. */
    public boolean remove(String scriptId) {
        ScriptIds.require(scriptId);
        ScriptCacheEntry removed;
        writeGuard.lock();
        try {
            removed = entries.remove(scriptId);
        } finally {
            writeGuard.unlock();
        }
        if (removed == null) return false;
        release(scriptId, removed.retire());
        log.info("Script removed: {} (was v{})", scriptId, removed.version());
        notifyListeners(l -> l.removed(scriptId, removed.version()));
        return true;
    }

    /** Removes everything and resets the global counter to 0. */
    public void clear() {
        List<ScriptCacheEntry> dropped;
        clearGuard.lock();
        try {
            dropped = new ArrayList<>(entries.values());
            entries.clear();
            currentVersion.set(0L);
        } finally {
            clearGuard.unlock();
        }
        for (ScriptCacheEntry e : dropped) {
            release(e.scriptId(), e.retire());
        }
        log.info("Script cache cleared ({} scripts)", dropped.size());
        notifyListeners(l -> l.cleared(dropped.size()));
    }

    // ---------------------------------------------------------------------
    // Diagnostics
    // ---------------------------------------------------------------------

    public Set<String> getAllTypeIds() {
        return Set.copyOf(entries.keySet());
    }

    public List<CacheEntryInfo> getDiagnostics() {
        List<CacheEntryInfo> out = new ArrayList<>(entries.size());
        for (ScriptCacheEntry e : entries.values()) {
            ScriptCacheEntry prev = e.previous();
            out.add(new CacheEntryInfo(
                    e.scriptId(),
                    e.version(),
                    e.unit().name(),
                    e.isInstantiated(),
                    e.lastUpdated(),
                    prev != null,
                    prev != null ? prev.version() : null,
                    e.historyDepth()
            ));
        }
        return out;
    }

    /** Number of previous versions available for rollback, 0 if not found. */
    public int getVersionHistoryDepth(String scriptId) {
        ScriptIds.require(scriptId);
        ScriptCacheEntry entry = entries.get(scriptId);
        return entry != null ? entry.historyDepth() : 0;
    }

    /** Sum of chain lengths (current + history) over all scripts. */
    public int getTotalVersionEntries() {
        int total = 0;
        for (ScriptCacheEntry e : entries.values()) {
            total += 1 + e.historyDepth();
        }
        return total;
    }

    private void notifyListeners(Consumer<ScriptCacheListener> call) {
        for (ScriptCacheListener l : listeners) {
            try {
                call.accept(l);
            } catch (Throwable t) {
                log.warn("Cache listener failed", t);
            }
        }
    }

    private void release(String scriptId, ScriptBehavior behavior) {
        if (behavior == null) return;
        if (deferUnload) {
            retiredInstances.add(new RetiredInstance(scriptId, behavior));
        } else {
            unloadQuietly(scriptId, behavior);
        }
    }

    private static void unloadQuietly(String scriptId, ScriptBehavior behavior) {
        if (behavior == null) return;
        try {
            behavior.unload();
        } catch (Throwable t) {
            log.warn("unload() failed for script {}", scriptId, t);
        }
    }
}
