package org.foxesworld.hotscript.engine.hotreload;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.hotscript.core.ScriptIds;
import org.foxesworld.hotscript.core.compile.CompileService;
import org.foxesworld.hotscript.core.compile.CompiledUnit;
import org.foxesworld.hotscript.core.compile.Diagnostic;
import org.foxesworld.hotscript.core.error.CompilationException;
import org.foxesworld.hotscript.core.error.ScriptInstantiationException;
import org.foxesworld.hotscript.engine.cache.ScriptCacheListener;
import org.foxesworld.hotscript.engine.cache.VersionedScriptCache;
import org.foxesworld.hotscript.engine.exec.ScriptFailure;
import org.foxesworld.hotscript.engine.exec.ScriptFailureListener;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Compiles changed scripts and installs them into the {@link VersionedScriptCache}.
 *
 * <p>A failed compile never touches the cache: the last good version keeps running. File change
 * notifications are debounced per script id, so a burst of saves produces one reload with the
 * latest text. Reloads of one id are serialized; different ids reload independently.</p>
 *
 * <p>With auto rollback enabled the service also listens to scheduler failures: when the version
 * it just installed cannot be instantiated, the id is rolled back once. That path never waits for
 * a reload in progress: the cache rollback runs inline, a backup restore goes to the reload
 * thread.</p>
 */
public final class ScriptHotReloadService implements ScriptFailureListener, ScriptCacheListener, Closeable {

    private static final Logger log = LogManager.getLogger(ScriptHotReloadService.class);

    private final CompileService compiler;
    private final VersionedScriptCache cache;
    private final ScriptBackupManager backups;
    private final ScriptSourceLocator locator;
    private final long debounceMillis;
    private final boolean autoRollback;

    private final HotReloadStatistics statistics = new HotReloadStatistics();
    private final List<HotReloadListener> listeners = new CopyOnWriteArrayList<>();

    private final Map<String, Object> reloadLocks = new ConcurrentHashMap<>();
    private final Map<String, Long> installedHashes = new ConcurrentHashMap<>();
    private final Map<String, Long> recentlyInstalled = new ConcurrentHashMap<>();
    private final Map<String, ScheduledFuture<?>> pending = new ConcurrentHashMap<>();

    private final ScheduledExecutorService executor;
    private volatile HotReloadWatcher watcher;

    public ScriptHotReloadService(CompileService compiler,
                                  VersionedScriptCache cache,
                                  ScriptBackupManager backups,
                                  ScriptSourceLocator locator,
                                  long debounceMillis,
                                  boolean autoRollback) {
        this.compiler = Objects.requireNonNull(compiler, "compiler");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.backups = backups;
        this.locator = Objects.requireNonNull(locator, "locator");
        this.debounceMillis = Math.max(0L, debounceMillis);
        this.autoRollback = autoRollback;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "hotscript-reload");
            t.setDaemon(true);
            return t;
        });
        cache.addListener(this);
    }

    public HotReloadStatistics statistics() {
        return statistics;
    }

    public void addListener(HotReloadListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(HotReloadListener listener) {
        listeners.remove(listener);
    }

    /** Starts feeding {@link #poll()} from the given watcher. The service closes it. */
    public void watch(HotReloadWatcher watcher) {
        this.watcher = Objects.requireNonNull(watcher, "watcher");
    }

    /** Drains the watcher, if any. Call once per frame from the simulation loop. */
    public void poll() {
        HotReloadWatcher w = watcher;
        if (w == null) return;
        Set<Path> changed = w.pollChanged();
        if (!changed.isEmpty()) onFilesChanged(changed);
    }

    // ---------------------------------------------------------------------
    // Reload
    // ---------------------------------------------------------------------

    /**
     * Compiles {@code sourceText} and installs it as the new current version of {@code scriptId}.
     * Identical text to the last installed one is skipped.
     */
    public ReloadResult reload(String scriptId, String sourceText) {
        ScriptIds.require(scriptId);
        Objects.requireNonNull(sourceText, "sourceText");

        synchronized (reloadLocks.computeIfAbsent(scriptId, k -> new Object())) {
            long hash = ScriptIds.contentHash(sourceText);
            Long lastHash = installedHashes.get(scriptId);
            if (lastHash != null && lastHash == hash && cache.contains(scriptId)) {
                statistics.recordUnchanged();
                log.debug("Reload skipped, source unchanged: {}", scriptId);
                return new ReloadResult(scriptId, ReloadResult.Status.UNCHANGED, cache.getVersion(scriptId), List.of());
            }

            long t0 = System.nanoTime();
            CompiledUnit unit;
            try {
                unit = compiler.compile(sourceText, scriptId);
            } catch (CompilationException e) {
                statistics.recordFailure(System.nanoTime() - t0);
                log.error("Reload failed for {}: {} error(s), keeping v{}",
                        scriptId, e.errors().size(), cache.getVersion(scriptId));
                for (Diagnostic d : e.diagnostics()) {
                    if (d.isError()) log.error("  {}: {}", scriptId, d.format());
                    else log.warn("  {}: {}", scriptId, d.format());
                }
                notifyFailed(scriptId, e.diagnostics(), e);
                return new ReloadResult(scriptId, ReloadResult.Status.FAILED, -1L, e.diagnostics());
            } catch (RuntimeException e) {
                statistics.recordFailure(System.nanoTime() - t0);
                log.error("Reload failed for {}: compiler error, keeping v{}",
                        scriptId, cache.getVersion(scriptId), e);
                notifyFailed(scriptId, List.of(), e);
                return new ReloadResult(scriptId, ReloadResult.Status.FAILED, -1L, List.of());
            }
            long compileNanos = System.nanoTime() - t0;

            if (backups != null) backups.backupCurrent(scriptId);
            long version = cache.updateVersion(scriptId, unit);
            long totalNanos = System.nanoTime() - t0;

            installedHashes.put(scriptId, hash);
            recentlyInstalled.put(scriptId, version);
            statistics.recordSuccess(compileNanos, totalNanos);

            long compileMillis = TimeUnit.NANOSECONDS.toMillis(compileNanos);
            log.info("Reloaded {} -> v{} (compile {} ms)", scriptId, version, compileMillis);
            for (HotReloadListener l : listeners) {
                try {
                    l.reloadSucceeded(scriptId, version, compileMillis);
                } catch (Throwable t) {
                    log.warn("Reload listener failed for {}", scriptId, t);
                }
            }
            return new ReloadResult(scriptId, ReloadResult.Status.INSTALLED, version, List.of());
        }
    }

    /**
     * Schedules reloads for changed files. Each script id waits for the debounce window; a newer
     * change for the same id restarts the window.
     */
    public void onFilesChanged(Collection<Path> files) {
        for (Path file : files) {
            String scriptId = locator.scriptIdOf(file);
            if (!ScriptIds.isValid(scriptId)) {
                log.debug("Ignoring change without script id: {}", file);
                continue;
            }
            pending.compute(scriptId, (id, previous) -> {
                if (previous != null && previous.cancel(false)) {
                    statistics.recordDebounced();
                }
                return executor.schedule(() -> reloadFile(id, file), debounceMillis, TimeUnit.MILLISECONDS);
            });
        }
    }

    private void reloadFile(String scriptId, Path file) {
        pending.remove(scriptId);
        if (!locator.exists(file)) {
            log.debug("Changed file vanished, keeping current version: {}", file);
            return;
        }
        String text;
        try {
            text = locator.read(file);
        } catch (IOException e) {
            log.warn("Failed to read script source {}", file, e);
            notifyFailed(scriptId, List.of(), e);
            return;
        }
        try {
            reload(scriptId, text);
        } catch (RuntimeException e) {
            log.error("Unexpected reload error for {}", scriptId, e);
        }
    }

    // ---------------------------------------------------------------------
    // Rollback
    // ---------------------------------------------------------------------

    /**
     * Rolls {@code scriptId} back to its previous cached version, falling back to the stored backup
     * when the cache holds no predecessor.
     *
     * @return false when neither is available
     */
    public boolean rollback(String scriptId) {
        ScriptIds.require(scriptId);
        synchronized (reloadLocks.computeIfAbsent(scriptId, k -> new Object())) {
            boolean done = cache.rollback(scriptId);
            if (!done && backups != null) {
                done = backups.restore(scriptId);
            }
            if (!done) {
                log.warn("Rollback impossible for {}: no previous version and no backup", scriptId);
                return false;
            }
            recordRollback(scriptId);
            return true;
        }
    }

    private void recordRollback(String scriptId) {
        statistics.recordRollback();

        long restored = cache.getVersion(scriptId);
        for (HotReloadListener l : listeners) {
            try {
                l.rolledBack(scriptId, restored);
            } catch (Throwable t) {
                log.warn("Reload listener failed for {}", scriptId, t);
            }
        }
    }

    @Override
    public void onFailure(ScriptFailure failure) {
        if (!autoRollback) return;
        if (failure.phase() != ScriptFailure.Phase.RESOLVE) return;
        if (!(failure.error() instanceof ScriptInstantiationException)) return;

        // only once per installed version
        if (!recentlyInstalled.remove(failure.scriptId(), failure.version())) return;

        String scriptId = failure.scriptId();
        log.warn("Auto rollback of {}: v{} failed to instantiate", scriptId, failure.version());
        if (cache.rollback(scriptId)) {
            recordRollback(scriptId);
            return;
        }
        if (backups == null) {
            log.warn("Auto rollback impossible for {}: no previous version", scriptId);
            return;
        }
        try {
            executor.execute(() -> rollback(scriptId));
        } catch (RejectedExecutionException e) {
            log.warn("Auto rollback of {} skipped, hot reload is stopped", scriptId);
        }
    }

    // Cache changes drop what this service recorded for the id; reload() records its own install afterwards.

    @Override
    public void installed(String scriptId, long version, long previousVersion) {
        forget(scriptId);
    }

    @Override
    public void rolledBack(String scriptId, long fromVersion, long toVersion) {
        forget(scriptId);
    }

    @Override
    public void removed(String scriptId, long lastVersion) {
        forget(scriptId);
    }

    @Override
    public void cleared(int removedScripts) {
        installedHashes.clear();
        recentlyInstalled.clear();
    }

    private void forget(String scriptId) {
        installedHashes.remove(scriptId);
        recentlyInstalled.remove(scriptId);
    }

    private void notifyFailed(String scriptId, List<Diagnostic> diagnostics, Throwable error) {
        for (HotReloadListener l : listeners) {
            try {
                l.reloadFailed(scriptId, diagnostics, error);
            } catch (Throwable t) {
                log.warn("Reload listener failed for {}", scriptId, t);
            }
        }
    }

    @Override
    public void close() throws IOException {
        for (ScheduledFuture<?> f : pending.values()) f.cancel(false);
        pending.clear();
        executor.shutdownNow();
        cache.removeListener(this);
        HotReloadWatcher w = watcher;
        watcher = null;
        if (w != null) w.close();
        log.info("Hot reload stopped: {}", statistics);
    }
}
