package org.foxesworld.hotscript.engine.exec;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.hotscript.core.behavior.ScriptBehavior;
import org.foxesworld.hotscript.core.behavior.ScriptEvent;
import org.foxesworld.hotscript.engine.attach.ScriptAttachment;
import org.foxesworld.hotscript.engine.attach.ScriptAttachmentRegistry;
import org.foxesworld.hotscript.engine.cache.ResolvedScript;
import org.foxesworld.hotscript.engine.cache.VersionedScriptCache;
import org.foxesworld.hotscript.engine.config.HotScriptConfig;
import org.foxesworld.hotscript.engine.events.ScriptEventBus;
import org.foxesworld.hotscript.engine.profiler.ScriptProfiler;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs every entity's attached scripts once per tick.
 *
 * <p>For each entity the active attachments run in execution order (priority desc, insertion
 * asc). Each one is resolved through the cache by id on every tick and no instance reference
 * survives the tick, so a version installed between ticks is picked up on the next one. The
 * attachment only remembers the serial of the instance it initialized, to know when
 * {@code initialize} has to run again.</p>
 *
 * <p>Every resolve and hook call is isolated: a failure is logged (rate limited per attachment),
 * counted, reported to {@link ScriptFailureListener}s, and the loop moves on to the next
 * attachment. An attachment failing {@code maxCrashStreak} ticks in a row is suspended for
 * {@code crashCooldownTicks} ticks or until another version of its script is installed.</p>
 *
 * <p>The scheduler switches the cache to deferred unload: instances replaced by a reload on
 * another thread stay usable until the start of the next tick, where they are unloaded.</p>
 */
public final class ScriptExecutionScheduler implements Closeable {

    private static final Logger log = LogManager.getLogger(ScriptExecutionScheduler.class);

    private static final int SUMMARY_EVERY_TICKS = 60;

    private final VersionedScriptCache cache;
    private final ScriptAttachmentRegistry registry;
    private final ScriptEventBus events;
    private final ScriptProfiler profiler;

    private final ExecutionMode mode;
    private final int workerThreads;
    private final int maxCrashStreak;
    private final long crashCooldownTicks;
    private final long failureLogIntervalNanos;
    private final int maxEventsPerTick;

    private final List<ScriptFailureListener> failureListeners = new CopyOnWriteArrayList<>();

    private ExecutorService workers;

    private long tickNumber = 0L;
    private double elapsedSeconds = 0.0;
    private int lastExecutedCount = 0;

    public ScriptExecutionScheduler(VersionedScriptCache cache,
                                    ScriptAttachmentRegistry registry,
                                    ScriptEventBus events,
                                    ScriptProfiler profiler,
                                    HotScriptConfig config) {
        this.cache = Objects.requireNonNull(cache, "cache");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.events = Objects.requireNonNull(events, "events");
        this.profiler = profiler;
        Objects.requireNonNull(config, "config");
        this.mode = config.executionMode();
        this.workerThreads = config.workerThreads();
        this.maxCrashStreak = config.maxCrashStreak();
        this.crashCooldownTicks = config.crashCooldownTicks();
        this.failureLogIntervalNanos = TimeUnit.MILLISECONDS.toNanos(config.failureLogIntervalMillis());
        this.maxEventsPerTick = config.maxEventsPerTick();
        cache.setDeferredUnload(true);
    }

    public ExecutionMode mode() { return mode; }

    public long tickNumber() { return tickNumber; }

    public double elapsedSeconds() { return elapsedSeconds; }

    public void addFailureListener(ScriptFailureListener listener) {
        failureListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Runs one simulation tick. Must be called from the simulation thread; in
     * {@link ExecutionMode#PARALLEL} it blocks until every worker finished.
     */
    public TickReport tick(float tpf) {
        tickNumber++;
        final long tick = tickNumber;
        final double elapsed = elapsedSeconds;

        cache.drainRetired();
        List<ScriptEvent> batch = events.pump(maxEventsPerTick, ScriptEventBus.DEFAULT_TIME_BUDGET_NANOS);
        int[] entities = registry.entities();
        Counters c = new Counters();

        if (mode == ExecutionMode.PARALLEL && entities.length > 1 && workerThreads > 1) {
            runParallel(entities, tick, elapsed, tpf, batch, c);
        } else {
            for (int entity : entities) {
                processEntity(entity, tick, elapsed, tpf, batch, c);
            }
        }

        elapsedSeconds += tpf;

        TickReport report = new TickReport(tick, entities.length, c.executed.get(), c.initialized.get(),
                c.errors.get(), c.inactive.get(), c.suspended.get(), batch.size());
        logSummary(report);

        if (profiler != null) profiler.tick();
        return report;
    }

    // ---------------------------------------------------------------------
    // Per entity
    // ---------------------------------------------------------------------

    private void processEntity(int entity, long tick, double elapsed, float tpf,
                               List<ScriptEvent> batch, Counters c) {
        List<ScriptAttachment> active = registry.activeAttachments(entity);
        c.inactive.addAndGet(registry.attachmentCount(entity) - active.size());

        for (ScriptAttachment a : active) {
            if (isSuspended(a, tick)) {
                c.suspended.incrementAndGet();
                continue;
            }
            runAttachment(entity, a, tick, elapsed, tpf, batch, c);
        }
    }

    private boolean isSuspended(ScriptAttachment a, long tick) {
        if (a.suspendedUntilTick <= tick) return false;
        if (cache.getVersion(a.scriptId()) != a.suspendedVersion) {
            // a different version is current now: give it a chance
            a.suspendedUntilTick = 0L;
            return false;
        }
        return true;
    }

    private void runAttachment(int entity, ScriptAttachment a, long tick, double elapsed, float tpf,
                               List<ScriptEvent> batch, Counters c) {
        final String scriptId = a.scriptId();

        ResolvedScript rs;
        try {
            rs = cache.resolve(scriptId);
        } catch (Throwable t) {
            if (profiler != null) profiler.recordError(scriptId);
            onFailure(new ScriptFailure(tick, entity, scriptId, cache.getVersion(scriptId),
                    ScriptFailure.Phase.RESOLVE, t), a, c);
            return;
        }

        ScriptBehavior behavior = rs.behavior();
        EntityScriptContext ctx = new EntityScriptContext(entity, scriptId, rs.version(), tick, elapsed, events);
        boolean failed = false;

        // (re)bind: first tick for this instance on this entity
        if (a.boundSerial != rs.instanceSerial()) {
            long t0 = begin();
            try {
                behavior.initialize(ctx);
                end(scriptId, ScriptProfiler.Phase.INIT, t0, true);
            } catch (Throwable t) {
                end(scriptId, ScriptProfiler.Phase.INIT, t0, false);
                onFailure(new ScriptFailure(tick, entity, scriptId, rs.version(), ScriptFailure.Phase.INIT, t), a, c);
                return; // stay unbound, initialize is retried next tick
            }
            if (a.boundSerial != 0L) {
                log.debug("Script {} rebound on entity {}: v{} -> v{}", scriptId, entity, a.boundVersion, rs.version());
            }
            a.boundSerial = rs.instanceSerial();
            a.boundVersion = rs.version();
            c.initialized.incrementAndGet();
        }

        for (ScriptEvent e : batch) {
            if (!e.appliesTo(entity)) continue;
            long t0 = begin();
            try {
                behavior.handleEvent(ctx, e);
                end(scriptId, ScriptProfiler.Phase.EVENT, t0, true);
            } catch (Throwable t) {
                end(scriptId, ScriptProfiler.Phase.EVENT, t0, false);
                failed = true;
                onFailure(new ScriptFailure(tick, entity, scriptId, rs.version(), ScriptFailure.Phase.EVENT, t), a, c);
            }
        }

        long t0 = begin();
        try {
            behavior.tick(ctx, tpf);
            end(scriptId, ScriptProfiler.Phase.TICK, t0, true);
            c.executed.incrementAndGet();
        } catch (Throwable t) {
            end(scriptId, ScriptProfiler.Phase.TICK, t0, false);
            onFailure(new ScriptFailure(tick, entity, scriptId, rs.version(), ScriptFailure.Phase.TICK, t), a, c);
            return;
        }

        if (!failed) a.crashStreak = 0;
    }

    private void onFailure(ScriptFailure f, ScriptAttachment a, Counters c) {
        c.errors.incrementAndGet();
        a.crashStreak++;

        long now = System.nanoTime();
        if (a.lastFailureLogNanos == 0L || now - a.lastFailureLogNanos >= failureLogIntervalNanos) {
            a.lastFailureLogNanos = now;
            log.error("Script {} failed in {} (entity={}, version={}, tick={})",
                    f.scriptId(), f.phase(), f.entityId(), f.version(), f.tickNumber(), f.error());
        }

        if (crashCooldownTicks > 0 && a.crashStreak >= maxCrashStreak) {
            a.crashStreak = 0;
            a.suspendedUntilTick = f.tickNumber() + 1 + crashCooldownTicks;
            a.suspendedVersion = f.version();
            log.warn("Script {} suspended on entity {} for {} ticks after {} consecutive failures (version={})",
                    f.scriptId(), f.entityId(), crashCooldownTicks, maxCrashStreak, f.version());
        }

        for (ScriptFailureListener l : failureListeners) {
            try {
                l.onFailure(f);
            } catch (Throwable t) {
                log.warn("Failure listener threw for script {}", f.scriptId(), t);
            }
        }
    }

    // ---------------------------------------------------------------------
    // Parallel
    // ---------------------------------------------------------------------

    private void runParallel(int[] entities, long tick, double elapsed, float tpf,
                             List<ScriptEvent> batch, Counters c) {
        ExecutorService pool = workers();
        int chunks = Math.min(workerThreads, entities.length);
        int per = (entities.length + chunks - 1) / chunks;

        List<Callable<Void>> tasks = new ArrayList<>(chunks);
        for (int from = 0; from < entities.length; from += per) {
            final int start = from;
            final int endExclusive = Math.min(entities.length, from + per);
            tasks.add(() -> {
                for (int i = start; i < endExclusive; i++) {
                    processEntity(entities[i], tick, elapsed, tpf, batch, c);
                }
                return null;
            });
        }

        try {
            for (Future<Void> f : pool.invokeAll(tasks)) {
                try {
                    f.get();
                } catch (ExecutionException e) {
                    log.error("Script worker failed during tick {}", tick, e.getCause());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Tick {} interrupted while waiting for script workers", tick);
        }
    }

    private synchronized ExecutorService workers() {
        if (workers == null) {
            AtomicInteger n = new AtomicInteger(1);
            ThreadFactory tf = r -> {
                Thread t = new Thread(r, "hotscript-worker-" + n.getAndIncrement());
                t.setDaemon(true);
                return t;
            };
            workers = Executors.newFixedThreadPool(workerThreads, tf);
            log.info("Script workers started: {}", workerThreads);
        }
        return workers;
    }

    @Override
    public synchronized void close() {
        if (workers != null) {
            workers.shutdownNow();
            workers = null;
        }
        cache.setDeferredUnload(false);
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private long begin() {
        return profiler != null ? profiler.begin() : 0L;
    }

    private void end(String scriptId, ScriptProfiler.Phase phase, long t0, boolean ok) {
        if (profiler != null) profiler.end(scriptId, phase, t0, ok);
    }

    private void logSummary(TickReport r) {
        boolean periodic = r.tickNumber() % SUMMARY_EVERY_TICKS == 0 && r.executed() > 0;
        boolean changed = r.executed() > 0 && r.executed() != lastExecutedCount;

        if (r.errors() > 0) {
            log.warn("Script tick {} summary: executed={} initialized={} errors={} suspended={}",
                    r.tickNumber(), r.executed(), r.initialized(), r.errors(), r.suspended());
        } else if (r.initialized() > 0 || periodic || changed) {
            log.debug("Script tick {} summary: executed={} initialized={} inactive={} events={}",
                    r.tickNumber(), r.executed(), r.initialized(), r.inactive(), r.events());
        }
        if (r.executed() > 0) lastExecutedCount = r.executed();
    }

    private static final class Counters {
        final AtomicInteger executed = new AtomicInteger();
        final AtomicInteger initialized = new AtomicInteger();
        final AtomicInteger errors = new AtomicInteger();
        final AtomicInteger inactive = new AtomicInteger();
        final AtomicInteger suspended = new AtomicInteger();
    }
}
