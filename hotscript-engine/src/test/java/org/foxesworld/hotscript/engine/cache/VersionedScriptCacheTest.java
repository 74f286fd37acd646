package org.foxesworld.hotscript.engine.cache;

import org.foxesworld.hotscript.core.behavior.ScriptBehavior;
import org.foxesworld.hotscript.core.compile.CompiledUnit;
import org.foxesworld.hotscript.core.error.ScriptInstantiationException;
import org.foxesworld.hotscript.core.error.ScriptNotFoundException;
import org.foxesworld.hotscript.engine.support.FakeCompileService;
import org.foxesworld.hotscript.engine.support.RecordingBehavior;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class VersionedScriptCacheTest {

    private FakeCompileService compiler;
    private VersionedScriptCache cache;

    @BeforeEach
    void setUp() {
        compiler = new FakeCompileService();
        cache = new VersionedScriptCache(compiler);
    }

    private CompiledUnit unit(String id, String text) {
        return compiler.compile(text, id);
    }

    @Test
    @DisplayName("Versions come from one global counter and strictly increase")
    void versionsIncreaseAcrossIds() {
        long a1 = cache.updateVersion("wander", unit("wander", "a"));
        long b1 = cache.updateVersion("patrol", unit("patrol", "a"));
        long a2 = cache.updateVersion("wander", unit("wander", "b"));

        assertEquals(1, a1);
        assertEquals(2, b1);
        assertEquals(3, a2);
        assertEquals(3, cache.currentVersion());
        assertEquals(3, cache.getVersion("wander"));
        assertEquals(2, cache.getVersion("patrol"));
    }

    @Test
    @DisplayName("Instance is created lazily, once, and reused until the next install")
    void lazyInstance() {
        cache.updateVersion("wander", unit("wander", "a"));
        assertEquals(0, compiler.executeCount.get());
        assertFalse(cache.getInstance("wander").instantiated());

        ScriptBehavior first = cache.getOrCreateInstance("wander");
        ScriptBehavior second = cache.getOrCreateInstance("wander");

        assertSame(first, second);
        assertEquals(1, compiler.executeCount.get());
        assertTrue(cache.getInstance("wander").instantiated());
    }

    @Test
    @DisplayName("Installing a new version drops and unloads the old instance")
    void updateReplacesInstance() {
        cache.updateVersion("wander", unit("wander", "a"));
        RecordingBehavior old = (RecordingBehavior) cache.getOrCreateInstance("wander");

        long v2 = cache.updateVersion("wander", unit("wander", "b"));
        RecordingBehavior fresh = (RecordingBehavior) cache.getOrCreateInstance("wander");

        assertNotSame(old, fresh);
        assertEquals("wander:b", fresh.label);
        assertEquals(1, old.unloads.get());
        assertEquals(v2, cache.resolve("wander").version());
    }

    @Test
    @DisplayName("History is pruned to maxHistoryDepth - 1 predecessors")
    void historyPruning() {
        for (String text : List.of("a", "b", "c", "d", "e")) {
            cache.updateVersion("wander", unit("wander", text));
        }

        assertEquals(2, cache.getVersionHistoryDepth("wander"));
        assertEquals(3, cache.getTotalVersionEntries());

        assertTrue(cache.rollback("wander"));
        assertTrue(cache.rollback("wander"));
        assertFalse(cache.rollback("wander"), "only two predecessors are kept");
        assertEquals(3, cache.getVersion("wander"));
    }

    @Test
    @DisplayName("Rollback reinstates the predecessor with a fresh instance")
    void rollbackCreatesFreshInstance() {
        long v1 = cache.updateVersion("wander", unit("wander", "a"));
        RecordingBehavior firstV1 = (RecordingBehavior) cache.getOrCreateInstance("wander");
        cache.updateVersion("wander", unit("wander", "b"));
        RecordingBehavior v2Instance = (RecordingBehavior) cache.getOrCreateInstance("wander");

        assertTrue(cache.rollback("wander"));
        assertEquals(v1, cache.getVersion("wander"));
        assertFalse(cache.getInstance("wander").instantiated());

        RecordingBehavior again = (RecordingBehavior) cache.getOrCreateInstance("wander");
        assertNotSame(firstV1, again);
        assertEquals("wander:a", again.label);
        assertEquals(1, v2Instance.unloads.get());
        assertEquals(0, cache.getVersionHistoryDepth("wander"));
    }

    @Test
    @DisplayName("getScriptType follows installs and rollbacks")
    void scriptTypeFollowsRollback() {
        CompiledUnit a = unit("wander", "a");
        CompiledUnit b = unit("wander", "b");
        cache.updateVersion("wander", a);
        cache.updateVersion("wander", b);
        assertSame(b, cache.getScriptType("wander"));

        assertTrue(cache.rollback("wander"));
        assertSame(a, cache.getScriptType("wander"));
        assertFalse(cache.rollback("wander"));
    }

    @Test
    @DisplayName("Listeners see installs, rollbacks, removals and clears")
    void listeners() {
        List<String> seen = new CopyOnWriteArrayList<>();
        cache.addListener(new ScriptCacheListener() {
            @Override public void installed(String id, long v, long prev) { seen.add("installed:" + id + ":" + v + ":" + prev); }
            @Override public void rolledBack(String id, long from, long to) { seen.add("rolledBack:" + id + ":" + from + ":" + to); }
            @Override public void removed(String id, long v) { seen.add("removed:" + id + ":" + v); }
            @Override public void cleared(int n) { seen.add("cleared:" + n); }
        });
        cache.addListener(new ScriptCacheListener() {
            @Override public void installed(String id, long v, long prev) { throw new IllegalStateException("listener bug"); }
        });

        cache.updateVersion("wander", unit("wander", "a"));
        cache.updateVersion("wander", unit("wander", "b"));
        cache.rollback("wander");
        cache.remove("wander");
        cache.updateVersion("patrol", unit("patrol", "a"));
        cache.clear();

        assertEquals(List.of("installed:wander:1:-1", "installed:wander:2:1", "rolledBack:wander:2:1",
                "removed:wander:1", "installed:patrol:3:-1", "cleared:1"), seen);
    }

    @Test
    @DisplayName("Rollback without predecessor or id changes nothing")
    void rollbackUnavailable() {
        assertFalse(cache.rollback("missing"));

        long v1 = cache.updateVersion("wander", unit("wander", "a"));
        ScriptBehavior instance = cache.getOrCreateInstance("wander");

        assertFalse(cache.rollback("wander"));
        assertEquals(v1, cache.getVersion("wander"));
        assertSame(instance, cache.getOrCreateInstance("wander"));
    }

    @Test
    @DisplayName("Concurrent first access creates exactly one instance")
    void concurrentFirstAccessCreatesOnce() throws Exception {
        cache.updateVersion("wander", unit("wander", "a"));

        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        Set<ScriptBehavior> seen = ConcurrentHashMap.newKeySet();
        try {
            Future<?>[] futures = new Future<?>[threads];
            for (int i = 0; i < threads; i++) {
                futures[i] = pool.submit(() -> {
                    start.await();
                    seen.add(cache.getOrCreateInstance("wander"));
                    return null;
                });
            }
            start.countDown();
            for (Future<?> f : futures) f.get(10, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, compiler.executeCount.get());
        assertEquals(1, seen.size());
    }

    @Test
    @DisplayName("Concurrent installs of different ids never lose a version")
    void concurrentInstalls() throws Exception {
        int threads = 8;
        int perThread = 50;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch done = new CountDownLatch(threads);
        for (int t = 0; t < threads; t++) {
            String id = "script" + t;
            pool.submit(() -> {
                try {
                    for (int i = 0; i < perThread; i++) cache.updateVersion(id, unit(id, "v" + i));
                } finally {
                    done.countDown();
                }
            });
        }
        assertTrue(done.await(10, TimeUnit.SECONDS));
        pool.shutdownNow();

        assertEquals(threads * perThread, cache.currentVersion());
        assertEquals(threads, cache.cachedScriptCount());
    }

    @Test
    @DisplayName("Concurrent installs of one id are serialized")
    void concurrentInstallsSameId() throws Exception {
        int threads = 8;
        int perThread = 50;
        Set<Long> versions = ConcurrentHashMap.newKeySet();
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        for (int t = 0; t < threads; t++) {
            String prefix = "t" + t + "-";
            pool.submit(() -> {
                try {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        versions.add(cache.updateVersion("wander", unit("wander", prefix + i)));
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        assertTrue(done.await(10, TimeUnit.SECONDS));
        pool.shutdownNow();

        int total = threads * perThread;
        assertEquals(total, versions.size());
        assertEquals(total, cache.currentVersion());
        assertEquals(total, cache.getVersion("wander"));
        assertEquals(cache.maxHistoryDepth() - 1, cache.getVersionHistoryDepth("wander"));

        long newer = cache.getVersion("wander");
        while (cache.rollback("wander")) {
            long older = cache.getVersion("wander");
            assertTrue(older < newer, older + " should be older than " + newer);
            newer = older;
        }
    }

    @Test
    @DisplayName("A lookup racing an install never executes the replaced version twice")
    void lookupRacingInstall() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger slowExecutions = new AtomicInteger();
        List<RecordingBehavior> slowInstances = new CopyOnWriteArrayList<>();
        compiler.register("slow", u -> {
            slowExecutions.incrementAndGet();
            entered.countDown();
            try {
                if (!release.await(10, TimeUnit.SECONDS)) throw new IllegalStateException("never released");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
            RecordingBehavior b = new RecordingBehavior("wander:slow", compiler.callLog());
            slowInstances.add(b);
            return b;
        });
        cache.updateVersion("wander", unit("wander", "slow"));

        ExecutorService pool = Executors.newFixedThreadPool(3);
        try {
            Future<ScriptBehavior> first = pool.submit(() -> cache.getOrCreateInstance("wander"));
            assertTrue(entered.await(10, TimeUnit.SECONDS));
            Future<ScriptBehavior> second = pool.submit(() -> cache.getOrCreateInstance("wander"));
            Future<Long> install = pool.submit(() -> cache.updateVersion("wander", unit("wander", "fast")));

            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
            while (cache.getVersion("wander") != 2L && System.nanoTime() < deadline) {
                Thread.sleep(1);
            }
            assertEquals(2L, cache.getVersion("wander"));
            release.countDown();

            ScriptBehavior a = first.get(10, TimeUnit.SECONDS);
            ScriptBehavior b = second.get(10, TimeUnit.SECONDS);
            assertEquals(2L, install.get(10, TimeUnit.SECONDS));

            assertEquals(1, slowExecutions.get());
            assertSame(slowInstances.get(0), a);
            String label = ((RecordingBehavior) b).label;
            assertTrue(label.equals("wander:slow") || label.equals("wander:fast"), label);
        } finally {
            release.countDown();
            pool.shutdownNow();
        }

        cache.clear();
        for (RecordingBehavior r : slowInstances) assertEquals(1, r.unloads.get(), r.label);
        for (RecordingBehavior r : compiler.created) assertEquals(1, r.unloads.get(), r.label);
    }

    @Test
    @DisplayName("clear during concurrent installs never leaves an entry newer than the counter")
    void clearRacingInstalls() throws Exception {
        int writers = 4;
        ExecutorService pool = Executors.newFixedThreadPool(writers + 1);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < writers; t++) {
                String id = "script" + t;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < 500; i++) cache.updateVersion(id, unit(id, "v" + i));
                    return null;
                }));
            }
            futures.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < 200; i++) cache.clear();
                return null;
            }));
            start.countDown();
            for (Future<?> f : futures) f.get(20, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        long counter = cache.currentVersion();
        for (CacheEntryInfo info : cache.getDiagnostics()) {
            assertTrue(info.version() <= counter, info + " is newer than counter " + counter);
        }
        long next = cache.updateVersion("after", unit("after", "a"));
        assertEquals(counter + 1, next);
    }

    @Test
    @DisplayName("Deferred unload queues dropped instances until drained")
    void deferredUnload() {
        cache.setDeferredUnload(true);
        cache.updateVersion("wander", unit("wander", "a"));
        RecordingBehavior old = (RecordingBehavior) cache.getOrCreateInstance("wander");

        cache.updateVersion("wander", unit("wander", "b"));
        assertEquals(0, old.unloads.get());
        assertEquals(1, cache.pendingUnloadCount());

        assertEquals(1, cache.drainRetired());
        assertEquals(1, old.unloads.get());
        assertEquals(0, cache.drainRetired());

        RecordingBehavior second = (RecordingBehavior) cache.getOrCreateInstance("wander");
        cache.clearInstance("wander");
        cache.setDeferredUnload(false);
        assertEquals(1, second.unloads.get());
    }

    @Test
    @DisplayName("Failed instantiation leaves the slot empty and can be retried")
    void instantiationFailureIsRetryable() {
        AtomicInteger attempts = new AtomicInteger();
        compiler.register("flaky", u -> {
            if (attempts.incrementAndGet() == 1) throw new IllegalStateException("first attempt fails");
            return new RecordingBehavior("flaky", compiler.callLog());
        });
        long v = cache.updateVersion("npc", unit("npc", "flaky"));

        ScriptInstantiationException e = assertThrows(ScriptInstantiationException.class,
                () -> cache.getOrCreateInstance("npc"));
        assertEquals(v, e.version());
        assertEquals("npc", e.scriptId());
        assertFalse(cache.getInstance("npc").instantiated());

        assertNotNull(cache.getOrCreateInstance("npc"));
        assertEquals(2, attempts.get());
    }

    @Test
    @DisplayName("Unknown, null and blank ids")
    void idValidation() {
        assertThrows(ScriptNotFoundException.class, () -> cache.getOrCreateInstance("missing"));
        assertThrows(NullPointerException.class, () -> cache.getVersion(null));
        assertThrows(IllegalArgumentException.class, () -> cache.updateVersion("  ", unit("x", "a")));

        assertEquals(-1, cache.getVersion("missing"));
        assertNull(cache.getScriptType("missing"));
        assertFalse(cache.getInstance("missing").found());
        assertFalse(cache.contains(""));
        assertFalse(cache.contains(null));
    }

    @Test
    @DisplayName("clearInstance keeps the version and re-creates on next access")
    void clearInstance() {
        long v = cache.updateVersion("wander", unit("wander", "a"));
        RecordingBehavior first = (RecordingBehavior) cache.getOrCreateInstance("wander");

        assertTrue(cache.clearInstance("wander"));
        assertEquals(1, first.unloads.get());
        assertEquals(v, cache.getVersion("wander"));
        assertNotSame(first, cache.getOrCreateInstance("wander"));
        assertFalse(cache.clearInstance("missing"));
    }

    @Test
    @DisplayName("remove drops the id with its history, clear resets the counter")
    void removeAndClear() {
        cache.updateVersion("wander", unit("wander", "a"));
        cache.updateVersion("wander", unit("wander", "b"));
        cache.updateVersion("patrol", unit("patrol", "a"));
        RecordingBehavior patrol = (RecordingBehavior) cache.getOrCreateInstance("patrol");

        assertTrue(cache.remove("wander"));
        assertFalse(cache.remove("wander"));
        assertFalse(cache.contains("wander"));
        assertThrows(ScriptNotFoundException.class, () -> cache.getOrCreateInstance("wander"));
        assertEquals(Set.of("patrol"), cache.getAllTypeIds());

        cache.clear();
        assertEquals(0, cache.cachedScriptCount());
        assertEquals(0, cache.currentVersion());
        assertEquals(1, patrol.unloads.get());
        assertEquals(1, cache.updateVersion("wander", unit("wander", "c")));
    }

    @Test
    @DisplayName("Explicit version install keeps history and leaves the counter alone")
    void explicitVersionInstall() {
        cache.updateVersion("wander", unit("wander", "a"));
        cache.updateVersion("wander", unit("wander", "b"));
        long before = cache.currentVersion();

        cache.updateVersion("wander", unit("wander", "restored"), 1L);

        assertEquals(1L, cache.getVersion("wander"));
        assertEquals(before, cache.currentVersion());
        assertEquals(1, cache.getVersionHistoryDepth("wander"));
        assertEquals("wander:restored", ((RecordingBehavior) cache.getOrCreateInstance("wander")).label);
        assertThrows(IllegalArgumentException.class,
                () -> cache.updateVersion("wander", unit("wander", "x"), -5L));
    }

    @Test
    @DisplayName("Diagnostics describe every cached script")
    void diagnostics() {
        cache.updateVersion("wander", unit("wander", "a"));
        cache.updateVersion("wander", unit("wander", "b"));
        cache.getOrCreateInstance("wander");

        List<CacheEntryInfo> infos = cache.getDiagnostics();
        assertEquals(1, infos.size());
        CacheEntryInfo info = infos.get(0);
        assertEquals("wander", info.typeId());
        assertEquals(2, info.version());
        assertTrue(info.instantiated());
        assertTrue(info.hasPreviousVersion());
        assertEquals(1L, info.previousVersionNumber());
        assertEquals(1, info.historyDepth());
        assertNotNull(info.lastUpdated());
    }

    @Test
    @DisplayName("maxHistoryDepth of 1 keeps no predecessors")
    void noHistory() {
        VersionedScriptCache flat = new VersionedScriptCache(compiler, 1);
        flat.updateVersion("wander", unit("wander", "a"));
        flat.updateVersion("wander", unit("wander", "b"));

        assertEquals(0, flat.getVersionHistoryDepth("wander"));
        assertFalse(flat.rollback("wander"));
        assertThrows(IllegalArgumentException.class, () -> new VersionedScriptCache(compiler, 0));
    }
}
