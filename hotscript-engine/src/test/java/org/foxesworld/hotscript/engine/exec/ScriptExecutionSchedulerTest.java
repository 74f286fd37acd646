package org.foxesworld.hotscript.engine.exec;

import org.foxesworld.hotscript.core.behavior.ScriptContext;
import org.foxesworld.hotscript.core.behavior.ScriptEvent;
import org.foxesworld.hotscript.core.error.ScriptInstantiationException;
import org.foxesworld.hotscript.engine.attach.ScriptAttachmentRegistry;
import org.foxesworld.hotscript.engine.cache.VersionedScriptCache;
import org.foxesworld.hotscript.engine.config.HotScriptConfig;
import org.foxesworld.hotscript.engine.ecs.EcsWorld;
import org.foxesworld.hotscript.engine.events.ScriptEventBus;
import org.foxesworld.hotscript.engine.profiler.ScriptProfiler;
import org.foxesworld.hotscript.engine.support.FakeCompileService;
import org.foxesworld.hotscript.engine.support.RecordingBehavior;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

public class ScriptExecutionSchedulerTest {

    private FakeCompileService compiler;
    private VersionedScriptCache cache;
    private EcsWorld world;
    private ScriptAttachmentRegistry registry;
    private ScriptEventBus events;
    private ScriptProfiler profiler;
    private ScriptExecutionScheduler scheduler;
    private final List<ScriptFailure> failures = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        compiler = new FakeCompileService();
        cache = new VersionedScriptCache(compiler);
        world = new EcsWorld();
        registry = new ScriptAttachmentRegistry(world);
        events = new ScriptEventBus();
        profiler = new ScriptProfiler();
        scheduler = newScheduler(HotScriptConfig.builder()
                .maxCrashStreak(3)
                .crashCooldownTicks(5)
                .build());
    }

    @AfterEach
    void tearDown() {
        scheduler.close();
    }

    private ScriptExecutionScheduler newScheduler(HotScriptConfig config) {
        if (scheduler != null) scheduler.close();
        ScriptExecutionScheduler s = new ScriptExecutionScheduler(cache, registry, events, profiler, config);
        s.addFailureListener(failures::add);
        return s;
    }

    private long install(String id, String text) {
        return cache.updateVersion(id, compiler.compile(text, id));
    }

    private RecordingBehavior current(String id) {
        return (RecordingBehavior) cache.getInstance(id).instance();
    }

    @Test
    @DisplayName("Wander: installed script is initialized once, ticked every frame, rebound after reload")
    void wanderScenario() {
        long v1 = install("wander", "v1");
        int npc = world.createEntity();
        registry.addAttachment(npc, "wander", 0);

        TickReport first = scheduler.tick(0.016f);
        scheduler.tick(0.016f);

        RecordingBehavior old = current("wander");
        assertEquals(1, old.inits.get());
        assertEquals(2, old.ticks.get());
        assertEquals(1, first.initialized());
        assertEquals(1, first.executed());
        assertEquals(List.of(v1, v1), old.seenVersions);

        long v2 = install("wander", "v2");
        TickReport afterReload = scheduler.tick(0.016f);

        RecordingBehavior fresh = current("wander");
        assertNotSame(old, fresh);
        assertEquals(1, old.unloads.get());
        assertEquals(2, old.ticks.get(), "old instance is never ticked after the reload");
        assertEquals(1, fresh.inits.get());
        assertEquals(1, fresh.ticks.get());
        assertEquals(List.of(v2), fresh.seenVersions);
        assertEquals(1, afterReload.initialized());
        assertEquals(v2, registry.find(npc, "wander").boundVersion);
    }

    @Test
    @DisplayName("Wander v2 fails to instantiate, siblings keep running, rollback restores a fresh v1")
    void brokenReloadAndRollback() {
        long v1 = install("wander", "v1");
        install("sibling", "ok");
        int npc = world.createEntity();
        registry.addAttachment(npc, "wander", 10);
        registry.addAttachment(npc, "sibling", 0);

        assertEquals(2, scheduler.tick(0.016f).executed());
        RecordingBehavior original = current("wander");

        install("wander", "broken-v2");
        TickReport broken = scheduler.tick(0.016f);

        assertEquals(1, broken.errors());
        assertEquals(1, broken.executed());
        assertEquals(2, current("sibling").ticks.get());
        assertEquals(ScriptFailure.Phase.RESOLVE, failures.get(0).phase());
        assertInstanceOf(ScriptInstantiationException.class, failures.get(0).error());

        assertTrue(cache.rollback("wander"));
        TickReport recovered = scheduler.tick(0.016f);

        RecordingBehavior restored = current("wander");
        assertNotSame(original, restored);
        assertEquals("wander:v1", restored.label);
        assertEquals(1, restored.inits.get());
        assertEquals(1, restored.ticks.get());
        assertEquals(0, recovered.errors());
        assertEquals(2, recovered.executed());
        assertEquals(v1, cache.getVersion("wander"));
    }

    @Test
    @DisplayName("An instance replaced mid-tick finishes the tick and is unloaded on the next one")
    void replacedDuringTick() {
        List<RecordingBehavior> made = new CopyOnWriteArrayList<>();
        compiler.register("self-reloading", u -> {
            RecordingBehavior b = new RecordingBehavior("npc:self-reloading", compiler.callLog()) {
                @Override
                public void handleEvent(ScriptContext ctx, ScriptEvent event) {
                    super.handleEvent(ctx, event);
                    install("npc", "v2");
                }

                @Override
                public void tick(ScriptContext ctx, float tpf) {
                    if (unloads.get() > 0) throw new IllegalStateException("Script instance unloaded");
                    super.tick(ctx, tpf);
                }
            };
            made.add(b);
            return b;
        });
        install("npc", "self-reloading");
        int e = world.createEntity();
        registry.addAttachment(e, "npc", 0);
        scheduler.tick(0.016f);

        events.emit("reload", 1);
        TickReport during = scheduler.tick(0.016f);

        RecordingBehavior old = made.get(0);
        assertEquals(0, during.errors());
        assertEquals(2, old.ticks.get());
        assertEquals(0, old.unloads.get());
        assertEquals(1, cache.pendingUnloadCount());

        TickReport after = scheduler.tick(0.016f);
        assertEquals(1, old.unloads.get());
        assertEquals(0, after.errors());
        assertEquals(1, after.initialized());
        assertEquals("npc:v2", current("npc").label);
        assertTrue(failures.isEmpty());
    }

    @Test
    @DisplayName("Rollback rebinds to a fresh instance of the previous version")
    void rollbackRebinds() {
        long v1 = install("wander", "v1");
        int npc = world.createEntity();
        registry.addAttachment(npc, "wander", 0);
        scheduler.tick(0.016f);
        install("wander", "v2");
        scheduler.tick(0.016f);

        assertTrue(cache.rollback("wander"));
        TickReport report = scheduler.tick(0.016f);

        RecordingBehavior restored = current("wander");
        assertEquals("wander:v1", restored.label);
        assertEquals(1, restored.inits.get());
        assertEquals(1, report.initialized());
        assertEquals(v1, registry.find(npc, "wander").boundVersion);
    }

    @Test
    @DisplayName("Attachments of one entity run in priority order")
    void executionOrder() {
        install("low", "x");
        install("high", "x");
        install("mid", "x");
        int e = world.createEntity();
        registry.addAttachment(e, "low", 10);
        registry.addAttachment(e, "high", 100);
        registry.addAttachment(e, "mid", 50);

        scheduler.tick(0.016f);

        List<String> ticks = compiler.callLog().stream().filter(s -> s.contains(".tick@")).toList();
        assertEquals(List.of("high:x.tick@" + e, "mid:x.tick@" + e, "low:x.tick@" + e), ticks);
    }

    @Test
    @DisplayName("A throwing script does not stop the others")
    void failureIsolation() {
        compiler.register("bad", u -> {
            RecordingBehavior b = new RecordingBehavior("bad", compiler.callLog());
            b.failOnTick = true;
            return b;
        });
        install("broken-tick", "bad");
        install("fine", "ok");
        int e1 = world.createEntity();
        int e2 = world.createEntity();
        registry.addAttachment(e1, "broken-tick", 10);
        registry.addAttachment(e1, "fine", 0);
        registry.addAttachment(e2, "fine", 0);

        TickReport report = assertDoesNotThrow(() -> scheduler.tick(0.016f));

        assertEquals(1, report.errors());
        assertEquals(2, report.executed());
        assertEquals(2, current("fine").ticks.get());
        assertEquals(1, failures.size());
        ScriptFailure f = failures.get(0);
        assertEquals(ScriptFailure.Phase.TICK, f.phase());
        assertEquals("broken-tick", f.scriptId());
        assertEquals(e1, f.entityId());
        assertInstanceOf(IllegalStateException.class, f.error());
        assertEquals(1, profiler.stats("broken-tick").errors.get());
    }

    @Test
    @DisplayName("Unknown script ids and failed instantiation are reported, not thrown")
    void resolveFailures() {
        install("npc", "broken-module");
        int e = world.createEntity();
        registry.addAttachment(e, "ghost", 1);
        registry.addAttachment(e, "npc", 0);

        TickReport report = scheduler.tick(0.016f);

        assertEquals(2, report.errors());
        assertEquals(0, report.executed());
        assertTrue(failures.stream().allMatch(f -> f.phase() == ScriptFailure.Phase.RESOLVE));
        assertFalse(cache.getInstance("npc").instantiated());
    }

    @Test
    @DisplayName("A failing initialize is retried on the next tick")
    void initRetried() {
        compiler.register("shaky", u -> {
            RecordingBehavior b = new RecordingBehavior("shaky", compiler.callLog());
            b.failOnInit = true;
            return b;
        });
        install("npc", "shaky");
        int e = world.createEntity();
        registry.addAttachment(e, "npc", 0);

        TickReport failed = scheduler.tick(0.016f);
        RecordingBehavior b = current("npc");
        assertEquals(1, failed.errors());
        assertEquals(0, b.ticks.get(), "tick is skipped while unbound");
        assertEquals(0L, registry.find(e, "npc").boundSerial);

        b.failOnInit = false;
        TickReport ok = scheduler.tick(0.016f);
        assertEquals(1, ok.initialized());
        assertEquals(1, b.inits.get());
        assertEquals(1, b.ticks.get());
    }

    @Test
    @DisplayName("Repeated failures suspend the attachment until cooldown ends")
    void crashBreaker() {
        compiler.register("bad", u -> {
            RecordingBehavior b = new RecordingBehavior("bad", compiler.callLog());
            b.failOnTick = true;
            return b;
        });
        install("npc", "bad");
        int e = world.createEntity();
        registry.addAttachment(e, "npc", 0);

        for (int i = 0; i < 3; i++) assertEquals(1, scheduler.tick(0.016f).errors());
        for (int i = 0; i < 5; i++) {
            TickReport r = scheduler.tick(0.016f);
            assertEquals(1, r.suspended(), "tick " + r.tickNumber());
            assertEquals(0, r.errors());
        }
        assertEquals(1, scheduler.tick(0.016f).errors(), "runs again after cooldown");
        assertEquals(4, failures.size());
    }

    @Test
    @DisplayName("Installing a new version lifts a suspension")
    void newVersionLiftsSuspension() {
        compiler.register("bad", u -> {
            RecordingBehavior b = new RecordingBehavior("bad", compiler.callLog());
            b.failOnTick = true;
            return b;
        });
        install("npc", "bad");
        int e = world.createEntity();
        registry.addAttachment(e, "npc", 0);
        for (int i = 0; i < 3; i++) scheduler.tick(0.016f);
        assertEquals(1, scheduler.tick(0.016f).suspended());

        install("npc", "fixed");
        TickReport r = scheduler.tick(0.016f);

        assertEquals(0, r.suspended());
        assertEquals(1, r.executed());
        assertEquals(1, current("npc").ticks.get());
    }

    @Test
    @DisplayName("Broadcast and targeted events reach handleEvent before tick")
    void eventDelivery() {
        install("listener", "x");
        int e1 = world.createEntity();
        int e2 = world.createEntity();
        registry.addAttachment(e1, "listener", 0);
        registry.addAttachment(e2, "listener", 0);

        List<ScriptEvent> hostSeen = new CopyOnWriteArrayList<>();
        events.on("alarm", hostSeen::add);
        events.emit("alarm", 3);
        events.emitTo(e2, "hit", "sword");

        TickReport report = scheduler.tick(0.016f);

        assertEquals(2, report.events());
        assertEquals(1, hostSeen.size());
        RecordingBehavior b = current("listener");
        assertEquals(3, b.events.size());
        List<String> forE2 = compiler.callLog().stream().filter(s -> s.endsWith("@" + e2)).toList();
        assertEquals(List.of("listener:x.init@" + e2, "listener:x.event:alarm@" + e2,
                "listener:x.event:hit@" + e2, "listener:x.tick@" + e2), forE2);
    }

    @Test
    @DisplayName("Events emitted by scripts are delivered on the next tick")
    void scriptEmittedEvents() {
        compiler.register("emitter", u -> new RecordingBehavior("emitter", compiler.callLog()) {
            @Override
            public void tick(ScriptContext ctx, float tpf) {
                super.tick(ctx, tpf);
                ctx.emit("ping", ctx.tickNumber());
            }
        });
        install("emitter", "emitter");
        install("listener", "x");
        int e = world.createEntity();
        registry.addAttachment(e, "emitter", 1);
        registry.addAttachment(e, "listener", 0);

        assertEquals(0, scheduler.tick(0.016f).events());
        assertEquals(1, scheduler.tick(0.016f).events());
        assertEquals(1L, current("listener").events.get(0).payload());
    }

    @Test
    @DisplayName("Inactive attachments are skipped and counted")
    void inactiveSkipped() {
        install("npc", "x");
        int e = world.createEntity();
        registry.addAttachment(e, "npc", 0);
        registry.setActive(e, "npc", false);

        TickReport r = scheduler.tick(0.016f);
        assertEquals(1, r.inactive());
        assertEquals(0, r.executed());
        assertEquals(0, compiler.executeCount.get());

        registry.setActive(e, "npc", true);
        assertEquals(1, scheduler.tick(0.016f).executed());
    }

    @Test
    @DisplayName("Parallel mode runs every entity on the worker pool")
    void parallelMode() {
        scheduler = newScheduler(HotScriptConfig.builder()
                .executionMode(ExecutionMode.PARALLEL)
                .workerThreads(4)
                .build());

        Set<String> threads = ConcurrentHashMap.newKeySet();
        compiler.register("counter", u -> new RecordingBehavior("counter", new CopyOnWriteArrayList<>()) {
            @Override
            public void tick(ScriptContext ctx, float tpf) {
                threads.add(Thread.currentThread().getName());
                super.tick(ctx, tpf);
            }
        });
        install("counter", "counter");
        int entities = 200;
        for (int i = 0; i < entities; i++) {
            registry.addAttachment(world.createEntity(), "counter", 0);
        }

        TickReport r1 = scheduler.tick(0.016f);
        TickReport r2 = scheduler.tick(0.016f);

        assertEquals(entities, r1.executed());
        assertEquals(entities, r1.initialized());
        assertEquals(entities, r2.executed());
        assertEquals(0, r2.initialized());
        assertEquals(2 * entities, current("counter").ticks.get());
        assertTrue(threads.stream().allMatch(n -> n.startsWith("hotscript-worker-")), threads.toString());
    }

    @Test
    @DisplayName("Tick number and elapsed time advance per tick")
    void clock() {
        install("npc", "x");
        registry.addAttachment(world.createEntity(), "npc", 0);

        scheduler.tick(0.5f);
        scheduler.tick(0.5f);

        assertEquals(2, scheduler.tickNumber());
        assertEquals(1.0, scheduler.elapsedSeconds(), 1e-6);
    }
}
