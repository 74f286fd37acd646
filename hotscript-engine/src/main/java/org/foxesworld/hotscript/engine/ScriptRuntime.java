package org.foxesworld.hotscript.engine;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.hotscript.core.HotScriptPlatform;
import org.foxesworld.hotscript.core.compile.CompileService;
import org.foxesworld.hotscript.engine.attach.ScriptAttachmentRegistry;
import org.foxesworld.hotscript.engine.cache.VersionedScriptCache;
import org.foxesworld.hotscript.engine.config.HotScriptConfig;
import org.foxesworld.hotscript.engine.ecs.EcsWorld;
import org.foxesworld.hotscript.engine.events.ScriptEventBus;
import org.foxesworld.hotscript.engine.exec.ScriptExecutionScheduler;
import org.foxesworld.hotscript.engine.exec.TickReport;
import org.foxesworld.hotscript.engine.hotreload.HotReloadWatcher;
import org.foxesworld.hotscript.engine.hotreload.ReloadResult;
import org.foxesworld.hotscript.engine.hotreload.ScriptBackupManager;
import org.foxesworld.hotscript.engine.hotreload.ScriptHotReloadService;
import org.foxesworld.hotscript.engine.hotreload.ScriptSourceLocator;
import org.foxesworld.hotscript.engine.profiler.ScriptProfiler;
import org.foxesworld.hotscript.script.GraalCompileService;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Script subsystem of a simulation: owns the cache, the entity storage with its attachments, the
 * event bus, the profiler, the tick scheduler and the reload pipeline.
 *
 * <p>Drive it from the simulation thread: load scripts, attach them to entities, call
 * {@link #update(float)} once per frame, {@link #close()} on shutdown.</p>
 */
public final class ScriptRuntime implements Closeable {

    private static final Logger log = LogManager.getLogger(ScriptRuntime.class);

    private final HotScriptConfig config;
    private final CompileService compiler;
    private final boolean ownsCompiler;

    private final VersionedScriptCache cache;
    private final EcsWorld world;
    private final ScriptAttachmentRegistry attachments;
    private final ScriptEventBus events;
    private final ScriptProfiler profiler;
    private final ScriptExecutionScheduler scheduler;
    private final ScriptBackupManager backups;
    private final ScriptHotReloadService reload;

    private volatile boolean closed;

    /** GraalJS backed runtime configured from {@code hotscript.*} system properties. */
    public static ScriptRuntime create() throws IOException {
        return create(HotScriptConfig.fromSystemProperties());
    }

    public static ScriptRuntime create(HotScriptConfig config) throws IOException {
        return new ScriptRuntime(new GraalCompileService(), true, config);
    }

    /** Runtime over a caller supplied compiler; the caller keeps ownership of it. */
    public ScriptRuntime(CompileService compiler, HotScriptConfig config) throws IOException {
        this(compiler, false, config);
    }

    private ScriptRuntime(CompileService compiler, boolean ownsCompiler, HotScriptConfig config) throws IOException {
        this.config = Objects.requireNonNull(config, "config");
        this.compiler = Objects.requireNonNull(compiler, "compiler");
        this.ownsCompiler = ownsCompiler;

        log.info("{} {} starting (java={}, os={}, cores={}, mode={})",
                HotScriptPlatform.NAME, HotScriptPlatform.VERSION,
                HotScriptPlatform.java(), HotScriptPlatform.os(), HotScriptPlatform.cores(),
                config.executionMode());

        this.cache = new VersionedScriptCache(compiler, config.maxHistoryDepth());
        this.world = new EcsWorld();
        this.attachments = new ScriptAttachmentRegistry(world);
        this.events = new ScriptEventBus();
        this.profiler = new ScriptProfiler()
                .setEnabled(config.profilerEnabled())
                .setReportEveryNanos(TimeUnit.MILLISECONDS.toNanos(config.profilerReportMillis()));
        this.scheduler = new ScriptExecutionScheduler(cache, attachments, events, profiler, config);
        this.backups = new ScriptBackupManager(cache, config.maxBackups());
        this.reload = new ScriptHotReloadService(compiler, cache, backups, new ScriptSourceLocator(),
                config.debounceMillis(), config.autoRollback());
        scheduler.addFailureListener(reload);

        if (config.hotReloadEnabled()) {
            Path root = config.hotReloadRoot();
            if (Files.isDirectory(root)) {
                reload.watch(new HotReloadWatcher(root, config.hotReloadExtensions(),
                        config.ignoredDirs(), config.ignoredFiles()));
            } else {
                log.warn("Hot reload enabled but root is not a directory: {}", root.toAbsolutePath());
            }
        }
    }

    public HotScriptConfig config() { return config; }
    public VersionedScriptCache cache() { return cache; }
    public EcsWorld world() { return world; }
    public ScriptAttachmentRegistry attachments() { return attachments; }
    public ScriptEventBus events() { return events; }
    public ScriptProfiler profiler() { return profiler; }
    public ScriptExecutionScheduler scheduler() { return scheduler; }
    public ScriptBackupManager backups() { return backups; }
    public ScriptHotReloadService hotReload() { return reload; }

    /** Compiles and installs a script; a failed compile leaves the current version in place. */
    public ReloadResult load(String scriptId, String sourceText) {
        ensureOpen();
        return reload.reload(scriptId, sourceText);
    }

    /** Loads a file, script id = file name without extension. */
    public ReloadResult loadFile(Path file) throws IOException {
        ensureOpen();
        ScriptSourceLocator locator = new ScriptSourceLocator();
        return reload.reload(locator.scriptIdOf(file), locator.read(file));
    }

    /** Loads every matching file below the hot reload root. */
    public int loadAll() throws IOException {
        ensureOpen();
        Path root = config.hotReloadRoot();
        if (!Files.isDirectory(root)) return 0;
        List<Path> paths;
        try (Stream<Path> files = Files.walk(root)) {
            paths = files.filter(Files::isRegularFile).sorted().toList();
        }
        int loaded = 0;
        for (Path p : paths) {
            String name = p.getFileName().toString().toLowerCase(Locale.ROOT);
            if (config.hotReloadExtensions().stream().noneMatch(name::endsWith)) continue;
            if (loadFile(p).installed()) loaded++;
        }
        log.info("Loaded {} script(s) from {}", loaded, root.toAbsolutePath());
        return loaded;
    }

    /** Polls file changes then runs one scheduler tick. */
    public TickReport update(float tpf) {
        ensureOpen();
        reload.poll();
        return scheduler.tick(tpf);
    }

    private void ensureOpen() {
        if (closed) throw new IllegalStateException("ScriptRuntime is closed");
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        log.info("Closing ScriptRuntime");

        scheduler.close();
        try {
            reload.close();
        } catch (IOException e) {
            log.warn("Error stopping hot reload", e);
        }
        cache.clear();
        backups.clear();
        events.clearAll();
        world.reset();

        if (ownsCompiler && compiler instanceof Closeable c) {
            try {
                c.close();
            } catch (IOException e) {
                log.warn("Error closing compiler", e);
            }
        }
    }
}
