package org.foxesworld.hotscript.engine.config;

import org.foxesworld.hotscript.core.HotScriptPlatform;
import org.foxesworld.hotscript.engine.cache.VersionedScriptCache;
import org.foxesworld.hotscript.engine.exec.ExecutionMode;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Set;

/**
 * Runtime settings. Read from {@code hotscript.*} system properties or built in code.
 */
public record HotScriptConfig(
        int maxHistoryDepth,
        ExecutionMode executionMode,
        int workerThreads,
        int maxCrashStreak,
        long crashCooldownTicks,
        long failureLogIntervalMillis,
        int maxEventsPerTick,
        boolean hotReloadEnabled,
        Path hotReloadRoot,
        long debounceMillis,
        Set<String> hotReloadExtensions,
        Set<String> ignoredDirs,
        Set<String> ignoredFiles,
        boolean autoRollback,
        boolean profilerEnabled,
        long profilerReportMillis,
        int maxBackups
) {

    public HotScriptConfig {
        if (maxHistoryDepth < 1) throw new IllegalArgumentException("maxHistoryDepth must be >= 1");
        Objects.requireNonNull(executionMode, "executionMode");
        Objects.requireNonNull(hotReloadRoot, "hotReloadRoot");
        workerThreads = Math.max(1, workerThreads);
        maxCrashStreak = Math.max(1, maxCrashStreak);
        crashCooldownTicks = Math.max(0L, crashCooldownTicks);
        failureLogIntervalMillis = Math.max(0L, failureLogIntervalMillis);
        maxEventsPerTick = Math.max(1, maxEventsPerTick);
        debounceMillis = Math.max(0L, debounceMillis);
        hotReloadExtensions = Set.copyOf(hotReloadExtensions);
        ignoredDirs = Set.copyOf(ignoredDirs);
        ignoredFiles = Set.copyOf(ignoredFiles);
        profilerReportMillis = Math.max(250L, profilerReportMillis);
        maxBackups = Math.max(1, maxBackups);
    }

    public static HotScriptConfig defaults() {
        return builder().build();
    }

    public static HotScriptConfig fromSystemProperties() {
        return from(SysProps.system());
    }

    public static HotScriptConfig from(SysProps p) {
        HotScriptConfig d = defaults();
        return new HotScriptConfig(
                p.i32("hotscript.cache.maxHistoryDepth", d.maxHistoryDepth, 1),
                p.enumValue("hotscript.exec.mode", ExecutionMode.class, d.executionMode),
                p.i32("hotscript.exec.threads", d.workerThreads, 1),
                p.i32("hotscript.exec.maxCrashStreak", d.maxCrashStreak, 1),
                p.i64("hotscript.exec.crashCooldownTicks", d.crashCooldownTicks, 0),
                p.i64("hotscript.exec.logIntervalMillis", d.failureLogIntervalMillis, 0),
                p.i32("hotscript.events.maxPerTick", d.maxEventsPerTick, 1),
                p.bool("hotscript.reload.enabled", d.hotReloadEnabled),
                Path.of(p.str("hotscript.reload.root", d.hotReloadRoot.toString())),
                p.i64("hotscript.reload.debounceMillis", d.debounceMillis, 0),
                p.csv("hotscript.reload.extensions", d.hotReloadExtensions),
                p.csv("hotscript.reload.ignore.dirs", d.ignoredDirs),
                p.csv("hotscript.reload.ignore.files", d.ignoredFiles),
                p.bool("hotscript.reload.autoRollback", d.autoRollback),
                p.bool("hotscript.profiler.enabled", d.profilerEnabled),
                p.i64("hotscript.profiler.reportMillis", d.profilerReportMillis, 250),
                p.i32("hotscript.backup.maxEntries", d.maxBackups, 1)
        );
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int maxHistoryDepth = VersionedScriptCache.DEFAULT_MAX_HISTORY_DEPTH;
        private ExecutionMode executionMode = ExecutionMode.SEQUENTIAL;
        private int workerThreads = HotScriptPlatform.cores();
        private int maxCrashStreak = 3;
        private long crashCooldownTicks = 300;
        private long failureLogIntervalMillis = 1_000;
        private int maxEventsPerTick = 4_096;
        private boolean hotReloadEnabled = false;
        private Path hotReloadRoot = Path.of("scripts");
        private long debounceMillis = 300;
        private Set<String> hotReloadExtensions = Set.of(".js");
        private Set<String> ignoredDirs = Set.of();
        private Set<String> ignoredFiles = Set.of();
        private boolean autoRollback = false;
        private boolean profilerEnabled = true;
        private long profilerReportMillis = 2_000;
        private int maxBackups = 1_024;

        public Builder maxHistoryDepth(int v) { this.maxHistoryDepth = v; return this; }
        public Builder executionMode(ExecutionMode v) { this.executionMode = v; return this; }
        public Builder workerThreads(int v) { this.workerThreads = v; return this; }
        public Builder maxCrashStreak(int v) { this.maxCrashStreak = v; return this; }
        public Builder crashCooldownTicks(long v) { this.crashCooldownTicks = v; return this; }
        public Builder failureLogIntervalMillis(long v) { this.failureLogIntervalMillis = v; return this; }
        public Builder maxEventsPerTick(int v) { this.maxEventsPerTick = v; return this; }
        public Builder hotReloadEnabled(boolean v) { this.hotReloadEnabled = v; return this; }
        public Builder hotReloadRoot(Path v) { this.hotReloadRoot = v; return this; }
        public Builder debounceMillis(long v) { this.debounceMillis = v; return this; }
        public Builder hotReloadExtensions(Set<String> v) { this.hotReloadExtensions = v; return this; }
        public Builder ignoredDirs(Set<String> v) { this.ignoredDirs = v; return this; }
        public Builder ignoredFiles(Set<String> v) { this.ignoredFiles = v; return this; }
        public Builder autoRollback(boolean v) { this.autoRollback = v; return this; }
        public Builder profilerEnabled(boolean v) { this.profilerEnabled = v; return this; }
        public Builder profilerReportMillis(long v) { this.profilerReportMillis = v; return this; }
        public Builder maxBackups(int v) { this.maxBackups = v; return this; }

        public HotScriptConfig build() {
            return new HotScriptConfig(maxHistoryDepth, executionMode, workerThreads, maxCrashStreak,
                    crashCooldownTicks, failureLogIntervalMillis, maxEventsPerTick, hotReloadEnabled,
                    hotReloadRoot, debounceMillis, hotReloadExtensions, ignoredDirs, ignoredFiles,
                    autoRollback, profilerEnabled, profilerReportMillis, maxBackups);
        }
    }
}
