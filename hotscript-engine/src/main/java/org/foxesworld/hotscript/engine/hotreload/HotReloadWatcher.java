package org.foxesworld.hotscript.engine.hotreload;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.*;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

import static java.nio.file.StandardWatchEventKinds.*;

/**
 * Recursive {@link WatchService} over a script root.
 *
 * <p>Only files whose name ends with one of the configured extensions are reported; directory
 * segments in {@code ignoredDirs} and file names in {@code ignoredFiles} are skipped. New
 * directories are registered as they appear. Not thread safe: poll from one thread.</p>
 */
public final class HotReloadWatcher implements Closeable {

    private static final Logger log = LogManager.getLogger(HotReloadWatcher.class);

    private final Path root;
    private final WatchService watchService;
    private final Set<String> extensions;
    private final Set<String> ignoredDirs;
    private final Set<String> ignoredFiles;

    private final Set<Path> registered = ConcurrentHashMap.newKeySet();

    public HotReloadWatcher(Path rootDirectory, Set<String> extensions) {
        this(rootDirectory, extensions, Set.of(), Set.of());
    }

    public HotReloadWatcher(Path rootDirectory, Set<String> extensions,
                            Set<String> ignoredDirs, Set<String> ignoredFiles) {
        this.root = rootDirectory.toAbsolutePath().normalize();
        this.extensions = normalizeExtensions(extensions);
        this.ignoredDirs = Set.copyOf(ignoredDirs);
        this.ignoredFiles = Set.copyOf(ignoredFiles);
        try {
            this.watchService = FileSystems.getDefault().newWatchService();
            registerAll(root);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to start hot reload watcher for " + root, e);
        }
        log.info("HotReloadWatcher watching (recursive): {} extensions={}", root, this.extensions);
    }

    public Path root() {
        return root;
    }

    private static Set<String> normalizeExtensions(Set<String> in) {
        Set<String> out = new HashSet<>();
        for (String e : in) {
            if (e == null || e.isBlank()) continue;
            String s = e.trim().toLowerCase(Locale.ROOT);
            out.add(s.startsWith(".") ? s : "." + s);
        }
        return Set.copyOf(out);
    }

    private void registerAll(Path start) throws IOException {
        Files.walkFileTree(start, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                if (isIgnoredDir(dir)) return FileVisitResult.SKIP_SUBTREE;
                Path norm = dir.toAbsolutePath().normalize();
                if (registered.add(norm)) {
                    norm.register(watchService, ENTRY_CREATE, ENTRY_MODIFY, ENTRY_DELETE);
                    log.debug("HotReloadWatcher registered: {}", norm);
                }
                return FileVisitResult.CONTINUE;
            }
        });
    }

    /** Any path segment below the root matching an ignored dir name excludes the directory. */
    boolean isIgnoredDir(Path dir) {
        Path abs = dir.toAbsolutePath().normalize();
        if (!abs.startsWith(root)) return true;
        for (Path seg : root.relativize(abs)) {
            if (ignoredDirs.contains(seg.toString())) return true;
        }
        return false;
    }

    /** True for files the reload pipeline cares about. */
    boolean isInteresting(Path file) {
        Path abs = file.toAbsolutePath().normalize();
        if (!abs.startsWith(root)) return false;

        Path parent = abs.getParent();
        if (parent != null && isIgnoredDir(parent)) return false;

        String name = abs.getFileName().toString();
        if (ignoredFiles.contains(name)) return false;

        String lower = name.toLowerCase(Locale.ROOT);
        for (String e : extensions) {
            if (lower.endsWith(e)) return true;
        }
        return false;
    }

    /**
     * Drains pending file system events.
     *
     * @return changed files as absolute paths, empty if nothing relevant changed
     */
    public Set<Path> pollChanged() {
        Set<Path> changed = new LinkedHashSet<>();

        WatchKey key;
        while ((key = watchService.poll()) != null) {
            Path watchedDir = (Path) key.watchable();

            for (WatchEvent<?> ev : key.pollEvents()) {
                WatchEvent.Kind<?> kind = ev.kind();
                if (kind == OVERFLOW) {
                    log.warn("HotReloadWatcher overflow in {}: some changes may be missed", watchedDir);
                    continue;
                }

                Path abs = watchedDir.resolve((Path) ev.context()).toAbsolutePath().normalize();

                if (kind == ENTRY_CREATE && Files.isDirectory(abs)) {
                    if (!isIgnoredDir(abs)) {
                        try {
                            registerAll(abs);
                        } catch (IOException ex) {
                            log.warn("HotReloadWatcher failed to register new dir {}", abs, ex);
                        }
                    }
                    continue;
                }

                if (isInteresting(abs)) {
                    changed.add(abs);
                    log.debug("HotReload change: {} {}", kind.name(), abs);
                }
            }

            if (!key.reset()) {
                registered.remove(watchedDir);
            }
        }

        return changed.isEmpty() ? Set.of() : Collections.unmodifiableSet(changed);
    }

    @Override
    public void close() throws IOException {
        registered.clear();
        watchService.close();
    }
}
