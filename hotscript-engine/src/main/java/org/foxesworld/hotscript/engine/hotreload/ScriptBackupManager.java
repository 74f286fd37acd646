package org.foxesworld.hotscript.engine.hotreload;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.hotscript.core.ScriptIds;
import org.foxesworld.hotscript.core.compile.CompiledUnit;
import org.foxesworld.hotscript.engine.cache.VersionedScriptCache;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Last-known-good compiled unit per script id, kept outside the cache history so a script can be
 * restored even after its history was pruned or the entry was removed.
 *
 * <p>Bounded: the least recently used backups are evicted past {@code maxEntries}.</p>
 */
public final class ScriptBackupManager {

    private static final Logger log = LogManager.getLogger(ScriptBackupManager.class);

    private record Backup(CompiledUnit unit, long version, Instant at) {}

    private final VersionedScriptCache cache;
    private final Cache<String, Backup> backups;

    public ScriptBackupManager(VersionedScriptCache cache, int maxEntries) {
        this.cache = Objects.requireNonNull(cache, "cache");
        this.backups = Caffeine.newBuilder()
                .maximumSize(Math.max(1, maxEntries))
                .build();
    }

    /**
     * Snapshots the current version of {@code scriptId}.
     *
     * @return false when the id is not in the cache
     */
    public boolean backupCurrent(String scriptId) {
        ScriptIds.require(scriptId);
        CompiledUnit unit = cache.getScriptType(scriptId);
        long version = cache.getVersion(scriptId);
        if (unit == null || version < 0) return false;
        backup(scriptId, unit, version);
        return true;
    }

    public void backup(String scriptId, CompiledUnit unit, long version) {
        ScriptIds.require(scriptId);
        Objects.requireNonNull(unit, "unit");
        backups.put(scriptId, new Backup(unit, version, Instant.now()));
        log.debug("Backup stored: {} v{}", scriptId, version);
    }

    public boolean hasBackup(String scriptId) {
        return ScriptIds.isValid(scriptId) && backups.getIfPresent(scriptId) != null;
    }

    /**
     * Reinstalls the backed up unit under its original version number.
     *
     * @return false when there is no backup for the id
     */
    public boolean restore(String scriptId) {
        ScriptIds.require(scriptId);
        Backup b = backups.getIfPresent(scriptId);
        if (b == null) {
            log.debug("No backup to restore for {}", scriptId);
            return false;
        }
        cache.updateVersion(scriptId, b.unit(), b.version());
        log.info("Backup restored: {} v{} (taken {})", scriptId, b.version(), b.at());
        return true;
    }

    public BackupInfo info(String scriptId) {
        if (!ScriptIds.isValid(scriptId)) return null;
        Backup b = backups.getIfPresent(scriptId);
        return b == null ? null : new BackupInfo(scriptId, b.version(), b.unit().name(), b.at());
    }

    public List<BackupInfo> all() {
        List<BackupInfo> out = new ArrayList<>();
        backups.asMap().forEach((id, b) -> out.add(new BackupInfo(id, b.version(), b.unit().name(), b.at())));
        return out;
    }

    public void discard(String scriptId) {
        if (ScriptIds.isValid(scriptId)) backups.invalidate(scriptId);
    }

    public void clear() {
        backups.invalidateAll();
    }
}
