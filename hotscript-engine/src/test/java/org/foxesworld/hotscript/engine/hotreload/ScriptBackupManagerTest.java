package org.foxesworld.hotscript.engine.hotreload;

import org.foxesworld.hotscript.engine.cache.VersionedScriptCache;
import org.foxesworld.hotscript.engine.support.FakeCompileService;
import org.foxesworld.hotscript.engine.support.RecordingBehavior;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ScriptBackupManagerTest {

    private FakeCompileService compiler;
    private VersionedScriptCache cache;
    private ScriptBackupManager backups;

    @BeforeEach
    void setUp() {
        compiler = new FakeCompileService();
        cache = new VersionedScriptCache(compiler);
        backups = new ScriptBackupManager(cache, 8);
    }

    @Test
    @DisplayName("A removed script comes back under its backed up version")
    void restoreAfterRemove() {
        long v = cache.updateVersion("wander", compiler.compile("good", "wander"));
        assertTrue(backups.backupCurrent("wander"));
        cache.remove("wander");

        assertTrue(backups.restore("wander"));
        assertEquals(v, cache.getVersion("wander"));
        assertEquals("wander:good", ((RecordingBehavior) cache.getOrCreateInstance("wander")).label);
    }

    @Test
    @DisplayName("Info, discard and missing backups")
    void bookkeeping() {
        assertFalse(backups.backupCurrent("missing"));
        assertFalse(backups.restore("missing"));
        assertNull(backups.info("missing"));

        cache.updateVersion("wander", compiler.compile("good", "wander"));
        backups.backupCurrent("wander");
        BackupInfo info = backups.info("wander");
        assertEquals("wander", info.scriptId());
        assertEquals(1, info.version());
        assertEquals("wander[good]", info.unitName());
        assertNotNull(info.backedUpAt());
        assertEquals(1, backups.all().size());

        backups.discard("wander");
        assertFalse(backups.hasBackup("wander"));
    }
}
