package org.foxesworld.hotscript.engine.hotreload;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class ScriptSourceLocatorTest {

    @TempDir
    Path dir;

    @Test
    void scriptIdIsFileNameWithoutExtension() throws Exception {
        ScriptSourceLocator locator = new ScriptSourceLocator();
        Path file = dir.resolve("npc").resolve("wander.js");
        Files.createDirectories(file.getParent());
        Files.writeString(file, "module.exports = {};");

        assertEquals("wander", locator.scriptIdOf(file));
        assertEquals("module.exports = {};", locator.read(file));
        assertTrue(locator.exists(file));
        assertFalse(locator.exists(dir.resolve("missing.js")));
    }
}
