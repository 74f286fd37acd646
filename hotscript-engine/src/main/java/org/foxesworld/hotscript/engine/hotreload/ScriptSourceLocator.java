package org.foxesworld.hotscript.engine.hotreload;

import org.foxesworld.hotscript.core.ScriptIds;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Maps source files to script ids and reads their text.
 */
public class ScriptSourceLocator {

    /** "scripts/npc/wander.js" -> "wander" */
    public String scriptIdOf(Path file) {
        Path name = file.getFileName();
        return name == null ? "" : ScriptIds.fromPath(name.toString());
    }

    public String read(Path file) throws IOException {
        return Files.readString(file, StandardCharsets.UTF_8);
    }

    public boolean exists(Path file) {
        return Files.isRegularFile(file);
    }
}
