package org.foxesworld.hotscript.core;

import java.util.Objects;

/**
 * Script id validation shared by every public boundary.
 */
public final class ScriptIds {

    private ScriptIds() {}

    /** Rejects null and blank ids before anything touches shared state. */
    public static String require(String scriptId) {
        Objects.requireNonNull(scriptId, "scriptId");
        if (scriptId.isBlank()) throw new IllegalArgumentException("scriptId is blank");
        return scriptId;
    }

    public static boolean isValid(String scriptId) {
        return scriptId != null && !scriptId.isBlank();
    }

    /**
     * Script id for a source path: file name without its extension.
     * "Scripts/npc/wander.js" -> "wander"
     */
    public static String fromPath(String path) {
        if (path == null) return "";
        String s = path.trim().replace('\\', '/');
        int slash = s.lastIndexOf('/');
        if (slash >= 0) s = s.substring(slash + 1);
        int dot = s.lastIndexOf('.');
        if (dot > 0) s = s.substring(0, dot);
        return s;
    }

    /**
     * FNV-1a 64-bit hash (stable across runs/JVMs). Used for source change detection,
     * not for anything security related.
     */
    public static long contentHash(String s) {
        if (s == null) return 0L;
        long h = 0xcbf29ce484222325L; // offset basis
        for (int i = 0, n = s.length(); i < n; i++) {
            h ^= s.charAt(i);
            h *= 0x100000001b3L; // prime
        }
        return h;
    }
}
