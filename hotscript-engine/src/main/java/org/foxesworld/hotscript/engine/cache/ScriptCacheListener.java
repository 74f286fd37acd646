package org.foxesworld.hotscript.engine.cache;

/**
 * Cache change notifications. Called on the thread that made the change, after it is visible.
 */
public interface ScriptCacheListener {

    /** @param previousVersion replaced version, -1 for a first install */
    default void installed(String scriptId, long version, long previousVersion) {}

    default void rolledBack(String scriptId, long fromVersion, long toVersion) {}

    default void removed(String scriptId, long lastVersion) {}

    default void cleared(int removedScripts) {}
}
