package org.foxesworld.hotscript.engine.cache;

import org.foxesworld.hotscript.core.behavior.ScriptBehavior;

/**
 * Result of a peek: version -1 and no instance when the id is unknown.
 */
public record VersionedInstance(long version, ScriptBehavior instance) {

    static final VersionedInstance ABSENT = new VersionedInstance(-1L, null);

    public boolean found() {
        return version >= 0;
    }

    public boolean instantiated() {
        return instance != null;
    }
}
