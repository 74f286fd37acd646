package org.foxesworld.hotscript.engine.exec;

/**
 * One isolated failure of one attachment during a tick.
 *
 * @param version cache version involved, -1 when the script could not be resolved at all
 */
public record ScriptFailure(long tickNumber, int entityId, String scriptId, long version,
                            Phase phase, Throwable error) {

    public enum Phase {
        /** Looking up or instantiating the current version. */
        RESOLVE,
        INIT,
        EVENT,
        TICK
    }
}
