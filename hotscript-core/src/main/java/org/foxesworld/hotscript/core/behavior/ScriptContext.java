package org.foxesworld.hotscript.core.behavior;

/**
 * Entity-scoped view handed to a {@link ScriptBehavior} on every call.
 */
public interface ScriptContext {

    int entityId();

    String scriptId();

    /** Cache version of the instance currently executing. */
    long scriptVersion();

    /** Number of the simulation tick in progress (starts at 1). */
    long tickNumber();

    /** Seconds of simulation time accumulated before this tick. */
    double elapsedSeconds();

    /** Queue an event for every entity. Delivered at the start of the next tick. */
    void emit(String name, Object payload);

    /** Queue an event for a single entity. Delivered at the start of the next tick. */
    void emitTo(int entityId, String name, Object payload);

    /** Logger name scripts should log under. */
    default String loggerName() {
        return "hotscript.script." + scriptId();
    }
}
