package org.foxesworld.hotscript.engine.exec;

import org.foxesworld.hotscript.core.behavior.ScriptContext;
import org.foxesworld.hotscript.engine.events.ScriptEventBus;

/**
 * Per call context: which entity, which script version, which tick.
 */
final class EntityScriptContext implements ScriptContext {

    private final int entityId;
    private final String scriptId;
    private final long scriptVersion;
    private final long tickNumber;
    private final double elapsedSeconds;
    private final ScriptEventBus events;

    EntityScriptContext(int entityId, String scriptId, long scriptVersion,
                        long tickNumber, double elapsedSeconds, ScriptEventBus events) {
        this.entityId = entityId;
        this.scriptId = scriptId;
        this.scriptVersion = scriptVersion;
        this.tickNumber = tickNumber;
        this.elapsedSeconds = elapsedSeconds;
        this.events = events;
    }

    @Override public int entityId() { return entityId; }
    @Override public String scriptId() { return scriptId; }
    @Override public long scriptVersion() { return scriptVersion; }
    @Override public long tickNumber() { return tickNumber; }
    @Override public double elapsedSeconds() { return elapsedSeconds; }

    @Override
    public void emit(String name, Object payload) {
        events.emit(name, payload);
    }

    @Override
    public void emitTo(int entityId, String name, Object payload) {
        events.emitTo(entityId, name, payload);
    }

    @Override
    public String toString() {
        return "ScriptContext{entity=" + entityId + ", script=" + scriptId + " v" + scriptVersion
                + ", tick=" + tickNumber + '}';
    }
}
