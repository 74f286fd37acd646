package org.foxesworld.hotscript.core.behavior;

import java.util.Objects;

/**
 * Event delivered to {@link ScriptBehavior#handleEvent}.
 *
 * @param targetEntity entity id, or {@link #BROADCAST} for every entity
 */
public record ScriptEvent(String name, Object payload, int targetEntity) {

    public static final int BROADCAST = 0;

    public ScriptEvent {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) throw new IllegalArgumentException("event name is blank");
        if (targetEntity < 0) throw new IllegalArgumentException("targetEntity must be >= 0");
    }

    public static ScriptEvent broadcast(String name, Object payload) {
        return new ScriptEvent(name, payload, BROADCAST);
    }

    public static ScriptEvent to(int entityId, String name, Object payload) {
        if (entityId <= 0) throw new IllegalArgumentException("entity must be > 0");
        return new ScriptEvent(name, payload, entityId);
    }

    public boolean isBroadcast() {
        return targetEntity == BROADCAST;
    }

    public boolean appliesTo(int entityId) {
        return targetEntity == BROADCAST || targetEntity == entityId;
    }
}
