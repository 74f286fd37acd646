package org.foxesworld.hotscript.engine.attach;

import java.util.Comparator;

/**
 * Binds one script id to an entity with a priority and an active flag.
 *
 * <p>{@code scriptId}, {@code priority} and {@code sequence} never change after creation; the
 * active flag is flipped in place so toggling a script never restructures the entity's storage.
 * The transient fields are runtime state owned by the scheduler and are not part of the record's
 * identity.</p>
 */
public final class ScriptAttachment {

    /** Higher priority first, then earlier insertion first. */
    public static final Comparator<ScriptAttachment> EXECUTION_ORDER =
            Comparator.comparingInt(ScriptAttachment::priority).reversed()
                    .thenComparingLong(ScriptAttachment::sequence);

    private final String scriptId;
    private final int priority;
    private final long sequence;
    private volatile boolean active = true;

    // runtime state (scheduler only, not serialized)
    /** Serial of the instance {@code initialize} last ran for on this entity, 0 if none. */
    public transient long boundSerial;
    /** Version that instance belongs to. */
    public transient long boundVersion;
    public transient int crashStreak;
    public transient long suspendedUntilTick;
    /** Version that tripped the crash breaker; installing another one lifts the suspension. */
    public transient long suspendedVersion;
    public transient long lastFailureLogNanos;

    ScriptAttachment(String scriptId, int priority, long sequence) {
        this.scriptId = scriptId;
        this.priority = priority;
        this.sequence = sequence;
    }

    public String scriptId() { return scriptId; }
    public int priority() { return priority; }

    /** Registry-wide insertion counter, breaks priority ties. */
    public long sequence() { return sequence; }

    public boolean isActive() { return active; }

    void setActive(boolean active) { this.active = active; }

    @Override
    public String toString() {
        return "ScriptAttachment{" + scriptId + ", priority=" + priority + ", seq=" + sequence
                + ", active=" + active + '}';
    }
}
