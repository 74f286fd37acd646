package org.foxesworld.hotscript.engine.exec;

/**
 * How the scheduler walks entities during a tick.
 */
public enum ExecutionMode {
    /** One thread, entities in ascending id order. */
    SEQUENTIAL,

    /**
     * Entities split across worker threads. Each entity is still processed by exactly one worker
     * and its attachments keep their priority order; only the order between entities is lost.
     * Behaviors shared by several entities must tolerate concurrent calls.
     */
    PARALLEL
}
