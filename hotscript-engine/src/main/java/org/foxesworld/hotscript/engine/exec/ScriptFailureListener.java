package org.foxesworld.hotscript.engine.exec;

/**
 * Notified for every isolated attachment failure. Called on the thread that ran the
 * attachment, which is a worker thread in {@link ExecutionMode#PARALLEL}.
 */
@FunctionalInterface
public interface ScriptFailureListener {
    void onFailure(ScriptFailure failure);
}
