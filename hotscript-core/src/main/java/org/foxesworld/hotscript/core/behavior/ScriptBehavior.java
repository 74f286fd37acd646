package org.foxesworld.hotscript.core.behavior;

/**
 * Minimal capability set every attached script provides.
 *
 * <p>One instance serves every entity the script is attached to; per-entity state belongs in the
 * {@link ScriptContext} or in the entity's components, not in fields keyed by nothing.</p>
 */
public interface ScriptBehavior {

    /** Called once per entity before the first tick that sees this instance. */
    void initialize(ScriptContext ctx);

    void tick(ScriptContext ctx, float tpf);

    void handleEvent(ScriptContext ctx, ScriptEvent event);

    /** Called when the owning cache drops this instance. */
    default void unload() {}
}
