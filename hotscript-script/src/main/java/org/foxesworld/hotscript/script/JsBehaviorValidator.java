package org.foxesworld.hotscript.script;

import org.foxesworld.hotscript.core.error.ScriptInstantiationException;
import org.graalvm.polyglot.Value;

/**
 * Checks that a JS value can act as a script behavior.
 *
 * <p>Contract: an object with at least one of {@code init(ctx)}, {@code update(ctx, tpf)} or
 * {@code onEvent(ctx, name, payload)}; {@code destroy()} is optional. Every member that is
 * present must be a function.</p>
 */
public final class JsBehaviorValidator {

    static final String INIT = "init";
    static final String UPDATE = "update";
    static final String ON_EVENT = "onEvent";
    static final String DESTROY = "destroy";

    public void validate(String scriptId, Value behavior) {
        if (behavior == null || behavior.isNull()) {
            throw fail(scriptId, "module produced no behavior (exports is null)");
        }
        if (!behavior.hasMembers()) {
            throw fail(scriptId, "behavior must be an object, got " + behavior);
        }

        boolean any = false;
        for (String hook : new String[]{INIT, UPDATE, ON_EVENT}) {
            any |= checkOptionalFunction(scriptId, behavior, hook);
        }
        checkOptionalFunction(scriptId, behavior, DESTROY);

        if (!any) {
            throw fail(scriptId, "no valid behavior: expected init, update or onEvent");
        }
    }

    /** @return true if the member is present */
    private static boolean checkOptionalFunction(String scriptId, Value obj, String name) {
        Value v = member(obj, name);
        if (v == null) return false;
        if (!v.canExecute()) throw fail(scriptId, name + " must be a function if present");
        return true;
    }

    static Value member(Value obj, String name) {
        if (obj == null || obj.isNull() || !obj.hasMember(name)) return null;
        Value v = obj.getMember(name);
        return (v == null || v.isNull()) ? null : v;
    }

    private static ScriptInstantiationException fail(String scriptId, String msg) {
        return new ScriptInstantiationException(scriptId, "Behavior contract violation: " + scriptId + " :: " + msg);
    }
}
