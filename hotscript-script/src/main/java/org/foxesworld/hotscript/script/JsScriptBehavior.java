package org.foxesworld.hotscript.script;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.hotscript.core.behavior.ScriptBehavior;
import org.foxesworld.hotscript.core.behavior.ScriptContext;
import org.foxesworld.hotscript.core.behavior.ScriptEvent;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.PolyglotException;
import org.graalvm.polyglot.Value;

import static org.foxesworld.hotscript.script.JsBehaviorValidator.*;

/**
 * Behavior backed by a JS object living in its own polyglot {@link Context}.
 *
 * <p>A context must not be entered by two threads at once, so every call takes the instance
 * lock. {@link #unload()} takes it too: an in-flight hook finishes before the context closes.</p>
 */
public final class JsScriptBehavior implements ScriptBehavior {

    private static final Logger log = LogManager.getLogger(JsScriptBehavior.class);

    private final String scriptId;
    private final Context context;

    private final Value init;
    private final Value update;
    private final Value onEvent;
    private final Value destroy;

    private final Object lock = new Object();
    private boolean closed;

    JsScriptBehavior(String scriptId, Context context, Value behavior) {
        this.scriptId = scriptId;
        this.context = context;
        this.init = member(behavior, INIT);
        this.update = member(behavior, UPDATE);
        this.onEvent = member(behavior, ON_EVENT);
        this.destroy = member(behavior, DESTROY);
    }

    public String scriptId() {
        return scriptId;
    }

    @Override
    public void initialize(ScriptContext ctx) {
        if (init == null) return;
        synchronized (lock) {
            ensureOpen();
            init.executeVoid(new JsContextBridge(ctx));
        }
    }

    @Override
    public void tick(ScriptContext ctx, float tpf) {
        if (update == null) return;
        synchronized (lock) {
            ensureOpen();
            update.executeVoid(new JsContextBridge(ctx), (double) tpf);
        }
    }

    @Override
    public void handleEvent(ScriptContext ctx, ScriptEvent event) {
        if (onEvent == null) return;
        synchronized (lock) {
            ensureOpen();
            onEvent.executeVoid(new JsContextBridge(ctx), event.name(), event.payload());
        }
    }

    @Override
    public void unload() {
        synchronized (lock) {
            if (closed) return;
            closed = true;
            try {
                if (destroy != null) destroy.executeVoid();
            } catch (PolyglotException e) {
                log.warn("destroy() failed for script {}", scriptId, e);
            } finally {
                try {
                    context.close(true);
                } catch (Exception e) {
                    log.warn("Error closing Graal context of script {}", scriptId, e);
                }
            }
        }
    }

    public boolean isClosed() {
        synchronized (lock) {
            return closed;
        }
    }

    private void ensureOpen() {
        if (closed) throw new IllegalStateException("Script instance unloaded: " + scriptId);
    }
}
