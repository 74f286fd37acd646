package org.foxesworld.hotscript.script;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.hotscript.core.behavior.ScriptContext;
import org.graalvm.polyglot.HostAccess;
import org.graalvm.polyglot.Value;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The {@code ctx} object scripts receive. Only {@link HostAccess.Export} members are visible.
 *
 * <p>Payloads leaving JS are deep copied into plain Java values (String, Boolean, Integer,
 * Double, List, Map) so nothing bound to one script's context leaks into another.</p>
 */
public final class JsContextBridge {

    private final ScriptContext ctx;
    private final Logger log;

    JsContextBridge(ScriptContext ctx) {
        this.ctx = ctx;
        this.log = LogManager.getLogger(ctx.loggerName());
    }

    @HostAccess.Export
    public int entity() { return ctx.entityId(); }

    @HostAccess.Export
    public String id() { return ctx.scriptId(); }

    @HostAccess.Export
    public long version() { return ctx.scriptVersion(); }

    @HostAccess.Export
    public long tick() { return ctx.tickNumber(); }

    @HostAccess.Export
    public double elapsed() { return ctx.elapsedSeconds(); }

    @HostAccess.Export
    public void info(String message) {
        log.info("[entity {}] {}", ctx.entityId(), message);
    }

    @HostAccess.Export
    public void warn(String message) {
        log.warn("[entity {}] {}", ctx.entityId(), message);
    }

    @HostAccess.Export
    public void emit(String name, Value payload) {
        ctx.emit(name, toHost(payload, 0));
    }

    @HostAccess.Export
    public void emitTo(int entityId, String name, Value payload) {
        ctx.emitTo(entityId, name, toHost(payload, 0));
    }

    private static final int MAX_DEPTH = 16;

    static Object toHost(Value v, int depth) {
        if (v == null || v.isNull()) return null;
        if (v.isString()) return v.asString();
        if (v.isBoolean()) return v.asBoolean();
        if (v.isNumber()) {
            if (v.fitsInInt()) return v.asInt();
            if (v.fitsInLong()) return v.asLong();
            return v.asDouble();
        }
        if (v.isHostObject()) return v.asHostObject();
        if (depth >= MAX_DEPTH) {
            throw new IllegalArgumentException("Event payload nested deeper than " + MAX_DEPTH);
        }
        if (v.hasArrayElements()) {
            long n = v.getArraySize();
            List<Object> out = new ArrayList<>((int) Math.min(n, 1024));
            for (long i = 0; i < n; i++) out.add(toHost(v.getArrayElement(i), depth + 1));
            return out;
        }
        if (v.hasMembers() && !v.canExecute()) {
            Map<String, Object> out = new LinkedHashMap<>();
            for (String key : v.getMemberKeys()) out.put(key, toHost(v.getMember(key), depth + 1));
            return out;
        }
        return v.toString();
    }
}
