package org.foxesworld.hotscript.script;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.hotscript.core.ScriptIds;
import org.foxesworld.hotscript.core.behavior.ScriptBehavior;
import org.foxesworld.hotscript.core.compile.CompileService;
import org.foxesworld.hotscript.core.compile.CompiledUnit;
import org.foxesworld.hotscript.core.compile.Diagnostic;
import org.foxesworld.hotscript.core.error.CompilationException;
import org.foxesworld.hotscript.core.error.ScriptInstantiationException;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.Engine;
import org.graalvm.polyglot.HostAccess;
import org.graalvm.polyglot.PolyglotException;
import org.graalvm.polyglot.Source;
import org.graalvm.polyglot.SourceSection;
import org.graalvm.polyglot.Value;

import java.io.Closeable;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * {@link CompileService} for CommonJS style JS modules on GraalJS.
 *
 * <p>{@link #compile} only parses: syntax errors become diagnostics, no script code runs.
 * {@link #execute} evaluates the module in a fresh context on the shared engine and returns a
 * {@link JsScriptBehavior} owning that context.</p>
 *
 * <p>A module exposes its behavior through {@code module.exports}, one of:</p>
 * <pre>
 * exports.create = () => ({ update(ctx, tpf) { ... } });   // factory
 * module.exports = function () { return { init(ctx) { ... } }; };
 * module.exports = { update(ctx, tpf) { ... }, onEvent(ctx, name, payload) { ... } };
 * </pre>
 */
public final class GraalCompileService implements CompileService, Closeable {

    private static final Logger log = LogManager.getLogger(GraalCompileService.class);

    static final String LANG = "js";

    /** Kept on the first line so reported line numbers match the author's file. */
    static final String WRAPPER_PREFIX = "(function(module, exports, __scriptId) { 'use strict'; ";
    static final String WRAPPER_SUFFIX = "\n})";

    private static final HostAccess HOST_ACCESS = HostAccess.newBuilder(HostAccess.NONE)
            .allowAccessAnnotatedBy(HostAccess.Export.class)
            .allowMapAccess(true)
            .allowListAccess(true)
            .build();

    private final Engine engine;
    private final JsBehaviorValidator validator = new JsBehaviorValidator();

    /** Parsed units by (script id, content hash): re-saving identical text does not re-parse. */
    private final Cache<UnitKey, JsCompiledUnit> units;

    public GraalCompileService() {
        this(256);
    }

    public GraalCompileService(int maxCachedUnits) {
        this.engine = Engine.newBuilder()
                .option("engine.WarnInterpreterOnly", "false")
                .build();
        this.units = Caffeine.newBuilder()
                .maximumSize(Math.max(1, maxCachedUnits))
                .expireAfterAccess(Duration.ofMinutes(10))
                .build();
        log.info("GraalCompileService ready (engine {} {})", engine.getImplementationName(), engine.getVersion());
    }

    private Context newContext() {
        return Context.newBuilder(LANG)
                .engine(engine)
                .allowHostAccess(HOST_ACCESS)
                .allowHostClassLookup(className -> false)
                .allowAllAccess(false)
                .build();
    }

    // ---------------------------------------------------------------------
    // Compile
    // ---------------------------------------------------------------------

    @Override
    public CompiledUnit compile(String sourceText, String scriptId) throws CompilationException {
        ScriptIds.require(scriptId);
        Objects.requireNonNull(sourceText, "sourceText");

        long hash = ScriptIds.contentHash(sourceText);
        UnitKey key = new UnitKey(scriptId, hash);
        JsCompiledUnit cached = units.getIfPresent(key);
        if (cached != null) {
            log.debug("Parsed unit cache hit: {}", scriptId);
            return cached;
        }

        Source src = Source.newBuilder(LANG, WRAPPER_PREFIX + sourceText + WRAPPER_SUFFIX, scriptId + ".js")
                .buildLiteral();

        try (Context ctx = newContext()) {
            ctx.parse(src);
        } catch (PolyglotException pe) {
            if (pe.isSyntaxError()) {
                throw new CompilationException(scriptId, List.of(toDiagnostic(pe)), pe);
            }
            throw new CompilationException(scriptId,
                    List.of(Diagnostic.error("Parse failed: " + pe.getMessage(), 0, 0)), pe);
        }

        JsCompiledUnit unit = new JsCompiledUnit(scriptId, src, hash);
        units.put(key, unit);
        log.debug("Compiled {} ({} chars)", scriptId, sourceText.length());
        return unit;
    }

    static Diagnostic toDiagnostic(PolyglotException pe) {
        SourceSection loc = pe.getSourceLocation();
        if (loc == null || !loc.isAvailable()) {
            return new Diagnostic(Diagnostic.Severity.ERROR, pe.getMessage(), 0, 0, "JS_SYNTAX");
        }
        int line = loc.getStartLine();
        int column = loc.getStartColumn();
        if (line == 1) column = Math.max(1, column - WRAPPER_PREFIX.length());
        return new Diagnostic(Diagnostic.Severity.ERROR, pe.getMessage(), line, column, "JS_SYNTAX");
    }

    // ---------------------------------------------------------------------
    // Execute
    // ---------------------------------------------------------------------

    @Override
    public ScriptBehavior execute(CompiledUnit unit) throws ScriptInstantiationException {
        Objects.requireNonNull(unit, "unit");
        if (!(unit instanceof JsCompiledUnit js)) {
            throw new ScriptInstantiationException(unit.scriptId(),
                    "Unsupported unit type: " + unit.getClass().getName());
        }

        String scriptId = js.scriptId();
        Context ctx = newContext();
        try {
            Value fn = ctx.eval(js.source());
            Value module = ctx.eval(LANG, "({ exports: {} })");
            fn.execute(module, module.getMember("exports"), scriptId);

            Value behavior = pickBehavior(scriptId, module.getMember("exports"));
            validator.validate(scriptId, behavior);
            return new JsScriptBehavior(scriptId, ctx, behavior);
        } catch (PolyglotException e) {
            closeQuietly(scriptId, ctx);
            throw new ScriptInstantiationException(scriptId, "Module evaluation failed: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            closeQuietly(scriptId, ctx);
            throw e;
        }
    }

    private static Value pickBehavior(String scriptId, Value exports) {
        if (exports == null || exports.isNull()) return exports;

        Value create = JsBehaviorValidator.member(exports, "create");
        if (create != null && create.canExecute()) {
            log.debug("Script {} uses exports.create() factory", scriptId);
            return create.execute();
        }
        if (exports.canExecute()) {
            log.debug("Script {} exports a factory function", scriptId);
            return exports.execute();
        }
        return exports;
    }

    private static void closeQuietly(String scriptId, Context ctx) {
        try {
            ctx.close(true);
        } catch (Exception e) {
            log.warn("Error closing Graal context of script {}", scriptId, e);
        }
    }

    /** Drops parsed units of one script. */
    public void invalidate(String scriptId) {
        if (scriptId == null) return;
        units.asMap().keySet().removeIf(k -> k.scriptId().equals(scriptId));
    }

    @Override
    public void close() {
        units.invalidateAll();
        try {
            engine.close(true);
        } catch (Exception e) {
            log.warn("Error closing Graal engine", e);
        }
        log.info("GraalCompileService closed");
    }

    private record UnitKey(String scriptId, long contentHash) {}
}
