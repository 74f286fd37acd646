package org.foxesworld.hotscript.script;

import org.foxesworld.hotscript.core.compile.CompiledUnit;
import org.graalvm.polyglot.Source;

import java.util.Objects;

/**
 * Parsed, not yet evaluated JS module. The source is the CommonJS wrapped text, so evaluating it
 * yields the module function.
 */
public final class JsCompiledUnit implements CompiledUnit {

    private final String scriptId;
    private final Source source;
    private final long sourceHash;

    JsCompiledUnit(String scriptId, Source source, long sourceHash) {
        this.scriptId = Objects.requireNonNull(scriptId, "scriptId");
        this.source = Objects.requireNonNull(source, "source");
        this.sourceHash = sourceHash;
    }

    @Override
    public String scriptId() { return scriptId; }

    @Override
    public String name() { return source.getName(); }

    @Override
    public long sourceHash() { return sourceHash; }

    Source source() { return source; }

    @Override
    public String toString() {
        return "JsCompiledUnit{" + scriptId + ", hash=" + Long.toHexString(sourceHash) + '}';
    }
}
