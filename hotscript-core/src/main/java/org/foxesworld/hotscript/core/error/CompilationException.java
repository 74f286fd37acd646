package org.foxesworld.hotscript.core.error;

import org.foxesworld.hotscript.core.compile.Diagnostic;

import java.util.List;

/**
 * Compilation produced at least one error-severity diagnostic.
 */
public class CompilationException extends ScriptException {

    private final List<Diagnostic> diagnostics;

    public CompilationException(String scriptId, List<Diagnostic> diagnostics) {
        this(scriptId, diagnostics, null);
    }

    public CompilationException(String scriptId, List<Diagnostic> diagnostics, Throwable cause) {
        super(scriptId, buildMessage(scriptId, diagnostics), cause);
        this.diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    public List<Diagnostic> diagnostics() {
        return diagnostics;
    }

    public List<Diagnostic> errors() {
        return diagnostics.stream().filter(Diagnostic::isError).toList();
    }

    /** One formatted error per line. */
    public String errorSummary() {
        StringBuilder sb = new StringBuilder();
        for (Diagnostic d : diagnostics) {
            if (!d.isError()) continue;
            if (sb.length() > 0) sb.append('\n');
            sb.append(d.format());
        }
        return sb.toString();
    }

    private static String buildMessage(String scriptId, List<Diagnostic> diagnostics) {
        long errors = diagnostics == null ? 0 : diagnostics.stream().filter(Diagnostic::isError).count();
        String first = diagnostics == null ? null : diagnostics.stream()
                .filter(Diagnostic::isError)
                .findFirst()
                .map(Diagnostic::format)
                .orElse(null);
        return "Compilation failed for '" + scriptId + "' (" + errors + " error(s))"
                + (first != null ? ": " + first : "");
    }
}
