package org.foxesworld.hotscript.core.compile;

import java.util.Objects;

/**
 * One compiler message. Line and column are 1-based, 0 when unknown.
 */
public record Diagnostic(Severity severity, String message, int line, int column, String code) {

    public enum Severity { INFO, WARNING, ERROR }

    public Diagnostic {
        Objects.requireNonNull(severity, "severity");
        message = message == null ? "" : message;
        line = Math.max(0, line);
        column = Math.max(0, column);
    }

    public static Diagnostic error(String message, int line, int column) {
        return new Diagnostic(Severity.ERROR, message, line, column, null);
    }

    public static Diagnostic warning(String message, int line, int column) {
        return new Diagnostic(Severity.WARNING, message, line, column, null);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    /** "Line 3, Col 7: message [code]" */
    public String format() {
        StringBuilder sb = new StringBuilder(message.length() + 32);
        if (line > 0) {
            sb.append("Line ").append(line);
            if (column > 0) sb.append(", Col ").append(column);
            sb.append(": ");
        }
        sb.append(message);
        if (code != null && !code.isBlank()) sb.append(" [").append(code).append(']');
        return sb.toString();
    }
}
