package org.foxesworld.hotscript.engine.hotreload;

import org.foxesworld.hotscript.core.compile.Diagnostic;

import java.util.List;

/**
 * Outcome of one reload attempt.
 *
 * @param version installed version, or the still current one when skipped, -1 on failure
 */
public record ReloadResult(String scriptId, Status status, long version, List<Diagnostic> diagnostics) {

    public enum Status { INSTALLED, UNCHANGED, FAILED }

    public ReloadResult {
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    public boolean installed() {
        return status == Status.INSTALLED;
    }
}
