package org.foxesworld.hotscript.engine.hotreload;

import org.foxesworld.hotscript.core.compile.Diagnostic;

import java.util.List;

/**
 * Reload outcome callbacks. Called on whichever thread performed the reload.
 */
public interface HotReloadListener {

    default void reloadSucceeded(String scriptId, long version, long compileMillis) {}

    default void reloadFailed(String scriptId, List<Diagnostic> diagnostics, Throwable error) {}

    default void rolledBack(String scriptId, long restoredVersion) {}
}
