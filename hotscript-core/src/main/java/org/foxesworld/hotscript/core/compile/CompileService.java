package org.foxesworld.hotscript.core.compile;

import org.foxesworld.hotscript.core.behavior.ScriptBehavior;
import org.foxesworld.hotscript.core.error.CompilationException;
import org.foxesworld.hotscript.core.error.ScriptInstantiationException;

/**
 * Turns script source into executable units and units into behavior instances.
 *
 * <p>Implementations never install anything into a cache: only a caller holding a successfully
 * compiled unit decides whether it becomes the current version of a script.</p>
 *
 * <p>{@link #compile} may be slow. Callers that need cancellation run it on their own worker and
 * simply drop the result; an implementation must not have side effects beyond its own caches.</p>
 */
public interface CompileService {

    /**
     * Compiles source text for the given script id.
     *
     * @throws CompilationException if any diagnostic has error severity
     */
    CompiledUnit compile(String sourceText, String scriptId) throws CompilationException;

    /**
     * Materializes a fresh default behavior instance from a compiled unit.
     *
     * @throws ScriptInstantiationException if the produced value does not satisfy the
     *                                      {@link ScriptBehavior} contract
     */
    ScriptBehavior execute(CompiledUnit unit) throws ScriptInstantiationException;
}
