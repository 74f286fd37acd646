package org.foxesworld.hotscript.core.compile;

/**
 * Opaque result of a successful compilation. Not yet instantiated.
 */
public interface CompiledUnit {

    /** Script id the unit was compiled for. */
    String scriptId();

    /** Human readable name for logs and diagnostics. */
    String name();

    /**
     * Stable hash of the source the unit was compiled from.
     * 0 when the backend does not track it.
     */
    default long sourceHash() {
        return 0L;
    }
}
