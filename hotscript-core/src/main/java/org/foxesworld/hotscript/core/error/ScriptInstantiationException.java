package org.foxesworld.hotscript.core.error;

/**
 * A compiled unit could not produce a valid behavior instance.
 *
 * <p>Retryable: the cache entry stays uninstantiated and the next lookup tries again.</p>
 */
public class ScriptInstantiationException extends ScriptException {

    private final long version;

    public ScriptInstantiationException(String scriptId, String message) {
        this(scriptId, -1L, message, null);
    }

    public ScriptInstantiationException(String scriptId, String message, Throwable cause) {
        this(scriptId, -1L, message, cause);
    }

    public ScriptInstantiationException(String scriptId, long version, String message, Throwable cause) {
        super(scriptId, message, cause);
        this.version = version;
    }

    /** Cache version that failed, -1 when raised outside the cache. */
    public long version() {
        return version;
    }
}
