package org.foxesworld.hotscript.core.error;

/**
 * Root of every failure raised by the scripting core.
 */
public class ScriptException extends RuntimeException {

    private final String scriptId;

    public ScriptException(String scriptId, String message) {
        super(message);
        this.scriptId = scriptId;
    }

    public ScriptException(String scriptId, String message, Throwable cause) {
        super(message, cause);
        this.scriptId = scriptId;
    }

    /** Script the failure belongs to, may be null. */
    public String scriptId() {
        return scriptId;
    }
}
