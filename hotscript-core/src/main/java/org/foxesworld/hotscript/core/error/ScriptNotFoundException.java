package org.foxesworld.hotscript.core.error;

public class ScriptNotFoundException extends ScriptException {

    public ScriptNotFoundException(String scriptId) {
        super(scriptId, "Script type '" + scriptId + "' not found in cache");
    }
}
