package org.foxesworld.hotscript.engine.cache;

import org.foxesworld.hotscript.core.behavior.ScriptBehavior;

/**
 * Version, instance serial and instance taken from the same cache entry.
 * The serial changes whenever a different instance is handed out for the id.
 */
public record ResolvedScript(String scriptId, long version, long instanceSerial, ScriptBehavior behavior) {}
