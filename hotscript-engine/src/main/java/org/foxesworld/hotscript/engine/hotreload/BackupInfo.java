package org.foxesworld.hotscript.engine.hotreload;

import java.time.Instant;

/** Last-known-good snapshot description. */
public record BackupInfo(String scriptId, long version, String unitName, Instant backedUpAt) {}
