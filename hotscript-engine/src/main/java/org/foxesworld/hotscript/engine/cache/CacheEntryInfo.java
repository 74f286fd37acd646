package org.foxesworld.hotscript.engine.cache;

import java.time.Instant;

/**
 * Diagnostic snapshot of one cached script.
 *
 * @param previousVersionNumber version of the direct predecessor, null when there is none
 */
public record CacheEntryInfo(
        String typeId,
        long version,
        String typeName,
        boolean instantiated,
        Instant lastUpdated,
        boolean hasPreviousVersion,
        Long previousVersionNumber,
        int historyDepth
) {}
