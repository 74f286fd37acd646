package org.foxesworld.hotscript.engine.profiler;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ScriptProfilerTest {

    @Test
    void recordsCallsAndErrorsPerScript() {
        ScriptProfiler profiler = new ScriptProfiler().setReportEveryNanos(0);

        long t0 = profiler.begin();
        profiler.end("wander", ScriptProfiler.Phase.INIT, t0, true);
        profiler.end("wander", ScriptProfiler.Phase.TICK, profiler.begin(), true);
        profiler.end("wander", ScriptProfiler.Phase.TICK, profiler.begin(), false);
        profiler.recordError("wander");

        ScriptProfiler.ScriptStats s = profiler.stats("wander");
        assertEquals(1, s.initCalls.get());
        assertEquals(2, s.tickCalls.get());
        assertEquals(2, s.errors.get());
        assertDoesNotThrow(profiler::tick);

        profiler.reset();
        assertNull(profiler.stats("wander"));
    }

    @Test
    void disabledRecordsNothing() {
        ScriptProfiler profiler = new ScriptProfiler().setEnabled(false);
        profiler.end("wander", ScriptProfiler.Phase.TICK, profiler.begin(), true);
        profiler.recordError("wander");
        assertNull(profiler.stats("wander"));
    }
}
