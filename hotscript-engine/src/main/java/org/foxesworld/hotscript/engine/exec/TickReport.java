package org.foxesworld.hotscript.engine.exec;

/**
 * What one scheduler tick did.
 *
 * @param executed    attachments whose tick hook completed
 * @param initialized initialize hooks that completed (first bind or rebind after reload)
 * @param errors      isolated failures of any phase
 * @param inactive    attachments skipped because their active flag is off
 * @param suspended   attachments skipped by the crash breaker
 * @param events      events drained from the bus for this tick
 */
public record TickReport(long tickNumber, int entities, int executed, int initialized, int errors,
                         int inactive, int suspended, int events) {

    public boolean hasErrors() {
        return errors > 0;
    }
}
