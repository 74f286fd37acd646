package org.foxesworld.hotscript.engine.events;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.hotscript.core.behavior.ScriptEvent;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Event queue between scripts and the host.
 *
 * <p>{@link #emit} is safe from any thread (scripts on parallel workers emit too). Events are
 * delivered once per tick by {@link #pump}: host subscribers are called right away and the
 * drained batch is returned so the scheduler can hand it to script {@code handleEvent} hooks.</p>
 */
public final class ScriptEventBus {

    private static final Logger log = LogManager.getLogger(ScriptEventBus.class);

    public static final int DEFAULT_MAX_EVENTS_PER_TICK = 4096;
    public static final long DEFAULT_TIME_BUDGET_NANOS = 2_000_000L; // 2ms

    private static final class Sub {
        final int id;
        final Consumer<ScriptEvent> fn;
        final boolean once;

        Sub(int id, Consumer<ScriptEvent> fn, boolean once) {
            this.id = id;
            this.fn = fn;
            this.once = once;
        }
    }

    /**
     * Small, allocation-light subscription list. Guarded by its own monitor.
     */
    private static final class SubList {

        private Sub[] arr = new Sub[8];
        private int size = 0;

        synchronized void add(Sub s) {
            if (size >= arr.length) {
                arr = Arrays.copyOf(arr, arr.length << 1);
            }
            arr[size++] = s;
        }

        synchronized boolean isEmpty() {
            return size == 0;
        }

        synchronized Sub[] snapshot() {
            return Arrays.copyOf(arr, size);
        }

        /** @return true if removed */
        synchronized boolean removeById(int id) {
            for (int i = 0; i < size; i++) {
                Sub s = arr[i];
                if (s != null && s.id == id) {
                    int last = size - 1;
                    arr[i] = arr[last];
                    arr[last] = null;
                    size = last;
                    return true;
                }
            }
            return false;
        }
    }

    private final AtomicInteger nextSubId = new AtomicInteger(1);
    private final Map<String, SubList> handlers = new ConcurrentHashMap<>();
    private final Queue<ScriptEvent> queue = new ConcurrentLinkedQueue<>();

    public void emit(ScriptEvent event) {
        if (event == null) return;
        queue.add(event);
    }

    public void emit(String name, Object payload) {
        if (name == null || name.isBlank()) return;
        emit(ScriptEvent.broadcast(name.trim(), payload));
    }

    public void emitTo(int entityId, String name, Object payload) {
        if (name == null || name.isBlank() || entityId <= 0) return;
        emit(ScriptEvent.to(entityId, name.trim(), payload));
    }

    /** @return subscription id, 0 if rejected */
    public int on(String name, Consumer<ScriptEvent> fn) { return subscribe(name, fn, false); }

    public int once(String name, Consumer<ScriptEvent> fn) { return subscribe(name, fn, true); }

    private int subscribe(String name, Consumer<ScriptEvent> fn, boolean once) {
        if (name == null || fn == null) return 0;
        String key = name.trim();
        if (key.isEmpty()) return 0;

        int id = nextSubId.getAndIncrement();
        handlers.computeIfAbsent(key, k -> new SubList()).add(new Sub(id, fn, once));
        return id;
    }

    public boolean off(String name, int subId) {
        if (subId <= 0 || name == null) return false;
        String key = name.trim();
        SubList list = handlers.get(key);
        if (list == null) return false;

        boolean removed = list.removeById(subId);
        if (removed && list.isEmpty()) {
            handlers.remove(key, list); // remove only if same instance still mapped
        }
        return removed;
    }

    public List<ScriptEvent> pump() {
        return pump(DEFAULT_MAX_EVENTS_PER_TICK, DEFAULT_TIME_BUDGET_NANOS);
    }

    /**
     * Drains up to {@code maxEvents} queued events (stopping early once the time budget is spent),
     * notifies host subscribers and returns the drained events in emission order.
     * Events left over stay queued for the next tick.
     */
    public List<ScriptEvent> pump(int maxEvents, long timeBudgetNanos) {
        int limit = Math.max(0, maxEvents);

        // guard against deadline overflow for huge budgets
        long now = System.nanoTime();
        long deadline;
        if (timeBudgetNanos <= 0L) {
            deadline = Long.MAX_VALUE;
        } else {
            long sum = now + timeBudgetNanos;
            deadline = (sum < now) ? Long.MAX_VALUE : sum;
        }

        List<ScriptEvent> drained = new ArrayList<>();
        int checkMask = 0x3F; // check the clock every 64 events

        while (drained.size() < limit) {
            ScriptEvent e = queue.poll();
            if (e == null) break;

            drained.add(e);
            dispatch(e);

            if ((drained.size() & checkMask) == 0 && System.nanoTime() >= deadline) break;
        }
        return drained;
    }

    private void dispatch(ScriptEvent e) {
        SubList list = handlers.get(e.name());
        if (list == null) return;

        for (Sub s : list.snapshot()) {
            if (s == null) continue;
            if (s.once && !list.removeById(s.id)) continue; // already consumed

            try {
                s.fn.accept(e);
            } catch (Throwable t) {
                log.error("Event handler failed: {} (subId={})", e.name(), s.id, t);
            }
        }

        if (list.isEmpty()) handlers.remove(e.name(), list);
    }

    public int queuedEventsApprox() {
        return queue.size();
    }

    public void clearAll() {
        handlers.clear();
        queue.clear();
    }
}
