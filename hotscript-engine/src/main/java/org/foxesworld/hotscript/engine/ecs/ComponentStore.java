package org.foxesworld.hotscript.engine.ecs;

import java.util.Arrays;
import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Typed component storage: Class -> Object[] indexed by entity id.
 *
 * <p>Mutations belong to the simulation thread between ticks. Concurrent reads during a
 * parallel tick are fine as long as nobody writes.</p>
 */
public final class ComponentStore {

    private final Map<Class<?>, Object[]> typed = new IdentityHashMap<>();
    private int capacity = 0;

    @SuppressWarnings("unchecked")
    public <T> T get(int entity, Class<T> type) {
        Object[] arr = typed.get(type);
        if (arr == null || entity <= 0 || entity >= arr.length) return null;
        return (T) arr[entity];
    }

    public <T> void put(int entity, Class<T> type, T value) {
        if (entity <= 0) throw new IllegalArgumentException("entity must be > 0");
        ensureCapacity(entity);
        Object[] arr = typed.computeIfAbsent(type, k -> new Object[capacity]);
        arr[entity] = value;
    }

    public <T> boolean has(int entity, Class<T> type) {
        return get(entity, type) != null;
    }

    public <T> void remove(int entity, Class<T> type) {
        Object[] arr = typed.get(type);
        if (arr == null || entity <= 0 || entity >= arr.length) return;
        arr[entity] = null;
    }

    /** Entity ids holding a component of {@code type}, ascending. */
    public int[] entitiesWith(Class<?> type) {
        Object[] arr = typed.get(type);
        if (arr == null) return new int[0];
        int[] out = new int[8];
        int n = 0;
        for (int e = 1; e < arr.length; e++) {
            if (arr[e] == null) continue;
            if (n == out.length) out = Arrays.copyOf(out, n << 1);
            out[n++] = e;
        }
        return Arrays.copyOf(out, n);
    }

    /** Remove ALL components for an entity (critical for destroyEntity). */
    public void removeAll(int entity) {
        if (entity <= 0) return;
        for (Object[] arr : typed.values()) {
            if (entity < arr.length) arr[entity] = null;
        }
    }

    public void reset() {
        typed.clear();
        capacity = 0;
    }

    private void ensureCapacity(int entityId) {
        if (entityId < capacity) return;

        int newCap = nextPow2(entityId + 1);
        if (newCap <= capacity) newCap = entityId + 1;

        for (Map.Entry<Class<?>, Object[]> e : typed.entrySet()) {
            e.setValue(Arrays.copyOf(e.getValue(), newCap));
        }
        capacity = newCap;
    }

    private static int nextPow2(int v) {
        int x = 1;
        while (x < v) x <<= 1;
        return x;
    }
}
