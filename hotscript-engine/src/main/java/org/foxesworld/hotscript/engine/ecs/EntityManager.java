package org.foxesworld.hotscript.engine.ecs;

import java.util.BitSet;

/**
 * Entity id allocation. Ids start at 1; destroyed ids are reused through a free list.
 * Owned by the simulation thread.
 */
public final class EntityManager {

    private int nextId = 1;
    private final BitSet alive = new BitSet();

    // free-list without boxing
    private int[] free = new int[256];
    private int freeSize = 0;

    public int create() {
        final int id;
        if (freeSize > 0) {
            id = free[--freeSize];
        } else {
            id = nextId++;
        }
        alive.set(id);
        return id;
    }

    public boolean isAlive(int id) {
        return id > 0 && alive.get(id);
    }

    /** @return false if the id was not alive */
    public boolean destroy(int id) {
        if (!isAlive(id)) return false;

        alive.clear(id);

        if (freeSize == free.length) {
            int[] n = new int[free.length << 1];
            System.arraycopy(free, 0, n, 0, free.length);
            free = n;
        }
        free[freeSize++] = id;
        return true;
    }

    public int aliveCount() {
        return alive.cardinality();
    }

    public void reset() {
        alive.clear();
        nextId = 1;
        freeSize = 0;
    }
}
