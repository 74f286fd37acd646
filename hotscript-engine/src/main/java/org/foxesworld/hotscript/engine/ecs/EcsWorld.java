package org.foxesworld.hotscript.engine.ecs;

public final class EcsWorld {

    private final EntityManager entities = new EntityManager();
    private final ComponentStore components = new ComponentStore();

    public EntityManager entities() { return entities; }
    public ComponentStore components() { return components; }

    public int createEntity() { return entities.create(); }

    /** Destroys the entity and drops every component it owned. */
    public boolean destroyEntity(int id) {
        if (!entities.destroy(id)) return false;
        components.removeAll(id);
        return true;
    }

    public boolean isAlive(int id) { return entities.isAlive(id); }

    public void reset() {
        entities.reset();
        components.reset();
    }
}
