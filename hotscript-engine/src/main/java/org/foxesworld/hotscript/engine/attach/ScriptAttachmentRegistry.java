package org.foxesworld.hotscript.engine.attach;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.hotscript.core.ScriptIds;
import org.foxesworld.hotscript.engine.ecs.EcsWorld;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Attachment boundary over the entity storage: add, remove and toggle scripts per entity and
 * iterate them in execution order.
 *
 * <p>Mutations must happen on the simulation thread between ticks.</p>
 */
public final class ScriptAttachmentRegistry {

    private static final Logger log = LogManager.getLogger(ScriptAttachmentRegistry.class);

    private final EcsWorld ecs;
    private long nextSequence = 1;

    public ScriptAttachmentRegistry(EcsWorld ecs) {
        this.ecs = Objects.requireNonNull(ecs, "ecs");
    }

    /**
     * Attaches {@code scriptId} to a live entity.
     *
     * @return false if the script is already attached to the entity (the existing record is kept)
     */
    public boolean addAttachment(int entity, String scriptId, int priority) {
        ScriptIds.require(scriptId);
        requireAlive(entity);

        ScriptAttachments list = ecs.components().get(entity, ScriptAttachments.class);
        if (list == null) {
            list = new ScriptAttachments();
            ecs.components().put(entity, ScriptAttachments.class, list);
        } else if (list.find(scriptId) != null) {
            log.debug("Script {} already attached to entity {}", scriptId, entity);
            return false;
        }

        list.insert(new ScriptAttachment(scriptId, priority, nextSequence++));
        log.debug("Attached script {} to entity {} (priority={})", scriptId, entity, priority);
        return true;
    }

    /** @return false if the script was not attached */
    public boolean removeAttachment(int entity, String scriptId) {
        ScriptIds.require(scriptId);
        ScriptAttachments list = ecs.components().get(entity, ScriptAttachments.class);
        if (list == null) return false;

        ScriptAttachment a = list.find(scriptId);
        if (a == null) return false;

        list.remove(a);
        if (list.isEmpty()) ecs.components().remove(entity, ScriptAttachments.class);
        log.debug("Detached script {} from entity {}", scriptId, entity);
        return true;
    }

    /**
     * Flips the active flag in place. The record keeps its position and stays counted.
     *
     * @return false if the script is not attached to the entity
     */
    public boolean setActive(int entity, String scriptId, boolean active) {
        ScriptIds.require(scriptId);
        ScriptAttachment a = find(entity, scriptId);
        if (a == null) return false;
        a.setActive(active);
        return true;
    }

    public ScriptAttachment find(int entity, String scriptId) {
        ScriptAttachments list = ecs.components().get(entity, ScriptAttachments.class);
        return list != null ? list.find(scriptId) : null;
    }

    public int attachmentCount(int entity) {
        ScriptAttachments list = ecs.components().get(entity, ScriptAttachments.class);
        return list != null ? list.size() : 0;
    }

    /** Every attachment of the entity, active or not, in execution order. */
    public List<ScriptAttachment> attachments(int entity) {
        ScriptAttachments list = ecs.components().get(entity, ScriptAttachments.class);
        return list != null ? list.ordered() : List.of();
    }

    /** Active attachments of the entity in execution order (a snapshot). */
    public List<ScriptAttachment> activeAttachments(int entity) {
        List<ScriptAttachment> all = attachments(entity);
        List<ScriptAttachment> out = new ArrayList<>(all.size());
        for (ScriptAttachment a : all) {
            if (a.isActive()) out.add(a);
        }
        return out;
    }

    /** Entities holding at least one attachment, ascending. */
    public int[] entities() {
        return ecs.components().entitiesWith(ScriptAttachments.class);
    }

    private void requireAlive(int entity) {
        if (!ecs.isAlive(entity)) throw new IllegalArgumentException("entity " + entity + " is not alive");
    }
}
