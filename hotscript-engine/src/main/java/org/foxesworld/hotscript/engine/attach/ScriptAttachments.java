package org.foxesworld.hotscript.engine.attach;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per-entity component holding every script attached to the entity, kept in execution order.
 */
public final class ScriptAttachments {

    private final List<ScriptAttachment> ordered = new ArrayList<>(4);
    private final List<ScriptAttachment> view = Collections.unmodifiableList(ordered);

    /** Execution order view; changes when the list changes. */
    public List<ScriptAttachment> ordered() {
        return view;
    }

    public int size() {
        return ordered.size();
    }

    public boolean isEmpty() {
        return ordered.isEmpty();
    }

    public ScriptAttachment find(String scriptId) {
        for (int i = 0, n = ordered.size(); i < n; i++) {
            ScriptAttachment a = ordered.get(i);
            if (a.scriptId().equals(scriptId)) return a;
        }
        return null;
    }

    void insert(ScriptAttachment a) {
        // stable insertion point: after every element that sorts before or equal to a
        int idx = ordered.size();
        for (int i = 0; i < ordered.size(); i++) {
            if (ScriptAttachment.EXECUTION_ORDER.compare(a, ordered.get(i)) < 0) {
                idx = i;
                break;
            }
        }
        ordered.add(idx, a);
    }

    boolean remove(ScriptAttachment a) {
        return ordered.remove(a);
    }
}
