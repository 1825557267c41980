package com.ndf.cnl.engine;

import com.ndf.cnl.model.AttributeValue;
import com.ndf.cnl.model.Morph;
import com.ndf.cnl.model.MorphDef;
import com.ndf.cnl.model.RelationEdge;
import com.ndf.cnl.model.StateRef;
import com.ndf.cnl.model.TransitionNode;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * One graph mutation produced by the diff.
 *
 * @param type     what to do
 * @param entityId stable id of the entity
 * @param payload  the entity definition: {@code NodeDef}, {@code MorphDef},
 *                 {@code RelationEdge}, {@code AttributeValue} or
 *                 {@code TransitionNode}. For deletes, the last known
 *                 definition.
 * @param line     1-based source line, 0 for deletes and derived operations
 */
public record Operation(OpType type, String entityId, Object payload, int line) {

    /**
     * Ids this operation depends on: the containers a connector attaches to and
     * the nodes and morphs a transition mentions.
     */
    public List<String> references() {
        Set<String> refs = new LinkedHashSet<>();
        if (payload instanceof MorphDef m) {
            refs.add(m.nodeId());
        } else if (payload instanceof RelationEdge r) {
            refs.add(r.sourceId());
            refs.add(r.targetId());
            refs.add(r.morphId());
        } else if (payload instanceof AttributeValue a) {
            refs.add(a.nodeId());
            refs.add(a.morphId());
        } else if (payload instanceof TransitionNode t) {
            refs.add(t.nodeId());
            for (StateRef ref : t.references()) {
                refs.add(ref.nodeId());
                if (ref.morphKey() != null && !ref.morphKey().equals(Morph.BASIC))
                    refs.add(ref.morphId());
            }
        }
        return new ArrayList<>(refs);
    }

    @Override
    public String toString() {
        return type.label() + "(" + entityId + ")";
    }
}
