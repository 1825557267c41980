package com.ndf.cnl.model;

import java.util.List;
import java.util.function.Predicate;

/**
 * Reference to a node, optionally narrowed to one of its morphs
 * ({@code Water:basic}).
 *
 * @param nodeId   referenced node id
 * @param morphKey morph key within that node, or null for the node as a whole
 */
public record StateRef(String nodeId, String morphKey) implements StateEntry {

    public static StateRef of(String nodeId) {
        return new StateRef(nodeId, null);
    }

    /** Morph id this reference points at, or null when it names the node only. */
    public String morphId() {
        return morphKey == null ? null : Morph.idOf(nodeId, morphKey);
    }

    @Override
    public List<StateRef> refs() {
        return List.of(this);
    }

    @Override
    public boolean isSatisfied(Predicate<StateRef> active) {
        return active.test(this);
    }
}
