package com.ndf.cnl.model;

import java.util.List;

/**
 * Immutable view of a compiled graph, used for rendering and export.
 */
public record GraphSnapshot(
        String description,
        List<PolyNode> nodes,
        List<RelationEdge> relations,
        List<AttributeValue> attributes,
        List<TransitionNode> transitions) {

    public GraphSnapshot {
        nodes = List.copyOf(nodes);
        relations = List.copyOf(relations);
        attributes = List.copyOf(attributes);
        transitions = List.copyOf(transitions);
    }

    public static GraphSnapshot empty() {
        return new GraphSnapshot(null, List.of(), List.of(), List.of(), List.of());
    }

    /** Returns the node with the given id, or null. */
    public PolyNode node(String id) {
        for (PolyNode n : nodes)
            if (n.getId().equals(id))
                return n;
        return null;
    }

    /** Returns the relation with the given id, or null. */
    public RelationEdge relation(String id) {
        for (RelationEdge r : relations)
            if (r.id().equals(id))
                return r;
        return null;
    }

    /** Returns the attribute with the given id, or null. */
    public AttributeValue attribute(String id) {
        for (AttributeValue a : attributes)
            if (a.id().equals(id))
                return a;
        return null;
    }

    /** Returns the transition declared by {@code nodeId}, or null. */
    public TransitionNode transitionOf(String nodeId) {
        for (TransitionNode t : transitions)
            if (t.nodeId().equals(nodeId))
                return t;
        return null;
    }
}
