package com.ndf.cnl.model;

/**
 * A typed, directed relation between two nodes, scoped to one morph of its
 * source node.
 */
public record RelationEdge(
        String id,
        String name,
        String sourceId,
        String targetId,
        String morphRef,
        String adjective,
        String adverb,
        String quantifier,
        String modality) {

    /** Id of the morph that owns this relation. */
    public String morphId() {
        return Morph.idOf(sourceId, morphRef);
    }
}
