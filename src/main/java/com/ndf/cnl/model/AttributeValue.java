package com.ndf.cnl.model;

/** A named value attached to one morph of a node. */
public record AttributeValue(
        String id,
        String nodeId,
        String name,
        String value,
        String unit,
        String morphRef,
        String qualifier,
        String quantifier,
        String adverb,
        String modality) {

    /** Id of the morph that owns this attribute. */
    public String morphId() {
        return Morph.idOf(nodeId, morphRef);
    }
}
