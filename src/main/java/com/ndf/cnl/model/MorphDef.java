package com.ndf.cnl.model;

/**
 * A non-basic morph as declared by a sub-heading. Basic morphs are implied by
 * their node and never appear as a MorphDef.
 */
public record MorphDef(String id, String nodeId, String key, String name, String description) {

    public MorphDef(String nodeId, String key, String name, String description) {
        this(Morph.idOf(nodeId, key), nodeId, key, name, description);
    }
}
