package com.ndf.cnl.model;

/**
 * The heading-level shape of a node as declared in CNL: everything the diff
 * compares about a node apart from its neighborhood.
 *
 * @param declared false when the node is only implied by a relation target
 */
public record NodeDef(String id, String name, String qualifier, String type, String description, boolean declared) {

    public static NodeDef implicit(String id, String name, String qualifier) {
        return new NodeDef(id, name, qualifier, null, null, false);
    }
}
