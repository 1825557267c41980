package com.ndf.cnl.io;

/**
 * A structural tree tagged with the submission version it was compiled from.
 * Passed explicitly to the diff so nothing reads previous state from shared
 * storage.
 */
public record TreeSnapshot(long version, StructuralTree tree) {

    public static TreeSnapshot initial() {
        return new TreeSnapshot(0, StructuralTree.empty());
    }

    public TreeSnapshot next(StructuralTree newTree) {
        return new TreeSnapshot(version + 1, newTree);
    }
}
