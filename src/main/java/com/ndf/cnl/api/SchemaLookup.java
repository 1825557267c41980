package com.ndf.cnl.api;

/**
 * Answers whether a relation, attribute or node type name is registered in the
 * active schema. Supplied by the host application.
 */
@FunctionalInterface
public interface SchemaLookup {
    boolean isKnownType(EntityKind kind, String name);

    /** A lookup that knows nothing; every name is unknown. */
    static SchemaLookup empty() {
        return (kind, name) -> false;
    }
}
