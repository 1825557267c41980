package com.ndf.cnl.error;

/** Categories of problems reported back to the CNL editor. */
public enum ErrorKind {
    /** Malformed heading, relation, attribute or state line. */
    PARSE_ERROR,
    /** A connector points at an id that will not exist after the submission. */
    UNRESOLVED_REFERENCE,
    /** Strict mode rejected an unknown relation or attribute name. */
    SCHEMA_VIOLATION,
    /** Two morphs of one node share a name; the later one is dropped. */
    DUPLICATE_MORPH_NAME,
    /** The last morph of a node was removed, which removes the node itself. */
    ORPHAN_MORPH_DELETION,
    /** The store adapter refused an operation. */
    STORE_FAILURE
}
