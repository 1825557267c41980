package com.ndf.cnl.api;

/** The kinds of entity a compiled graph is made of. */
public enum EntityKind {
    NODE,
    MORPH,
    RELATION,
    ATTRIBUTE,
    TRANSITION
}
