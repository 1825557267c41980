package com.ndf.cnl.io;

/** A parsed content line: relation, attribute or transition state. */
public interface Statement {

    /** Canonical CNL form of this statement. */
    String toCnl();
}
