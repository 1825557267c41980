package com.ndf.cnl.error;

/** A node declares two morphs with the same name. */
public class DuplicateMorphNameException extends CnlException {
    public DuplicateMorphNameException(int line, String nodeId, String morphName) {
        super(ErrorKind.DUPLICATE_MORPH_NAME, line, nodeId,
                "Duplicate morph '" + morphName + "' on node " + nodeId + " (line " + line + ")");
    }
}
