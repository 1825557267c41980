package com.ndf.cnl.error;

import lombok.Getter;

/** A relation, attribute or transition state refers to an id that does not exist. */
@Getter
public class UnresolvedReferenceException extends CnlException {
    private final String missingId;

    public UnresolvedReferenceException(int line, String entityId, String missingId) {
        super(ErrorKind.UNRESOLVED_REFERENCE, line, entityId,
                "Unresolved reference '" + missingId + "' from " + entityId);
        this.missingId = missingId;
    }
}
