package com.ndf.cnl.error;

import com.ndf.cnl.api.EntityKind;

/** Strict mode rejected a relation or attribute name the schema does not list. */
public class SchemaViolationException extends CnlException {
    public SchemaViolationException(int line, String entityId, EntityKind kind, String name) {
        super(ErrorKind.SCHEMA_VIOLATION, line, entityId,
                "Unknown " + kind.name().toLowerCase() + " type '" + name + "'");
    }
}
