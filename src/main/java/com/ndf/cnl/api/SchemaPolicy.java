package com.ndf.cnl.api;

import com.ndf.cnl.error.SchemaViolationException;

/**
 * Decides how the applier treats relation and attribute names.
 *
 * @see com.ndf.cnl.schema.StrictSchema
 * @see com.ndf.cnl.schema.OpenSchema
 */
public interface SchemaPolicy {

    /**
     * Admits {@code name} for an operation on {@code entityId}.
     *
     * @throws SchemaViolationException if the name is not allowed
     */
    void admit(EntityKind kind, String name, String entityId, int line);

    /** True when unknown names are rejected rather than registered. */
    boolean isStrict();
}
