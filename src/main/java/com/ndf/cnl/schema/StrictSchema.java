package com.ndf.cnl.schema;

import com.ndf.cnl.api.EntityKind;
import com.ndf.cnl.api.SchemaLookup;
import com.ndf.cnl.api.SchemaPolicy;
import com.ndf.cnl.error.SchemaViolationException;

/** Rejects every relation or attribute name the lookup does not know. */
public final class StrictSchema implements SchemaPolicy {
    private final SchemaLookup lookup;

    public StrictSchema(SchemaLookup lookup) {
        this.lookup = lookup == null ? SchemaLookup.empty() : lookup;
    }

    @Override
    public void admit(EntityKind kind, String name, String entityId, int line) {
        if (!lookup.isKnownType(kind, name))
            throw new SchemaViolationException(line, entityId, kind, name);
    }

    @Override
    public boolean isStrict() {
        return true;
    }
}
