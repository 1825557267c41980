package com.ndf.cnl.schema;

import com.ndf.cnl.api.EntityKind;
import com.ndf.cnl.api.SchemaLookup;
import com.ndf.cnl.api.SchemaPolicy;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import lombok.extern.log4j.Log4j2;

/**
 * Accepts every name. Names the lookup does not know are registered with this
 * instance, which lives as long as the graph it belongs to; the host schema
 * is never modified.
 */
@Log4j2
public final class OpenSchema implements SchemaPolicy {
    private final SchemaLookup lookup;
    private final Map<EntityKind, Set<String>> registered = new EnumMap<>(EntityKind.class);

    public OpenSchema() {
        this(SchemaLookup.empty());
    }

    public OpenSchema(SchemaLookup lookup) {
        this.lookup = lookup == null ? SchemaLookup.empty() : lookup;
    }

    @Override
    public void admit(EntityKind kind, String name, String entityId, int line) {
        if (lookup.isKnownType(kind, name))
            return;
        if (registered.computeIfAbsent(kind, k -> new LinkedHashSet<>()).add(name))
            log.info("Registered {} type '{}' for this graph (first used by {})", kind.name().toLowerCase(), name,
                    entityId);
    }

    @Override
    public boolean isStrict() {
        return false;
    }

    /** Names registered so far for {@code kind}, in first-use order. */
    public Set<String> registered(EntityKind kind) {
        return Collections.unmodifiableSet(registered.getOrDefault(kind, Set.of()));
    }

    /** A lookup that knows the host schema plus everything registered here. */
    public SchemaLookup asLookup() {
        return (kind, name) -> lookup.isKnownType(kind, name) || registered(kind).contains(name);
    }
}
