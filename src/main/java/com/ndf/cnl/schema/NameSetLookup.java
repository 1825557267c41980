package com.ndf.cnl.schema;

import com.ndf.cnl.api.EntityKind;
import com.ndf.cnl.api.SchemaLookup;
import com.ndf.cnl.io.CompilerConfig;

import java.util.Collection;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Schema lookup over fixed name lists, matched case-insensitively. Used when
 * the known relation and attribute types come from {@link CompilerConfig}
 * rather than from a host application.
 */
public final class NameSetLookup implements SchemaLookup {
    private final Map<EntityKind, Set<String>> names = new EnumMap<>(EntityKind.class);

    public static NameSetLookup fromConfig(CompilerConfig config) {
        return new NameSetLookup()
                .with(EntityKind.RELATION, config.getKnownRelations())
                .with(EntityKind.ATTRIBUTE, config.getKnownAttributes());
    }

    public NameSetLookup with(EntityKind kind, Collection<String> known) {
        Set<String> set = names.computeIfAbsent(kind, k -> new HashSet<>());
        if (known != null)
            for (String n : known)
                set.add(normalize(n));
        return this;
    }

    @Override
    public boolean isKnownType(EntityKind kind, String name) {
        Set<String> set = names.get(kind);
        return set != null && name != null && set.contains(normalize(name));
    }

    private static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
