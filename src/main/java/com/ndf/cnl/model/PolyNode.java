package com.ndf.cnl.model;

import java.util.LinkedHashMap;
import java.util.Map;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A node whose visible neighborhood varies by context. Every PolyNode has a
 * basic morph, flagged explicitly and referenced by {@link #basicMorphId}.
 */
@Data
@NoArgsConstructor
public final class PolyNode {
    private String id, name, qualifier, type, description;
    // false for nodes that only exist because a relation targets them
    private boolean declared;
    private String basicMorphId, activeMorphId;
    private Map<String, Morph> morphs = new LinkedHashMap<>();

    public PolyNode(String id, String name, String qualifier, String type, String description, boolean declared) {
        this.id = id;
        this.name = name;
        this.qualifier = qualifier;
        this.type = type;
        this.description = description;
        this.declared = declared;
        Morph basic = Morph.basicOf(id);
        this.morphs.put(basic.getId(), basic);
        this.basicMorphId = basic.getId();
        this.activeMorphId = basic.getId();
    }

    public Morph basicMorph() {
        return morphs.get(basicMorphId);
    }

    public Morph morph(String key) {
        return morphs.get(Morph.idOf(id, key));
    }

    public PolyNode copy() {
        PolyNode n = new PolyNode();
        n.id = id;
        n.name = name;
        n.qualifier = qualifier;
        n.type = type;
        n.description = description;
        n.declared = declared;
        n.basicMorphId = basicMorphId;
        n.activeMorphId = activeMorphId;
        for (Morph m : morphs.values())
            n.morphs.put(m.getId(), m.copy());
        return n;
    }
}
