package com.ndf.cnl.engine;

import com.ndf.cnl.model.AttributeValue;
import com.ndf.cnl.model.GraphSnapshot;
import com.ndf.cnl.model.Morph;
import com.ndf.cnl.model.MorphDef;
import com.ndf.cnl.model.NodeDef;
import com.ndf.cnl.model.PolyNode;
import com.ndf.cnl.model.RelationEdge;
import com.ndf.cnl.model.TransitionNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

import lombok.Getter;

/**
 * Every entity a structural tree declares, keyed by stable id in declaration
 * order. This is what the diff compares; two trees that resolve to equal maps
 * describe the same graph.
 */
@Getter
public final class ResolvedGraph {
    private final Map<String, NodeDef> nodes = new LinkedHashMap<>();
    private final Map<String, MorphDef> morphs = new LinkedHashMap<>();
    private final Map<String, RelationEdge> relations = new LinkedHashMap<>();
    private final Map<String, AttributeValue> attributes = new LinkedHashMap<>();
    private final Map<String, TransitionNode> transitions = new LinkedHashMap<>();
    // id -> 1-based source line
    private final Map<String, Integer> lines = new LinkedHashMap<>();

    public static ResolvedGraph empty() {
        return new ResolvedGraph();
    }

    public int line(String id) {
        return lines.getOrDefault(id, 0);
    }

    /**
     * True if {@code id} names a node, morph (basic morphs included), relation,
     * attribute or transition of this graph.
     */
    public boolean contains(String id) {
        if (nodes.containsKey(id) || morphs.containsKey(id) || relations.containsKey(id)
                || attributes.containsKey(id) || transitions.containsKey(id))
            return true;
        int sep = id.indexOf(':');
        return sep > 0 && id.substring(sep + 1).equals(Morph.BASIC) && nodes.containsKey(id.substring(0, sep));
    }

    public int size() {
        return nodes.size() + morphs.size() + relations.size() + attributes.size() + transitions.size();
    }

    /** Copy holding only the entities whose id passes {@code keep}. */
    public ResolvedGraph retain(Predicate<String> keep) {
        ResolvedGraph g = new ResolvedGraph();
        nodes.forEach((id, v) -> {
            if (keep.test(id))
                g.nodes.put(id, v);
        });
        morphs.forEach((id, v) -> {
            if (keep.test(id))
                g.morphs.put(id, v);
        });
        relations.forEach((id, v) -> {
            if (keep.test(id))
                g.relations.put(id, v);
        });
        attributes.forEach((id, v) -> {
            if (keep.test(id))
                g.attributes.put(id, v);
        });
        transitions.forEach((id, v) -> {
            if (keep.test(id))
                g.transitions.put(id, v);
        });
        lines.forEach((id, v) -> {
            if (g.contains(id))
                g.lines.put(id, v);
        });
        return g;
    }

    /**
     * Builds the snapshot this graph would produce if applied to an empty
     * model, without checking references.
     */
    public GraphSnapshot toSnapshot(String description) {
        Map<String, PolyNode> ns = new LinkedHashMap<>();
        for (NodeDef d : nodes.values())
            ns.put(d.id(), new PolyNode(d.id(), d.name(), d.qualifier(), d.type(), d.description(), d.declared()));
        for (MorphDef md : morphs.values()) {
            PolyNode n = ns.get(md.nodeId());
            if (n != null)
                n.getMorphs().put(md.id(), new Morph(md.nodeId(), md.key(), md.name(), md.description(), false));
        }
        List<RelationEdge> rs = new ArrayList<>();
        for (RelationEdge r : relations.values()) {
            Morph m = morphOf(ns, r.sourceId(), r.morphRef());
            if (m != null) {
                m.getRelationIds().add(r.id());
                rs.add(r);
            }
        }
        List<AttributeValue> as = new ArrayList<>();
        for (AttributeValue a : attributes.values()) {
            Morph m = morphOf(ns, a.nodeId(), a.morphRef());
            if (m != null) {
                m.getAttributeIds().add(a.id());
                as.add(a);
            }
        }
        return new GraphSnapshot(description, new ArrayList<>(ns.values()), rs, as,
                new ArrayList<>(transitions.values()));
    }

    private static Morph morphOf(Map<String, PolyNode> ns, String nodeId, String key) {
        PolyNode n = ns.get(nodeId);
        return n == null ? null : n.morph(key);
    }
}
