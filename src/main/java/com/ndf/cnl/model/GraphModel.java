package com.ndf.cnl.model;

import com.ndf.cnl.error.DuplicateMorphNameException;
import com.ndf.cnl.error.UnresolvedReferenceException;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Getter;
import lombok.Setter;
import lombok.extern.log4j.Log4j2;

/**
 * Mutable in-memory graph that compiled operations are applied to.
 *
 * <p>
 * Relations and attributes live in flat maps keyed by id; morphs only hold
 * their ids. Every mutator checks the references it needs and throws
 * {@link UnresolvedReferenceException} if one is missing, so the model never
 * holds a dangling connector.
 *
 * <p>
 * Not thread-safe. One compilation per graph at a time.
 */
@Log4j2
public final class GraphModel {
    private final Map<String, PolyNode> nodes = new LinkedHashMap<>();
    private final Map<String, RelationEdge> relations = new LinkedHashMap<>();
    private final Map<String, AttributeValue> attributes = new LinkedHashMap<>();
    private final Map<String, TransitionNode> transitions = new LinkedHashMap<>();

    @Getter
    @Setter
    private String description;

    /** Rebuilds a model from a previously exported snapshot. */
    public static GraphModel fromSnapshot(GraphSnapshot snapshot) {
        GraphModel model = new GraphModel();
        model.description = snapshot.description();
        for (PolyNode n : snapshot.nodes())
            model.nodes.put(n.getId(), n.copy());
        for (RelationEdge r : snapshot.relations())
            model.relations.put(r.id(), r);
        for (AttributeValue a : snapshot.attributes())
            model.attributes.put(a.id(), a);
        for (TransitionNode t : snapshot.transitions())
            model.transitions.put(t.id(), t);
        return model;
    }

    // ── Lookup ──────────────────────────────────────────────────────

    /** True if any entity (node, morph, relation, attribute, transition) has this id. */
    public boolean contains(String id) {
        return nodes.containsKey(id) || morph(id) != null || relations.containsKey(id)
                || attributes.containsKey(id) || transitions.containsKey(id);
    }

    public PolyNode node(String id) {
        return nodes.get(id);
    }

    /** Resolves a morph id ({@code nodeId:key}), or returns null. */
    public Morph morph(String morphId) {
        int sep = morphId.indexOf(':');
        if (sep <= 0)
            return null;
        PolyNode n = nodes.get(morphId.substring(0, sep));
        return n == null ? null : n.getMorphs().get(morphId);
    }

    public RelationEdge relation(String id) {
        return relations.get(id);
    }

    public AttributeValue attribute(String id) {
        return attributes.get(id);
    }

    public TransitionNode transition(String id) {
        return transitions.get(id);
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int relationCount() {
        return relations.size();
    }

    public int attributeCount() {
        return attributes.size();
    }

    // ── Nodes ───────────────────────────────────────────────────────

    /**
     * Adds a node, or merges the definition into an existing node with the same
     * id. An implicit definition never overwrites a declared node.
     *
     * @return true if the node was created
     */
    public boolean putNode(NodeDef def) {
        PolyNode existing = nodes.get(def.id());
        if (existing == null) {
            nodes.put(def.id(), new PolyNode(def.id(), def.name(), def.qualifier(), def.type(),
                    def.description(), def.declared()));
            return true;
        }
        if (def.declared() || !existing.isDeclared())
            copyHeader(def, existing);
        return false;
    }

    public void updateNode(NodeDef def) {
        copyHeader(def, requireNode(def.id(), def.id()));
    }

    private static void copyHeader(NodeDef def, PolyNode n) {
        n.setName(def.name());
        n.setQualifier(def.qualifier());
        n.setType(def.type());
        n.setDescription(def.description());
        n.setDeclared(def.declared());
    }

    /**
     * Removes a node with all its morphs. Connectors still touching the node are
     * removed with it.
     *
     * @return ids of connectors removed along with the node
     */
    public List<String> removeNode(String id) {
        PolyNode n = nodes.remove(id);
        if (n == null)
            throw new UnresolvedReferenceException(0, id, id);
        List<String> cascaded = new ArrayList<>();
        for (Iterator<RelationEdge> it = relations.values().iterator(); it.hasNext();) {
            RelationEdge r = it.next();
            if (r.sourceId().equals(id) || r.targetId().equals(id)) {
                it.remove();
                detach(r.morphId(), r.id());
                cascaded.add(r.id());
            }
        }
        for (Iterator<AttributeValue> it = attributes.values().iterator(); it.hasNext();) {
            AttributeValue a = it.next();
            if (a.nodeId().equals(id)) {
                it.remove();
                cascaded.add(a.id());
            }
        }
        for (Iterator<TransitionNode> it = transitions.values().iterator(); it.hasNext();) {
            TransitionNode t = it.next();
            if (t.nodeId().equals(id) || t.references().stream().anyMatch(r -> r.nodeId().equals(id))) {
                it.remove();
                cascaded.add(t.id());
            }
        }
        if (!cascaded.isEmpty())
            log.warn("Removing node {} also removed {} dangling connector(s): {}", id, cascaded.size(), cascaded);
        return cascaded;
    }

    // ── Morphs ──────────────────────────────────────────────────────

    public void addMorph(MorphDef def) {
        PolyNode n = requireNode(def.nodeId(), def.id());
        if (n.getMorphs().containsKey(def.id()))
            throw new DuplicateMorphNameException(0, def.nodeId(), def.name());
        n.getMorphs().put(def.id(), new Morph(def.nodeId(), def.key(), def.name(), def.description(), false));
    }

    public void updateMorph(MorphDef def) {
        Morph m = morph(def.id());
        if (m == null)
            throw new UnresolvedReferenceException(0, def.id(), def.id());
        m.setName(def.name());
        m.setDescription(def.description());
    }

    /**
     * Removes a morph together with the relations and attributes it owns.
     * Removing the last remaining morph removes the node.
     *
     * @return true if the node was removed as a consequence
     */
    public boolean removeMorph(String morphId) {
        Morph m = morph(morphId);
        if (m == null)
            throw new UnresolvedReferenceException(0, morphId, morphId);
        PolyNode n = nodes.get(m.getNodeId());
        if (n.getMorphs().size() == 1) {
            removeNode(n.getId());
            return true;
        }
        if (m.isBasic())
            throw new IllegalArgumentException("Basic morph " + morphId + " can only be removed with its node");
        for (String rid : m.getRelationIds())
            relations.remove(rid);
        for (String aid : m.getAttributeIds())
            attributes.remove(aid);
        n.getMorphs().remove(morphId);
        if (morphId.equals(n.getActiveMorphId()))
            n.setActiveMorphId(n.getBasicMorphId());
        return false;
    }

    /** Switches the neighborhood a node currently shows. */
    public void setActiveMorph(String nodeId, String morphKey) {
        PolyNode n = requireNode(nodeId, nodeId);
        Morph m = n.morph(morphKey);
        if (m == null)
            throw new UnresolvedReferenceException(0, nodeId, Morph.idOf(nodeId, morphKey));
        n.setActiveMorphId(m.getId());
    }

    // ── Connectors ──────────────────────────────────────────────────

    public void putRelation(RelationEdge r) {
        requireNode(r.sourceId(), r.id());
        requireNode(r.targetId(), r.id());
        Morph m = requireMorph(r.morphId(), r.id());
        relations.put(r.id(), r);
        if (!m.getRelationIds().contains(r.id()))
            m.getRelationIds().add(r.id());
    }

    public boolean removeRelation(String id) {
        RelationEdge r = relations.remove(id);
        if (r == null)
            return false;
        detach(r.morphId(), id);
        return true;
    }

    public void putAttribute(AttributeValue a) {
        requireNode(a.nodeId(), a.id());
        Morph m = requireMorph(a.morphId(), a.id());
        attributes.put(a.id(), a);
        if (!m.getAttributeIds().contains(a.id()))
            m.getAttributeIds().add(a.id());
    }

    public boolean removeAttribute(String id) {
        AttributeValue a = attributes.remove(id);
        if (a == null)
            return false;
        Morph m = morph(a.morphId());
        if (m != null)
            m.getAttributeIds().remove(id);
        return true;
    }

    public void putTransition(TransitionNode t) {
        requireNode(t.nodeId(), t.id());
        transitions.put(t.id(), t);
    }

    public boolean removeTransition(String id) {
        return transitions.remove(id) != null;
    }

    private void detach(String morphId, String relationId) {
        Morph m = morph(morphId);
        if (m != null)
            m.getRelationIds().remove(relationId);
    }

    private PolyNode requireNode(String nodeId, String from) {
        PolyNode n = nodes.get(nodeId);
        if (n == null)
            throw new UnresolvedReferenceException(0, from, nodeId);
        return n;
    }

    private Morph requireMorph(String morphId, String from) {
        Morph m = morph(morphId);
        if (m == null)
            throw new UnresolvedReferenceException(0, from, morphId);
        return m;
    }

    // ── Export ──────────────────────────────────────────────────────

    /** Deep copy of the current state. */
    public GraphSnapshot snapshot() {
        List<PolyNode> ns = new ArrayList<>(nodes.size());
        for (PolyNode n : nodes.values())
            ns.add(n.copy());
        return new GraphSnapshot(description, ns, new ArrayList<>(relations.values()),
                new ArrayList<>(attributes.values()), new ArrayList<>(transitions.values()));
    }
}
