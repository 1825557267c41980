package com.ndf.cnl.util;

import com.ndf.cnl.model.AttributeValue;
import com.ndf.cnl.model.GraphSnapshot;
import com.ndf.cnl.model.LogicalOperatorNode;
import com.ndf.cnl.model.Morph;
import com.ndf.cnl.model.PolyNode;
import com.ndf.cnl.model.RelationEdge;
import com.ndf.cnl.model.StateEntry;
import com.ndf.cnl.model.StateRef;
import com.ndf.cnl.model.TransitionNode;

import java.util.HashMap;
import java.util.Map;

/**
 * Diagnostic utility for inspecting a compiled graph.
 *
 * <p>
 * Generates human-readable dumps of single nodes and of the whole graph, and a
 * Mermaid diagram for embedding in Markdown.
 *
 * <p>
 * <b>Usage:</b> intended for debugging sessions and documentation, not for
 * per-submission work.
 */
public final class GraphExplain {
    private final GraphSnapshot snapshot;
    private final Map<String, PolyNode> nodes = new HashMap<>();
    private final Map<String, RelationEdge> relations = new HashMap<>();
    private final Map<String, AttributeValue> attributes = new HashMap<>();

    public GraphExplain(GraphSnapshot snapshot) {
        this.snapshot = snapshot;
        for (PolyNode n : snapshot.nodes())
            nodes.put(n.getId(), n);
        for (RelationEdge r : snapshot.relations())
            relations.put(r.id(), r);
        for (AttributeValue a : snapshot.attributes())
            attributes.put(a.id(), a);
    }

    /**
     * Dumps a single node with its morphs and their neighborhoods.
     */
    public String explainNode(String nodeId) {
        PolyNode n = nodes.get(nodeId);
        if (n == null)
            throw new IllegalArgumentException("Unknown node: " + nodeId);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Node: ").append(n.getId()).append('\n')
                .append("  Name: ").append(label(n)).append('\n')
                .append("  Type: ").append(n.getType() == null ? "-" : n.getType()).append('\n')
                .append("  Declared: ").append(n.isDeclared()).append('\n')
                .append("  Active morph: ").append(n.getActiveMorphId()).append('\n');
        for (Morph m : n.getMorphs().values()) {
            sb.append("  Morph ").append(m.getKey()).append(m.isBasic() ? " (basic)" : "").append(": ")
                    .append(m.getAttributeIds().size()).append(" attribute(s), ")
                    .append(m.getRelationIds().size()).append(" relation(s)\n");
            for (String aid : m.getAttributeIds()) {
                AttributeValue a = attributes.get(aid);
                if (a != null)
                    sb.append("    ").append(a.name()).append(" = ").append(a.value())
                            .append(a.unit() == null ? "" : " " + a.unit()).append('\n');
            }
            for (String rid : m.getRelationIds()) {
                RelationEdge r = relations.get(rid);
                if (r != null)
                    sb.append("    <").append(r.name()).append("> ").append(r.targetId()).append('\n');
            }
        }
        TransitionNode t = snapshot.transitionOf(nodeId);
        if (t != null)
            sb.append("  Transition: ").append(states(t)).append('\n');
        return sb.toString();
    }

    /**
     * Dumps every node and its outgoing relations in a compact text format.
     */
    public String dumpGraph() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Graph (").append(snapshot.nodes().size()).append(" nodes, ")
                .append(snapshot.relations().size()).append(" relations, ")
                .append(snapshot.attributes().size()).append(" attributes):\n");
        for (PolyNode n : snapshot.nodes()) {
            sb.append("  ").append(n.getId());
            if (!n.isDeclared())
                sb.append(" (implicit)");
            if (n.getMorphs().size() > 1)
                sb.append(" [").append(n.getMorphs().size()).append(" morphs]");
            boolean first = true;
            for (RelationEdge r : snapshot.relations()) {
                if (!r.sourceId().equals(n.getId()))
                    continue;
                sb.append(first ? " -> " : ", ").append(r.targetId());
                first = false;
            }
            sb.append('\n');
        }
        for (TransitionNode t : snapshot.transitions())
            sb.append("  ").append(t.id()).append(": ").append(states(t)).append('\n');
        return sb.toString();
    }

    /**
     * Generates a Mermaid JS graph diagram.
     * <p>
     * Nodes first in snapshot order, then one labelled edge per relation.
     * Relations owned by a non-basic morph carry the morph key in their label.
     * Transitions draw dotted edges from their prior state and to their post
     * state.
     * </p>
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("graph TD;\n");

        // 1. Declare nodes
        for (PolyNode n : snapshot.nodes()) {
            sb.append("  ").append(sanitize(n.getId())).append("[\"<div class='node-inner'><span class='node-title")
                    .append(n.isDeclared() ? "" : " implicit-node").append("'>").append(escape(label(n)))
                    .append("</span>");
            if (n.getType() != null)
                sb.append("<span class='node-type'>").append(escape(n.getType())).append("</span>");
            sb.append("</div>\"];\n");
        }

        // 2. Relations
        for (RelationEdge r : snapshot.relations()) {
            String label = Morph.BASIC.equals(r.morphRef()) ? r.name() : r.name() + " (" + r.morphRef() + ")";
            sb.append("  ").append(sanitize(r.sourceId())).append(" -- \"").append(escape(label)).append("\" --> ")
                    .append(sanitize(r.targetId())).append(";\n");
        }

        // 3. Transitions
        for (TransitionNode t : snapshot.transitions()) {
            String self = sanitize(t.nodeId());
            for (StateEntry e : t.priorState())
                for (StateRef ref : e.refs())
                    sb.append("  ").append(sanitize(ref.nodeId())).append(" -.-> ").append(self).append(";\n");
            for (StateEntry e : t.postState())
                for (StateRef ref : e.refs())
                    sb.append("  ").append(self).append(" -.-> ").append(sanitize(ref.nodeId())).append(";\n");
        }
        return sb.toString();
    }

    private static String states(TransitionNode t) {
        StringBuilder sb = new StringBuilder();
        appendEntries(sb, t.priorState());
        sb.append(" => ");
        appendEntries(sb, t.postState());
        return sb.toString();
    }

    private static void appendEntries(StringBuilder sb, Iterable<StateEntry> entries) {
        boolean first = true;
        for (StateEntry e : entries) {
            if (!first)
                sb.append(", ");
            first = false;
            if (e instanceof LogicalOperatorNode l) {
                for (int i = 0; i < l.operands().size(); i++) {
                    if (i > 0)
                        sb.append(' ').append(l.operator().symbol()).append(' ');
                    sb.append(ref(l.operands().get(i)));
                }
            } else {
                sb.append(ref((StateRef) e));
            }
        }
    }

    private static String ref(StateRef r) {
        return r.morphKey() == null ? r.nodeId() : r.morphId();
    }

    private static String label(PolyNode n) {
        return n.getQualifier() == null ? n.getName() : n.getQualifier() + " " + n.getName();
    }

    // double quotes end a Mermaid label
    private static String escape(String text) {
        return text.replace("\"", "#quot;");
    }

    private static String sanitize(String id) {
        return id.replaceAll("[^a-zA-Z0-9_]", "_");
    }
}
