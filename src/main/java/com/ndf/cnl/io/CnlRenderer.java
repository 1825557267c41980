package com.ndf.cnl.io;

import com.ndf.cnl.engine.IdentityResolver;
import com.ndf.cnl.model.AttributeValue;
import com.ndf.cnl.model.GraphSnapshot;
import com.ndf.cnl.model.LogicalOperatorNode;
import com.ndf.cnl.model.Morph;
import com.ndf.cnl.model.PolyNode;
import com.ndf.cnl.model.RelationEdge;
import com.ndf.cnl.model.StateEntry;
import com.ndf.cnl.model.StateRef;
import com.ndf.cnl.model.TransitionNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes graphs back out as CNL in normalized form.
 *
 * <p>
 * Normalized form is the graph description followed by one block per declared
 * node: heading, description fence, attribute lines, relation lines (one
 * target per line), state lines, then each morph block laid out the same way.
 * Blocks are separated by a blank line. Nodes that exist only as relation
 * targets are not written; they reappear when the text is parsed again.
 */
public final class CnlRenderer {

    private CnlRenderer() {
        // Utility class
    }

    /** {@code render(parse(text))}. */
    public static String normalize(String text, CnlParser parser) {
        return render(parser.parse(text));
    }

    public static String normalize(String text) {
        return normalize(text, new CnlParser());
    }

    public static String render(StructuralTree tree) {
        return render(IdentityResolver.resolve(tree).toSnapshot(tree.getDescription()));
    }

    public static String render(GraphSnapshot snapshot) {
        Map<String, PolyNode> nodes = new HashMap<>();
        for (PolyNode n : snapshot.nodes())
            nodes.put(n.getId(), n);
        Map<String, RelationEdge> relations = new HashMap<>();
        for (RelationEdge r : snapshot.relations())
            relations.put(r.id(), r);
        Map<String, AttributeValue> attributes = new HashMap<>();
        for (AttributeValue a : snapshot.attributes())
            attributes.put(a.id(), a);

        List<String> blocks = new ArrayList<>();
        if (snapshot.description() != null && !snapshot.description().isBlank())
            blocks.add(snapshot.description().strip() + "\n");

        for (PolyNode n : snapshot.nodes()) {
            if (!n.isDeclared())
                continue;
            StringBuilder sb = new StringBuilder(256);
            sb.append(new Heading(1, null, new NodeName(n.getQualifier(), n.getName()), n.getType()).toCnl())
                    .append('\n');
            appendDescription(sb, n.getDescription());
            Morph basic = n.basicMorph();
            if (basic != null)
                appendNeighborhood(sb, basic, nodes, relations, attributes);
            TransitionNode t = snapshot.transitionOf(n.getId());
            if (t != null) {
                if (!t.priorState().isEmpty())
                    sb.append(stateLine(StateRecord.Phase.PRIOR, t.priorState(), nodes)).append('\n');
                if (!t.postState().isEmpty())
                    sb.append(stateLine(StateRecord.Phase.POST, t.postState(), nodes)).append('\n');
            }
            blocks.add(sb.toString());

            for (Morph m : n.getMorphs().values()) {
                if (m.isBasic())
                    continue;
                StringBuilder mb = new StringBuilder(128);
                mb.append("## ").append(m.getName()).append('\n');
                appendDescription(mb, m.getDescription());
                appendNeighborhood(mb, m, nodes, relations, attributes);
                blocks.add(mb.toString());
            }
        }
        return String.join("\n", blocks);
    }

    private static void appendDescription(StringBuilder sb, String description) {
        if (description == null || description.isBlank())
            return;
        sb.append(":::description\n").append(description.strip()).append("\n:::\n");
    }

    private static void appendNeighborhood(StringBuilder sb, Morph m, Map<String, PolyNode> nodes,
            Map<String, RelationEdge> relations, Map<String, AttributeValue> attributes) {
        for (String id : m.getAttributeIds()) {
            AttributeValue a = attributes.get(id);
            if (a != null)
                sb.append(new AttributeRecord(a.name(), a.value(), a.unit(), a.qualifier(), a.quantifier(),
                        a.adverb(), a.modality()).toCnl()).append('\n');
        }
        for (String id : m.getRelationIds()) {
            RelationEdge r = relations.get(id);
            if (r != null)
                sb.append(new RelationRecord(r.name(), List.of(nameOf(r.targetId(), nodes)), r.adjective(),
                        r.adverb(), r.quantifier(), r.modality()).toCnl()).append('\n');
        }
    }

    private static String stateLine(StateRecord.Phase phase, List<StateEntry> entries, Map<String, PolyNode> nodes) {
        List<StateRecord.Term> terms = new ArrayList<>(entries.size());
        for (StateEntry e : entries) {
            List<StateRecord.Operand> operands = new ArrayList<>();
            for (StateRef ref : e.refs())
                operands.add(new StateRecord.Operand(nameOf(ref.nodeId(), nodes), ref.morphKey()));
            LogicalOperatorNode.Operator op = e instanceof LogicalOperatorNode l ? l.operator() : null;
            terms.add(new StateRecord.Term(op, operands));
        }
        return new StateRecord(phase, terms).toCnl();
    }

    private static NodeName nameOf(String nodeId, Map<String, PolyNode> nodes) {
        PolyNode n = nodes.get(nodeId);
        return n == null ? new NodeName(null, nodeId) : new NodeName(n.getQualifier(), n.getName());
    }
}
