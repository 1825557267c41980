package com.ndf.cnl.engine;

import com.ndf.cnl.io.AttributeRecord;
import com.ndf.cnl.io.NodeName;
import com.ndf.cnl.io.RelationRecord;
import com.ndf.cnl.io.StateRecord;
import com.ndf.cnl.io.Statement;
import com.ndf.cnl.io.StructuralTree;
import com.ndf.cnl.model.AttributeValue;
import com.ndf.cnl.model.LogicalOperatorNode;
import com.ndf.cnl.model.Morph;
import com.ndf.cnl.model.MorphDef;
import com.ndf.cnl.model.NodeDef;
import com.ndf.cnl.model.RelationEdge;
import com.ndf.cnl.model.StateEntry;
import com.ndf.cnl.model.StateRef;
import com.ndf.cnl.model.TransitionNode;
import com.ndf.cnl.util.Slugs;

import java.util.ArrayList;
import java.util.List;

import lombok.extern.log4j.Log4j2;

/**
 * Derives stable ids from CNL content.
 *
 * <p>
 * An id depends only on the fields that identify a fact, never on its position
 * in the text, so an unchanged line keeps its id across submissions:
 *
 * <pre>
 * node        qualifier_base
 * morph       nodeId:morphKey
 * relation    sourceId:morphKey/name/adjective/quantifier/modality/targetId
 * attribute   nodeId:morphKey/name/qualifier/quantifier/modality
 * transition  nodeId/transition
 * </pre>
 *
 * Empty slots are written as {@value Slugs#EMPTY}. Attribute values, units and
 * adverbs are not part of the id: changing them updates the attribute.
 */
@Log4j2
public final class IdentityResolver {

    private IdentityResolver() {
        // Utility class
    }

    // ── Id functions ────────────────────────────────────────────────

    public static String nodeId(String qualifier, String base) {
        String q = Slugs.slug(qualifier);
        String b = Slugs.slug(base);
        return q.isEmpty() ? b : q + "_" + b;
    }

    public static String nodeId(NodeName name) {
        return nodeId(name.qualifier(), name.base());
    }

    public static String morphId(String nodeId, String morphName) {
        return Morph.idOf(nodeId, Slugs.slug(morphName));
    }

    public static String relationId(String sourceId, String morphKey, String name, String adjective,
            String quantifier, String modality, String targetId) {
        return String.join("/", Morph.idOf(sourceId, morphKey), Slugs.slot(name), Slugs.slot(adjective),
                Slugs.slot(quantifier), Slugs.slot(modality), targetId);
    }

    public static String attributeId(String nodeId, String morphKey, String name, String qualifier,
            String quantifier, String modality) {
        return String.join("/", Morph.idOf(nodeId, morphKey), Slugs.slot(name), Slugs.slot(qualifier),
                Slugs.slot(quantifier), Slugs.slot(modality));
    }

    public static String transitionId(String nodeId) {
        return TransitionNode.idOf(nodeId);
    }

    // ── Tree resolution ─────────────────────────────────────────────

    /**
     * Resolves every block of {@code tree} into id-keyed definitions. Relation
     * targets that no heading declares become implicit nodes.
     */
    public static ResolvedGraph resolve(StructuralTree tree) {
        ResolvedGraph g = new ResolvedGraph();

        // Declared nodes first so an implicit target never shadows a later heading
        for (StructuralTree.NodeBlock block : tree.getNodes()) {
            NodeName name = block.getHeading().name();
            g.getNodes().put(block.getId(), new NodeDef(block.getId(), name.base(), name.qualifier(),
                    block.getHeading().type(), block.getDescription(), true));
            g.getLines().put(block.getId(), block.getLine());
        }

        for (StructuralTree.NodeBlock block : tree.getNodes()) {
            String nodeId = block.getId();
            List<StateEntry> prior = new ArrayList<>();
            List<StateEntry> post = new ArrayList<>();
            int transitionLine = 0;

            for (StructuralTree.ContentLine cl : block.getContent()) {
                if (cl.statement() instanceof StateRecord s) {
                    if (transitionLine == 0)
                        transitionLine = cl.line();
                    (s.phase() == StateRecord.Phase.PRIOR ? prior : post).addAll(stateEntries(s));
                } else {
                    resolveStatement(g, nodeId, Morph.BASIC, cl);
                }
            }
            for (StructuralTree.MorphBlock mb : block.getMorphs()) {
                MorphDef md = new MorphDef(nodeId, mb.getKey(), mb.getName(), mb.getDescription());
                g.getMorphs().put(md.id(), md);
                g.getLines().put(md.id(), mb.getLine());
                for (StructuralTree.ContentLine cl : mb.getContent())
                    resolveStatement(g, nodeId, mb.getKey(), cl);
            }
            if (transitionLine > 0) {
                TransitionNode t = new TransitionNode(transitionId(nodeId), nodeId, prior, post);
                g.getTransitions().put(t.id(), t);
                g.getLines().put(t.id(), transitionLine);
            }
        }
        log.debug("Resolved {} node(s), {} morph(s), {} relation(s), {} attribute(s), {} transition(s)",
                g.getNodes().size(), g.getMorphs().size(), g.getRelations().size(), g.getAttributes().size(),
                g.getTransitions().size());
        return g;
    }

    private static void resolveStatement(ResolvedGraph g, String nodeId, String morphKey,
            StructuralTree.ContentLine cl) {
        Statement st = cl.statement();
        if (st instanceof RelationRecord r) {
            for (NodeName target : r.targets()) {
                String targetId = nodeId(target);
                if (!g.getNodes().containsKey(targetId)) {
                    g.getNodes().put(targetId, NodeDef.implicit(targetId, target.base(), target.qualifier()));
                    g.getLines().put(targetId, cl.line());
                }
                String id = relationId(nodeId, morphKey, r.name(), r.adjective(), r.quantifier(), r.modality(),
                        targetId);
                g.getRelations().put(id, new RelationEdge(id, r.name(), nodeId, targetId, morphKey,
                        r.adjective(), r.adverb(), r.quantifier(), r.modality()));
                g.getLines().putIfAbsent(id, cl.line());
            }
        } else if (st instanceof AttributeRecord a) {
            String id = attributeId(nodeId, morphKey, a.name(), a.qualifier(), a.quantifier(), a.modality());
            AttributeValue v = new AttributeValue(id, nodeId, a.name(), a.value(), a.unit(), morphKey,
                    a.qualifier(), a.quantifier(), a.adverb(), a.modality());
            AttributeValue previous = g.getAttributes().put(id, v);
            if (previous != null && !previous.equals(v))
                log.warn("Attribute {} declared twice (lines {} and {}), keeping '{}'", id, g.line(id), cl.line(),
                        a.value());
            g.getLines().put(id, cl.line());
        }
    }

    private static List<StateEntry> stateEntries(StateRecord s) {
        List<StateEntry> entries = new ArrayList<>(s.terms().size());
        for (StateRecord.Term term : s.terms()) {
            List<StateRef> refs = new ArrayList<>(term.operands().size());
            for (StateRecord.Operand op : term.operands())
                refs.add(new StateRef(nodeId(op.node()), op.morph() == null ? null : Slugs.slug(op.morph())));
            if (term.operator() == null)
                entries.add(refs.get(0));
            else
                entries.add(new LogicalOperatorNode(term.operator(), refs));
        }
        return entries;
    }
}
