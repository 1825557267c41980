package com.ndf.cnl.engine;

import com.ndf.cnl.io.CnlParser;
import com.ndf.cnl.model.AttributeValue;
import com.ndf.cnl.model.LogicalOperatorNode;
import com.ndf.cnl.model.NodeDef;
import com.ndf.cnl.model.RelationEdge;
import com.ndf.cnl.model.StateRef;
import com.ndf.cnl.model.TransitionNode;
import org.junit.Test;

import static org.junit.Assert.*;

public class IdentityResolverTest {

    private static ResolvedGraph resolve(String... lines) {
        return IdentityResolver.resolve(new CnlParser().parse(String.join("\n", lines)));
    }

    @Test
    public void testIdFunctions() {
        assertEquals("hydrogen", IdentityResolver.nodeId(null, "Hydrogen"));
        assertEquals("female_mathematician", IdentityResolver.nodeId("female", "Mathematician"));
        assertEquals("hydrogen_ion", IdentityResolver.nodeId(null, "  Hydrogen   ion "));
        assertEquals("hydrogen:hydrogen_ion", IdentityResolver.morphId("hydrogen", "Hydrogen ion"));
        assertEquals("hydrogen:basic/part_of/-/-/-/water",
                IdentityResolver.relationId("hydrogen", "basic", "part of", null, null, null, "water"));
        assertEquals("a:m/likes/strong/two/usually/b",
                IdentityResolver.relationId("a", "m", "likes", "strong", "two", "usually", "b"));
        assertEquals("hydrogen:basic/number_of_protons/-/-/-",
                IdentityResolver.attributeId("hydrogen", "basic", "number of protons", null, null, null));
        assertEquals("combustion/transition", IdentityResolver.transitionId("combustion"));
    }

    @Test
    public void testRelationTargetsBecomeImplicitNodes() {
        ResolvedGraph g = resolve("# Hydrogen", "<part of> Water, Ocean;", "# Water");

        NodeDef water = g.getNodes().get("water");
        assertTrue(water.declared());
        NodeDef ocean = g.getNodes().get("ocean");
        assertNotNull(ocean);
        assertFalse(ocean.declared());
        assertEquals("Ocean", ocean.name());
        assertEquals(2, g.line("ocean"));

        assertEquals(2, g.getRelations().size());
        RelationEdge r = g.getRelations().get("hydrogen:basic/part_of/-/-/-/ocean");
        assertEquals("hydrogen", r.sourceId());
        assertEquals("ocean", r.targetId());
        assertEquals("basic", r.morphRef());
    }

    @Test
    public void testMorphScopesItsConnectors() {
        ResolvedGraph g = resolve("# Hydrogen", "## Hydrogen ion", "<part of> Water;", "has charge: +1;");
        assertTrue(g.getMorphs().containsKey("hydrogen:hydrogen_ion"));
        assertTrue(g.getRelations().containsKey("hydrogen:hydrogen_ion/part_of/-/-/-/water"));
        AttributeValue a = g.getAttributes().get("hydrogen:hydrogen_ion/charge/-/-/-");
        assertEquals("hydrogen_ion", a.morphRef());
        assertEquals("hydrogen:hydrogen_ion", a.morphId());
    }

    @Test
    public void testSameFactTwiceCollides() {
        ResolvedGraph g = resolve("# A", "<likes> B;", "<likes> B;", "<likes> B [sometimes];", "<likes> *two* B;");
        assertEquals(3, g.getRelations().size());
        assertEquals(2, g.line("a:basic/likes/-/-/-/b"));
    }

    @Test
    public void testAttributeValueIsNotPartOfId() {
        ResolvedGraph before = resolve("# A", "has weight: 3 *kg*;");
        ResolvedGraph after = resolve("# A", "has weight: ++about++ 4 *lb*;");
        assertEquals(before.getAttributes().keySet(), after.getAttributes().keySet());
        assertEquals("4", after.getAttributes().get("a:basic/weight/-/-/-").value());
    }

    @Test
    public void testLastAttributeDeclarationWins() {
        ResolvedGraph g = resolve("# A", "has colour: red;", "# A", "has colour: blue;");
        assertEquals(1, g.getAttributes().size());
        assertEquals("blue", g.getAttributes().get("a:basic/colour/-/-/-").value());
        assertEquals(4, g.line("a:basic/colour/-/-/-"));
    }

    @Test
    public void testTransitionResolution() {
        ResolvedGraph g = resolve("# Combustion [Transition]",
                "priorState: Hydrogen:basic, Oxygen:Basic, Spark|Flame",
                "postState: Water");

        TransitionNode t = g.getTransitions().get("combustion/transition");
        assertNotNull(t);
        assertEquals(2, g.line(t.id()));
        assertEquals(3, t.priorState().size());
        assertEquals(new StateRef("hydrogen", "basic"), t.priorState().get(0));
        assertEquals(new StateRef("oxygen", "basic"), t.priorState().get(1));

        LogicalOperatorNode or = (LogicalOperatorNode) t.priorState().get(2);
        assertEquals(LogicalOperatorNode.Operator.OR, or.operator());
        assertEquals(StateRef.of("spark"), or.operands().get(0));
        assertEquals(StateRef.of("flame"), or.operands().get(1));

        assertEquals(1, t.postState().size());
        // state references do not create nodes
        assertFalse(g.getNodes().containsKey("water"));
    }

    @Test
    public void testContainsBasicMorph() {
        ResolvedGraph g = resolve("# A");
        assertTrue(g.contains("a"));
        assertTrue(g.contains("a:basic"));
        assertFalse(g.contains("a:other"));
        assertFalse(g.contains("b:basic"));
    }

    @Test
    public void testRetain() {
        ResolvedGraph g = resolve("# A", "<likes> B;");
        ResolvedGraph kept = g.retain(id -> !id.contains("/"));
        assertEquals(2, kept.getNodes().size());
        assertTrue(kept.getRelations().isEmpty());
        assertEquals(0, kept.line("a:basic/likes/-/-/-/b"));
    }
}
