package com.ndf.cnl.engine;

import com.ndf.cnl.error.ErrorKind;
import com.ndf.cnl.io.CnlParser;
import org.junit.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.Assert.*;

public class DiffEngineTest {

    private final DiffEngine diff = new DiffEngine();

    private static ResolvedGraph resolve(String... lines) {
        return IdentityResolver.resolve(new CnlParser().parse(String.join("\n", lines)));
    }

    private static List<OpType> types(DiffResult r) {
        return r.operations().stream().map(Operation::type).collect(Collectors.toList());
    }

    @Test
    public void testIdenticalGraphsProduceNothing() {
        ResolvedGraph g = resolve("# Hydrogen [Element]", "has number of protons: 1;", "<part of> Water;");
        DiffResult r = diff.diff(g, resolve("# Hydrogen [Element]", "has number of protons: 1;", "<part of> Water;"));
        assertTrue(r.isEmpty());
        assertTrue(r.errors().isEmpty());
    }

    @Test
    public void testFirstSubmissionAddsEverything() {
        DiffResult r = diff.diff(ResolvedGraph.empty(), resolve("# Hydrogen", "has number of protons: 1;"));
        assertEquals(List.of(OpType.ADD_NODE, OpType.ADD_ATTRIBUTE), types(r));
        assertEquals(1, r.operations().get(0).line());
        assertEquals(2, r.operations().get(1).line());
    }

    @Test
    public void testValueChangeIsOneUpdate() {
        DiffResult r = diff.diff(resolve("# A", "has weight: 3 *kg*;"), resolve("# A", "has weight: 4 *kg*;"));
        assertEquals(List.of(OpType.UPDATE_ATTRIBUTE), types(r));
        assertEquals("a:basic/weight/-/-/-", r.operations().get(0).entityId());
    }

    @Test
    public void testHeadingTypeChangeUpdatesNode() {
        DiffResult r = diff.diff(resolve("# A"), resolve("# A [Thing]"));
        assertEquals(List.of(OpType.UPDATE_NODE), types(r));
    }

    @Test
    public void testMorphAddedWithNewTarget() {
        DiffResult r = diff.diff(resolve("# Hydrogen"), resolve("# Hydrogen", "## Hydrogen ion", "<part of> Water;"));
        assertEquals(List.of(OpType.ADD_NODE, OpType.ADD_MORPH, OpType.ADD_RELATION), types(r));
        assertEquals("water", r.operations().get(0).entityId());
        assertEquals("hydrogen:hydrogen_ion", r.operations().get(1).entityId());
    }

    @Test
    public void testRelationTargetingLaterHeadingStillOrdered() {
        // the relation is discovered before its target's heading
        DiffResult r = diff.diff(ResolvedGraph.empty(), resolve("# A", "<likes> B;", "# B"));
        List<String> ids = r.operations().stream().map(Operation::entityId).collect(Collectors.toList());
        assertTrue(ids.indexOf("b") < ids.indexOf("a:basic/likes/-/-/-/b"));
        assertTrue(ids.indexOf("a") < ids.indexOf("a:basic/likes/-/-/-/b"));
    }

    @Test
    public void testRemovingNodeDeletesEverythingItOwned() {
        ResolvedGraph before = resolve("# A", "<r> B;", "## M", "has x: 1;", "# B", "has y: 2;");
        DiffResult r = diff.diff(before, ResolvedGraph.empty());

        assertEquals(6, r.operations().size());
        for (Operation op : r.operations())
            assertTrue(op.type().isDelete());
        // connectors first, then morphs, then nodes
        assertEquals(OpType.DELETE_RELATION, r.operations().get(0).type());
        assertEquals(OpType.DELETE_ATTRIBUTE, r.operations().get(1).type());
        assertEquals(OpType.DELETE_ATTRIBUTE, r.operations().get(2).type());
        assertEquals(OpType.DELETE_MORPH, r.operations().get(3).type());
        assertEquals(OpType.DELETE_NODE, r.operations().get(4).type());
        assertEquals(OpType.DELETE_NODE, r.operations().get(5).type());
    }

    @Test
    public void testStillReferencedNodeBecomesImplicit() {
        DiffResult r = diff.diff(resolve("# A", "<r> B;", "# B", "has y: 2;"), resolve("# A", "<r> B;"));
        assertEquals(List.of(OpType.DELETE_ATTRIBUTE, OpType.UPDATE_NODE), types(r));
    }

    @Test
    public void testUnresolvedStateReferenceDropsTransition() {
        DiffResult r = diff.diff(ResolvedGraph.empty(),
                resolve("# Fuel", "# Burning [Transition]", "priorState: Fuel, Spark", "postState: Fuel"));
        assertEquals(List.of(OpType.ADD_NODE, OpType.ADD_NODE), types(r));
        assertEquals(1, r.errors().size());
        assertEquals(ErrorKind.UNRESOLVED_REFERENCE, r.errors().get(0).kind());
        assertEquals("burning/transition", r.errors().get(0).entityId());
        assertEquals(3, r.errors().get(0).line());
    }

    @Test
    public void testStateReferenceResolvedOutsideTheTree() {
        DiffResult r = diff.diff(ResolvedGraph.empty(),
                resolve("# Burning [Transition]", "priorState: Spark:hot"), id -> id.equals("spark:hot"));
        assertTrue(r.errors().isEmpty());
        assertEquals(List.of(OpType.ADD_NODE, OpType.ADD_TRANSITION), types(r));
    }

    @Test
    public void testReferenceDeletedInSameSubmissionIsUnresolved() {
        ResolvedGraph before = resolve("# Spark");
        ResolvedGraph after = resolve("# Burning [Transition]", "priorState: Spark");
        // the live graph still holds spark, but this submission removes it
        DiffResult r = diff.diff(before, after, id -> id.equals("spark"));
        assertEquals(1, r.errors().size());
        assertFalse(types(r).contains(OpType.ADD_TRANSITION));
    }

    @Test
    public void testNowUnresolvedTransitionIsDeleted() {
        ResolvedGraph before = resolve("# Spark", "# Burning [Transition]", "priorState: Spark");
        ResolvedGraph after = resolve("# Burning [Transition]", "priorState: Spark");
        DiffResult r = diff.diff(before, after);
        assertEquals(List.of(OpType.DELETE_TRANSITION, OpType.DELETE_NODE), types(r));
        assertEquals(1, r.errors().size());
    }
}
