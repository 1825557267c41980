package com.ndf.cnl.model;

import org.junit.Test;

import java.util.List;
import java.util.Set;

import static org.junit.Assert.*;

public class TransitionNodeTest {

    private final TransitionNode combustion = new TransitionNode("combustion/transition", "combustion",
            List.of(new StateRef("hydrogen", "basic"), new StateRef("oxygen", "basic"),
                    new LogicalOperatorNode(LogicalOperatorNode.Operator.OR,
                            List.of(StateRef.of("spark"), StateRef.of("flame")))),
            List.of(StateRef.of("water")));

    @Test
    public void testReferences() {
        assertEquals(5, combustion.references().size());
        assertEquals(StateRef.of("water"), combustion.references().get(4));
    }

    @Test
    public void testTriggerNeedsOneOfTheOrOperands() {
        Set<String> active = Set.of("hydrogen", "oxygen", "flame");
        assertTrue(combustion.isTriggered(r -> active.contains(r.nodeId())));

        Set<String> noIgnition = Set.of("hydrogen", "oxygen");
        assertFalse(combustion.isTriggered(r -> noIgnition.contains(r.nodeId())));
    }

    @Test
    public void testAndNeedsEveryOperand() {
        LogicalOperatorNode and = new LogicalOperatorNode(LogicalOperatorNode.Operator.AND,
                List.of(StateRef.of("fuel"), StateRef.of("air")));
        assertFalse(and.isSatisfied(r -> r.nodeId().equals("fuel")));
        assertTrue(and.isSatisfied(r -> true));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testOperatorNeedsTwoOperands() {
        new LogicalOperatorNode(LogicalOperatorNode.Operator.OR, List.of(StateRef.of("spark")));
    }
}
