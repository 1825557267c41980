package com.ndf.cnl.model;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * The process view of a transition node: what must hold before it fires and
 * what holds afterwards.
 *
 * @param id         transition id, {@code nodeId + "/transition"}
 * @param nodeId     id of the PolyNode that declares the transition
 * @param priorState preconditions, including trigger conditions
 * @param postState  outcomes
 */
public record TransitionNode(String id, String nodeId, List<StateEntry> priorState, List<StateEntry> postState) {

    public static final String SUFFIX = "/transition";

    public TransitionNode {
        priorState = List.copyOf(priorState);
        postState = List.copyOf(postState);
    }

    public static String idOf(String nodeId) {
        return nodeId + SUFFIX;
    }

    /** All references in prior and post state, in declaration order. */
    public List<StateRef> references() {
        List<StateRef> refs = new ArrayList<>();
        for (StateEntry e : priorState)
            refs.addAll(e.refs());
        for (StateEntry e : postState)
            refs.addAll(e.refs());
        return refs;
    }

    /** True when every prior-state entry is satisfied. */
    public boolean isTriggered(Predicate<StateRef> active) {
        for (StateEntry e : priorState)
            if (!e.isSatisfied(active))
                return false;
        return true;
    }
}
