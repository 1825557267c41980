package com.ndf.cnl.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;
import java.util.function.Predicate;

/**
 * One entry of a transition's prior or post state: either a plain node
 * reference or a logical combination of references.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = StateRef.class, name = "ref"),
        @JsonSubTypes.Type(value = LogicalOperatorNode.class, name = "logic")
})
public interface StateEntry {

    /** Every node reference this entry mentions. */
    List<StateRef> refs();

    /** Evaluates this entry given which references are currently active. */
    boolean isSatisfied(Predicate<StateRef> active);
}
