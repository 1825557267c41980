package com.ndf.cnl.engine;

import com.ndf.cnl.api.EntityKind;

import java.util.Locale;

/**
 * Every mutation a compilation can emit.
 *
 * <p>
 * Node and morph operations are container-tier: they create or remove the
 * places connectors attach to. Relation, attribute and transition operations
 * are connector-tier.
 */
public enum OpType {
    ADD_NODE(Action.ADD, EntityKind.NODE),
    UPDATE_NODE(Action.UPDATE, EntityKind.NODE),
    DELETE_NODE(Action.DELETE, EntityKind.NODE),

    ADD_MORPH(Action.ADD, EntityKind.MORPH),
    UPDATE_MORPH(Action.UPDATE, EntityKind.MORPH),
    DELETE_MORPH(Action.DELETE, EntityKind.MORPH),

    ADD_RELATION(Action.ADD, EntityKind.RELATION),
    UPDATE_RELATION(Action.UPDATE, EntityKind.RELATION),
    DELETE_RELATION(Action.DELETE, EntityKind.RELATION),

    ADD_ATTRIBUTE(Action.ADD, EntityKind.ATTRIBUTE),
    UPDATE_ATTRIBUTE(Action.UPDATE, EntityKind.ATTRIBUTE),
    DELETE_ATTRIBUTE(Action.DELETE, EntityKind.ATTRIBUTE),

    ADD_TRANSITION(Action.ADD, EntityKind.TRANSITION),
    UPDATE_TRANSITION(Action.UPDATE, EntityKind.TRANSITION),
    DELETE_TRANSITION(Action.DELETE, EntityKind.TRANSITION);

    public enum Action {
        ADD, UPDATE, DELETE
    }

    public enum Tier {
        CONTAINER, CONNECTOR
    }

    private final Action action;
    private final EntityKind kind;

    OpType(Action action, EntityKind kind) {
        this.action = action;
        this.kind = kind;
    }

    public Action action() {
        return action;
    }

    public EntityKind kind() {
        return kind;
    }

    public Tier tier() {
        return kind == EntityKind.NODE || kind == EntityKind.MORPH ? Tier.CONTAINER : Tier.CONNECTOR;
    }

    public boolean isDelete() {
        return action == Action.DELETE;
    }

    public static OpType of(Action action, EntityKind kind) {
        return valueOf(action.name() + "_" + kind.name());
    }

    /** Lower camel-case name, e.g. {@code addRelation}. */
    public String label() {
        String k = kind.name();
        return action.name().toLowerCase(Locale.ROOT) + k.charAt(0) + k.substring(1).toLowerCase(Locale.ROOT);
    }
}
