package com.ndf.cnl.engine;

import com.ndf.cnl.api.EntityKind;
import com.ndf.cnl.error.CompileError;
import com.ndf.cnl.error.UnresolvedReferenceException;
import com.ndf.cnl.model.Morph;
import com.ndf.cnl.model.StateRef;
import com.ndf.cnl.model.TransitionNode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

import lombok.extern.log4j.Log4j2;

/**
 * Compares two resolved graphs by id and emits the operations that turn the
 * first into the second.
 *
 * <p>
 * An id present only in the previous graph is deleted, an id present only in
 * the new graph is added, and an id present in both with a different
 * definition is updated. Unchanged entities produce nothing, so resubmitting
 * the same text yields an empty list.
 *
 * <p>
 * Transitions whose state references would not exist after the submission
 * (not in the new graph, and not already known to the live graph or store) are
 * dropped and reported instead of emitted.
 */
@Log4j2
public final class DiffEngine {

    public DiffResult diff(ResolvedGraph previous, ResolvedGraph next) {
        return diff(previous, next, id -> false);
    }

    /**
     * @param existing answers whether an id already exists outside the two
     *                 graphs, in the live model or the store
     */
    public DiffResult diff(ResolvedGraph previous, ResolvedGraph next, Predicate<String> existing) {
        List<CompileError> errors = new ArrayList<>();
        ResolvedGraph target = dropUnresolved(previous, next, existing, errors);

        List<Operation> ops = new ArrayList<>();
        compare(EntityKind.NODE, previous.getNodes(), target.getNodes(), target, ops);
        compare(EntityKind.MORPH, previous.getMorphs(), target.getMorphs(), target, ops);
        compare(EntityKind.RELATION, previous.getRelations(), target.getRelations(), target, ops);
        compare(EntityKind.ATTRIBUTE, previous.getAttributes(), target.getAttributes(), target, ops);
        compare(EntityKind.TRANSITION, previous.getTransitions(), target.getTransitions(), target, ops);

        List<Operation> ordered = OperationOrder.sort(ops);
        log.info("Diff: {} operation(s), {} unresolved reference(s)", ordered.size(), errors.size());
        return new DiffResult(ordered, errors);
    }

    private static <T> void compare(EntityKind kind, Map<String, T> before, Map<String, T> after,
            ResolvedGraph target, List<Operation> out) {
        for (Map.Entry<String, T> e : before.entrySet()) {
            if (!after.containsKey(e.getKey()))
                out.add(new Operation(OpType.of(OpType.Action.DELETE, kind), e.getKey(), e.getValue(), 0));
        }
        for (Map.Entry<String, T> e : after.entrySet()) {
            String id = e.getKey();
            T old = before.get(id);
            if (old == null)
                out.add(new Operation(OpType.of(OpType.Action.ADD, kind), id, e.getValue(), target.line(id)));
            else if (!Objects.equals(old, e.getValue()))
                out.add(new Operation(OpType.of(OpType.Action.UPDATE, kind), id, e.getValue(), target.line(id)));
        }
    }

    // ── Reference checks ────────────────────────────────────────────

    private static ResolvedGraph dropUnresolved(ResolvedGraph previous, ResolvedGraph next,
            Predicate<String> existing, List<CompileError> errors) {
        Set<String> dropped = new HashSet<>();
        for (TransitionNode t : next.getTransitions().values()) {
            for (StateRef ref : t.references()) {
                String id = ref.morphKey() == null || ref.morphKey().equals(Morph.BASIC) ? ref.nodeId()
                        : ref.morphId();
                if (!existsAfter(id, previous, next, existing)) {
                    UnresolvedReferenceException e = new UnresolvedReferenceException(next.line(t.id()), t.id(), id);
                    log.warn(e.getMessage());
                    errors.add(e.toError());
                    dropped.add(t.id());
                    break;
                }
            }
        }
        return dropped.isEmpty() ? next : next.retain(id -> !dropped.contains(id));
    }

    private static boolean existsAfter(String id, ResolvedGraph previous, ResolvedGraph next,
            Predicate<String> existing) {
        if (next.contains(id))
            return true;
        // present before and absent now means this submission deletes it
        return !previous.contains(id) && existing.test(id);
    }
}
