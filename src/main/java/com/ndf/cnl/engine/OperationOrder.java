package com.ndf.cnl.engine;

import com.ndf.cnl.api.EntityKind;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;

import lombok.extern.log4j.Log4j2;

/**
 * Dependency-ordered operation list.
 *
 * <p>
 * Each operation is a vertex; an edge {@code a -> b} means {@code a} must be
 * applied before {@code b}. Edges come from {@link Operation#references()}:
 * <ul>
 * <li>an add or update runs after the add or update of everything it
 * references (node before relation, morph before its attributes)</li>
 * <li>a delete runs before the delete of everything it references (relation
 * before the morph and node it hangs off)</li>
 * </ul>
 * Independent operations are ordered by {@link #rank(OpType)} and then by the
 * order they were added, so the same input always sorts the same way.
 */
@Log4j2
public final class OperationOrder {
    private final List<Operation> ordered;

    private OperationOrder(List<Operation> ordered) {
        this.ordered = ordered;
    }

    public List<Operation> operations() {
        return ordered;
    }

    public int size() {
        return ordered.size();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Shorthand for {@code builder().addAll(ops).build().operations()}. */
    public static List<Operation> sort(Collection<Operation> ops) {
        return builder().addAll(ops).build().operations();
    }

    /**
     * Tie-break rank: connector deletes, morph deletes, node deletes, node
     * adds and updates, morph adds and updates, connector adds and updates.
     */
    public static int rank(OpType type) {
        boolean delete = type.isDelete();
        if (type.tier() == OpType.Tier.CONNECTOR)
            return delete ? 0 : 5;
        if (type.kind() == EntityKind.NODE)
            return delete ? 2 : 3;
        return delete ? 1 : 4;
    }

    /**
     * Builder for the operation order. Handles dependency discovery and cycle
     * detection.
     */
    public static final class Builder {
        private final List<Operation> ops = new ArrayList<>();
        private final Map<String, Integer> idToIdx = new HashMap<>();
        private final Map<Integer, List<Integer>> forwardEdges = new HashMap<>();

        public Builder add(Operation op) {
            if (idToIdx.containsKey(op.entityId()))
                throw new IllegalArgumentException("Duplicate operation for " + op.entityId());
            int idx = ops.size();
            ops.add(op);
            idToIdx.put(op.entityId(), idx);
            forwardEdges.put(idx, new ArrayList<>());
            return this;
        }

        public Builder addAll(Collection<Operation> all) {
            for (Operation op : all)
                add(op);
            return this;
        }

        /** Forces the operation on {@code before} to run ahead of the one on {@code after}. */
        public Builder addEdge(String before, String after) {
            if (before.equals(after))
                throw new IllegalArgumentException("Self-edge not allowed: " + before);
            forwardEdges.get(requireIndex(before)).add(requireIndex(after));
            return this;
        }

        private int requireIndex(String entityId) {
            Integer idx = idToIdx.get(entityId);
            if (idx == null)
                throw new IllegalArgumentException("No operation for " + entityId);
            return idx;
        }

        /**
         * Sorts the operations.
         * <p>
         * Kahn's algorithm with a priority queue in place of the plain FIFO.
         */
        public OperationOrder build() {
            int n = ops.size();

            // 1. Derive edges from references
            for (int i = 0; i < n; i++) {
                Operation op = ops.get(i);
                for (String ref : op.references()) {
                    Integer j = idToIdx.get(ref);
                    if (j == null || j == i)
                        continue;
                    Operation dep = ops.get(j);
                    if (op.type().isDelete() && dep.type().isDelete())
                        forwardEdges.get(i).add(j);
                    else if (!op.type().isDelete() && !dep.type().isDelete())
                        forwardEdges.get(j).add(i);
                }
            }

            // 2. In-degrees
            int[] inDegree = new int[n];
            for (List<Integer> children : forwardEdges.values())
                for (int child : children)
                    inDegree[child]++;

            // 3. Kahn's algorithm, lowest (rank, position) first
            PriorityQueue<Integer> ready = new PriorityQueue<>(
                    Comparator.<Integer>comparingInt(i -> rank(ops.get(i).type())).thenComparingInt(i -> i));
            for (int i = 0; i < n; i++)
                if (inDegree[i] == 0)
                    ready.add(i);

            List<Operation> sorted = new ArrayList<>(n);
            while (!ready.isEmpty()) {
                int curr = ready.poll();
                sorted.add(ops.get(curr));
                for (int child : forwardEdges.get(curr))
                    if (--inDegree[child] == 0)
                        ready.add(child);
            }
            if (sorted.size() != n)
                throw new IllegalStateException("Cycle detected! Ordered " + sorted.size() + " of " + n);
            log.debug("Ordered {} operation(s)", n);
            return new OperationOrder(sorted);
        }
    }
}
