package com.ndf.cnl.engine;

import com.ndf.cnl.api.EntityKind;
import com.ndf.cnl.api.GraphStore;
import com.ndf.cnl.api.SchemaPolicy;
import com.ndf.cnl.api.StoreResult;
import com.ndf.cnl.error.CnlException;
import com.ndf.cnl.error.CompileError;
import com.ndf.cnl.error.ErrorKind;
import com.ndf.cnl.error.UnresolvedReferenceException;
import com.ndf.cnl.model.AttributeValue;
import com.ndf.cnl.model.GraphModel;
import com.ndf.cnl.model.Morph;
import com.ndf.cnl.model.MorphDef;
import com.ndf.cnl.model.NodeDef;
import com.ndf.cnl.model.PolyNode;
import com.ndf.cnl.model.RelationEdge;
import com.ndf.cnl.model.TransitionNode;

import java.util.ArrayList;
import java.util.List;

import lombok.extern.log4j.Log4j2;

/**
 * Applies an ordered operation list to a {@link GraphModel}.
 *
 * <p>
 * Each operation is applied on its own: a failure is recorded in the audit and
 * the pass continues. Once every operation has been tried, the applied ones are
 * handed to the {@link GraphStore} in a single batch and any operation the
 * store refuses is marked failed in the audit. The in-memory model is not
 * rolled back for store refusals.
 */
@Log4j2
public final class OperationApplier {
    private final GraphModel model;
    private final SchemaPolicy schema;
    private final GraphStore store;

    /**
     * @param store may be null, in which case nothing is persisted
     */
    public OperationApplier(GraphModel model, SchemaPolicy schema, GraphStore store) {
        if (model == null || schema == null)
            throw new IllegalArgumentException("model and schema are required");
        this.model = model;
        this.schema = schema;
        this.store = store;
    }

    /**
     * Applies {@code ops} in the given order.
     *
     * @return one audit entry per operation, plus one extra {@code DELETE_NODE}
     *         entry for every node removed because its last morph went
     */
    public List<AuditEntry> apply(List<Operation> ops) {
        List<AuditEntry> audit = new ArrayList<>(ops.size());
        List<Operation> applied = new ArrayList<>(ops.size());
        List<Integer> auditIndex = new ArrayList<>(ops.size());

        for (Operation op : ops) {
            try {
                Operation derived = applyOne(op);
                audit.add(AuditEntry.applied(op));
                applied.add(op);
                auditIndex.add(audit.size() - 1);
                if (derived != null) {
                    audit.add(new AuditEntry(OpType.DELETE_NODE, derived.entityId(), AuditEntry.Status.APPLIED,
                            new CompileError(ErrorKind.ORPHAN_MORPH_DELETION, op.line(), derived.entityId(),
                                    "last morph removed"),
                            op.line()));
                    applied.add(derived);
                    auditIndex.add(audit.size() - 1);
                }
                log.debug("Applied {}", op);
            } catch (CnlException e) {
                CompileError err = e.toError();
                if (err.line() == 0)
                    err = err.withLine(op.line());
                log.warn("Failed {}: {}", op, err.message());
                audit.add(AuditEntry.failed(op, err));
            }
        }

        if (store != null && !applied.isEmpty())
            persist(applied, auditIndex, audit);
        return audit;
    }

    /** @return a derived node deletion, or null */
    private Operation applyOne(Operation op) {
        switch (op.type()) {
            case ADD_NODE:
                model.putNode((NodeDef) op.payload());
                return null;
            case UPDATE_NODE:
                model.updateNode((NodeDef) op.payload());
                return null;
            case DELETE_NODE:
                model.removeNode(op.entityId());
                return null;

            case ADD_MORPH:
                model.addMorph((MorphDef) op.payload());
                return null;
            case UPDATE_MORPH:
                model.updateMorph((MorphDef) op.payload());
                return null;
            case DELETE_MORPH: {
                Morph m = model.morph(op.entityId());
                PolyNode owner = m == null ? null : model.node(m.getNodeId());
                if (model.removeMorph(op.entityId())) {
                    log.info("Removed node {}: last morph {} removed", owner.getId(), op.entityId());
                    return new Operation(OpType.DELETE_NODE, owner.getId(), new NodeDef(owner.getId(),
                            owner.getName(), owner.getQualifier(), owner.getType(), owner.getDescription(),
                            owner.isDeclared()), op.line());
                }
                return null;
            }

            case ADD_RELATION:
            case UPDATE_RELATION: {
                RelationEdge r = (RelationEdge) op.payload();
                schema.admit(EntityKind.RELATION, r.name(), op.entityId(), op.line());
                model.putRelation(r);
                return null;
            }
            case DELETE_RELATION:
                requireRemoved(model.removeRelation(op.entityId()), op);
                return null;

            case ADD_ATTRIBUTE:
            case UPDATE_ATTRIBUTE: {
                AttributeValue a = (AttributeValue) op.payload();
                schema.admit(EntityKind.ATTRIBUTE, a.name(), op.entityId(), op.line());
                model.putAttribute(a);
                return null;
            }
            case DELETE_ATTRIBUTE:
                requireRemoved(model.removeAttribute(op.entityId()), op);
                return null;

            case ADD_TRANSITION:
            case UPDATE_TRANSITION:
                model.putTransition((TransitionNode) op.payload());
                return null;
            case DELETE_TRANSITION:
                requireRemoved(model.removeTransition(op.entityId()), op);
                return null;

            default:
                throw new IllegalArgumentException("Unknown operation type: " + op.type());
        }
    }

    private static void requireRemoved(boolean removed, Operation op) {
        if (!removed)
            throw new UnresolvedReferenceException(op.line(), op.entityId(), op.entityId());
    }

    private void persist(List<Operation> applied, List<Integer> auditIndex, List<AuditEntry> audit) {
        List<StoreResult> results = store.batchApply(applied);
        if (results == null || results.size() != applied.size())
            log.error("Store returned {} result(s) for {} operation(s)", results == null ? 0 : results.size(),
                    applied.size());
        int failures = 0;
        for (int i = 0; i < applied.size(); i++) {
            StoreResult r = results != null && i < results.size() ? results.get(i)
                    : StoreResult.failed(applied.get(i).entityId(), "no result from store");
            if (r.success())
                continue;
            int at = auditIndex.get(i);
            AuditEntry e = audit.get(at);
            audit.set(at, new AuditEntry(e.op(), e.entityId(), AuditEntry.Status.FAILED,
                    new CompileError(ErrorKind.STORE_FAILURE, e.line(), e.entityId(), r.error()), e.line()));
            failures++;
        }
        if (failures > 0)
            log.warn("Store refused {} of {} operation(s)", failures, applied.size());
    }
}
