package com.ndf.cnl.api;

import com.ndf.cnl.engine.Operation;

import java.util.List;

/**
 * Persistence collaborator for compiled graphs.
 *
 * <p>
 * The compiler issues exactly one {@link #batchApply} call per submission.
 * Whether the batch commits atomically is up to the implementation; the
 * compiler only relies on getting one result per operation, in order.
 */
public interface GraphStore {

    /**
     * Looks up a persisted entity.
     *
     * @return the entity, or null if the store has never seen the id or it was
     *         deleted
     */
    StoredEntity get(String id);

    /** Applies the operations in order and reports one result per operation. */
    List<StoreResult> batchApply(List<Operation> operations);
}
