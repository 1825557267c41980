package com.ndf.cnl.api;

/**
 * Outcome of one operation inside a {@link GraphStore#batchApply} call.
 *
 * @param entityId the entity the operation touched
 * @param success  whether the store accepted the operation
 * @param error    reason for refusal, null on success
 */
public record StoreResult(String entityId, boolean success, String error) {

    public static StoreResult ok(String entityId) {
        return new StoreResult(entityId, true, null);
    }

    public static StoreResult failed(String entityId, String error) {
        return new StoreResult(entityId, false, error);
    }
}
