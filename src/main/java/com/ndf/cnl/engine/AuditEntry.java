package com.ndf.cnl.engine;

import com.ndf.cnl.error.CompileError;

/**
 * Outcome of applying one operation.
 *
 * @param error why the operation failed, or an informational note for
 *              derived events; null otherwise
 */
public record AuditEntry(OpType op, String entityId, Status status, CompileError error, int line) {

    public enum Status {
        APPLIED, FAILED
    }

    public static AuditEntry applied(Operation op) {
        return new AuditEntry(op.type(), op.entityId(), Status.APPLIED, null, op.line());
    }

    public static AuditEntry failed(Operation op, CompileError error) {
        return new AuditEntry(op.type(), op.entityId(), Status.FAILED, error, op.line());
    }

    public boolean isApplied() {
        return status == Status.APPLIED;
    }
}
