package com.ndf.cnl.error;

import lombok.Getter;

/**
 * Base class for problems the compiler detects in a submission.
 *
 * <p>
 * These are thrown where the problem is found and caught per line or per
 * operation, so a single bad line never aborts the whole submission.
 */
@Getter
public abstract class CnlException extends RuntimeException {
    private final ErrorKind kind;
    private final int line;
    private final String entityId;

    protected CnlException(ErrorKind kind, int line, String entityId, String message) {
        super(message);
        this.kind = kind;
        this.line = line;
        this.entityId = entityId;
    }

    /** Converts this exception into the report form returned to callers. */
    public CompileError toError() {
        return new CompileError(kind, line, entityId, getMessage());
    }
}
