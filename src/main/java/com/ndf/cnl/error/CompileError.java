package com.ndf.cnl.error;

/**
 * A problem reported alongside partial results.
 *
 * @param kind     category of the problem
 * @param line     1-based source line, or 0 when no line applies
 * @param entityId affected entity, if any
 * @param message  human-readable description
 */
public record CompileError(ErrorKind kind, int line, String entityId, String message) {

    public CompileError withLine(int newLine) {
        return new CompileError(kind, newLine, entityId, message);
    }
}
