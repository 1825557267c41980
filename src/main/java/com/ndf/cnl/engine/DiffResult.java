package com.ndf.cnl.engine;

import com.ndf.cnl.error.CompileError;

import java.util.List;

/**
 * Operations that turn one resolved graph into another, plus the connectors
 * that were dropped because a reference would not exist afterwards.
 */
public record DiffResult(List<Operation> operations, List<CompileError> errors) {

    public DiffResult {
        operations = List.copyOf(operations);
        errors = List.copyOf(errors);
    }

    public boolean isEmpty() {
        return operations.isEmpty();
    }
}
