package com.ndf.cnl;

import com.ndf.cnl.engine.AuditEntry;
import com.ndf.cnl.engine.Operation;
import com.ndf.cnl.error.CompileError;
import com.ndf.cnl.error.ErrorKind;
import com.ndf.cnl.io.TreeSnapshot;
import com.ndf.cnl.model.GraphSnapshot;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Everything one submission produced.
 *
 * @param operations ordered operations the diff emitted
 * @param audit      one entry per applied or failed operation
 * @param errors     parse errors, dropped connectors and failed operations
 * @param snapshot   the graph after the submission
 * @param tree       structural tree of the submission, to pass as
 *                   {@code previous} next time
 */
public record CompilationResult(
        List<Operation> operations,
        List<AuditEntry> audit,
        List<CompileError> errors,
        GraphSnapshot snapshot,
        TreeSnapshot tree) {

    public CompilationResult {
        operations = List.copyOf(operations);
        audit = List.copyOf(audit);
        errors = List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public List<CompileError> errors(ErrorKind kind) {
        return errors.stream().filter(e -> e.kind() == kind).collect(Collectors.toList());
    }

    public long appliedCount() {
        return audit.stream().filter(AuditEntry::isApplied).count();
    }

    public long failedCount() {
        return audit.size() - appliedCount();
    }
}
