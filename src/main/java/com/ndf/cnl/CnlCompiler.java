package com.ndf.cnl;

import com.ndf.cnl.api.GraphStore;
import com.ndf.cnl.api.SchemaLookup;
import com.ndf.cnl.api.SchemaPolicy;
import com.ndf.cnl.engine.AuditEntry;
import com.ndf.cnl.engine.DiffEngine;
import com.ndf.cnl.engine.DiffResult;
import com.ndf.cnl.engine.IdentityResolver;
import com.ndf.cnl.engine.OperationApplier;
import com.ndf.cnl.engine.ResolvedGraph;
import com.ndf.cnl.error.CompileError;
import com.ndf.cnl.io.CnlParser;
import com.ndf.cnl.io.CompilerConfig;
import com.ndf.cnl.io.StructuralTree;
import com.ndf.cnl.io.TreeSnapshot;
import com.ndf.cnl.model.GraphModel;
import com.ndf.cnl.schema.NameSetLookup;
import com.ndf.cnl.schema.OpenSchema;
import com.ndf.cnl.schema.StrictSchema;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Compiles CNL submissions into graph mutations.
 *
 * <p>
 * A submission goes through five stages:
 * <ol>
 * <li>parse the new text into a {@link StructuralTree}</li>
 * <li>resolve the previous and new trees into id-keyed definitions</li>
 * <li>diff them into operations and drop connectors with unresolved
 * references</li>
 * <li>order the operations by dependency</li>
 * <li>apply them to the graph model and hand the applied ones to the store in
 * one batch</li>
 * </ol>
 *
 * <p>
 * The compiler itself holds no per-graph state: the previous tree is always
 * passed in. {@link CnlGraph} keeps that state for callers that compile the
 * same graph repeatedly.
 */
public final class CnlCompiler {
    private static final Logger log = LogManager.getLogger(CnlCompiler.class);

    private final CompilerConfig config;
    private final SchemaLookup schema;
    private final GraphStore store;
    private final CnlParser parser;
    private final DiffEngine diffEngine = new DiffEngine();

    public CnlCompiler() {
        this(CompilerConfig.defaults(), null, null);
    }

    public CnlCompiler(CompilerConfig config) {
        this(config, null, null);
    }

    /**
     * @param config compiler settings
     * @param schema host schema, or null to use the names listed in
     *               {@code config}
     * @param store  persistence target, or null to keep results in memory only
     */
    public CnlCompiler(CompilerConfig config, SchemaLookup schema, GraphStore store) {
        this.config = config == null ? CompilerConfig.defaults() : config;
        this.schema = schema == null ? NameSetLookup.fromConfig(this.config) : schema;
        this.store = store;
        this.parser = new CnlParser(this.config.getTransitionType());
    }

    public CompilerConfig config() {
        return config;
    }

    public SchemaLookup schema() {
        return schema;
    }

    public CnlParser parser() {
        return parser;
    }

    public StructuralTree parse(String text) {
        return parser.parse(text);
    }

    /** Schema policy for a submission. */
    public SchemaPolicy policyFor(boolean strictMode) {
        return strictMode ? new StrictSchema(schema) : new OpenSchema(schema);
    }

    // ── Stateless entry points ──────────────────────────────────────

    /** Compiles a first submission, using the configured strict mode. */
    public CompilationResult compile(String newText) {
        return compile(TreeSnapshot.initial(), newText, config.isStrictMode());
    }

    public CompilationResult compile(String previousText, String newText, boolean strictMode) {
        return compile(new TreeSnapshot(0, parser.parse(previousText)), newText, strictMode);
    }

    /**
     * Compiles {@code newText} against {@code previous}. The graph the previous
     * tree describes is rebuilt in memory first, so the result's snapshot is
     * the complete graph after the submission.
     */
    public CompilationResult compile(TreeSnapshot previous, String newText, boolean strictMode) {
        return compile(previous, newText, replay(previous.tree()), policyFor(strictMode));
    }

    // ── Core ────────────────────────────────────────────────────────

    /**
     * Compiles {@code newText} against {@code previous} and applies the result
     * to {@code model}.
     *
     * <p>
     * Entities of the previous tree that {@code model} does not hold (lines that
     * failed last time) count as absent, so they are retried if still present.
     */
    public CompilationResult compile(TreeSnapshot previous, String newText, GraphModel model, SchemaPolicy policy) {
        StructuralTree tree = parser.parse(newText);
        ResolvedGraph before = IdentityResolver.resolve(previous.tree()).retain(model::contains);
        ResolvedGraph after = IdentityResolver.resolve(tree);

        DiffResult diff = diffEngine.diff(before, after, existing(model));
        model.setDescription(tree.getDescription());
        List<AuditEntry> audit = new OperationApplier(model, policy, store).apply(diff.operations());

        List<CompileError> errors = new ArrayList<>(tree.getErrors());
        errors.addAll(diff.errors());
        for (AuditEntry e : audit)
            if (!e.isApplied())
                errors.add(e.error());

        CompilationResult result = new CompilationResult(diff.operations(), audit, errors, model.snapshot(),
                previous.next(tree));
        log.info("Compiled version {} ({}): {} operation(s), {} applied, {} error(s)", result.tree().version(),
                policy.isStrict() ? "strict" : "open", result.operations().size(), result.appliedCount(),
                errors.size());
        return result;
    }

    /** Rebuilds the graph a tree describes in a fresh model, accepting every name. */
    GraphModel replay(StructuralTree tree) {
        GraphModel model = new GraphModel();
        if (tree.getNodes().isEmpty()) {
            model.setDescription(tree.getDescription());
            return model;
        }
        DiffResult diff = diffEngine.diff(ResolvedGraph.empty(), IdentityResolver.resolve(tree), existing(model));
        new OperationApplier(model, new OpenSchema(schema), null).apply(diff.operations());
        model.setDescription(tree.getDescription());
        log.debug("Replayed previous tree: {} node(s)", model.nodeCount());
        return model;
    }

    private Predicate<String> existing(GraphModel model) {
        return id -> model.contains(id) || (store != null && store.get(id) != null);
    }
}
