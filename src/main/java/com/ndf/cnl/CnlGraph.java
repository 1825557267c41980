package com.ndf.cnl;

import com.ndf.cnl.api.EntityKind;
import com.ndf.cnl.io.CnlRenderer;
import com.ndf.cnl.io.SnapshotCodec;
import com.ndf.cnl.io.TreeSnapshot;
import com.ndf.cnl.model.GraphModel;
import com.ndf.cnl.model.GraphSnapshot;
import com.ndf.cnl.model.PolyNode;
import com.ndf.cnl.model.StateRef;
import com.ndf.cnl.model.TransitionNode;
import com.ndf.cnl.schema.OpenSchema;
import com.ndf.cnl.schema.StrictSchema;
import com.ndf.cnl.util.GraphExplain;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Set;

/**
 * One graph edited through successive CNL submissions.
 *
 * <p>
 * Holds the live {@link GraphModel}, the structural tree of the last
 * submission and the relation and attribute names this graph registered in
 * non-strict mode. Each {@link #submit} diffs against the previous submission
 * only.
 *
 * <p>
 * Not thread-safe: callers must not run two submissions for the same graph at
 * once.
 */
public class CnlGraph {
    private static final Logger log = LogManager.getLogger(CnlGraph.class);

    private final String graphId;
    private final CnlCompiler compiler;
    private final GraphModel model = new GraphModel();
    private final OpenSchema openSchema;
    private final StrictSchema strictSchema;
    private TreeSnapshot tree = TreeSnapshot.initial();

    public CnlGraph(String graphId) {
        this(graphId, new CnlCompiler());
    }

    public CnlGraph(String graphId, CnlCompiler compiler) {
        this.graphId = graphId;
        this.compiler = compiler;
        this.openSchema = new OpenSchema(compiler.schema());
        // names registered while open stay known once the graph turns strict
        this.strictSchema = new StrictSchema(openSchema.asLookup());
    }

    public String getGraphId() {
        return graphId;
    }

    /** Submits the full CNL text of the graph, using the configured strict mode. */
    public CompilationResult submit(String text) {
        return submit(text, compiler.config().isStrictMode());
    }

    public CompilationResult submit(String text, boolean strictMode) {
        CompilationResult result = compiler.compile(tree, text, model, strictMode ? strictSchema : openSchema);
        tree = result.tree();
        log.info("Graph {} now at version {} ({} nodes)", graphId, tree.version(), model.nodeCount());
        return result;
    }

    public GraphSnapshot snapshot() {
        return model.snapshot();
    }

    public TreeSnapshot treeSnapshot() {
        return tree;
    }

    public long version() {
        return tree.version();
    }

    /** Names this graph registered for {@code kind} while in non-strict mode. */
    public Set<String> registeredTypes(EntityKind kind) {
        return openSchema.registered(kind);
    }

    // ── Views ───────────────────────────────────────────────────────

    /** The graph in normalized CNL. */
    public String render() {
        return CnlRenderer.render(model.snapshot());
    }

    public String toJson() {
        return SnapshotCodec.toJson(model.snapshot());
    }

    public String toMermaid() {
        return new GraphExplain(model.snapshot()).toMermaid();
    }

    // ── Process state ───────────────────────────────────────────────

    /** Switches the morph a node currently shows, e.g. Water to its vapor morph. */
    public void activate(String nodeId, String morphKey) {
        model.setActiveMorph(nodeId, morphKey);
        log.debug("Graph {}: {} now shows {}", graphId, nodeId, morphKey);
    }

    /**
     * True if the transition declared by {@code nodeId} can fire: every prior
     * state reference names an existing node, and a reference with a morph
     * also requires that morph to be the node's active one.
     */
    public boolean isTriggered(String nodeId) {
        TransitionNode t = model.transition(TransitionNode.idOf(nodeId));
        if (t == null)
            throw new IllegalArgumentException("No transition on node " + nodeId);
        return t.isTriggered(this::isActive);
    }

    private boolean isActive(StateRef ref) {
        PolyNode n = model.node(ref.nodeId());
        if (n == null)
            return false;
        return ref.morphKey() == null || ref.morphId().equals(n.getActiveMorphId());
    }
}
