package com.ndf.cnl.engine;

import com.ndf.cnl.api.EntityKind;
import com.ndf.cnl.api.GraphStore;
import com.ndf.cnl.api.StoreResult;
import com.ndf.cnl.api.StoredEntity;
import com.ndf.cnl.error.ErrorKind;
import com.ndf.cnl.model.AttributeValue;
import com.ndf.cnl.model.GraphModel;
import com.ndf.cnl.model.MorphDef;
import com.ndf.cnl.model.NodeDef;
import com.ndf.cnl.model.RelationEdge;
import com.ndf.cnl.schema.NameSetLookup;
import com.ndf.cnl.schema.OpenSchema;
import com.ndf.cnl.schema.StrictSchema;
import com.ndf.cnl.store.InMemoryGraphStore;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class OperationApplierTest {

    private static Operation addNode(String id) {
        return new Operation(OpType.ADD_NODE, id, new NodeDef(id, id, null, null, null, true), 1);
    }

    private static Operation addRelation(String name, String source, String target, int line) {
        String id = IdentityResolver.relationId(source, "basic", name, null, null, null, target);
        return new Operation(OpType.ADD_RELATION, id,
                new RelationEdge(id, name, source, target, "basic", null, null, null, null), line);
    }

    private static Operation addAttribute(String node, String name, String value, int line) {
        String id = IdentityResolver.attributeId(node, "basic", name, null, null, null);
        return new Operation(OpType.ADD_ATTRIBUTE, id,
                new AttributeValue(id, node, name, value, null, "basic", null, null, null, null), line);
    }

    @Test
    public void testAppliesInOrder() {
        GraphModel model = new GraphModel();
        List<AuditEntry> audit = new OperationApplier(model, new OpenSchema(), null).apply(List.of(
                addNode("hydrogen"), addNode("water"), addRelation("part of", "hydrogen", "water", 3),
                addAttribute("hydrogen", "number of protons", "1", 2)));

        assertEquals(4, audit.size());
        for (AuditEntry e : audit)
            assertTrue(e.isApplied());
        assertEquals(2, model.nodeCount());
        assertEquals(1, model.relationCount());
        assertEquals(1, model.attributeCount());
        assertEquals(1, model.node("hydrogen").basicMorph().getRelationIds().size());
    }

    @Test
    public void testStrictSchemaFailsOnlyTheUnknownName() {
        GraphModel model = new GraphModel();
        StrictSchema strict = new StrictSchema(new NameSetLookup().with(EntityKind.RELATION, List.of("part of")));
        List<AuditEntry> audit = new OperationApplier(model, strict, null).apply(List.of(
                addNode("a"), addNode("b"), addRelation("frobnicates", "a", "b", 7), addRelation("part of", "a", "b", 8)));

        assertEquals(AuditEntry.Status.FAILED, audit.get(2).status());
        assertEquals(ErrorKind.SCHEMA_VIOLATION, audit.get(2).error().kind());
        assertEquals(7, audit.get(2).error().line());
        assertTrue(audit.get(3).isApplied());
        assertEquals(1, model.relationCount());
    }

    @Test
    public void testOpenSchemaRegistersUnknownNames() {
        OpenSchema open = new OpenSchema();
        new OperationApplier(new GraphModel(), open, null).apply(List.of(
                addNode("a"), addNode("b"), addRelation("frobnicates", "a", "b", 1), addAttribute("a", "glow", "dim", 2)));
        assertTrue(open.registered(EntityKind.RELATION).contains("frobnicates"));
        assertTrue(open.registered(EntityKind.ATTRIBUTE).contains("glow"));
    }

    @Test
    public void testMissingTargetFailsWithOperationLine() {
        GraphModel model = new GraphModel();
        List<AuditEntry> audit = new OperationApplier(model, new OpenSchema(), null).apply(List.of(
                addNode("a"), addRelation("likes", "a", "ghost", 5)));

        AuditEntry failed = audit.get(1);
        assertFalse(failed.isApplied());
        assertEquals(ErrorKind.UNRESOLVED_REFERENCE, failed.error().kind());
        assertEquals(5, failed.error().line());
        assertEquals(0, model.relationCount());
    }

    @Test
    public void testDeletingMissingConnectorFails() {
        List<AuditEntry> audit = new OperationApplier(new GraphModel(), new OpenSchema(), null).apply(List.of(
                new Operation(OpType.DELETE_ATTRIBUTE, "a:basic/x/-/-/-", null, 0)));
        assertEquals(AuditEntry.Status.FAILED, audit.get(0).status());
    }

    @Test
    public void testRemovingLastMorphRemovesNode() {
        GraphModel model = new GraphModel();
        model.putNode(new NodeDef("a", "A", null, null, null, true));

        InMemoryGraphStore store = new InMemoryGraphStore();
        List<AuditEntry> audit = new OperationApplier(model, new OpenSchema(), store).apply(List.of(
                new Operation(OpType.DELETE_MORPH, "a:basic", null, 4)));

        assertEquals(2, audit.size());
        assertTrue(audit.get(0).isApplied());
        AuditEntry derived = audit.get(1);
        assertEquals(OpType.DELETE_NODE, derived.op());
        assertEquals("a", derived.entityId());
        assertTrue(derived.isApplied());
        assertEquals(ErrorKind.ORPHAN_MORPH_DELETION, derived.error().kind());
        assertNull(model.node("a"));
        // the derived deletion is persisted with the batch
        assertEquals(2, store.journal().size());
    }

    @Test
    public void testMorphOperations() {
        GraphModel model = new GraphModel();
        List<AuditEntry> audit = new OperationApplier(model, new OpenSchema(), null).apply(List.of(
                addNode("water"),
                new Operation(OpType.ADD_MORPH, "water:ice", new MorphDef("water", "ice", "Ice", null), 2),
                new Operation(OpType.UPDATE_MORPH, "water:ice", new MorphDef("water", "ice", "Ice", "Frozen"), 2)));
        assertEquals(3, audit.stream().filter(AuditEntry::isApplied).count());
        assertEquals("Frozen", model.morph("water:ice").getDescription());
    }

    @Test
    public void testSingleStoreBatch() {
        InMemoryGraphStore store = new InMemoryGraphStore();
        new OperationApplier(new GraphModel(), new OpenSchema(), store).apply(List.of(
                addNode("a"), addNode("b"), addRelation("likes", "a", "b", 3), addRelation("likes", "a", "ghost", 4)));
        assertEquals(1, store.batchCount());
        // the failed relation never reaches the store
        assertEquals(3, store.journal().size());
        assertNotNull(store.get("a"));
    }

    @Test
    public void testStoreRefusalMarksEntryFailed() {
        List<List<Operation>> batches = new ArrayList<>();
        GraphStore refusing = new GraphStore() {
            @Override
            public StoredEntity get(String id) {
                return null;
            }

            @Override
            public List<StoreResult> batchApply(List<Operation> operations) {
                batches.add(operations);
                List<StoreResult> results = new ArrayList<>();
                for (Operation op : operations)
                    results.add(op.type() == OpType.ADD_RELATION ? StoreResult.failed(op.entityId(), "disk full")
                            : StoreResult.ok(op.entityId()));
                return results;
            }
        };

        GraphModel model = new GraphModel();
        List<AuditEntry> audit = new OperationApplier(model, new OpenSchema(), refusing).apply(List.of(
                addNode("a"), addNode("b"), addRelation("likes", "a", "b", 3)));

        assertEquals(1, batches.size());
        assertTrue(audit.get(0).isApplied());
        assertEquals(AuditEntry.Status.FAILED, audit.get(2).status());
        assertEquals(ErrorKind.STORE_FAILURE, audit.get(2).error().kind());
        assertEquals("disk full", audit.get(2).error().message());
        assertEquals(3, audit.get(2).line());
    }
}
