package com.ndf.cnl.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ndf.cnl.api.GraphStore;
import com.ndf.cnl.api.StoreResult;
import com.ndf.cnl.api.StoredEntity;
import com.ndf.cnl.engine.OpType;
import com.ndf.cnl.engine.Operation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.extern.log4j.Log4j2;

/**
 * Reference {@link GraphStore} that keeps everything on the heap.
 *
 * <p>
 * Entity bodies are stored as Jackson trees. Every applied operation is also
 * appended to a journal, so tests and tools can see exactly what each batch
 * contained. Deletes remove the entity from the index; the journal keeps it.
 */
@Log4j2
public final class InMemoryGraphStore implements GraphStore {
    private final ObjectMapper mapper = new ObjectMapper();
    private final Map<String, StoredEntity> index = new LinkedHashMap<>();
    private final List<JournalEntry> journal = new ArrayList<>();
    private long batches;

    /** One applied operation. */
    public record JournalEntry(long batch, OpType type, String entityId, JsonNode body) {
    }

    @Override
    public StoredEntity get(String id) {
        return index.get(id);
    }

    @Override
    public List<StoreResult> batchApply(List<Operation> operations) {
        long batch = ++batches;
        List<StoreResult> results = new ArrayList<>(operations.size());
        for (Operation op : operations) {
            try {
                JsonNode body = op.payload() == null ? null : mapper.valueToTree(op.payload());
                if (op.type().isDelete())
                    index.remove(op.entityId());
                else
                    index.put(op.entityId(), new StoredEntity(op.type().kind(), op.entityId(), body));
                journal.add(new JournalEntry(batch, op.type(), op.entityId(), body));
                results.add(StoreResult.ok(op.entityId()));
            } catch (IllegalArgumentException e) {
                log.error("Batch {}: cannot store {}: {}", batch, op, e.getMessage());
                results.add(StoreResult.failed(op.entityId(), e.getMessage()));
            }
        }
        log.debug("Batch {} applied {} operation(s), {} entities stored", batch, operations.size(), index.size());
        return results;
    }

    /** Seeds an entity directly, bypassing the batch journal. */
    public void put(StoredEntity entity) {
        index.put(entity.id(), entity);
    }

    public int size() {
        return index.size();
    }

    public long batchCount() {
        return batches;
    }

    public List<JournalEntry> journal() {
        return Collections.unmodifiableList(journal);
    }
}
