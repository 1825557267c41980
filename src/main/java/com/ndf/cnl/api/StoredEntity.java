package com.ndf.cnl.api;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * An entity as persisted by a {@link GraphStore}.
 *
 * @param kind entity kind
 * @param id   entity id
 * @param body JSON body of the entity
 */
public record StoredEntity(EntityKind kind, String id, JsonNode body) {
}
