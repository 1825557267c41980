package com.ndf.cnl.model;

import java.util.ArrayList;
import java.util.List;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A named neighborhood of a {@link PolyNode}. Relations and attributes are
 * held by id; their bodies live in the graph's flat collections.
 */
@Data
@NoArgsConstructor
public final class Morph {
    public static final String BASIC = "basic";

    private String id, nodeId, key, name, description;
    private boolean basic;
    private List<String> relationIds = new ArrayList<>();
    private List<String> attributeIds = new ArrayList<>();

    public Morph(String nodeId, String key, String name, String description, boolean basic) {
        this.id = idOf(nodeId, key);
        this.nodeId = nodeId;
        this.key = key;
        this.name = name;
        this.description = description;
        this.basic = basic;
    }

    public static String idOf(String nodeId, String key) {
        return nodeId + ":" + key;
    }

    public static Morph basicOf(String nodeId) {
        return new Morph(nodeId, BASIC, BASIC, null, true);
    }

    public Morph copy() {
        Morph m = new Morph(nodeId, key, name, description, basic);
        m.relationIds = new ArrayList<>(relationIds);
        m.attributeIds = new ArrayList<>(attributeIds);
        return m;
    }
}
