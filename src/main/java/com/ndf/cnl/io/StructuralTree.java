package com.ndf.cnl.io;

import com.ndf.cnl.error.CompileError;

import java.util.ArrayList;
import java.util.List;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Heading hierarchy of a CNL document: one {@link NodeBlock} per top-level
 * heading, each with optional morph sub-blocks.
 */
@Data
public final class StructuralTree {
    /** Free text before the first heading. */
    private String description;
    private List<NodeBlock> nodes = new ArrayList<>();
    /** Line-level problems found while building the tree. */
    private List<CompileError> errors = new ArrayList<>();

    public static StructuralTree empty() {
        return new StructuralTree();
    }

    /** A depth-1 heading with its basic-morph content and morph sub-blocks. */
    @Data
    @NoArgsConstructor
    public static final class NodeBlock {
        private String id;
        private Heading heading;
        private int line;
        private String description;
        private List<ContentLine> content = new ArrayList<>();
        private List<MorphBlock> morphs = new ArrayList<>();

        public NodeBlock(String id, Heading heading, int line) {
            this.id = id;
            this.heading = heading;
            this.line = line;
        }

        public MorphBlock morph(String key) {
            for (MorphBlock m : morphs)
                if (m.getKey().equals(key))
                    return m;
            return null;
        }
    }

    /** A depth-2+ heading under a node: an alternative neighborhood. */
    @Data
    @NoArgsConstructor
    public static final class MorphBlock {
        private String key, name;
        private int line;
        private String description;
        private List<ContentLine> content = new ArrayList<>();

        public MorphBlock(String key, String name, int line) {
            this.key = key;
            this.name = name;
            this.line = line;
        }
    }

    /** A parsed content line with its 1-based position in the source text. */
    public record ContentLine(int line, Statement statement) {
    }
}
