package com.ndf.cnl.io;

import com.ndf.cnl.engine.IdentityResolver;
import com.ndf.cnl.error.CnlException;
import com.ndf.cnl.error.CnlParseException;
import com.ndf.cnl.error.DuplicateMorphNameException;
import com.ndf.cnl.model.Morph;
import com.ndf.cnl.util.Slugs;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import lombok.extern.log4j.Log4j2;

/**
 * Builds a {@link StructuralTree} from CNL text.
 *
 * <p>
 * Line-oriented: each line is either a heading, a fence marker, a description
 * line inside a fence, or a content line handed to {@link LineParser}. A line
 * that fails is recorded as an error and parsing continues with the next one.
 *
 * <p>
 * A fence with an unknown tag is skipped up to its closing marker or the next
 * heading, whichever comes first. A node heading that appears twice merges
 * into the first block. A morph whose key is already taken on its node (or is
 * {@code basic}) is rejected together with every line up to the next heading.
 */
@Log4j2
public final class CnlParser {
    public static final String DEFAULT_TRANSITION_TYPE = "Transition";

    private enum Fence {
        NONE, DESCRIPTION, CNL, SKIP
    }

    private final String transitionType;

    public CnlParser() {
        this(DEFAULT_TRANSITION_TYPE);
    }

    /** @param transitionType heading type that marks a transition node */
    public CnlParser(String transitionType) {
        this.transitionType = transitionType == null ? DEFAULT_TRANSITION_TYPE : transitionType;
    }

    public StructuralTree parse(String text) {
        return new Run().parse(text == null ? "" : text);
    }

    public boolean isTransition(Heading heading) {
        return heading.type() != null && heading.type().equalsIgnoreCase(transitionType);
    }

    /** Per-call parser state. */
    private final class Run {
        private final StructuralTree tree = new StructuralTree();
        private final Map<String, StructuralTree.NodeBlock> byId = new LinkedHashMap<>();
        private final StringBuilder graphDescription = new StringBuilder();

        private StructuralTree.NodeBlock node;
        private StructuralTree.MorphBlock morph;
        // true between a rejected heading and the next heading
        private boolean rejected;
        // true until the first content line of the current block
        private boolean atBlockStart;

        private Fence fence = Fence.NONE;
        private StringBuilder fenceText;
        private int fenceLine;

        StructuralTree parse(String text) {
            String[] lines = text.split("\\r?\\n", -1);
            for (int i = 0; i < lines.length; i++) {
                int lineNo = i + 1;
                try {
                    accept(lines[i], lineNo);
                } catch (CnlException e) {
                    log.warn("Rejected line {}: {}", lineNo, e.getMessage());
                    tree.getErrors().add(e.toError());
                }
            }
            if (fence != Fence.NONE && fence != Fence.CNL) {
                closeFence();
                tree.getErrors().add(new CnlParseException(fenceLine, "Unclosed fence").toError());
            }
            tree.setDescription(Slugs.blankToNull(graphDescription.toString()));
            tree.setNodes(new ArrayList<>(byId.values()));
            log.debug("Parsed {} node block(s), {} error(s)", tree.getNodes().size(), tree.getErrors().size());
            return tree;
        }

        private void accept(String raw, int lineNo) {
            String line = raw.strip();

            // ── Inside a fence ──
            if (fence == Fence.SKIP && LineParser.isHeading(line)) {
                // an unclosed skipped fence ends at the next heading
                tree.getErrors().add(new CnlParseException(fenceLine, "Unclosed fence").toError());
                closeFence();
            } else if (fence == Fence.DESCRIPTION || fence == Fence.SKIP) {
                if (isFenceClose(line))
                    closeFence();
                else if (fence == Fence.DESCRIPTION)
                    fenceText.append(raw).append('\n');
                return;
            }
            if (fence == Fence.CNL && isFenceClose(line)) {
                fence = Fence.NONE;
                return;
            }

            // ── Fence openers ──
            String fenceTag = fenceTag(line);
            if (fenceTag != null) {
                openFence(fenceTag, lineNo);
                return;
            }

            // ── Headings ──
            if (LineParser.isHeading(line)) {
                heading(line, lineNo);
                return;
            }

            if (line.isEmpty())
                return;
            if (rejected)
                return;
            if (node == null) {
                if (LineParser.isAttribute(line) || LineParser.isState(line) || LineParser.isRelation(line))
                    throw new CnlParseException(lineNo, "Content line before the first node heading");
                graphDescription.append(raw).append('\n');
                return;
            }
            content(line, lineNo);
        }

        private void heading(String line, int lineNo) {
            fence = Fence.NONE;
            rejected = false;
            atBlockStart = true;
            morph = null;
            Heading h;
            try {
                h = LineParser.parseHeading(line, lineNo);
            } catch (CnlException e) {
                rejected = true;
                throw e;
            }
            if (h.depth() == 1) {
                String id = IdentityResolver.nodeId(h.name().qualifier(), h.name().base());
                StructuralTree.NodeBlock existing = byId.get(id);
                if (existing != null) {
                    log.warn("Node {} redefined at line {}, merging into block at line {}", id, lineNo,
                            existing.getLine());
                    if (existing.getHeading().type() == null && h.type() != null)
                        existing.setHeading(h);
                    node = existing;
                } else {
                    node = new StructuralTree.NodeBlock(id, h, lineNo);
                    byId.put(id, node);
                }
                return;
            }
            if (node == null) {
                rejected = true;
                throw new CnlParseException(lineNo, "Morph heading '" + h.text() + "' has no enclosing node");
            }
            String name = LineParser.collapse(h.text());
            String key = Slugs.slug(name);
            if (key.isEmpty()) {
                rejected = true;
                throw new CnlParseException(lineNo, "Morph heading has no name");
            }
            if (key.equals(Morph.BASIC) || node.morph(key) != null) {
                rejected = true;
                throw new DuplicateMorphNameException(lineNo, node.getId(), name);
            }
            morph = new StructuralTree.MorphBlock(key, name, lineNo);
            node.getMorphs().add(morph);
        }

        private void content(String line, int lineNo) {
            atBlockStart = false;
            Statement st = LineParser.parseStatement(line, lineNo);
            if (st instanceof StateRecord) {
                if (!isTransition(node.getHeading()))
                    throw new CnlParseException(lineNo, "State line outside a " + transitionType + " node");
                if (morph != null)
                    throw new CnlParseException(lineNo, "State line inside morph '" + morph.getName() + "'");
            }
            StructuralTree.ContentLine cl = new StructuralTree.ContentLine(lineNo, st);
            if (morph != null)
                morph.getContent().add(cl);
            else
                node.getContent().add(cl);
        }

        // ── Fences ──

        private void openFence(String tag, int lineNo) {
            if (tag.isEmpty())
                throw new CnlParseException(lineNo, "Fence marker without an open fence");
            fenceLine = lineNo;
            if (tag.equals("cnl")) {
                fence = Fence.CNL;
                return;
            }
            if (!tag.equals("description")) {
                fence = Fence.SKIP;
                return;
            }
            if (node != null && (rejected || !atBlockStart)) {
                fence = Fence.SKIP;
                if (!rejected)
                    throw new CnlParseException(lineNo, "Description fence must directly follow its heading");
                return;
            }
            fence = Fence.DESCRIPTION;
            fenceText = new StringBuilder();
        }

        private void closeFence() {
            if (fence == Fence.DESCRIPTION) {
                String text = Slugs.blankToNull(stripTrailingNewline(fenceText.toString()));
                if (node == null)
                    graphDescription.append(text == null ? "" : text).append('\n');
                else if (morph != null)
                    morph.setDescription(text);
                else
                    node.setDescription(text);
                atBlockStart = false;
            }
            fence = Fence.NONE;
            fenceText = null;
        }
    }

    // ── Fence markers ───────────────────────────────────────────────

    /** Returns the lower-cased tag of an opening fence, "" for a bare fence, or null. */
    private static String fenceTag(String line) {
        String rest;
        if (line.startsWith(":::"))
            rest = line.substring(3);
        else if (line.startsWith("```"))
            rest = line.substring(3);
        else
            return null;
        return rest.strip().toLowerCase(Locale.ROOT);
    }

    private static boolean isFenceClose(String line) {
        return line.equals(":::") || line.equals("```");
    }

    private static String stripTrailingNewline(String s) {
        return s.endsWith("\n") ? s.substring(0, s.length() - 1) : s;
    }
}
