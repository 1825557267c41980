package com.ndf.cnl.io;

import com.ndf.cnl.error.CnlParseException;
import com.ndf.cnl.model.LogicalOperatorNode;
import com.ndf.cnl.util.Slugs;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses single CNL lines into records.
 *
 * <p>
 * Pure and side-effect free: target nodes named by a relation are not created
 * here. Optional markers are matched by fixed sub-patterns:
 * <ul>
 * <li>{@code **bold**} qualifier or adjective</li>
 * <li>{@code *italics*} quantifier, or unit after an attribute value</li>
 * <li>{@code ++underline++} adverb</li>
 * <li>{@code [brackets]} modality at the end of a line, type at the end of a
 * heading</li>
 * </ul>
 */
public final class LineParser {
    static final Pattern BOLD = Pattern.compile("\\*\\*([^*]+)\\*\\*");
    static final Pattern ITALIC = Pattern.compile("(?<!\\*)\\*(?!\\*)([^*]+)\\*(?!\\*)");
    static final Pattern ADVERB = Pattern.compile("\\+\\+([^+]+)\\+\\+");

    private static final Pattern HEADING = Pattern.compile("^(#+)\\s*(.*)$");
    private static final Pattern TRAILING_BRACKET = Pattern.compile("\\s*\\[([^\\]]+)\\]\\s*$");
    private static final Pattern RELATION = Pattern.compile(
            "^(?:\\+\\+([^+]+)\\+\\+\\s*)?(?:\\*\\*([^*]+)\\*\\*\\s*)?<([^<>]*)>(.*)$");
    private static final Pattern LEADING_QUANTIFIER = Pattern.compile("^\\*(?!\\*)([^*]+)\\*(?!\\*)\\s*(.*)$");
    private static final Pattern LEADING_QUALIFIER = Pattern.compile("^\\*\\*([^*]+)\\*\\*\\s*(.*)$");
    private static final Pattern STATE = Pattern.compile("^(prior\\s*state|post\\s*state)\\s*:(.*)$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern WS = Pattern.compile("\\s+");

    private LineParser() {
        // Utility class
    }

    // ── Classification ──────────────────────────────────────────────

    public static boolean isHeading(String line) {
        return HEADING.matcher(line.strip()).matches();
    }

    public static boolean isAttribute(String line) {
        return line.strip().toLowerCase(Locale.ROOT).startsWith("has ");
    }

    public static boolean isState(String line) {
        return STATE.matcher(line.strip()).matches();
    }

    /** True if the line starts with a {@code <relation>} marker, after optional adverb and adjective. */
    public static boolean isRelation(String line) {
        return RELATION.matcher(line.strip()).matches();
    }

    /**
     * Parses any content line.
     *
     * @throws CnlParseException if the line is not a relation, attribute or state
     *                           line, or is malformed
     */
    public static Statement parseStatement(String line, int lineNo) {
        if (isAttribute(line))
            return parseAttribute(line, lineNo);
        if (isState(line))
            return parseState(line, lineNo);
        if (line.indexOf('<') >= 0)
            return parseRelation(line, lineNo);
        throw new CnlParseException(lineNo, "Unrecognized line '" + line.strip() + "'");
    }

    // ── Headings ────────────────────────────────────────────────────

    public static Heading parseHeading(String line, int lineNo) {
        Matcher m = HEADING.matcher(line.strip());
        if (!m.matches())
            throw new CnlParseException(lineNo, "Not a heading");
        int depth = m.group(1).length();
        String text = m.group(2).trim();
        String rest = text;
        String type = null;
        Matcher t = TRAILING_BRACKET.matcher(rest);
        if (t.find()) {
            type = t.group(1).trim();
            rest = rest.substring(0, t.start());
        }
        return new Heading(depth, text, NodeName.parse(rest, lineNo), type);
    }

    // ── Relations ───────────────────────────────────────────────────

    public static RelationRecord parseRelation(String line, int lineNo) {
        String s = stripTerminator(line.strip());
        String modality = null;
        Matcher mm = TRAILING_BRACKET.matcher(s);
        if (mm.find()) {
            modality = mm.group(1).trim();
            s = s.substring(0, mm.start());
        }
        Matcher m = RELATION.matcher(s);
        if (!m.matches())
            throw new CnlParseException(lineNo, "Malformed relation line '" + line.strip() + "'");
        String name = collapse(m.group(3));
        if (Slugs.slug(name).isEmpty())
            throw new CnlParseException(lineNo, "Relation name '" + name + "' has no letters or digits");

        String rest = m.group(4).trim();
        String quantifier = null;
        Matcher q = LEADING_QUANTIFIER.matcher(rest);
        if (q.matches()) {
            quantifier = q.group(1).trim();
            rest = q.group(2);
        }
        List<NodeName> targets = new ArrayList<>();
        for (String part : rest.split(",")) {
            if (!part.isBlank())
                targets.add(NodeName.parse(part, lineNo));
        }
        if (targets.isEmpty())
            throw new CnlParseException(lineNo, "Relation <" + name + "> has no target");
        return new RelationRecord(name, targets, trimOrNull(m.group(2)), trimOrNull(m.group(1)), quantifier,
                modality);
    }

    // ── Attributes ──────────────────────────────────────────────────

    public static AttributeRecord parseAttribute(String line, int lineNo) {
        String s = stripTerminator(line.strip());
        if (!isAttribute(s))
            throw new CnlParseException(lineNo, "Attribute line must start with 'has'");
        String rest = s.substring(4).trim();
        int colon = rest.indexOf(':');
        if (colon < 0)
            throw new CnlParseException(lineNo, "Incomplete attribute line, expected 'has name: value'");

        String namePart = rest.substring(0, colon).trim();
        String quantifier = null, qualifier = null;
        Matcher q = LEADING_QUANTIFIER.matcher(namePart);
        if (q.matches()) {
            quantifier = q.group(1).trim();
            namePart = q.group(2);
        }
        Matcher b = LEADING_QUALIFIER.matcher(namePart);
        if (b.matches()) {
            qualifier = b.group(1).trim();
            namePart = b.group(2);
        }
        String name = collapse(namePart);

        String valuePart = rest.substring(colon + 1);
        String adverb = null, modality = null, unit = null;
        Matcher a = ADVERB.matcher(valuePart);
        if (a.find()) {
            adverb = a.group(1).trim();
            valuePart = a.replaceFirst(" ");
        }
        Matcher mm = TRAILING_BRACKET.matcher(valuePart);
        if (mm.find()) {
            modality = mm.group(1).trim();
            valuePart = valuePart.substring(0, mm.start());
        }
        Matcher u = ITALIC.matcher(valuePart);
        if (u.find()) {
            unit = u.group(1).trim();
            valuePart = u.replaceFirst(" ");
        }
        String value = collapse(valuePart);
        if (Slugs.slug(name).isEmpty() || value.isEmpty())
            throw new CnlParseException(lineNo, "Missing attribute name or value in '" + line.strip() + "'");
        return new AttributeRecord(name, value, unit, qualifier, quantifier, adverb, modality);
    }

    // ── Transition states ───────────────────────────────────────────

    public static StateRecord parseState(String line, int lineNo) {
        Matcher m = STATE.matcher(stripTerminator(line.strip()));
        if (!m.matches())
            throw new CnlParseException(lineNo, "Expected 'priorState:' or 'postState:'");
        StateRecord.Phase phase = m.group(1).toLowerCase(Locale.ROOT).startsWith("prior")
                ? StateRecord.Phase.PRIOR
                : StateRecord.Phase.POST;

        List<StateRecord.Term> terms = new ArrayList<>();
        for (String entry : m.group(2).split(",")) {
            if (entry.isBlank())
                continue;
            boolean or = entry.indexOf('|') >= 0, and = entry.indexOf('&') >= 0;
            if (or && and)
                throw new CnlParseException(lineNo, "Cannot mix '|' and '&' in '" + entry.trim() + "'");
            LogicalOperatorNode.Operator op = or ? LogicalOperatorNode.Operator.OR
                    : and ? LogicalOperatorNode.Operator.AND : null;
            List<StateRecord.Operand> operands = new ArrayList<>();
            String[] parts = op == null ? new String[] { entry } : entry.split(Pattern.quote(String.valueOf(op.symbol())));
            for (String p : parts)
                operands.add(parseOperand(p, lineNo));
            if (op != null && operands.size() < 2)
                throw new CnlParseException(lineNo, "Operator '" + op.symbol() + "' needs two operands");
            terms.add(new StateRecord.Term(op, operands));
        }
        if (terms.isEmpty())
            throw new CnlParseException(lineNo, phase.keyword() + " lists no nodes");
        return new StateRecord(phase, terms);
    }

    private static StateRecord.Operand parseOperand(String text, int lineNo) {
        String t = text.trim();
        if (t.isEmpty())
            throw new CnlParseException(lineNo, "Empty state reference");
        int colon = t.lastIndexOf(':');
        if (colon < 0)
            return new StateRecord.Operand(NodeName.parse(t, lineNo), null);
        String morph = collapse(t.substring(colon + 1));
        if (Slugs.slug(morph).isEmpty())
            throw new CnlParseException(lineNo, "Missing morph name in '" + t + "'");
        return new StateRecord.Operand(NodeName.parse(t.substring(0, colon), lineNo), morph);
    }

    // ── Helpers ─────────────────────────────────────────────────────

    private static String stripTerminator(String s) {
        String t = s.strip();
        while (t.endsWith(";"))
            t = t.substring(0, t.length() - 1).strip();
        return t;
    }

    static String collapse(String s) {
        return WS.matcher(s).replaceAll(" ").trim();
    }

    private static String trimOrNull(String s) {
        if (s == null)
            return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
