package com.ndf.cnl.io;

/**
 * A parsed markdown heading.
 *
 * @param depth number of leading {@code #}
 * @param text  heading text without the {@code #} marks
 * @param name  base name and qualifier
 * @param type  bracketed type, e.g. {@code Element}, or null
 */
public record Heading(int depth, String text, NodeName name, String type) {

    public String toCnl() {
        return "#".repeat(depth) + " " + name.toCnl() + (type == null ? "" : " [" + type + "]");
    }
}
