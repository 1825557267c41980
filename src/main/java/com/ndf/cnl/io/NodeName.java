package com.ndf.cnl.io;

import com.ndf.cnl.error.CnlParseException;
import com.ndf.cnl.util.Slugs;

import java.util.regex.Matcher;

/**
 * A node name as written in CNL: a base name with an optional bold qualifier,
 * e.g. {@code **female** mathematician}.
 */
public record NodeName(String qualifier, String base) {

    /** Parses a node name, failing on a base name with no letters or digits. */
    public static NodeName parse(String text, int line) {
        String qualifier = null;
        Matcher m = LineParser.BOLD.matcher(text);
        if (m.find())
            qualifier = m.group(1).trim();
        String base = LineParser.collapse(LineParser.BOLD.matcher(text).replaceAll(" "));
        if (base.isEmpty())
            throw new CnlParseException(line, "Missing base name in '" + text.trim() + "'");
        if (Slugs.slug(base).isEmpty())
            throw new CnlParseException(line, "Name '" + base + "' has no letters or digits");
        return new NodeName(qualifier, base);
    }

    public String toCnl() {
        return qualifier == null ? base : "**" + qualifier + "** " + base;
    }
}
