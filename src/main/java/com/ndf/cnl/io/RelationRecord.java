package com.ndf.cnl.io;

import java.util.List;
import java.util.stream.Collectors;

/**
 * {@code [++adverb++] [**adjective**] <name> [*quantifier*] target, ... [[modality]];}
 */
public record RelationRecord(
        String name,
        List<NodeName> targets,
        String adjective,
        String adverb,
        String quantifier,
        String modality) implements Statement {

    public RelationRecord {
        targets = List.copyOf(targets);
    }

    @Override
    public String toCnl() {
        StringBuilder sb = new StringBuilder(64);
        if (adverb != null)
            sb.append("++").append(adverb).append("++ ");
        if (adjective != null)
            sb.append("**").append(adjective).append("** ");
        sb.append('<').append(name).append("> ");
        if (quantifier != null)
            sb.append('*').append(quantifier).append("* ");
        sb.append(targets.stream().map(NodeName::toCnl).collect(Collectors.joining(", ")));
        if (modality != null)
            sb.append(" [").append(modality).append(']');
        return sb.append(';').toString();
    }
}
