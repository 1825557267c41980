package com.ndf.cnl.io;

/**
 * {@code has [*quantifier*] [**qualifier**] name: [++adverb++] value [*unit*] [[modality]];}
 */
public record AttributeRecord(
        String name,
        String value,
        String unit,
        String qualifier,
        String quantifier,
        String adverb,
        String modality) implements Statement {

    @Override
    public String toCnl() {
        StringBuilder sb = new StringBuilder(64).append("has ");
        if (quantifier != null)
            sb.append('*').append(quantifier).append("* ");
        if (qualifier != null)
            sb.append("**").append(qualifier).append("** ");
        sb.append(name).append(": ");
        if (adverb != null)
            sb.append("++").append(adverb).append("++ ");
        sb.append(value);
        if (unit != null)
            sb.append(" *").append(unit).append('*');
        if (modality != null)
            sb.append(" [").append(modality).append(']');
        return sb.append(';').toString();
    }
}
