package com.vidnyan.flowc.domain.codegen;

import java.util.Locale;

/**
 * Formatting preferences for generated code.
 */
public record CodeStyle(
    int indentSize,
    QuoteStyle quoteStyle,
    boolean semicolons,
    boolean trailingCommas
) {

    public enum QuoteStyle {
        SINGLE('\''),
        DOUBLE('"');

        private final char quote;

        QuoteStyle(char quote) {
            this.quote = quote;
        }

        public char quote() {
            return quote;
        }

        public static QuoteStyle fromTag(String tag) {
            if (tag == null || tag.isBlank()) {
                return SINGLE;
            }
            return QuoteStyle.valueOf(tag.trim().toUpperCase(Locale.ROOT));
        }
    }

    public CodeStyle {
        if (indentSize < 0) {
            throw new IllegalArgumentException("Indent size must not be negative: " + indentSize);
        }
        quoteStyle = quoteStyle != null ? quoteStyle : QuoteStyle.SINGLE;
    }

    public static CodeStyle defaults() {
        return new CodeStyle(2, QuoteStyle.SINGLE, true, true);
    }

    public String indent() {
        return " ".repeat(indentSize);
    }

    public String indent(int depth) {
        return " ".repeat(indentSize * depth);
    }

    /**
     * Statement terminator: ";" or nothing.
     */
    public String terminator() {
        return semicolons ? ";" : "";
    }

    /**
     * Quote a string literal, escaping backslashes, the quote character and line breaks.
     */
    public String quote(String value) {
        char q = quoteStyle.quote();
        StringBuilder sb = new StringBuilder(value.length() + 2).append(q);
        for (char c : value.toCharArray()) {
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c == q) {
                        sb.append('\\');
                    }
                    sb.append(c);
                }
            }
        }
        return sb.append(q).toString();
    }
}
