package com.e2eq.cnl.parser;

/**
 * Delimiters of a notation segment.
 */
public enum Fence {
    COLONS(":::cnl", ":::"),
    BACKTICKS("```cnl", "```");

    private final String open;
    private final String close;

    Fence(String open, String close) {
        this.open = open;
        this.close = close;
    }

    public String open() {
        return open;
    }

    public String close() {
        return close;
    }

    static Fence opening(String trimmedLine) {
        for (Fence f : values()) {
            if (trimmedLine.equalsIgnoreCase(f.open)) return f;
        }
        return null;
    }
}
