package com.sassextend.selector;

public enum Combinator {
    DESCENDANT(" "),
    CHILD(">"),
    ADJACENT_SIBLING("+"),
    GENERAL_SIBLING("~");

    private final String symbol;

    Combinator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Looks up a combinator by its CSS symbol. Any non-empty all-whitespace symbol is the descendant combinator.
     */
    public static Combinator fromSymbol(String symbol) {
        if (symbol == null) {
            throw new IllegalArgumentException("Combinator symbol must not be null");
        }
        if (!symbol.isEmpty() && symbol.isBlank()) {
            return DESCENDANT;
        }
        for (Combinator combinator : values()) {
            if (combinator.symbol.equals(symbol.trim())) {
                return combinator;
            }
        }
        throw new IllegalArgumentException("Unknown combinator: " + symbol);
    }
}
