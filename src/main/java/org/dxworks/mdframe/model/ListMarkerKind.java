package org.dxworks.mdframe.model;

/**
 * The five list marker kinds. Items of one list always share a kind.
 */
public enum ListMarkerKind {
    MINUS('-', false),
    PLUS('+', false),
    STAR('*', false),
    DOT('.', true),
    PARENTHESIS(')', true);

    private final char symbol;
    private final boolean ordered;

    ListMarkerKind(char symbol, boolean ordered) {
        this.symbol = symbol;
        this.ordered = ordered;
    }

    public char getSymbol() {
        return symbol;
    }

    public boolean isOrdered() {
        return ordered;
    }

    public static ListMarkerKind fromSymbol(char symbol) {
        for (ListMarkerKind kind : values()) {
            if (kind.symbol == symbol) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Not a list marker: " + symbol);
    }
}
