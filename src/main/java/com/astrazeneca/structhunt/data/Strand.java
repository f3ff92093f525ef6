package com.astrazeneca.structhunt.data;

public enum Strand {
    FORWARD('+'),
    REVERSE('-');

    public final char symbol;

    Strand(char symbol) {
        this.symbol = symbol;
    }

    /**
     * @param symbol strand column of an annotation line
     * @return strand for "+" or "-", null for anything else
     */
    public static Strand fromSymbol(String symbol) {
        if ("+".equals(symbol)) {
            return FORWARD;
        }
        if ("-".equals(symbol)) {
            return REVERSE;
        }
        return null;
    }
}
