package com.firesql.store;

/**
 * Comparison operators the document store evaluates natively.
 */
public enum StoreOperator {
    EQ("=="),
    NEQ("!="),
    LT("<"),
    LTE("<="),
    GT(">"),
    GTE(">=");

    private final String symbol;

    StoreOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * Map a SQL comparison token to an operator.
     *
     * @throws IllegalArgumentException for unknown tokens
     */
    public static StoreOperator fromSql(String token) {
        switch (token) {
            case "=":
            case "==":
                return EQ;
            case "!=":
            case "<>":
                return NEQ;
            case "<":
                return LT;
            case "<=":
                return LTE;
            case ">":
                return GT;
            case ">=":
                return GTE;
            default:
                throw new IllegalArgumentException("Unknown operator: " + token);
        }
    }
}
