package com.popupkit.condition;

public enum ComparisonOperator {
    EQUALS("="),
    NOT_EQUALS("!="),
    GREATER(">"),
    LESS("<"),
    GREATER_OR_EQUAL(">="),
    LESS_OR_EQUAL("<=");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean isOrdering() {
        return this != EQUALS && this != NOT_EQUALS;
    }

    /**
     * Apply the operator to the sign of a comparison result.
     */
    public boolean test(int comparison) {
        switch (this) {
            case EQUALS:
                return comparison == 0;
            case NOT_EQUALS:
                return comparison != 0;
            case GREATER:
                return comparison > 0;
            case LESS:
                return comparison < 0;
            case GREATER_OR_EQUAL:
                return comparison >= 0;
            case LESS_OR_EQUAL:
                return comparison <= 0;
            default:
                throw new IllegalStateException("Unhandled operator " + this);
        }
    }

    public static ComparisonOperator fromSymbol(String symbol) {
        if ("==".equals(symbol)) {
            return EQUALS;
        }
        for (ComparisonOperator op : values()) {
            if (op.symbol.equals(symbol)) {
                return op;
            }
        }
        return null;
    }
}
