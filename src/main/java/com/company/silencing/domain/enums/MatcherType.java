package com.company.silencing.domain.enums;

public enum MatcherType {
    EQUAL("="),
    NOT_EQUAL("!="),
    REGEX("=~"),
    NOT_REGEX("!~");

    private final String operator;

    MatcherType(String operator) {
        this.operator = operator;
    }

    public String getOperator() {
        return operator;
    }

    public boolean isRegex() {
        return this == REGEX || this == NOT_REGEX;
    }

    public static MatcherType fromOperator(String operator) {
        for (MatcherType type : values()) {
            if (type.operator.equals(operator)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown matcher operator: " + operator);
    }

    @Override
    public String toString() {
        return operator;
    }
}
