package com.docvault.access;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ConditionOperator {
    EQUALS("equals"),
    CONTAINS("contains"),
    GREATER_THAN("greater_than"),
    LESS_THAN("less_than");

    private final String code;

    ConditionOperator(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
