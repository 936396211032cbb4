package io.storyloom.core.exception;

import java.util.Arrays;
import java.util.Optional;

/// Machine-readable reason attached to a failed node or run.
public enum FailureCode {
    NODE_ERROR("node_error"),
    AI_ERROR("ai_error"),
    MISSING_PROMPT("missing_prompt"),
    UNDECLARED_VARIABLE("undeclared_variable"),
    INVALID_PATTERN("invalid_pattern"),
    INVALID_JSON("invalid_json"),
    EXTRACT_MISS("extract_miss"),
    LOOP_MAX_EXCEEDED("loop_max_exceeded"),
    ITEM_FAILED("item_failed"),
    JUMP_OUT_OF_SCOPE("jump_out_of_scope"),
    CANCELLED("cancelled"),
    TIMEOUT("timeout");

    private final String wireName;

    FailureCode(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<FailureCode> fromWireName(String wireName) {
        return Arrays.stream(values()).filter(c -> c.wireName.equals(wireName)).findFirst();
    }

    @Override
    public String toString() {
        return wireName;
    }
}
