package io.storyloom.core.workflow;

import java.util.Arrays;
import java.util.Optional;

/// Node type tags as they appear in the editor's node list.
///
/// Block-structured kinds come in start/end pairs sharing a `block_id`. The legacy
/// single-node kinds (`condition`, `loop`, `batch`) carry their control flow in config.
public enum NodeType {
    START("start"),
    OUTPUT("output"),
    AI_CHAT("ai_chat"),
    TEXT_EXTRACT("text_extract"),
    TEXT_CONCAT("text_concat"),
    VAR_UPDATE("var_update"),
    LOOP_START("loop_start"),
    LOOP_END("loop_end"),
    PARALLEL_START("parallel_start"),
    PARALLEL_END("parallel_end"),
    CONDITION_IF("condition_if"),
    CONDITION_ELSE("condition_else"),
    CONDITION_END("condition_end"),
    CONDITION("condition"),
    LOOP("loop"),
    BATCH("batch");

    private final String wireName;

    NodeType(String wireName) {
        this.wireName = wireName;
    }

    /// Returns the snake_case name used in persisted workflows.
    public String wireName() {
        return wireName;
    }

    /// Looks up a type by its wire name.
    ///
    /// @param wireName persisted type name, may be null
    /// @return matching type, or empty if unknown
    public static Optional<NodeType> fromWireName(String wireName) {
        return Arrays.stream(values()).filter(t -> t.wireName.equals(wireName)).findFirst();
    }

    public boolean isBlockStart() {
        return this == LOOP_START || this == PARALLEL_START || this == CONDITION_IF;
    }

    public boolean isBlockEnd() {
        return this == LOOP_END || this == PARALLEL_END || this == CONDITION_END;
    }

    /// Returns true for nodes that only mark block boundaries and never change the
    /// previous output seen by the next node.
    public boolean isMarker() {
        return isBlockStart() || isBlockEnd() || this == CONDITION_ELSE;
    }

    public boolean isLegacy() {
        return this == CONDITION || this == LOOP || this == BATCH;
    }

    /// Returns the block-end type that closes this block-start type.
    ///
    /// @throws IllegalStateException if this type does not open a block
    public NodeType closingType() {
        return switch (this) {
            case LOOP_START -> LOOP_END;
            case PARALLEL_START -> PARALLEL_END;
            case CONDITION_IF -> CONDITION_END;
            default -> throw new IllegalStateException(wireName + " does not open a block");
        };
    }

    @Override
    public String toString() {
        return wireName;
    }
}
