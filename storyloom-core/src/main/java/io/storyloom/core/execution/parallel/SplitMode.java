package io.storyloom.core.execution.parallel;

import java.util.Arrays;
import java.util.Optional;

/// How a parallel block or batch splits its input into items.
public enum SplitMode {
    /// One item per non-blank line.
    LINE("line"),
    /// Items separated by a configured separator.
    SEPARATOR("separator"),
    /// Elements of a JSON array.
    JSON_ARRAY("json_array");

    private final String wireName;

    SplitMode(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<SplitMode> fromWireName(String wireName) {
        return Arrays.stream(values()).filter(m -> m.wireName.equals(wireName)).findFirst();
    }
}
