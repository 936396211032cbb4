package io.storyloom.core.execution.parallel;

import java.util.Arrays;
import java.util.Optional;

/// How item outputs are merged at the join.
public enum OutputMode {
    /// JSON array of outputs ordered by item index.
    ARRAY("array"),
    /// Outputs joined by a separator, ordered by item index.
    CONCAT("concat");

    private final String wireName;

    OutputMode(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<OutputMode> fromWireName(String wireName) {
        return Arrays.stream(values()).filter(m -> m.wireName.equals(wireName)).findFirst();
    }
}
