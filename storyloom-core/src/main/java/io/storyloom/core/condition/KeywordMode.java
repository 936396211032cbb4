package io.storyloom.core.condition;

import java.util.Arrays;
import java.util.Optional;

/// How a keyword list is matched against the input.
public enum KeywordMode {
    /// At least one keyword occurs.
    ANY("any"),
    /// Every keyword occurs.
    ALL("all"),
    /// No keyword occurs.
    NONE("none");

    private final String wireName;

    KeywordMode(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<KeywordMode> fromWireName(String wireName) {
        return Arrays.stream(values()).filter(m -> m.wireName.equals(wireName)).findFirst();
    }
}
