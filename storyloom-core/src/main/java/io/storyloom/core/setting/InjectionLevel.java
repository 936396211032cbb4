package io.storyloom.core.setting;

import java.util.Arrays;
import java.util.Optional;

/// Token budget applied to setting injection.
public enum InjectionLevel {
    MINIMAL("minimal", 500),
    BALANCED("balanced", 1500),
    FULL("full", 3000);

    private final String wireName;
    private final int tokenBudget;

    InjectionLevel(String wireName, int tokenBudget) {
        this.wireName = wireName;
        this.tokenBudget = tokenBudget;
    }

    public int tokenBudget() {
        return tokenBudget;
    }

    public static Optional<InjectionLevel> fromWireName(String wireName) {
        return Arrays.stream(values()).filter(l -> l.wireName.equals(wireName)).findFirst();
    }
}
