package io.storyloom.core.condition;

import java.util.Arrays;
import java.util.Optional;

public enum ConditionType {
    KEYWORD("keyword"),
    LENGTH("length"),
    REGEX("regex"),
    AI_JUDGE("ai_judge");

    private final String wireName;

    ConditionType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<ConditionType> fromWireName(String wireName) {
        return Arrays.stream(values()).filter(t -> t.wireName.equals(wireName)).findFirst();
    }
}
