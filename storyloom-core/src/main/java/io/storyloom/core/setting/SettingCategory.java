package io.storyloom.core.setting;

import java.util.Arrays;
import java.util.Optional;

/// Library category of a setting, each with its own default injection heading.
public enum SettingCategory {
    CHARACTER("character", "[Characters]\n{{items}}"),
    WORLDVIEW("worldview", "[Worldview]\n{{items}}"),
    STYLE("style", "[Writing Style]\n{{items}}"),
    OUTLINE("outline", "[Story Outline]\n{{items}}");

    private final String wireName;
    private final String defaultTemplate;

    SettingCategory(String wireName, String defaultTemplate) {
        this.wireName = wireName;
        this.defaultTemplate = defaultTemplate;
    }

    public String wireName() {
        return wireName;
    }

    public String defaultTemplate() {
        return defaultTemplate;
    }

    public static Optional<SettingCategory> fromWireName(String wireName) {
        return Arrays.stream(values()).filter(c -> c.wireName.equals(wireName)).findFirst();
    }
}
