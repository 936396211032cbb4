package io.storyloom.core.setting;

import java.util.Objects;

/// Library entry injected into AI system prompts.
///
/// @param id unique setting ID, not null
/// @param category library category, not null
/// @param name display name, not null
/// @param content full text, not null
/// @param enabled disabled settings are never injected
/// @param injectionMode manual or automatic injection, not null
/// @param priority rank under a token budget, not null
/// @param summary shorter text used when the content does not fit, may be null
public record Setting(
        String id,
        SettingCategory category,
        String name,
        String content,
        boolean enabled,
        InjectionMode injectionMode,
        SettingPriority priority,
        String summary) {

    public Setting {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(name, "name must not be null");
        content = content != null ? content : "";
        injectionMode = injectionMode != null ? injectionMode : InjectionMode.MANUAL;
        priority = priority != null ? priority : SettingPriority.MEDIUM;
    }

    /// Creates an enabled, manually injected, medium priority setting.
    public static Setting of(String id, SettingCategory category, String name, String content) {
        return new Setting(
                id, category, name, content, true, InjectionMode.MANUAL, SettingPriority.MEDIUM, null);
    }

    public boolean hasSummary() {
        return summary != null && !summary.isEmpty();
    }

    Setting withContent(String newContent) {
        return new Setting(
                id, category, name, newContent, enabled, injectionMode, priority, summary);
    }
}
