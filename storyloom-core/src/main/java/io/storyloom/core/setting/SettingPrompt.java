package io.storyloom.core.setting;

/// Per-category override of the injection template.
///
/// Templates use either `{{items}}` for the pre-joined list, or
/// `{{#each items}}...{{name}}...{{content}}...{{/each}}` for per-item formatting.
///
/// @param category category the template applies to, not null
/// @param promptTemplate template text, not null
/// @param enabled disabled templates fall back to the category default
public record SettingPrompt(SettingCategory category, String promptTemplate, boolean enabled) {}
