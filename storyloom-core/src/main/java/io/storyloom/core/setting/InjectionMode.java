package io.storyloom.core.setting;

public enum InjectionMode {
    /// Injected only when a node lists the setting in `setting_ids`.
    MANUAL,
    /// Injected into every `ai_chat` node.
    AUTO
}
