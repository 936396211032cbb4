package io.storyloom.core.setting;

/// Injection priority under a token budget. Declaration order is the sort order.
public enum SettingPriority {
    HIGH,
    MEDIUM,
    LOW
}
