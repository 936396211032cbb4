package io.storyloom.core.setting;

import java.util.List;

/// Boundary to the settings library owned by the surrounding application.
public interface SettingsProvider {

    /// Returns every setting of the project, enabled or not.
    List<Setting> getSettings();

    /// Returns the category template overrides of the project.
    List<SettingPrompt> getSettingPrompts();

    /// Provider with no settings, used when a run has no library.
    SettingsProvider EMPTY =
            new SettingsProvider() {
                @Override
                public List<Setting> getSettings() {
                    return List.of();
                }

                @Override
                public List<SettingPrompt> getSettingPrompts() {
                    return List.of();
                }
            };
}
