package io.storyloom.core.setting;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/// Settings library held in memory.
///
/// @implNote Thread-safe. Backed by copy-on-write lists.
public class InMemorySettingsProvider implements SettingsProvider {

    private final List<Setting> settings = new CopyOnWriteArrayList<>();
    private final List<SettingPrompt> prompts = new CopyOnWriteArrayList<>();

    public InMemorySettingsProvider addSetting(Setting setting) {
        settings.add(Objects.requireNonNull(setting, "setting must not be null"));
        return this;
    }

    public InMemorySettingsProvider addPrompt(SettingPrompt prompt) {
        prompts.add(Objects.requireNonNull(prompt, "prompt must not be null"));
        return this;
    }

    @Override
    public List<Setting> getSettings() {
        return List.copyOf(settings);
    }

    @Override
    public List<SettingPrompt> getSettingPrompts() {
        return List.copyOf(prompts);
    }
}
