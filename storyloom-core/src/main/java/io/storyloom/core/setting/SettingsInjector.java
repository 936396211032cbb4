package io.storyloom.core.setting;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Builds the text prepended to an `ai_chat` system prompt from the settings library.
///
/// ### Selection
/// Candidates are every enabled `auto` setting followed by every enabled setting named in
/// the node's `setting_ids`. With an {@link InjectionLevel}, candidates are sorted by
/// priority and admitted while the estimated token total stays within budget; a setting
/// that does not fit may still enter through its summary.
///
/// ### Rendering
/// Settings are grouped by category in first-seen order. Each group renders through the
/// enabled {@link SettingPrompt} for its category or the category default, and groups are
/// separated by a blank line.
public class SettingsInjector {

    private static final Pattern EACH_BLOCK =
            Pattern.compile("\\{\\{#each items}}([\\s\\S]*?)\\{\\{/each}}");
    private static final Pattern CJK = Pattern.compile("[\\u4e00-\\u9fff\\u3400-\\u4dbf]");

    /// Result of an injection.
    ///
    /// @param text rendered injection text, empty when nothing was selected
    /// @param settingNames names of injected settings in render order
    public record Injection(String text, List<String> settingNames) {
        public static final Injection NONE = new Injection("", List.of());

        public boolean isEmpty() {
            return text.isEmpty();
        }
    }

    /// Renders the injection for one node.
    ///
    /// @param provider settings library, not null
    /// @param settingIds IDs selected on the node, not null
    /// @param level token budget, or null for no budget
    /// @return injection, never null
    public Injection inject(SettingsProvider provider, List<String> settingIds, InjectionLevel level) {
        List<Setting> candidates = collectCandidates(provider.getSettings(), settingIds);
        if (candidates.isEmpty()) {
            return Injection.NONE;
        }
        List<Setting> selected =
                level != null ? applyBudget(candidates, level.tokenBudget()) : candidates;
        if (selected.isEmpty()) {
            return Injection.NONE;
        }
        return new Injection(
                render(selected, provider.getSettingPrompts()),
                grouped(selected).values().stream()
                        .flatMap(List::stream)
                        .map(Setting::name)
                        .toList());
    }

    /// Estimates tokens as CJK characters times 1.5 plus other words times 1.3, rounded up.
    public static int estimateTokens(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        Matcher cjk = CJK.matcher(text);
        int cjkChars = 0;
        while (cjk.find()) {
            cjkChars++;
        }
        String remaining = CJK.matcher(text).replaceAll(" ").trim();
        int words = remaining.isEmpty() ? 0 : remaining.split("\\s+").length;
        return (int) Math.ceil(cjkChars * 1.5 + words * 1.3);
    }

    private List<Setting> collectCandidates(List<Setting> all, List<String> manualIds) {
        Map<String, Setting> candidates = new LinkedHashMap<>();
        for (Setting setting : all) {
            if (setting.enabled() && setting.injectionMode() == InjectionMode.AUTO) {
                candidates.put(setting.id(), setting);
            }
        }
        for (Setting setting : all) {
            if (setting.enabled() && manualIds.contains(setting.id())) {
                candidates.put(setting.id(), setting);
            }
        }
        return new ArrayList<>(candidates.values());
    }

    private List<Setting> applyBudget(List<Setting> candidates, int budget) {
        List<Setting> sorted = new ArrayList<>(candidates);
        sorted.sort(Comparator.comparing(Setting::priority));

        List<Setting> result = new ArrayList<>();
        int used = 0;
        for (Setting setting : sorted) {
            int tokens = estimateTokens(setting.content());
            if (used + tokens <= budget) {
                result.add(setting);
                used += tokens;
            } else if (setting.hasSummary()) {
                int summaryTokens = estimateTokens(setting.summary());
                if (used + summaryTokens <= budget) {
                    result.add(setting.withContent(setting.summary()));
                    used += summaryTokens;
                }
            }
        }
        return result;
    }

    private Map<SettingCategory, List<Setting>> grouped(List<Setting> settings) {
        Map<SettingCategory, List<Setting>> byCategory = new LinkedHashMap<>();
        for (Setting setting : settings) {
            byCategory.computeIfAbsent(setting.category(), k -> new ArrayList<>()).add(setting);
        }
        return byCategory;
    }

    private String render(List<Setting> settings, List<SettingPrompt> prompts) {
        List<String> parts = new ArrayList<>();
        for (Map.Entry<SettingCategory, List<Setting>> group : grouped(settings).entrySet()) {
            String template =
                    prompts.stream()
                            .filter(p -> p.category() == group.getKey() && p.enabled())
                            .map(SettingPrompt::promptTemplate)
                            .filter(t -> t != null && !t.isEmpty())
                            .findFirst()
                            .orElse(group.getKey().defaultTemplate());
            parts.add(renderGroup(template, group.getValue()));
        }
        return String.join("\n\n", parts);
    }

    private String renderGroup(String template, List<Setting> settings) {
        Matcher each = EACH_BLOCK.matcher(template);
        if (each.find()) {
            String itemTemplate = each.group(1);
            StringBuilder items = new StringBuilder();
            for (Setting setting : settings) {
                items.append(
                        itemTemplate
                                .replace("{{name}}", setting.name())
                                .replace("{{content}}", setting.content()));
            }
            return template.substring(0, each.start())
                    + items
                    + template.substring(each.end());
        }
        List<String> items = new ArrayList<>();
        for (Setting setting : settings) {
            items.add(setting.name() + ": " + setting.content());
        }
        return template.replace("{{items}}", String.join("\n\n", items));
    }
}
