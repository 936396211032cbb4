package io.storyloom.core.variable;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Regex-based resolver for the editor's reference syntax.
///
/// - `{{name}}` resolves to a variable, then to the reserved `input`/`previous` values
/// - `{{@nodeId > label}}` and `{{@nodeId}}` resolve to that node's latest output
///
/// Substituted text is never re-scanned, so values containing `{{...}}` stay literal.
public class DefaultTemplateResolver implements TemplateResolver {

    private static final Pattern REFERENCE_PATTERN =
            Pattern.compile("\\{\\{\\s*(@?)([^{}>]+?)\\s*(?:>[^{}]*)?}}");

    @Override
    public String resolve(String template, VariableStore store) {
        if (template == null) {
            return "";
        }
        if (!template.contains("{{")) {
            return template;
        }

        Matcher matcher = REFERENCE_PATTERN.matcher(template);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            boolean nodeReference = !matcher.group(1).isEmpty();
            String name = matcher.group(2).trim();
            String replacement =
                    nodeReference
                            ? store.getNodeOutput(name).orElse("")
                            : store.lookup(name).orElse("");
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }

        matcher.appendTail(result);
        return result.toString();
    }
}
