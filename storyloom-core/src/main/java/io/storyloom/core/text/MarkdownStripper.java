package io.storyloom.core.text;

import java.util.List;
import java.util.regex.Pattern;

/// Converts markdown to plain text with a fixed sequence of regex rewrites.
///
/// Code fences and inline code keep their content, images become their alt text and
/// links their link text. Emphasis, headings, quotes, list markers, rules and HTML tags
/// are removed. Runs of blank lines collapse to one and the result is trimmed.
public final class MarkdownStripper {

    private record Rule(Pattern pattern, String replacement) {}

    private static final List<Rule> RULES =
            List.of(
                    rule("```[^\\n]*\\n([\\s\\S]*?)```", "$1"),
                    rule("`([^`]*)`", "$1"),
                    rule("!\\[([^\\]]*)]\\([^)]*\\)", "$1"),
                    rule("\\[([^\\]]*)]\\([^)]*\\)", "$1"),
                    rule("(?m)^#{1,6}\\s+", ""),
                    rule("\\*\\*([^*]+)\\*\\*", "$1"),
                    rule("__([^_]+)__", "$1"),
                    rule("\\*([^*\\n]+)\\*", "$1"),
                    rule("(?<![\\w])_([^_\\n]+)_(?![\\w])", "$1"),
                    rule("~~([^~]+)~~", "$1"),
                    rule("(?m)^>\\s*", ""),
                    rule("(?m)^[ \\t]*[-*+]\\s+", ""),
                    rule("(?m)^[ \\t]*\\d+\\.\\s+", ""),
                    rule("(?m)^[-*_]{3,}\\s*$", ""),
                    rule("<[^>]+>", ""),
                    rule("\\\\([\\\\`*_{}\\[\\]()#+\\-.!])", "$1"),
                    rule("\\n{3,}", "\n\n"));

    private MarkdownStripper() {}

    private static Rule rule(String regex, String replacement) {
        return new Rule(Pattern.compile(regex), replacement);
    }

    /// Strips markdown formatting.
    ///
    /// @param markdown markdown text, may be null
    /// @return plain text, empty for null input, never null
    public static String strip(String markdown) {
        if (markdown == null || markdown.isEmpty()) {
            return "";
        }
        String text = markdown.replace("\r\n", "\n");
        for (Rule rule : RULES) {
            text = rule.pattern().matcher(text).replaceAll(rule.replacement());
        }
        return text.trim();
    }
}
