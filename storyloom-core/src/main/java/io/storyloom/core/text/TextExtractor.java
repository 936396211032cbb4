package io.storyloom.core.text;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Regex and marker based text extraction.
public final class TextExtractor {

    private TextExtractor() {}

    /// Collects every match of a pattern.
    ///
    /// A match with capture groups contributes its non-null groups joined by newlines;
    /// a match without groups contributes the whole match. Matches are joined by
    /// newlines.
    ///
    /// @param input text to search, not null
    /// @param pattern compiled pattern, not null
    /// @return joined matches, empty if nothing matched
    public static String allMatches(String input, Pattern pattern) {
        Matcher matcher = pattern.matcher(input);
        List<String> matches = new ArrayList<>();
        while (matcher.find()) {
            if (matcher.groupCount() == 0) {
                matches.add(matcher.group());
                continue;
            }
            List<String> groups = new ArrayList<>();
            for (int g = 1; g <= matcher.groupCount(); g++) {
                if (matcher.group(g) != null) {
                    groups.add(matcher.group(g));
                }
            }
            matches.add(String.join("\n", groups));
        }
        return String.join("\n", matches);
    }

    /// Returns the text between the first start marker and the next end marker.
    ///
    /// @param input text to search, not null
    /// @param startMarker opening marker, not empty
    /// @param endMarker closing marker; null or empty, or not found, takes the rest
    /// @return extracted text, empty if the start marker is missing
    public static String between(String input, String startMarker, String endMarker) {
        int start = input.indexOf(startMarker);
        if (start < 0) {
            return "";
        }
        int from = start + startMarker.length();
        if (endMarker == null || endMarker.isEmpty()) {
            return input.substring(from);
        }
        int end = input.indexOf(endMarker, from);
        return end < 0 ? input.substring(from) : input.substring(from, end);
    }
}
