package io.storyloom.core.execution.parallel;

import io.storyloom.core.json.JsonCodec;
import io.storyloom.core.json.JsonFormatException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/// Splits block input into items.
///
/// Line and separator items are trimmed and blank items dropped. JSON array elements are
/// kept as the codec returns them.
public class ItemSplitter {

    private static final Pattern LINE_BREAK = Pattern.compile("\\r?\\n");

    private final JsonCodec jsonCodec;

    public ItemSplitter(JsonCodec jsonCodec) {
        this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec must not be null");
    }

    /// Splits the input.
    ///
    /// @param input text to split, not null
    /// @param mode split mode, not null
    /// @param separator separator for {@link SplitMode#SEPARATOR}; null or empty falls
    ///     back to line splitting
    /// @return items in input order, never null
    /// @throws JsonFormatException if `json_array` input is not a JSON array
    public List<String> split(String input, SplitMode mode, String separator)
            throws JsonFormatException {
        return switch (mode) {
            case LINE -> clean(LINE_BREAK.split(input));
            case SEPARATOR ->
                    separator == null || separator.isEmpty()
                            ? clean(LINE_BREAK.split(input))
                            : clean(input.split(Pattern.quote(unescape(separator)), -1));
            case JSON_ARRAY -> input.isBlank() ? List.of() : jsonCodec.parseArrayItems(input.trim());
        };
    }

    private List<String> clean(String[] parts) {
        List<String> items = new ArrayList<>(parts.length);
        for (String part : parts) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                items.add(trimmed);
            }
        }
        return items;
    }

    // Editors store "\n" typed into a text field as two characters
    private String unescape(String separator) {
        return separator.replace("\\n", "\n").replace("\\t", "\t");
    }
}
