package io.storyloom.core.json;

import java.util.List;
import java.util.Optional;

/// JSON operations the node handlers need, kept behind an interface so that
/// {@code storyloom-core} stays free of a JSON library. The Jackson implementation
/// lives in {@code storyloom-serialization} as {@code JacksonJsonCodec}.
public interface JsonCodec {

    /// Parses a JSON array into item texts.
    ///
    /// String elements are returned as-is; any other element is returned as its JSON text.
    ///
    /// @param json JSON array text, not null
    /// @return items in array order, never null
    /// @throws JsonFormatException if the text is not a JSON array
    List<String> parseArrayItems(String json) throws JsonFormatException;

    /// Reads a value by a dotted path such as `chapters[0].title` or `a.b.0`.
    ///
    /// String values are returned as-is; objects, arrays, numbers and booleans are
    /// returned as their JSON text.
    ///
    /// @param json JSON document, not null
    /// @param path dotted path, empty for the whole document, not null
    /// @return value text, or empty if the path does not exist
    /// @throws JsonFormatException if the document is not valid JSON
    Optional<String> readPath(String json, String path) throws JsonFormatException;

    /// Serializes strings as a JSON array.
    ///
    /// @param items values in order, not null
    /// @return JSON array text, never null
    String writeStringArray(List<String> items);

    /// Codec for environments without a JSON library; every parse fails.
    JsonCodec UNAVAILABLE =
            new JsonCodec() {
                @Override
                public List<String> parseArrayItems(String json) throws JsonFormatException {
                    throw new JsonFormatException("No JSON codec configured");
                }

                @Override
                public Optional<String> readPath(String json, String path)
                        throws JsonFormatException {
                    throw new JsonFormatException("No JSON codec configured");
                }

                @Override
                public String writeStringArray(List<String> items) {
                    throw new IllegalStateException("No JSON codec configured");
                }
            };
}
