package io.storyloom.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.storyloom.core.json.JsonCodec;
import io.storyloom.core.json.JsonFormatException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/// Jackson implementation of the engine's {@link JsonCodec}.
///
/// ### Path syntax
/// Segments are separated by `.`, `[` or `]`, so `chapters[1].title`, `chapters.1.title`
/// and `chapters[1][title]` address the same value. A numeric segment indexes an array; on
/// an object it is used as a field name.
///
/// @implNote Thread-safe. The mapper is configured once and only read afterwards.
public class JacksonJsonCodec implements JsonCodec {

    private static final Pattern PATH_SEPARATOR = Pattern.compile("[.\\[\\]]");

    private final ObjectMapper mapper;

    public JacksonJsonCodec() {
        this(new ObjectMapper());
    }

    public JacksonJsonCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public List<String> parseArrayItems(String json) throws JsonFormatException {
        JsonNode root = parse(json);
        if (!root.isArray()) {
            throw new JsonFormatException("Expected a JSON array but got " + root.getNodeType());
        }
        List<String> items = new ArrayList<>(root.size());
        for (JsonNode element : root) {
            items.add(text(element));
        }
        return items;
    }

    @Override
    public Optional<String> readPath(String json, String path) throws JsonFormatException {
        JsonNode current = parse(json);
        for (String segment : PATH_SEPARATOR.split(path.trim())) {
            if (segment.isEmpty()) {
                continue;
            }
            current = step(current, segment);
            if (current == null) {
                return Optional.empty();
            }
        }
        return Optional.of(text(current));
    }

    @Override
    public String writeStringArray(List<String> items) {
        try {
            return mapper.writeValueAsString(items);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to write JSON array: " + e.getMessage(), e);
        }
    }

    private JsonNode parse(String json) throws JsonFormatException {
        try {
            JsonNode root = mapper.readTree(json);
            if (root == null || root.isMissingNode()) {
                throw new JsonFormatException("Empty JSON document");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new JsonFormatException("Invalid JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static JsonNode step(JsonNode node, String segment) {
        if (node.isArray()) {
            try {
                return node.get(Integer.parseInt(segment));
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return node.isObject() ? node.get(segment) : null;
    }

    private static String text(JsonNode node) {
        return node.isTextual() ? node.textValue() : node.toString();
    }
}
