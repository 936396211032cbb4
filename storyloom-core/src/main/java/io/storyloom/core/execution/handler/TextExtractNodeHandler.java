package io.storyloom.core.execution.handler;

import io.storyloom.core.exception.FailureCode;
import io.storyloom.core.exception.NodeExecutionException;
import io.storyloom.core.json.JsonFormatException;
import io.storyloom.core.text.MarkdownStripper;
import io.storyloom.core.text.TextExtractor;
import io.storyloom.core.workflow.NodeConfig;
import io.storyloom.core.workflow.NodeType;
import io.storyloom.core.workflow.WorkflowNode;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/// Extracts part of the input text.
///
/// ### Modes (`extract_mode`)
/// - `regex` (default): all matches of `regex_pattern`, capture groups joined
/// - `start_end`: text between `start_marker` and `end_marker`
/// - `json_path`: value at `json_path`, non-string values as JSON text
/// - `md_to_text`: the input with markdown removed
///
/// The output is trimmed. A miss yields an empty output, or fails with `extract_miss`
/// when `strict` is set.
public class TextExtractNodeHandler implements NodeHandler {

    @Override
    public NodeType getNodeType() {
        return NodeType.TEXT_EXTRACT;
    }

    @Override
    public HandlerResult execute(WorkflowNode node, HandlerContext context)
            throws NodeExecutionException {
        NodeConfig config = context.getConfig();
        String input = InputSources.read(config, context.getScope());
        String mode = config.getString("extract_mode", "regex");

        Map<String, Object> resolvedConfig = new LinkedHashMap<>();
        resolvedConfig.put("inputText", input);
        resolvedConfig.put("extractMode", mode);

        String extracted =
                switch (mode) {
                    case "start_end" -> {
                        String start = config.getString("start_marker", "");
                        String end = config.getString("end_marker", "");
                        resolvedConfig.put("startMarker", start);
                        resolvedConfig.put("endMarker", end);
                        if (start.isEmpty()) {
                            throw new NodeExecutionException(
                                    FailureCode.NODE_ERROR, "start_marker is required");
                        }
                        yield TextExtractor.between(input, start, end);
                    }
                    case "json_path" -> {
                        String path = config.getString("json_path", "");
                        resolvedConfig.put("jsonPath", path);
                        yield readJson(input, path, context);
                    }
                    case "md_to_text" -> MarkdownStripper.strip(input);
                    default -> {
                        String pattern = config.getString("regex_pattern", "");
                        resolvedConfig.put("regexPattern", pattern);
                        yield TextExtractor.allMatches(input, compile(pattern));
                    }
                };

        String output = extracted.trim();
        if (output.isEmpty() && config.getBoolean("strict", false)) {
            throw new NodeExecutionException(
                    FailureCode.EXTRACT_MISS, "Nothing extracted in " + mode + " mode");
        }
        return HandlerResult.output(output, resolvedConfig);
    }

    private Pattern compile(String pattern) throws NodeExecutionException {
        if (pattern.isEmpty()) {
            throw new NodeExecutionException(FailureCode.INVALID_PATTERN, "regex_pattern is empty");
        }
        try {
            return Pattern.compile(pattern);
        } catch (PatternSyntaxException e) {
            throw new NodeExecutionException(
                    FailureCode.INVALID_PATTERN,
                    "Invalid regex '" + pattern + "': " + e.getDescription(),
                    e);
        }
    }

    private String readJson(String input, String path, HandlerContext context)
            throws NodeExecutionException {
        try {
            return context.getServices().jsonCodec().readPath(input.trim(), path).orElse("");
        } catch (JsonFormatException e) {
            throw new NodeExecutionException(
                    FailureCode.INVALID_JSON, "Input is not valid JSON: " + e.getMessage(), e);
        }
    }
}
