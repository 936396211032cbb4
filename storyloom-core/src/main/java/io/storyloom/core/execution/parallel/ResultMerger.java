package io.storyloom.core.execution.parallel;

import io.storyloom.core.json.JsonCodec;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/// Merges successful item outputs into the join output, ordered by item index.
public class ResultMerger {

    public static final String DEFAULT_SEPARATOR = "\n";

    private final JsonCodec jsonCodec;

    public ResultMerger(JsonCodec jsonCodec) {
        this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec must not be null");
    }

    /// Merges item outputs.
    ///
    /// @param results item results in any order, all successful, not null
    /// @param mode merge mode, not null
    /// @param separator separator for {@link OutputMode#CONCAT}; null uses a newline
    /// @return merged output, never null
    public String merge(List<ItemResult> results, OutputMode mode, String separator) {
        List<String> outputs =
                results.stream()
                        .sorted(Comparator.comparingInt(ItemResult::index))
                        .map(ItemResult::output)
                        .toList();
        return switch (mode) {
            case ARRAY -> jsonCodec.writeStringArray(outputs);
            case CONCAT ->
                    String.join(
                            separator != null
                                    ? separator.replace("\\n", "\n").replace("\\t", "\t")
                                    : DEFAULT_SEPARATOR,
                            outputs);
        };
    }
}
