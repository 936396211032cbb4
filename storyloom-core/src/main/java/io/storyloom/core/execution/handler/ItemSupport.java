package io.storyloom.core.execution.handler;

import io.storyloom.core.exception.FailureCode;
import io.storyloom.core.exception.NodeExecutionException;
import io.storyloom.core.execution.parallel.ItemResult;
import io.storyloom.core.execution.parallel.OutputMode;
import io.storyloom.core.execution.parallel.SplitMode;
import io.storyloom.core.json.JsonFormatException;
import io.storyloom.core.workflow.ConfigLimits;
import io.storyloom.core.workflow.NodeConfig;
import java.util.List;
import java.util.stream.Collectors;

/// Splitting, limits and merging shared by parallel blocks and batches.
final class ItemSupport {

    private ItemSupport() {}

    static List<String> split(NodeConfig config, String input, HandlerServices services)
            throws NodeExecutionException {
        SplitMode mode =
                SplitMode.fromWireName(config.getString("split_mode", "line")).orElse(SplitMode.LINE);
        try {
            return services.itemSplitter().split(input, mode, config.getString("separator"));
        } catch (JsonFormatException e) {
            throw new NodeExecutionException(
                    FailureCode.INVALID_JSON, "Input is not a JSON array: " + e.getMessage(), e);
        }
    }

    static int concurrency(NodeConfig config, String owner) {
        return ConfigLimits.clamp(
                "concurrency of '" + owner + "'",
                config.getInt("concurrency", ConfigLimits.DEFAULT_CONCURRENCY),
                ConfigLimits.MIN_CONCURRENCY,
                ConfigLimits.MAX_CONCURRENCY);
    }

    static int retryCount(NodeConfig config, String owner) {
        return ConfigLimits.clamp(
                "retry_count of '" + owner + "'",
                config.getInt("retry_count", 0),
                ConfigLimits.MIN_RETRY,
                ConfigLimits.MAX_RETRY);
    }

    static OutputMode outputMode(NodeConfig config) {
        return OutputMode.fromWireName(config.getString("output_mode", "array")).orElse(OutputMode.ARRAY);
    }

    /// Fails when any item failed, listing every failed item.
    static void requireAllSucceeded(List<ItemResult> results) throws NodeExecutionException {
        List<ItemResult> failed = results.stream().filter(r -> !r.isSuccess()).toList();
        if (failed.isEmpty()) {
            return;
        }
        throw new NodeExecutionException(
                FailureCode.ITEM_FAILED,
                failed.size()
                        + " of "
                        + results.size()
                        + " items failed: "
                        + failed.stream()
                                .map(r -> "#" + r.index() + " " + r.error())
                                .collect(Collectors.joining("; ")));
    }
}
