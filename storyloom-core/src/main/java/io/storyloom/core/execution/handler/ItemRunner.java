package io.storyloom.core.execution.handler;

import io.storyloom.core.execution.parallel.ItemResult;
import java.util.List;

/// Runs nodes once per item in isolated variable scopes.
///
/// Each item-run starts from a copy of the calling scope with `item` and `item_index`
/// set and the item as its previous output.
public interface ItemRunner {

    /// Runs the given nodes in list order for every item.
    ///
    /// @param nodeIds nodes to run per item, in order, not null
    /// @param items split items, not null
    /// @param concurrency maximum item-runs in flight, clamped to 1-10
    /// @param retryCount extra attempts per failed item
    /// @return results ordered by item index, never null
    List<ItemResult> runNodes(List<String> nodeIds, List<String> items, int concurrency, int retryCount);
}
