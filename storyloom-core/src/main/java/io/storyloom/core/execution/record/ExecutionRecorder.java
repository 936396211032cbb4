package io.storyloom.core.execution.record;

import java.util.NoSuchElementException;

/// Sole writer of persisted execution and node-result rows.
///
/// Driven by {@link RecordingExecutionListener}; the engine never calls it directly, so a
/// failing recorder cannot change a run's control flow.
///
/// @see InMemoryExecutionRecorder for the in-memory implementation
public interface ExecutionRecorder {

    /// Stores the row of a run that just started.
    ///
    /// @param record row in status `running`, not null
    void createExecution(ExecutionRecord record);

    /// Applies a status change to an execution row.
    ///
    /// @param executionId row to update, not null
    /// @param update change to apply, not null
    /// @throws NoSuchElementException if no such execution exists
    void updateExecution(String executionId, ExecutionUpdate update);

    /// Stores the row of a node execution that just started.
    ///
    /// @param record row in status `running`, not null
    void createNodeResult(NodeResultRecord record);

    /// Applies a change to a node result row.
    ///
    /// @param nodeResultId row to update, not null
    /// @param update change to apply, not null
    /// @throws NoSuchElementException if no such node result exists
    void updateNodeResult(String nodeResultId, NodeResultUpdate update);
}
