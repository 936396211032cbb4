package io.storyloom.core.execution;

import io.storyloom.core.execution.event.ExecutionEvent;

/// Receives the structured event stream of a run.
///
/// ### Event order for one node execution
/// ```
/// node_started
/// node_streaming*        ai_chat nodes only, once per chunk
/// node_completed | node_failed
/// ```
/// Nodes bypassed by a branch or loop exit produce a single `node_skipped`.
///
/// @implNote Implementations must be thread-safe. Parallel item-runs emit events from
/// worker threads, and pause/resume events come from the thread that requested them.
///
/// @see CompositeExecutionListener
/// @see LoggingExecutionListener
/// @see io.storyloom.core.execution.record.RecordingExecutionListener
@FunctionalInterface
public interface ExecutionListener {

    /// Called for every event of the run, in emission order per thread.
    ///
    /// @param event the event, not null
    void onEvent(ExecutionEvent event);

    /// No-op listener instance that ignores all events.
    ExecutionListener NOOP = event -> {};
}
