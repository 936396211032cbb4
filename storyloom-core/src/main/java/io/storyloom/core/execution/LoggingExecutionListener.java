package io.storyloom.core.execution;

import io.storyloom.core.execution.event.ExecutionEvent;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Logs the event stream through `java.util.logging`.
///
/// Lifecycle events log at INFO, node events at FINE, failures at WARNING. Streaming
/// chunks log at FINEST.
///
/// ### Log Format
/// ```
/// [executionId] execution_started
/// [executionId] node_completed chapter-1 (ai_chat #2): 1532 chars
/// [executionId] node_failed extract (text_extract #1): invalid_json Input is not JSON
/// ```
public class LoggingExecutionListener implements ExecutionListener {

    private static final Logger logger =
            Logger.getLogger(LoggingExecutionListener.class.getName());

    @Override
    public void onEvent(ExecutionEvent event) {
        Level level = levelOf(event);
        if (!logger.isLoggable(level)) {
            return;
        }
        StringBuilder message =
                new StringBuilder("[").append(event.executionId()).append("] ").append(event.type());
        if (event.type().isNodeEvent()) {
            message.append(' ')
                    .append(event.nodeId())
                    .append(" (")
                    .append(event.nodeType())
                    .append(event.iteration() > 0 ? " #" + event.iteration() : "")
                    .append(')');
        }
        if (event.content() != null) {
            message.append(": ").append(event.content().length()).append(" chars");
        }
        if (event.error() != null) {
            message.append(": ").append(event.code()).append(' ').append(event.error());
        }
        logger.log(level, message.toString());
    }

    private Level levelOf(ExecutionEvent event) {
        return switch (event.type()) {
            case NODE_FAILED, EXECUTION_FAILED, EXECUTION_TIMEOUT -> Level.WARNING;
            case NODE_STREAMING -> Level.FINEST;
            case NODE_STARTED, NODE_COMPLETED, NODE_SKIPPED, NODE_OUTPUT_EDITED -> Level.FINE;
            default -> Level.INFO;
        };
    }
}
