package io.storyloom.core.execution;

import io.storyloom.core.execution.event.ExecutionEvent;
import java.util.List;
import java.util.logging.Logger;

/// Fans out events to an ordered set of delegates.
///
/// All delegates are invoked in declaration order. A runtime exception from one
/// delegate is logged and does not stop the remaining delegates or the run.
///
/// ### Usage
/// {@snippet :
/// ExecutionListener composite = new CompositeExecutionListener(
///     new RecordingExecutionListener(recorder),
///     new LoggingExecutionListener()
/// );
/// }
///
/// @implNote Thread-safe if all delegates are thread-safe.
public final class CompositeExecutionListener implements ExecutionListener {

    private static final Logger logger =
            Logger.getLogger(CompositeExecutionListener.class.getName());

    private final List<ExecutionListener> delegates;

    /// @param delegates listeners to notify, not null, elements not null
    public CompositeExecutionListener(ExecutionListener... delegates) {
        this.delegates = List.of(delegates);
    }

    @Override
    public void onEvent(ExecutionEvent event) {
        for (ExecutionListener delegate : delegates) {
            try {
                delegate.onEvent(event);
            } catch (RuntimeException e) {
                logger.warning(
                        "Listener "
                                + delegate.getClass().getSimpleName()
                                + " failed on "
                                + event.type()
                                + ": "
                                + e.getMessage());
            }
        }
    }
}
