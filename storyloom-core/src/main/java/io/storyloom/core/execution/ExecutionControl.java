package io.storyloom.core.execution;

import io.storyloom.core.exception.FailureCode;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/// Cooperative pause, cancel and timeout control of one run.
///
/// Requests only set flags. The interpreter observes them at node boundaries through
/// {@link #checkpoint()}, and the AI streaming loop polls {@link #isAbortRequested()} at
/// every chunk.
///
/// ### Pause
/// The first thread to reach a boundary after {@link #requestPause()} moves the state to
/// {@link ExecutorState#PAUSED}; every thread reaching a boundary then waits until
/// {@link #requestResume()} or {@link #requestCancel()}. A paused run does not time out
/// while waiting; the deadline is checked again right after it resumes.
///
/// @implNote Thread-safe. Parallel item-runs share one control.
public class ExecutionControl {

    /// Receives pause and resume transitions, called while holding the control lock.
    public interface Observer {
        Observer NOOP = new Observer() {};

        default void onPaused() {}

        default void onResumed() {}
    }

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition resumed = lock.newCondition();
    private final Observer observer;

    private ExecutorState state = ExecutorState.IDLE;
    private boolean pauseRequested;
    private boolean cancelRequested;
    private Long deadlineNanos;

    public ExecutionControl(Observer observer) {
        this.observer = Objects.requireNonNull(observer, "observer must not be null");
    }

    /// Moves from idle to running and starts the timeout clock.
    ///
    /// @param timeout wall-clock budget of the run, null for none
    /// @throws IllegalStateException if the run was already started
    public void start(Duration timeout) {
        lock.lock();
        try {
            if (state != ExecutorState.IDLE) {
                throw new IllegalStateException("Run already started: " + state);
            }
            state = ExecutorState.RUNNING;
            if (timeout != null) {
                deadlineNanos = System.nanoTime() + timeout.toNanos();
            }
        } finally {
            lock.unlock();
        }
    }

    /// Records the terminal state. Later calls are ignored.
    public void finish(ExecutorState terminal) {
        lock.lock();
        try {
            if (!state.isTerminal()) {
                state = terminal;
            }
            resumed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public ExecutorState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    /// Asks the run to pause at the next node boundary.
    ///
    /// @return true if the request was accepted; false when the run is not running
    public boolean requestPause() {
        lock.lock();
        try {
            if (state != ExecutorState.RUNNING) {
                return false;
            }
            pauseRequested = true;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /// Resumes a paused run, or withdraws a pause request not yet honoured.
    ///
    /// @return true if the run was paused or had a pending pause request
    public boolean requestResume() {
        lock.lock();
        try {
            if (!pauseRequested) {
                return false;
            }
            pauseRequested = false;
            if (state == ExecutorState.PAUSED) {
                state = ExecutorState.RUNNING;
                observer.onResumed();
            }
            resumed.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /// Asks the run to stop at the next node or chunk boundary.
    ///
    /// @return true if the run had not finished yet
    public boolean requestCancel() {
        lock.lock();
        try {
            if (state.isTerminal()) {
                return false;
            }
            cancelRequested = true;
            resumed.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /// Returns true once the run is cancelled or past its deadline.
    public boolean isAbortRequested() {
        lock.lock();
        try {
            return cancelRequested || pastDeadline();
        } finally {
            lock.unlock();
        }
    }

    /// Returns why the run is aborting.
    ///
    /// @return the abort code, or null if no abort is pending
    public FailureCode abortCode() {
        lock.lock();
        try {
            if (cancelRequested) {
                return FailureCode.CANCELLED;
            }
            return pastDeadline() ? FailureCode.TIMEOUT : null;
        } finally {
            lock.unlock();
        }
    }

    private boolean pastDeadline() {
        return deadlineNanos != null && System.nanoTime() - deadlineNanos > 0;
    }

    /// Node boundary: aborts, pauses or returns.
    ///
    /// @throws RunAbortedException if the run was cancelled or timed out
    public void checkpoint() {
        lock.lock();
        try {
            while (true) {
                FailureCode abort = abortCode();
                if (abort != null) {
                    throw new RunAbortedException(abort);
                }
                if (!pauseRequested) {
                    return;
                }
                if (state == ExecutorState.RUNNING) {
                    state = ExecutorState.PAUSED;
                    observer.onPaused();
                }
                resumed.awaitUninterruptibly();
            }
        } finally {
            lock.unlock();
        }
    }
}
