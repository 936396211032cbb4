package io.storyloom.core.exception;

import java.io.Serial;

/// Raised by a node handler when the node cannot produce its output.
///
/// The executor records the node as failed with this exception's code and message,
/// then fails the run.
public class NodeExecutionException extends Exception {
    @Serial private static final long serialVersionUID = 1877432651009823367L;

    private final FailureCode code;

    public NodeExecutionException(FailureCode code, String message) {
        super(message);
        this.code = code;
    }

    public NodeExecutionException(FailureCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public FailureCode getCode() {
        return code;
    }
}
