package io.storyloom.core.execution;

import io.storyloom.core.exception.FailureCode;
import java.io.Serial;

/// Thrown at a node or chunk boundary once the run has been cancelled or has timed out.
///
/// Unwinds the interpreter, including item-runs, without recording a node failure.
public class RunAbortedException extends RuntimeException {
    @Serial private static final long serialVersionUID = 4409175261837364152L;

    private final FailureCode code;

    public RunAbortedException(FailureCode code) {
        super(code == FailureCode.TIMEOUT ? "Execution timed out" : "Execution cancelled");
        this.code = code;
    }

    /// Returns {@link FailureCode#CANCELLED} or {@link FailureCode#TIMEOUT}.
    public FailureCode getCode() {
        return code;
    }
}
