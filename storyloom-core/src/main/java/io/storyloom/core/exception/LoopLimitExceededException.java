package io.storyloom.core.exception;

import java.io.Serial;

/// Raised when a loop would continue past the workflow's global iteration ceiling.
public class LoopLimitExceededException extends NodeExecutionException {
    @Serial private static final long serialVersionUID = -7712045118890243190L;

    private final int ceiling;

    public LoopLimitExceededException(String blockId, int ceiling) {
        super(
                FailureCode.LOOP_MAX_EXCEEDED,
                "Loop '" + blockId + "' exceeded the iteration ceiling of " + ceiling);
        this.ceiling = ceiling;
    }

    public int getCeiling() {
        return ceiling;
    }
}
