package io.storyloom.core.execution;

import io.storyloom.core.exception.FailureCode;
import java.util.Objects;

/// Why a run or node failed.
///
/// @param nodeId node that failed, may be null for run-level failures
/// @param code machine-readable reason, not null
/// @param reason human-readable message, not null
public record ExecutionFailure(String nodeId, FailureCode code, String reason) {

    public ExecutionFailure {
        Objects.requireNonNull(code, "code must not be null");
        reason = reason != null ? reason : code.wireName();
    }
}
