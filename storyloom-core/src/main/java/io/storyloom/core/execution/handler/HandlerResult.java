package io.storyloom.core.execution.handler;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Output of one node handler call.
///
/// A transparent result belongs to a block marker or a legacy control node: its output
/// is a status text for the trace and never becomes the previous output or a node
/// output reference.
///
/// @param output text produced by the node, never null
/// @param resolvedConfig config values the handler actually used, never null
/// @param signal where the cursor goes next, never null
/// @param transparent true if the output must not reach the variable store
public record HandlerResult(
        String output, Map<String, Object> resolvedConfig, ControlSignal signal, boolean transparent) {

    public HandlerResult {
        output = output != null ? output : "";
        resolvedConfig =
                resolvedConfig != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(resolvedConfig))
                        : Map.of();
        Objects.requireNonNull(signal, "signal must not be null");
    }

    /// Regular output, cursor moves on.
    public static HandlerResult output(String output, Map<String, Object> resolvedConfig) {
        return new HandlerResult(output, resolvedConfig, ControlSignal.CONTINUE, false);
    }

    /// Marker or control node result that leaves the previous output untouched.
    public static HandlerResult control(
            String status, Map<String, Object> resolvedConfig, ControlSignal signal) {
        return new HandlerResult(status, resolvedConfig, signal, true);
    }
}
