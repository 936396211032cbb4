package io.storyloom.core.execution.handler;

import io.storyloom.core.variable.VariableStore;
import io.storyloom.core.workflow.NodeConfig;

/// Reads the input text of nodes that take `input_mode`/`input_source`/`input_variable`.
///
/// - `input_mode: manual`: `input_variable` holds a template, already resolved
/// - `input_source: previous`: the previous output
/// - otherwise, when `input_variable` names something: that node's output, else the
///   variable of that name
/// - otherwise the previous output
final class InputSources {

    private InputSources() {}

    static String read(NodeConfig config, VariableStore scope) {
        if ("manual".equals(config.getString("input_mode"))) {
            return config.getString("input_variable", "");
        }
        if ("previous".equals(config.getString("input_source"))) {
            return scope.getLastOutput();
        }
        if (config.has("input_variable")) {
            return named(config.getString("input_variable").trim(), scope);
        }
        return scope.getLastOutput();
    }

    /// Node output wins over a variable of the same name.
    static String named(String name, VariableStore scope) {
        return scope.getNodeOutput(name).or(() -> scope.lookup(name)).orElse("");
    }
}
