package io.storyloom.core.workflow;

import io.storyloom.core.exception.WorkflowConfigurationException;
import java.util.ArrayList;
import java.util.List;

/// Range checks applied when a workflow is saved or loaded for editing.
///
/// ### Checked settings
/// - workflow `loop_max_count` in 1-50 and `timeout_seconds` positive
/// - `max_iterations` of `loop_start` and legacy `loop` nodes in 1-50
/// - `concurrency` of `parallel_start` and `batch` nodes in 1-10
/// - `retry_count` of `parallel_start` nodes in 0-5
///
/// Values that pass here are still clamped at run time, since the global ceiling may
/// have been lowered after the node was configured.
public final class WorkflowValidator {

    /// Validates the workflow and throws if any setting is out of range.
    ///
    /// @param workflow workflow to check, not null
    /// @throws WorkflowConfigurationException listing every violation
    public void validate(Workflow workflow) {
        List<String> violations = collectViolations(workflow);
        if (!violations.isEmpty()) {
            throw new WorkflowConfigurationException(violations);
        }
    }

    /// Returns all range violations without throwing.
    ///
    /// @param workflow workflow to check, not null
    /// @return violation messages, empty if valid
    public List<String> collectViolations(Workflow workflow) {
        List<String> violations = new ArrayList<>();

        Integer loopMax = workflow.getLoopMaxCount();
        if (loopMax != null
                && !ConfigLimits.inRange(
                        loopMax, ConfigLimits.MIN_ITERATIONS, ConfigLimits.MAX_ITERATIONS)) {
            violations.add("loop_max_count must be between 1 and 50, was " + loopMax);
        }
        Integer timeout = workflow.getTimeoutSeconds();
        if (timeout != null && timeout <= 0) {
            violations.add("timeout_seconds must be positive, was " + timeout);
        }

        for (WorkflowNode node : workflow.getNodes()) {
            NodeConfig config = NodeConfig.of(node.getConfig());
            switch (node.getType()) {
                case LOOP_START, LOOP ->
                        checkRange(
                                violations,
                                node,
                                config,
                                "max_iterations",
                                ConfigLimits.MIN_ITERATIONS,
                                ConfigLimits.MAX_ITERATIONS);
                case PARALLEL_START -> {
                    checkRange(
                            violations,
                            node,
                            config,
                            "concurrency",
                            ConfigLimits.MIN_CONCURRENCY,
                            ConfigLimits.MAX_CONCURRENCY);
                    checkRange(
                            violations,
                            node,
                            config,
                            "retry_count",
                            ConfigLimits.MIN_RETRY,
                            ConfigLimits.MAX_RETRY);
                }
                case BATCH ->
                        checkRange(
                                violations,
                                node,
                                config,
                                "concurrency",
                                ConfigLimits.MIN_CONCURRENCY,
                                ConfigLimits.MAX_CONCURRENCY);
                default -> {}
            }
        }
        return violations;
    }

    private void checkRange(
            List<String> violations,
            WorkflowNode node,
            NodeConfig config,
            String key,
            int min,
            int max) {
        if (!config.has(key)) {
            return;
        }
        Integer value = config.getInteger(key);
        if (value == null) {
            violations.add(node.getId() + "." + key + " must be a number");
        } else if (!ConfigLimits.inRange(value, min, max)) {
            violations.add(
                    node.getId()
                            + "."
                            + key
                            + " must be between "
                            + min
                            + " and "
                            + max
                            + ", was "
                            + value);
        }
    }
}
