package io.storyloom.core.execution.handler;

import io.storyloom.core.exception.NodeExecutionException;
import io.storyloom.core.workflow.NodeType;
import io.storyloom.core.workflow.WorkflowNode;

/// Strategy interface for executing one node type.
///
/// Implementations are stateless and thread-safe; parallel item-runs call the same
/// handler instance from several threads. Everything a handler needs arrives through the
/// {@link HandlerContext}, including the config already passed through variable
/// substitution.
///
/// ### Example implementation
/// {@snippet :
/// public class UppercaseNodeHandler implements NodeHandler {
///     public NodeType getNodeType() {
///         return NodeType.OUTPUT;
///     }
///
///     public HandlerResult execute(WorkflowNode node, HandlerContext context) {
///         String text = context.getScope().getLastOutput().toUpperCase();
///         return HandlerResult.output(text, Map.of());
///     }
/// }
/// }
public interface NodeHandler {

    /// Returns the node type this handler executes. Used as the registry key.
    NodeType getNodeType();

    /// Executes a node.
    ///
    /// @param node node to execute, not null
    /// @param context run services and the node's resolved config, not null
    /// @return output and control signal, never null
    /// @throws NodeExecutionException if the node fails; the run then fails with the
    ///     exception's code
    HandlerResult execute(WorkflowNode node, HandlerContext context) throws NodeExecutionException;
}
