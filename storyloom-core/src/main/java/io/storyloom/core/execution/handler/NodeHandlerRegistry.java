package io.storyloom.core.execution.handler;

import io.storyloom.core.exception.NodeHandlerNotFoundException;
import io.storyloom.core.workflow.NodeType;
import java.util.Optional;

/// Registry of node handlers keyed by node type.
///
/// ### Example usage
/// {@snippet :
/// NodeHandler handler = registry.getHandlerOrThrow(NodeType.AI_CHAT);
/// // Replace a built-in handler
/// registry.register(new MyOutputNodeHandler());
/// }
public interface NodeHandlerRegistry {

    Optional<NodeHandler> getHandler(NodeType nodeType);

    /// Gets the handler for a node type, throwing if none is registered.
    ///
    /// @param nodeType node type, not null
    /// @return the handler, never null
    /// @throws NodeHandlerNotFoundException if no handler is registered
    NodeHandler getHandlerOrThrow(NodeType nodeType) throws NodeHandlerNotFoundException;

    /// Registers a handler under {@link NodeHandler#getNodeType()}, replacing any
    /// previous one.
    void register(NodeHandler handler);

    boolean hasHandler(NodeType nodeType);
}
