package io.storyloom.core.execution.handler;

import io.storyloom.core.exception.NodeHandlerNotFoundException;
import io.storyloom.core.workflow.NodeType;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/// Default implementation of NodeHandlerRegistry.
///
/// Registers a built-in handler for every {@link NodeType}. All built-in handlers are
/// stateless; they obtain services from the {@link HandlerContext} at execution time.
public class DefaultNodeHandlerRegistry implements NodeHandlerRegistry {

    private final Map<NodeType, NodeHandler> registry = new EnumMap<>(NodeType.class);

    /// Creates a registry with all built-in handlers pre-registered.
    public DefaultNodeHandlerRegistry() {
        register(new StartNodeHandler());
        register(new OutputNodeHandler());
        register(new AiChatNodeHandler());
        register(new TextExtractNodeHandler());
        register(new TextConcatNodeHandler());
        register(new VarUpdateNodeHandler());
        register(new LoopStartNodeHandler());
        register(new LoopEndNodeHandler());
        register(new ParallelStartNodeHandler());
        register(new ParallelEndNodeHandler());
        register(new ConditionIfNodeHandler());
        register(new ConditionElseNodeHandler());
        register(new ConditionEndNodeHandler());
        register(new LegacyConditionNodeHandler());
        register(new LegacyLoopNodeHandler());
        register(new BatchNodeHandler());
    }

    @Override
    public synchronized Optional<NodeHandler> getHandler(NodeType nodeType) {
        return Optional.ofNullable(registry.get(nodeType));
    }

    @Override
    public NodeHandler getHandlerOrThrow(NodeType nodeType) throws NodeHandlerNotFoundException {
        return getHandler(nodeType)
                .orElseThrow(
                        () ->
                                new NodeHandlerNotFoundException(
                                        "No handler registered for node type: " + nodeType));
    }

    @Override
    public synchronized void register(NodeHandler handler) {
        registry.put(handler.getNodeType(), handler);
    }

    @Override
    public synchronized boolean hasHandler(NodeType nodeType) {
        return registry.containsKey(nodeType);
    }
}
