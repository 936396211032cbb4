package io.storyloom.core.execution;

import io.storyloom.core.ai.AiInvoker;
import io.storyloom.core.ai.StreamingInvocation;
import io.storyloom.core.block.BlockInfo;
import io.storyloom.core.block.BlockTable;
import io.storyloom.core.exception.FailureCode;
import io.storyloom.core.exception.NodeExecutionException;
import io.storyloom.core.execution.event.ExecutionEvent;
import io.storyloom.core.execution.event.ExecutionEventType;
import io.storyloom.core.execution.handler.BlockState;
import io.storyloom.core.execution.handler.ControlSignal;
import io.storyloom.core.execution.handler.HandlerContext;
import io.storyloom.core.execution.handler.HandlerResult;
import io.storyloom.core.execution.handler.HandlerServices;
import io.storyloom.core.execution.handler.ItemRunner;
import io.storyloom.core.execution.handler.NodeHandler;
import io.storyloom.core.execution.handler.NodeHandlerRegistry;
import io.storyloom.core.execution.parallel.ItemResult;
import io.storyloom.core.execution.parallel.ParallelItemRunner;
import io.storyloom.core.variable.ConfigResolver;
import io.storyloom.core.variable.VariableStore;
import io.storyloom.core.workflow.ConfigLimits;
import io.storyloom.core.workflow.NodeConfig;
import io.storyloom.core.workflow.NodeType;
import io.storyloom.core.workflow.Workflow;
import io.storyloom.core.workflow.WorkflowNode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Cursor loop over the resolved node list of one run.
///
/// The main run walks the whole list; parallel item-runs walk a block body and batch
/// item-runs walk their target nodes, each on its own variable scope and block state.
/// All of them share the control, the event stream, the trace and the per-node
/// iteration counters.
///
/// ### Per node
/// 1. {@link ExecutionControl#checkpoint()}: cancel, timeout, pause
/// 2. resolve the config against the current scope, emit `node_started`
/// 3. run the handler, record its output unless it is transparent
/// 4. emit `node_completed` or `node_failed`, then apply the control signal
final class NodeInterpreter {

    private static final Logger logger = Logger.getLogger(NodeInterpreter.class.getName());

    static final String ITEM_VARIABLE = "item";
    static final String ITEM_INDEX_VARIABLE = "item_index";

    private final String executionId;
    private final Workflow workflow;
    private final BlockTable blocks;
    private final NodeHandlerRegistry registry;
    private final HandlerServices services;
    private final ConfigResolver configResolver;
    private final StreamingInvocation streaming;
    private final ParallelItemRunner parallelRunner;
    private final ExecutionControl control;
    private final ExecutionListener listener;
    private final int loopCeiling;

    private final Map<String, AtomicInteger> iterations = new ConcurrentHashMap<>();
    private final List<NodeTrace> trace = Collections.synchronizedList(new ArrayList<>());
    private final AtomicReference<String> finalOutputNodeId = new AtomicReference<>();
    private volatile String currentNodeId;

    private record Range(int from, int to) {
        boolean contains(int index) {
            return index >= from && index < to;
        }
    }

    NodeInterpreter(
            String executionId,
            Workflow workflow,
            BlockTable blocks,
            NodeHandlerRegistry registry,
            HandlerServices services,
            ConfigResolver configResolver,
            StreamingInvocation streaming,
            ParallelItemRunner parallelRunner,
            ExecutionControl control,
            ExecutionListener listener,
            int loopCeiling) {
        this.executionId = executionId;
        this.workflow = workflow;
        this.blocks = blocks;
        this.registry = registry;
        this.services = services;
        this.configResolver = configResolver;
        this.streaming = streaming;
        this.parallelRunner = parallelRunner;
        this.control = control;
        this.listener = listener;
        this.loopCeiling = loopCeiling;
    }

    /// Runs the whole node list on the main scope.
    ///
    /// @throws NodeFailedException if a node fails
    /// @throws RunAbortedException if the run is cancelled or times out
    void runMain(VariableStore scope) throws NodeFailedException {
        runRange(scope, new BlockState(), new Range(0, blocks.size()), true);
    }

    /// Current output of the last `output` node of the main run, else the last output.
    ///
    /// Read from `scope`, so an edit made while paused is part of the final output.
    String finalOutput(VariableStore scope) {
        String nodeId = finalOutputNodeId.get();
        if (nodeId == null) {
            return scope.getLastOutput();
        }
        return scope.getNodeOutput(nodeId).orElseGet(scope::getLastOutput);
    }

    List<NodeTrace> trace() {
        synchronized (trace) {
            return List.copyOf(trace);
        }
    }

    /// Node the main cursor is on, or the last one it ran.
    String currentNodeId() {
        return currentNodeId;
    }

    private void runRange(VariableStore scope, BlockState state, Range range, boolean main)
            throws NodeFailedException {
        int cursor = range.from();
        while (true) {
            if (cursor >= range.to()) {
                if (main && state.armedLegacyLoop().isPresent()) {
                    cursor = blocks.indexOf(state.armedLegacyLoop().get()).orElseThrow();
                    continue;
                }
                return;
            }
            control.checkpoint();

            WorkflowNode node = blocks.nodeAt(cursor);
            if (blocks.isBatchTarget(cursor)) {
                skip(node);
                cursor++;
                continue;
            }
            if (main) {
                currentNodeId = node.getId();
            }

            ControlSignal signal = executeNode(cursor, scope, state, range, main);

            if (signal instanceof ControlSignal.Continue) {
                cursor++;
            } else if (signal instanceof ControlSignal.End) {
                return;
            } else if (signal instanceof ControlSignal.Jump jump) {
                cursor = blocks.indexOf(jump.nodeId()).orElseThrow();
                state.dropFramesOutside(cursor, blocks);
            } else if (signal instanceof ControlSignal.EnterBlock enter) {
                state.pushLoop(enter.blockId());
                logger.fine("Entered loop " + enter.blockId() + " (depth " + state.depth() + ")");
                cursor++;
            } else if (signal instanceof ControlSignal.RepeatBlock repeat) {
                state.nextIteration(repeat.blockId());
                cursor = block(repeat.blockId()).startIndex() + 1;
            } else if (signal instanceof ControlSignal.ExitBlock exit) {
                state.popLoop(exit.blockId());
                cursor++;
            } else if (signal instanceof ControlSignal.SkipTo skipTo) {
                for (int i = cursor + 1; i < skipTo.index(); i++) {
                    skip(blocks.nodeAt(i));
                }
                cursor = skipTo.index();
            } else if (signal instanceof ControlSignal.FanOut fanOut) {
                BlockInfo block = block(fanOut.blockId());
                state.recordJoin(block, fanOutBody(block, fanOut, scope));
                cursor = block.endIndex();
            } else {
                throw new IllegalStateException("Unknown control signal: " + signal);
            }
        }
    }

    private List<ItemResult> fanOutBody(
            BlockInfo block, ControlSignal.FanOut fanOut, VariableStore scope) {
        logger.info(
                "Parallel block "
                        + block.blockId()
                        + " fanning out "
                        + fanOut.items().size()
                        + " items, concurrency "
                        + fanOut.concurrency());
        Range body = new Range(block.startIndex() + 1, block.endIndex());
        return runItems(
                fanOut.items(),
                fanOut.concurrency(),
                fanOut.retryCount(),
                scope,
                (itemScope, itemState) -> runRange(itemScope, itemState, body, false));
    }

    /// Batch item-runs: the target nodes in order, once per item.
    private ItemRunner itemRunnerFor(VariableStore scope) {
        return (nodeIds, items, concurrency, retryCount) ->
                runItems(
                        items,
                        concurrency,
                        retryCount,
                        scope,
                        (itemScope, itemState) -> {
                            for (String nodeId : nodeIds) {
                                int index = blocks.indexOf(nodeId).orElseThrow();
                                control.checkpoint();
                                ControlSignal signal =
                                        executeNode(
                                                index,
                                                itemScope,
                                                itemState,
                                                new Range(index, index + 1),
                                                false);
                                if (signal instanceof ControlSignal.End) {
                                    return;
                                }
                            }
                        });
    }

    @FunctionalInterface
    private interface ItemBody {
        void run(VariableStore itemScope, BlockState itemState) throws NodeFailedException;
    }

    private List<ItemResult> runItems(
            List<String> items,
            int concurrency,
            int retryCount,
            VariableStore scope,
            ItemBody body) {
        int window =
                Math.max(
                        ConfigLimits.MIN_CONCURRENCY,
                        Math.min(ConfigLimits.MAX_CONCURRENCY, concurrency));
        try {
            return parallelRunner.run(
                    items,
                    window,
                    Math.max(0, retryCount),
                    (index, item) -> {
                        VariableStore itemScope = scope.copy();
                        itemScope.set(ITEM_VARIABLE, item);
                        itemScope.set(ITEM_INDEX_VARIABLE, String.valueOf(index));
                        itemScope.setLastOutput(item);
                        body.run(itemScope, new BlockState());
                        return itemScope.getLastOutput();
                    },
                    control::isAbortRequested);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            control.requestCancel();
            throw new RunAbortedException(FailureCode.CANCELLED);
        }
    }

    private ControlSignal executeNode(
            int index, VariableStore scope, BlockState state, Range range, boolean main)
            throws NodeFailedException {
        WorkflowNode node = blocks.nodeAt(index);
        int iteration =
                iterations.computeIfAbsent(node.getId(), id -> new AtomicInteger()).incrementAndGet();
        String input = scope.getLastOutput();
        Instant startedAt = Instant.now();
        Map<String, Object> resolved = configResolver.resolve(node.getConfig(), scope);

        emit(nodeEvent(ExecutionEventType.NODE_STARTED, node, iteration)
                .input(input)
                .resolvedConfig(resolved)
                .timestamp(startedAt)
                .build());

        NodeHandler handler =
                registry.getHandler(node.getType())
                        .orElseThrow(
                                () ->
                                        new IllegalStateException(
                                                "No handler for " + node.getType()));
        HandlerContext context =
                HandlerContext.builder()
                        .executionId(executionId)
                        .workflow(workflow)
                        .node(node)
                        .index(index)
                        .iteration(iteration)
                        .config(NodeConfig.of(resolved))
                        .blocks(blocks)
                        .scope(scope)
                        .blockState(state)
                        .services(services)
                        .configResolver(configResolver)
                        .aiInvoker(aiInvoker())
                        .streamSink(
                                (accumulated, delta) ->
                                        emit(nodeEvent(
                                                        ExecutionEventType.NODE_STREAMING,
                                                        node,
                                                        iteration)
                                                .content(accumulated)
                                                .delta(delta)
                                                .build()))
                        .itemRunner(itemRunnerFor(scope))
                        .loopCeiling(loopCeiling)
                        .build();

        try {
            HandlerResult result = handler.execute(node, context);
            if (result.signal() instanceof ControlSignal.Jump jump) {
                int target = blocks.indexOf(jump.nodeId()).orElse(-1);
                if (!range.contains(target) && !main) {
                    throw new NodeExecutionException(
                            FailureCode.JUMP_OUT_OF_SCOPE,
                            "Jump to '" + jump.nodeId() + "' leaves the item-run");
                }
            }

            if (!result.transparent()) {
                scope.recordOutput(node.getId(), result.output());
            }
            if (main && node.getType() == NodeType.OUTPUT) {
                finalOutputNodeId.set(node.getId());
            }

            Map<String, Object> reported =
                    result.resolvedConfig().isEmpty() ? resolved : result.resolvedConfig();
            emit(nodeEvent(ExecutionEventType.NODE_COMPLETED, node, iteration)
                    .input(input)
                    .content(result.output())
                    .resolvedConfig(reported)
                    .build());
            record(node, iteration, NodeTrace.Status.COMPLETED, input, result.output(), null, startedAt);
            logger.fine("Node " + node.getId() + " #" + iteration + " completed");
            return result.signal();
        } catch (NodeExecutionException e) {
            throw failed(node, iteration, input, resolved, startedAt, e.getCode(), e.getMessage(), e);
        } catch (RunAbortedException e) {
            throw failed(node, iteration, input, resolved, startedAt, e.getCode(), e.getMessage(), e);
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Handler for node " + node.getId() + " crashed", e);
            throw failed(
                    node, iteration, input, resolved, startedAt, FailureCode.NODE_ERROR, e.toString(), e);
        }
    }

    /// Records the failure and returns the exception to unwind with.
    private NodeFailedException failed(
            WorkflowNode node,
            int iteration,
            String input,
            Map<String, Object> resolved,
            Instant startedAt,
            FailureCode code,
            String reason,
            Exception cause) {
        emit(nodeEvent(ExecutionEventType.NODE_FAILED, node, iteration)
                .input(input)
                .resolvedConfig(resolved)
                .failure(code, reason)
                .build());
        record(node, iteration, NodeTrace.Status.FAILED, input, null, reason, startedAt);

        FailureCode abort = control.abortCode();
        if (abort != null) {
            throw new RunAbortedException(abort);
        }
        logger.warning("Node " + node.getId() + " failed [" + code + "]: " + reason);
        return new NodeFailedException(node.getId(), code, reason, cause);
    }

    private void skip(WorkflowNode node) {
        emit(nodeEvent(ExecutionEventType.NODE_SKIPPED, node, 0).build());
        trace.add(
                new NodeTrace(
                        node.getId(),
                        node.getName(),
                        node.getType(),
                        0,
                        NodeTrace.Status.SKIPPED,
                        null,
                        null,
                        null,
                        null,
                        Instant.now()));
    }

    private void record(
            WorkflowNode node,
            int iteration,
            NodeTrace.Status status,
            String input,
            String output,
            String error,
            Instant startedAt) {
        trace.add(
                new NodeTrace(
                        node.getId(),
                        node.getName(),
                        node.getType(),
                        iteration,
                        status,
                        input,
                        output,
                        error,
                        startedAt,
                        Instant.now()));
    }

    private AiInvoker aiInvoker() {
        return (request, onChunk) -> streaming.invoke(request, onChunk, control::isAbortRequested);
    }

    private BlockInfo block(String blockId) {
        return blocks.block(blockId)
                .orElseThrow(() -> new IllegalStateException("Unknown block " + blockId));
    }

    private ExecutionEvent.Builder nodeEvent(
            ExecutionEventType type, WorkflowNode node, int iteration) {
        return ExecutionEvent.builder(type, executionId, workflow.getId())
                .node(node.getId(), node.getName(), node.getType())
                .iteration(iteration);
    }

    void emit(ExecutionEvent event) {
        try {
            listener.onEvent(event);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Listener failed on " + event.type(), e);
        }
    }
}
