package io.storyloom.core.variable;

import io.storyloom.core.ai.ChatMessage;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Mutable per-run scope holding variables, node outputs and chat history.
///
/// ### Lookup order for `{{name}}`
/// 1. a stored variable called `name`
/// 2. the reserved names `input` (run input) and `previous` (last output)
/// 3. otherwise absent, which templates render as the empty string
///
/// Parallel item-runs work on a {@link #copy()} so their writes never reach the
/// outer scope.
///
/// @implNote All methods are synchronized. A store is normally touched by one thread
/// at a time, but the executor may snapshot it while a listener reads it.
public class VariableStore {

    public static final String INPUT = "input";
    public static final String PREVIOUS = "previous";

    private static final TemplateResolver DEFAULT_RESOLVER = new DefaultTemplateResolver();

    private final Map<String, String> variables = new LinkedHashMap<>();
    private final Map<String, String> nodeOutputs = new LinkedHashMap<>();
    private final Map<String, List<ChatMessage>> chatHistory = new LinkedHashMap<>();
    private String lastOutput = "";
    private String lastOutputNodeId;
    private String input = "";

    public VariableStore() {}

    /// Creates a store seeded with workflow globals.
    ///
    /// @param initial initial variables, not null
    public VariableStore(Map<String, String> initial) {
        Objects.requireNonNull(initial, "initial must not be null").forEach(this::set);
    }

    public synchronized Optional<String> get(String name) {
        return Optional.ofNullable(variables.get(name));
    }

    /// Returns the value `{{name}}` resolves to, honouring reserved names.
    public synchronized Optional<String> lookup(String name) {
        String value = variables.get(name);
        if (value != null) {
            return Optional.of(value);
        }
        if (INPUT.equals(name)) {
            return Optional.of(input);
        }
        if (PREVIOUS.equals(name)) {
            return Optional.of(lastOutput);
        }
        return Optional.empty();
    }

    public synchronized void set(String name, String value) {
        Objects.requireNonNull(name, "name must not be null");
        variables.put(name, value != null ? value : "");
    }

    /// Returns true if the variable has been declared by a start node or set before.
    public synchronized boolean isDeclared(String name) {
        return variables.containsKey(name);
    }

    public synchronized Map<String, String> variables() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    }

    public synchronized Optional<String> getNodeOutput(String nodeId) {
        return Optional.ofNullable(nodeOutputs.get(nodeId));
    }

    public synchronized boolean hasNodeOutput(String nodeId) {
        return nodeOutputs.containsKey(nodeId);
    }

    /// Records a node's output and makes it the previous output for the next node.
    public synchronized void recordOutput(String nodeId, String output) {
        String value = output != null ? output : "";
        nodeOutputs.put(nodeId, value);
        lastOutput = value;
        lastOutputNodeId = nodeId;
    }

    /// Replaces a recorded output after a user edit.
    ///
    /// The edit also becomes the previous output when the node produced it.
    ///
    /// @throws IllegalArgumentException if the node has produced no output in this run
    public synchronized void replaceNodeOutput(String nodeId, String output) {
        if (!nodeOutputs.containsKey(nodeId)) {
            throw new IllegalArgumentException("Node '" + nodeId + "' has no recorded output");
        }
        String value = output != null ? output : "";
        nodeOutputs.put(nodeId, value);
        if (nodeId.equals(lastOutputNodeId)) {
            lastOutput = value;
        }
    }

    public synchronized String getLastOutput() {
        return lastOutput;
    }

    /// Overrides the previous output without attributing it to a node.
    public synchronized void setLastOutput(String output) {
        lastOutput = output != null ? output : "";
        lastOutputNodeId = null;
    }

    public synchronized String getInput() {
        return input;
    }

    public synchronized void setInput(String input) {
        this.input = input != null ? input : "";
    }

    /// Returns the most recent `limit` chat messages recorded for a node.
    public synchronized List<ChatMessage> getChatHistory(String nodeId, int limit) {
        List<ChatMessage> history = chatHistory.getOrDefault(nodeId, List.of());
        int from = Math.max(0, history.size() - Math.max(0, limit));
        return List.copyOf(history.subList(from, history.size()));
    }

    public synchronized void appendChatTurn(String nodeId, String userMessage, String reply) {
        List<ChatMessage> history = chatHistory.computeIfAbsent(nodeId, k -> new ArrayList<>());
        history.add(ChatMessage.user(userMessage));
        history.add(ChatMessage.assistant(reply));
    }

    /// Resolves a template against this store with the default resolver.
    public String resolve(String template) {
        return DEFAULT_RESOLVER.resolve(template, this);
    }

    /// Creates an independent copy for a child scope.
    public synchronized VariableStore copy() {
        return fromSnapshot(snapshot());
    }

    public synchronized VariableSnapshot snapshot() {
        Map<String, List<ChatMessage>> history = new LinkedHashMap<>();
        chatHistory.forEach((k, v) -> history.put(k, new ArrayList<>(v)));
        return new VariableSnapshot(variables, nodeOutputs, lastOutput, input, history);
    }

    /// Rebuilds a store from a snapshot.
    ///
    /// @param snapshot persisted state, not null
    /// @return new store resolving every template exactly as the snapshotted store did
    public static VariableStore fromSnapshot(VariableSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        VariableStore store = new VariableStore();
        store.variables.putAll(snapshot.variables());
        store.nodeOutputs.putAll(snapshot.nodeOutputs());
        snapshot.chatHistory().forEach((k, v) -> store.chatHistory.put(k, new ArrayList<>(v)));
        store.lastOutput = snapshot.lastOutput();
        store.input = snapshot.input();
        return store;
    }
}
