package io.storyloom.core.execution;

import static io.storyloom.core.WorkflowFixtures.aiChat;
import static io.storyloom.core.WorkflowFixtures.setVariable;
import static io.storyloom.core.WorkflowFixtures.workflow;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.storyloom.core.StoryloomConfig;
import io.storyloom.core.WorkflowFixtures;
import io.storyloom.core.ai.AiRequest;
import io.storyloom.core.ai.stub.StubAiClient;
import io.storyloom.core.ai.stub.StubResponse;
import io.storyloom.core.exception.FailureCode;
import io.storyloom.core.exception.WorkflowStructureException;
import io.storyloom.core.execution.event.ExecutionEvent;
import io.storyloom.core.execution.event.ExecutionEventType;
import io.storyloom.core.execution.handler.DefaultNodeHandlerRegistry;
import io.storyloom.core.execution.handler.NodeHandlerRegistry;
import io.storyloom.core.execution.record.ExecutionRecord;
import io.storyloom.core.execution.record.InMemoryExecutionRecorder;
import io.storyloom.core.execution.record.NodeResultRecord;
import io.storyloom.core.execution.record.NodeResultStatus;
import io.storyloom.core.execution.record.RecordingExecutionListener;
import io.storyloom.core.json.JsonCodec;
import io.storyloom.core.setting.SettingsProvider;
import io.storyloom.core.workflow.NodeType;
import io.storyloom.core.workflow.Workflow;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class WorkflowExecutorTest {

    private StubAiClient ai;
    private ExecutorService executorService;
    private WorkflowExecutor executor;
    private final List<ExecutionEvent> events = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        ai = new StubAiClient();
        executorService = Executors.newCachedThreadPool();
        executor = executorWith(new DefaultNodeHandlerRegistry());
    }

    @AfterEach
    void tearDown() {
        executorService.shutdownNow();
    }

    private WorkflowExecutor executorWith(NodeHandlerRegistry registry) {
        return new WorkflowExecutor(
                registry,
                ai,
                SettingsProvider.EMPTY,
                JsonCodec.UNAVAILABLE,
                executorService,
                StoryloomConfig.builder().streamPollInterval(Duration.ofMillis(5)).build());
    }

    private ExecutionResult run(Workflow workflow, String input) {
        return executor.execute(workflow, ExecutionOptions.withInput(input), events::add);
    }

    private List<ExecutionEventType> eventTypes() {
        return events.stream().map(ExecutionEvent::type).toList();
    }

    private static Map<String, Object> text(String value) {
        return Map.of("sources", List.of(Map.of("custom", value)));
    }

    private static String lastUserPrompt(AiRequest request) {
        return request.messages().get(request.messages().size() - 1).content();
    }

    private static WorkflowFixtures withMarks(String id) {
        return WorkflowFixtures.bare(id)
                .node(
                        "start",
                        NodeType.START,
                        Map.of(
                                "custom_variables",
                                List.of(Map.of("name", "marks", "default_value", ""))));
    }

    @Nested
    class Linear {

        @Test
        void shouldRunNodesInOrderAndReturnOutputNodeText() {
            // Given
            Workflow wf =
                    workflow("tale")
                            .node("draft", NodeType.AI_CHAT, aiChat("You tell tales.", "Tell of {{input}}"))
                            .node("result", NodeType.OUTPUT, Map.of("format", "text"))
                            .build();

            // When
            ExecutionResult result = run(wf, "a **dragon**");

            // Then
            assertThat(result.isCompleted()).isTrue();
            assertThat(result.finalOutput()).isEqualTo("Tell of a dragon");
            assertThat(result.getFailure()).isEmpty();
            assertThat(result.trace())
                    .extracting(NodeTrace::nodeId)
                    .containsExactly("start", "draft", "result");
            assertThat(result.traceOf("draft").get(0).output()).isEqualTo("Tell of a **dragon**");
            assertThat(result.traceOf("draft").get(0).iteration()).isEqualTo(1);
        }

        @Test
        void shouldEmitLifecycleEventsAroundNodeEvents() {
            Workflow wf = workflow("tale").node("result", NodeType.OUTPUT, Map.of()).build();

            ExecutionResult result = run(wf, "seed");

            assertThat(eventTypes())
                    .containsExactly(
                            ExecutionEventType.EXECUTION_STARTED,
                            ExecutionEventType.NODE_STARTED,
                            ExecutionEventType.NODE_COMPLETED,
                            ExecutionEventType.NODE_STARTED,
                            ExecutionEventType.NODE_COMPLETED,
                            ExecutionEventType.EXECUTION_COMPLETED);
            ExecutionEvent completed = events.get(events.size() - 1);
            assertThat(completed.status()).isEqualTo(ExecutionStatus.COMPLETED);
            assertThat(completed.finalOutput()).isEqualTo("seed");
            assertThat(completed.executionId()).isEqualTo(result.executionId());
        }

        @Test
        void shouldResolveNodeReferencesAndSeededVariables() {
            // Given
            Workflow wf =
                    workflow("tale")
                            .node("draft", NodeType.AI_CHAT, aiChat("", "{{tone}} tale of {{input}}"))
                            .node("note", NodeType.TEXT_CONCAT, text("unrelated"))
                            .node("summary", NodeType.TEXT_CONCAT, text("[{{@draft}}] after [{{previous}}]"))
                            .build();

            // When
            ExecutionResult result =
                    executor.execute(
                            wf,
                            ExecutionOptions.builder().input("a comet").variable("tone", "grim").build(),
                            ExecutionListener.NOOP);

            // Then
            assertThat(result.finalOutput()).isEqualTo("[grim tale of a comet] after [unrelated]");
        }

        @Test
        void shouldFailOnUndeclaredVariableAndStop() {
            // Given
            Workflow wf =
                    workflow("tale")
                            .node("set", NodeType.VAR_UPDATE, setVariable("ghost", "boo"))
                            .node("result", NodeType.OUTPUT, Map.of())
                            .build();

            // When
            ExecutionResult result = run(wf, "seed");

            // Then
            assertThat(result.status()).isEqualTo(ExecutionStatus.FAILED);
            assertThat(result.failure().nodeId()).isEqualTo("set");
            assertThat(result.failure().code()).isEqualTo(FailureCode.UNDECLARED_VARIABLE);
            assertThat(result.traceOf("set").get(0).status()).isEqualTo(NodeTrace.Status.FAILED);
            assertThat(result.traceOf("result")).isEmpty();
            assertThat(eventTypes()).endsWith(
                    ExecutionEventType.NODE_FAILED, ExecutionEventType.EXECUTION_FAILED);
        }

        @Test
        void shouldFailWithAiErrorWhenProviderFails() {
            ai.enqueue(StubResponse.failure("quota exhausted"));
            Workflow wf = workflow("tale").node("draft", NodeType.AI_CHAT, aiChat("sys", "user")).build();

            ExecutionResult result = run(wf, "seed");

            assertThat(result.status()).isEqualTo(ExecutionStatus.FAILED);
            assertThat(result.failure().code()).isEqualTo(FailureCode.AI_ERROR);
            assertThat(result.failure().reason()).contains("quota exhausted");
        }
    }

    @Nested
    class Preparation {

        @Test
        void shouldRejectNodeTypeWithoutHandler() {
            // Given
            NodeHandlerRegistry partial = mock(NodeHandlerRegistry.class);
            when(partial.hasHandler(any()))
                    .thenAnswer(invocation -> invocation.getArgument(0) != NodeType.AI_CHAT);
            Workflow wf = workflow("tale").node("draft", NodeType.AI_CHAT, aiChat("s", "u")).build();

            // When / Then
            assertThatThrownBy(() -> executorWith(partial).prepare(wf, ExecutionOptions.defaults(), events::add))
                    .isInstanceOf(WorkflowStructureException.class)
                    .hasMessageContaining("ai_chat");
            assertThat(events).isEmpty();
        }

        @Test
        void shouldRejectUnclosedBlockBeforeRunning() {
            Workflow wf =
                    workflow("tale")
                            .open("loop", NodeType.LOOP_START, "l", Map.of())
                            .node("result", NodeType.OUTPUT, Map.of())
                            .build();

            assertThatThrownBy(() -> run(wf, "seed")).isInstanceOf(WorkflowStructureException.class);
            assertThat(events).isEmpty();
        }

        @Test
        void shouldRunOnlyOnce() {
            WorkflowRun run =
                    executor.prepare(
                            workflow("tale").build(), ExecutionOptions.defaults(), ExecutionListener.NOOP);

            assertThat(run.getStatus()).isEmpty();
            run.execute();

            assertThat(run.getStatus()).contains(ExecutionStatus.COMPLETED);
            assertThatThrownBy(run::execute).isInstanceOf(IllegalStateException.class);
        }
    }

    @Nested
    class Loops {

        @Test
        void shouldRunCountLoopBodyMaxIterationsTimes() {
            // Given
            Workflow wf =
                    withMarks("loop")
                            .open("loop", NodeType.LOOP_START, "l", Map.of("max_iterations", 3))
                            .node("mark", NodeType.VAR_UPDATE, setVariable("marks", "{{marks}}*"))
                            .close("loop_end", NodeType.LOOP_END, "l")
                            .node("result", NodeType.OUTPUT, Map.of())
                            .build();

            // When
            ExecutionResult result = run(wf, "seed");

            // Then
            assertThat(result.isCompleted()).isTrue();
            assertThat(result.finalOutput()).isEqualTo("***");
            assertThat(result.variables().variables()).containsEntry("marks", "***");
            assertThat(result.traceOf("mark"))
                    .extracting(NodeTrace::iteration)
                    .containsExactly(1, 2, 3);
            assertThat(result.traceOf("loop_end")).hasSize(3);
        }

        @Test
        void shouldStopConditionLoopWhenConditionTurnsFalse() {
            Workflow wf =
                    withMarks("loop")
                            .open(
                                    "loop",
                                    NodeType.LOOP_START,
                                    "l",
                                    Map.of(
                                            "loop_type", "condition",
                                            "condition_type", "length",
                                            "length_operator", "<",
                                            "length_value", 3))
                            .node("mark", NodeType.VAR_UPDATE, setVariable("marks", "{{marks}}*"))
                            .close("loop_end", NodeType.LOOP_END, "l")
                            .build();

            ExecutionResult result = run(wf, "seed");

            assertThat(result.finalOutput()).isEqualTo("***");
            assertThat(result.traceOf("mark")).hasSize(3);
        }

        @Test
        void shouldFailWhenLoopPassesWorkflowCeiling() {
            // Given
            Workflow wf =
                    withMarks("loop")
                            .open("loop", NodeType.LOOP_START, "l", Map.of("max_iterations", 5))
                            .node("mark", NodeType.VAR_UPDATE, setVariable("marks", "{{marks}}*"))
                            .close("loop_end", NodeType.LOOP_END, "l")
                            .loopMaxCount(2)
                            .build();

            // When
            ExecutionResult result = run(wf, "seed");

            // Then
            assertThat(result.status()).isEqualTo(ExecutionStatus.FAILED);
            assertThat(result.failure().code()).isEqualTo(FailureCode.LOOP_MAX_EXCEEDED);
            assertThat(result.failure().nodeId()).isEqualTo("loop_end");
            assertThat(result.variables().variables()).containsEntry("marks", "**");
        }

        @Test
        void shouldKeepPreviousOutputAcrossLoopMarkers() {
            Workflow wf =
                    workflow("loop")
                            .node("seed", NodeType.TEXT_CONCAT, text("before"))
                            .open("loop", NodeType.LOOP_START, "l", Map.of("max_iterations", 1))
                            .close("loop_end", NodeType.LOOP_END, "l")
                            .node("result", NodeType.OUTPUT, Map.of())
                            .build();

            assertThat(run(wf, "x").finalOutput()).isEqualTo("before");
        }
    }

    @Nested
    class Conditions {

        private Workflow branching() {
            return workflow("branch")
                    .open(
                            "if",
                            NodeType.CONDITION_IF,
                            "c",
                            Map.of("condition_type", "keyword", "keywords", List.of("dragon")))
                    .node("brave", NodeType.TEXT_CONCAT, text("brave"))
                    .close("else", NodeType.CONDITION_ELSE, "c")
                    .node("timid", NodeType.TEXT_CONCAT, text("timid"))
                    .close("end", NodeType.CONDITION_END, "c")
                    .node("result", NodeType.OUTPUT, Map.of())
                    .build();
        }

        @Test
        void shouldTakeIfBranchAndSkipElseBranch() {
            ExecutionResult result = run(branching(), "a dragon wakes");

            assertThat(result.finalOutput()).isEqualTo("brave");
            assertThat(result.traceOf("timid"))
                    .extracting(NodeTrace::status)
                    .containsExactly(NodeTrace.Status.SKIPPED);
            assertThat(events)
                    .filteredOn(e -> e.type() == ExecutionEventType.NODE_SKIPPED)
                    .extracting(ExecutionEvent::nodeId)
                    .containsExactly("timid");
        }

        @Test
        void shouldTakeElseBranchWhenConditionIsFalse() {
            ExecutionResult result = run(branching(), "a quiet morning");

            assertThat(result.finalOutput()).isEqualTo("timid");
            assertThat(result.traceOf("brave"))
                    .extracting(NodeTrace::status)
                    .containsExactly(NodeTrace.Status.SKIPPED);
            assertThat(result.traceOf("else"))
                    .extracting(NodeTrace::status)
                    .containsExactly(NodeTrace.Status.COMPLETED);
        }
    }

    @Nested
    class Parallel {

        @Test
        void shouldMergeItemOutputsInItemOrder() {
            // Given
            ai.respondWith(
                    request -> {
                        String prompt = lastUserPrompt(request);
                        long delay = prompt.contains("Dawn") ? 80 : 5;
                        return StubResponse.text(prompt).withChunkDelay(Duration.ofMillis(delay));
                    });
            Workflow wf =
                    workflow("scenes")
                            .open(
                                    "fan_out",
                                    NodeType.PARALLEL_START,
                                    "p",
                                    Map.of(
                                            "split_mode", "line",
                                            "concurrency", 2,
                                            "output_mode", "concat",
                                            "output_separator", " | "))
                            .node("scene", NodeType.AI_CHAT, aiChat("", "Scene {{item_index}}: {{item}}"))
                            .close("fan_in", NodeType.PARALLEL_END, "p")
                            .node("result", NodeType.OUTPUT, Map.of())
                            .build();

            // When
            ExecutionResult result = run(wf, "Dawn\nDusk\nNoon\nNight");

            // Then
            assertThat(result.isCompleted()).isTrue();
            assertThat(result.finalOutput())
                    .isEqualTo("Scene 0: Dawn | Scene 1: Dusk | Scene 2: Noon | Scene 3: Night");
            assertThat(result.traceOf("scene"))
                    .extracting(NodeTrace::iteration)
                    .containsExactlyInAnyOrder(1, 2, 3, 4);
            assertThat(result.variables().variables()).doesNotContainKeys("item", "item_index");
            assertThat(ai.requests()).hasSize(4);
        }

        @Test
        void shouldFailJoinWhenAnItemFails() {
            // Given
            ai.respondWith(
                    request ->
                            lastUserPrompt(request).contains("Dusk")
                                    ? StubResponse.failure("too dark")
                                    : StubResponse.text(lastUserPrompt(request)));
            Workflow wf =
                    workflow("scenes")
                            .open("fan_out", NodeType.PARALLEL_START, "p", Map.of("output_mode", "concat"))
                            .node("scene", NodeType.AI_CHAT, aiChat("", "{{item}}"))
                            .close("fan_in", NodeType.PARALLEL_END, "p")
                            .build();

            // When
            ExecutionResult result = run(wf, "Dawn\nDusk");

            // Then
            assertThat(result.status()).isEqualTo(ExecutionStatus.FAILED);
            assertThat(result.failure().nodeId()).isEqualTo("fan_in");
            assertThat(result.failure().code()).isEqualTo(FailureCode.ITEM_FAILED);
            assertThat(result.failure().reason()).contains("1 of 2 items failed", "#1");
        }

        @Test
        void shouldRunBatchTargetsPerItemAndSkipThemInMainRun() {
            // Given
            Workflow wf =
                    workflow("batch")
                            .node(
                                    "each",
                                    NodeType.BATCH,
                                    Map.of(
                                            "target_nodes", List.of("scene"),
                                            "output_mode", "concat",
                                            "output_separator", " / "))
                            .node("scene", NodeType.AI_CHAT, aiChat("", "Scene: {{item}}"))
                            .node("result", NodeType.OUTPUT, Map.of())
                            .build();

            // When
            ExecutionResult result = run(wf, "Dawn\nDusk");

            // Then
            assertThat(result.finalOutput()).isEqualTo("Scene: Dawn / Scene: Dusk");
            assertThat(result.traceOf("scene"))
                    .extracting(NodeTrace::status)
                    .containsExactlyInAnyOrder(
                            NodeTrace.Status.COMPLETED,
                            NodeTrace.Status.COMPLETED,
                            NodeTrace.Status.SKIPPED);
        }

        @Test
        void shouldFinishNestedFanOutOnSmallWorkerPool() {
            // Given
            executorService.shutdownNow();
            executorService = Executors.newFixedThreadPool(2);
            executor = executorWith(new DefaultNodeHandlerRegistry());
            ai.respondWith(request -> StubResponse.text(lastUserPrompt(request)));
            Workflow wf =
                    workflow("chapters")
                            .open(
                                    "chapters_out",
                                    NodeType.PARALLEL_START,
                                    "chapters",
                                    Map.of(
                                            "concurrency", 2,
                                            "output_mode", "concat",
                                            "output_separator", " | "))
                            .open(
                                    "scenes_out",
                                    NodeType.PARALLEL_START,
                                    "scenes",
                                    Map.of(
                                            "split_mode", "separator",
                                            "separator", ",",
                                            "concurrency", 2,
                                            "output_mode", "concat",
                                            "output_separator", " + "))
                            .node("scene", NodeType.AI_CHAT, aiChat("", "Scene: {{item}}"))
                            .close("scenes_in", NodeType.PARALLEL_END, "scenes")
                            .close("chapters_in", NodeType.PARALLEL_END, "chapters")
                            .node("result", NodeType.OUTPUT, Map.of())
                            .build();

            // When
            ExecutionResult result =
                    assertTimeoutPreemptively(
                            Duration.ofSeconds(10), () -> run(wf, "Dawn,Dusk\nNoon,Night"));

            // Then
            assertThat(result.isCompleted()).isTrue();
            assertThat(result.finalOutput())
                    .isEqualTo("Scene: Dawn + Scene: Dusk | Scene: Noon + Scene: Night");
            assertThat(ai.requests()).hasSize(4);
        }

        @Test
        void shouldTimeOutWhileItemsWaitOnSilentProvider() {
            // Given
            ai.respondWith(request -> StubResponse.hanging());
            Workflow wf =
                    workflow("scenes")
                            .open("fan_out", NodeType.PARALLEL_START, "p", Map.of("concurrency", 2))
                            .node("scene", NodeType.AI_CHAT, aiChat("", "{{item}}"))
                            .close("fan_in", NodeType.PARALLEL_END, "p")
                            .build();

            // When
            ExecutionResult result =
                    assertTimeoutPreemptively(
                            Duration.ofSeconds(5),
                            () ->
                                    executor.execute(
                                            wf,
                                            ExecutionOptions.builder()
                                                    .input("Dawn\nDusk\nNoon")
                                                    .timeout(Duration.ofMillis(100))
                                                    .build(),
                                            events::add));

            // Then
            assertThat(result.status()).isEqualTo(ExecutionStatus.TIMEOUT);
            assertThat(result.failure().code()).isEqualTo(FailureCode.TIMEOUT);
            assertThat(ai.requests()).hasSizeLessThanOrEqualTo(2);
        }
    }

    @Nested
    class LegacyNodes {

        @Test
        void shouldJumpOnConditionOutcomeAndExposeResult() {
            // Given
            Workflow wf =
                    workflow("legacy")
                            .node(
                                    "check",
                                    NodeType.CONDITION,
                                    Map.of(
                                            "keywords", List.of("dragon"),
                                            "true_action", "jump",
                                            "true_target", "brave"))
                            .node("timid", NodeType.TEXT_CONCAT, text("timid"))
                            .node("brave", NodeType.TEXT_CONCAT, text("brave"))
                            .build();

            // When
            ExecutionResult result = run(wf, "a dragon");

            // Then
            assertThat(result.finalOutput()).isEqualTo("brave");
            assertThat(result.traceOf("timid")).isEmpty();
            assertThat(result.variables().variables()).containsEntry("_condition_check", "true");
        }

        @Test
        void shouldEndRunOnFalseEndAction() {
            Workflow wf =
                    workflow("legacy")
                            .node(
                                    "check",
                                    NodeType.CONDITION,
                                    Map.of("keywords", List.of("dragon"), "false_action", "end"))
                            .node("never", NodeType.TEXT_CONCAT, text("never"))
                            .build();

            ExecutionResult result = run(wf, "a quiet sea");

            assertThat(result.isCompleted()).isTrue();
            assertThat(result.finalOutput()).isEqualTo("a quiet sea");
            assertThat(result.traceOf("never")).isEmpty();
        }

        @Test
        void shouldWrapLegacyLoopUntilMaxIterations() {
            // Given
            Workflow wf =
                    withMarks("legacy")
                            .node("repeat", NodeType.LOOP, Map.of("max_iterations", 3))
                            .node("mark", NodeType.VAR_UPDATE, setVariable("marks", "{{marks}}*"))
                            .build();

            // When
            ExecutionResult result = run(wf, "seed");

            // Then
            assertThat(result.isCompleted()).isTrue();
            assertThat(result.finalOutput()).isEqualTo("***");
            assertThat(result.traceOf("repeat")).hasSize(4);
            assertThat(result.traceOf("mark")).hasSize(3);
        }
    }

    @Nested
    class RunControl {

        private Workflow twoDrafts() {
            return workflow("drafts")
                    .node("draft", NodeType.AI_CHAT, aiChat("", "Draft of {{input}}"))
                    .node("polish", NodeType.AI_CHAT, aiChat("", "Polish [{{@draft}}] [{{previous}}]"))
                    .node("result", NodeType.OUTPUT, Map.of())
                    .build();
        }

        private WorkflowRun pausingAfter(String nodeId, CountDownLatch paused, ExecutionListener extra) {
            return pausingAfter(twoDrafts(), nodeId, paused, extra);
        }

        private WorkflowRun pausingAfter(
                Workflow wf, String nodeId, CountDownLatch paused, ExecutionListener extra) {
            AtomicReference<WorkflowRun> self = new AtomicReference<>();
            WorkflowRun run =
                    executor.prepare(
                            wf,
                            ExecutionOptions.withInput("a comet"),
                            event -> {
                                events.add(event);
                                extra.onEvent(event);
                                if (event.type() == ExecutionEventType.NODE_COMPLETED
                                        && nodeId.equals(event.nodeId())) {
                                    self.get().pause();
                                }
                                if (event.type() == ExecutionEventType.EXECUTION_PAUSED) {
                                    paused.countDown();
                                }
                            });
            self.set(run);
            return run;
        }

        @Test
        void shouldProduceSameOutputsWhenPausedAndResumed() throws Exception {
            // Given
            ExecutionResult straight = executor.execute(twoDrafts(), "a comet");
            CountDownLatch paused = new CountDownLatch(1);
            WorkflowRun run = pausingAfter("draft", paused, ExecutionListener.NOOP);

            // When
            CompletableFuture<ExecutionResult> done = run.start();
            assertThat(paused.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(run.getStatus()).contains(ExecutionStatus.PAUSED);
            assertThat(run.resume()).isTrue();
            ExecutionResult resumed = done.get(5, TimeUnit.SECONDS);

            // Then
            assertThat(resumed.finalOutput()).isEqualTo(straight.finalOutput());
            assertThat(resumed.trace())
                    .extracting(NodeTrace::output)
                    .isEqualTo(straight.trace().stream().map(NodeTrace::output).toList());
            assertThat(eventTypes())
                    .contains(
                            ExecutionEventType.EXECUTION_PAUSED,
                            ExecutionEventType.EXECUTION_RESUMED);
        }

        @Test
        void shouldFeedEditedOutputToLaterNodes() throws Exception {
            // Given
            CountDownLatch paused = new CountDownLatch(1);
            WorkflowRun run = pausingAfter("draft", paused, ExecutionListener.NOOP);
            CompletableFuture<ExecutionResult> done = run.start();
            assertThat(paused.await(5, TimeUnit.SECONDS)).isTrue();

            // When
            run.editNodeOutput("draft", "Edited draft");
            run.resume();
            ExecutionResult result = done.get(5, TimeUnit.SECONDS);

            // Then
            assertThat(result.finalOutput()).isEqualTo("Polish [Edited draft] [Edited draft]");
            assertThat(events)
                    .filteredOn(e -> e.type() == ExecutionEventType.NODE_OUTPUT_EDITED)
                    .extracting(ExecutionEvent::content)
                    .containsExactly("Edited draft");
        }

        @Test
        void shouldReturnEditedOutputNodeTextAsFinalOutput() throws Exception {
            // Given
            Workflow wf =
                    withMarks("edited")
                            .node("draft", NodeType.AI_CHAT, aiChat("", "Draft of {{input}}"))
                            .node("result", NodeType.OUTPUT, Map.of())
                            .node("mark", NodeType.VAR_UPDATE, setVariable("marks", "{{marks}}*"))
                            .build();
            CountDownLatch paused = new CountDownLatch(1);
            WorkflowRun run = pausingAfter(wf, "result", paused, ExecutionListener.NOOP);
            CompletableFuture<ExecutionResult> done = run.start();
            assertThat(paused.await(5, TimeUnit.SECONDS)).isTrue();

            // When
            run.editNodeOutput("result", "A comet, rewritten");
            run.resume();
            ExecutionResult result = done.get(5, TimeUnit.SECONDS);

            // Then
            assertThat(result.isCompleted()).isTrue();
            assertThat(result.finalOutput()).isEqualTo("A comet, rewritten");
            assertThat(events)
                    .filteredOn(e -> e.type() == ExecutionEventType.EXECUTION_COMPLETED)
                    .extracting(ExecutionEvent::finalOutput)
                    .containsExactly("A comet, rewritten");
        }

        @Test
        void shouldRejectEditWhileRunning() {
            WorkflowRun run = executor.prepare(twoDrafts(), ExecutionOptions.defaults(), events::add);

            assertThatThrownBy(() -> run.editNodeOutput("draft", "x"))
                    .isInstanceOf(IllegalStateException.class);
        }

        @Test
        void shouldCancelMidStreamAndRecordFailedNode() throws Exception {
            // Given
            ai.enqueue(StubResponse.hanging("The night "));
            InMemoryExecutionRecorder recorder = new InMemoryExecutionRecorder();
            CountDownLatch streaming = new CountDownLatch(1);
            WorkflowRun run =
                    executor.prepare(
                            twoDrafts(),
                            ExecutionOptions.builder().executionId("exec-cancel").input("a comet").build(),
                            new CompositeExecutionListener(
                                    new RecordingExecutionListener(recorder),
                                    event -> {
                                        if (event.type() == ExecutionEventType.NODE_STREAMING) {
                                            streaming.countDown();
                                        }
                                    }));

            // When
            CompletableFuture<ExecutionResult> done = run.start();
            assertThat(streaming.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(run.cancel()).isTrue();
            ExecutionResult result = done.get(5, TimeUnit.SECONDS);

            // Then
            assertThat(result.status()).isEqualTo(ExecutionStatus.CANCELLED);
            assertThat(result.failure().code()).isEqualTo(FailureCode.CANCELLED);
            assertThat(result.failure().nodeId()).isEqualTo("draft");
            assertThat(run.cancel()).isFalse();

            assertThat(recorder.findExecution("exec-cancel"))
                    .map(ExecutionRecord::status)
                    .contains(ExecutionStatus.CANCELLED);
            List<NodeResultRecord> nodeResults = recorder.findNodeResults("exec-cancel");
            assertThat(nodeResults).extracting(NodeResultRecord::nodeId).containsExactly("start", "draft");
            assertThat(nodeResults.get(1).status()).isEqualTo(NodeResultStatus.FAILED);
        }

        @Test
        void shouldTimeOutWaitingOnSilentProvider() {
            // Given
            ai.enqueue(StubResponse.hanging());
            Workflow wf = twoDrafts();

            // When
            ExecutionResult result =
                    executor.execute(
                            wf,
                            ExecutionOptions.builder()
                                    .input("a comet")
                                    .timeout(Duration.ofMillis(100))
                                    .build(),
                            events::add);

            // Then
            assertThat(result.status()).isEqualTo(ExecutionStatus.TIMEOUT);
            assertThat(result.failure().code()).isEqualTo(FailureCode.TIMEOUT);
            assertThat(result.failure().nodeId()).isEqualTo("draft");
            assertThat(eventTypes()).endsWith(ExecutionEventType.EXECUTION_TIMEOUT);
        }
    }
}
