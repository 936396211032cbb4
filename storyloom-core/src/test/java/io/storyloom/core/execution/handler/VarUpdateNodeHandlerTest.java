package io.storyloom.core.execution.handler;

import static io.storyloom.core.WorkflowFixtures.setVariable;
import static io.storyloom.core.WorkflowFixtures.workflow;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.storyloom.core.exception.FailureCode;
import io.storyloom.core.exception.NodeExecutionException;
import io.storyloom.core.variable.VariableStore;
import io.storyloom.core.workflow.NodeType;
import io.storyloom.core.workflow.Workflow;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class VarUpdateNodeHandlerTest {

    private final VarUpdateNodeHandler handler = new VarUpdateNodeHandler();
    private VariableStore scope;

    @BeforeEach
    void setUp() {
        scope = new VariableStore();
        scope.set("hero", "Ada");
        scope.set("mood", "calm");
    }

    @Test
    void shouldAssignResolvedCustomValue() throws Exception {
        // Given
        Workflow wf =
                workflow("wf")
                        .node("set", NodeType.VAR_UPDATE, setVariable("mood", "{{hero}} is restless"))
                        .build();

        // When
        HandlerResult result =
                handler.execute(
                        wf.getNode("set").orElseThrow(),
                        HandlerContexts.forNode(wf, "set", scope).build());

        // Then
        assertThat(scope.get("mood")).contains("Ada is restless");
        assertThat(result.output()).isEqualTo("Ada is restless");
        assertThat(result.transparent()).isFalse();
        assertThat(result.resolvedConfig())
                .containsEntry("variableName", "mood")
                .containsEntry("variableValue", "Ada is restless");
    }

    @Test
    void shouldAssignPreviousOutput() throws Exception {
        // Given
        scope.recordOutput("draft", "The tide came in.");
        Workflow wf =
                workflow("wf")
                        .node(
                                "set",
                                NodeType.VAR_UPDATE,
                                Map.of("variable_name", "mood", "value_source", "previous"))
                        .build();

        // When
        handler.execute(
                wf.getNode("set").orElseThrow(), HandlerContexts.forNode(wf, "set", scope).build());

        // Then
        assertThat(scope.get("mood")).contains("The tide came in.");
    }

    @Test
    void shouldPreferValueTemplateOverCustomValue() throws Exception {
        Workflow wf =
                workflow("wf")
                        .node(
                                "set",
                                NodeType.VAR_UPDATE,
                                Map.of(
                                        "variable_name", "mood",
                                        "value_template", "from template",
                                        "custom_value", "from custom"))
                        .build();

        handler.execute(
                wf.getNode("set").orElseThrow(), HandlerContexts.forNode(wf, "set", scope).build());

        assertThat(scope.get("mood")).contains("from template");
    }

    @Test
    void shouldRejectUndeclaredVariable() {
        // Given
        Workflow wf =
                workflow("wf")
                        .node("set", NodeType.VAR_UPDATE, setVariable("villain", "Mordo"))
                        .build();

        // When / Then
        assertThatThrownBy(
                        () ->
                                handler.execute(
                                        wf.getNode("set").orElseThrow(),
                                        HandlerContexts.forNode(wf, "set", scope).build()))
                .isInstanceOf(NodeExecutionException.class)
                .hasMessageContaining("villain")
                .extracting("code")
                .isEqualTo(FailureCode.UNDECLARED_VARIABLE);
        assertThat(scope.isDeclared("villain")).isFalse();
    }

    @Test
    void shouldRejectBlankVariableName() {
        Workflow wf =
                workflow("wf")
                        .node("set", NodeType.VAR_UPDATE, setVariable("  ", "anything"))
                        .build();

        assertThatThrownBy(
                        () ->
                                handler.execute(
                                        wf.getNode("set").orElseThrow(),
                                        HandlerContexts.forNode(wf, "set", scope).build()))
                .isInstanceOf(NodeExecutionException.class)
                .extracting("code")
                .isEqualTo(FailureCode.UNDECLARED_VARIABLE);
    }
}
