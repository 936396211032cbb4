package io.storyloom.core.block;

import static io.storyloom.core.WorkflowFixtures.bare;
import static io.storyloom.core.WorkflowFixtures.workflow;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.storyloom.core.WorkflowFixtures;
import io.storyloom.core.exception.WorkflowStructureException;
import io.storyloom.core.workflow.NodeType;
import io.storyloom.core.workflow.WorkflowNode;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class BlockResolverTest {

    private final BlockResolver resolver = new BlockResolver();

    private BlockTable resolve(WorkflowFixtures fixture) {
        return resolver.resolve(fixture.build().getNodes());
    }

    @Nested
    class ValidStructures {

        @Test
        void shouldResolveNestedBlocksWithElse() {
            // Given
            WorkflowFixtures fixture =
                    workflow("nested")
                            .open("loop", NodeType.LOOP_START, "L", Map.of())
                            .open("if", NodeType.CONDITION_IF, "C", Map.of())
                            .node("yes", NodeType.OUTPUT, Map.of())
                            .close("else", NodeType.CONDITION_ELSE, "C")
                            .node("no", NodeType.OUTPUT, Map.of())
                            .close("endif", NodeType.CONDITION_END, "C")
                            .close("endloop", NodeType.LOOP_END, "L");

            // When
            BlockTable table = resolve(fixture);

            // Then
            BlockInfo loop = table.block("L").orElseThrow();
            assertThat(loop.startIndex()).isEqualTo(1);
            assertThat(loop.endIndex()).isEqualTo(7);
            assertThat(loop.parentBlockId()).isNull();
            assertThat(loop.childBlockIds()).containsExactly("C");

            BlockInfo condition = table.block("C").orElseThrow();
            assertThat(condition.kind()).isEqualTo(NodeType.CONDITION_IF);
            assertThat(condition.elseIndex()).isEqualTo(4);
            assertThat(condition.parentBlockId()).isEqualTo("L");

            assertThat(table.blockAtMarker(4)).contains(condition);
            assertThat(table.enclosingBlock(3)).contains(condition);
            assertThat(table.enclosingBlock(2)).contains(loop);
            assertThat(table.enclosingBlock(0)).isEmpty();
            assertThat(table.indexOf("no")).contains(5);
            assertThat(table.blocks()).extracting(BlockInfo::blockId).containsExactly("L", "C");
        }

        @Test
        void shouldAcceptSiblingBlocks() {
            // Given
            WorkflowFixtures fixture =
                    workflow("siblings")
                            .open("p1", NodeType.PARALLEL_START, "P1", Map.of())
                            .close("p1_end", NodeType.PARALLEL_END, "P1")
                            .open("p2", NodeType.PARALLEL_START, "P2", Map.of())
                            .close("p2_end", NodeType.PARALLEL_END, "P2");

            // When
            BlockTable table = resolve(fixture);

            // Then
            assertThat(table.blocks()).hasSize(2);
            assertThat(table.block("P2").orElseThrow().parentBlockId()).isNull();
        }

        @Test
        void shouldMarkBatchTargets() {
            // Given
            WorkflowFixtures fixture =
                    workflow("batch")
                            .node("batch", NodeType.BATCH, Map.of("target_nodes", List.of("draft")))
                            .node("draft", NodeType.AI_CHAT, Map.of())
                            .node("out", NodeType.OUTPUT, Map.of());

            // When
            BlockTable table = resolve(fixture);

            // Then
            assertThat(table.isBatchTarget(2)).isTrue();
            assertThat(table.isBatchTarget(3)).isFalse();
        }

        @Test
        void shouldOnlyWarnOnInconsistentParentBlockId() {
            // Given
            List<WorkflowNode> nodes =
                    List.of(
                            WorkflowNode.builder().id("s").type(NodeType.START).orderIndex(0).build(),
                            WorkflowNode.builder()
                                    .id("out")
                                    .type(NodeType.OUTPUT)
                                    .orderIndex(1)
                                    .parentBlockId("nowhere")
                                    .build());

            // When / Then
            assertThat(resolver.resolve(nodes).size()).isEqualTo(2);
        }
    }

    @Nested
    class StructuralErrors {

        @Test
        void shouldRejectEmptyWorkflow() {
            assertThatThrownBy(() -> resolver.resolve(List.of()))
                    .isInstanceOf(WorkflowStructureException.class)
                    .hasMessageContaining("no nodes");
        }

        @Test
        void shouldRequireStartNodeFirst() {
            assertThatThrownBy(() -> resolve(bare("w").node("out", NodeType.OUTPUT, Map.of())))
                    .isInstanceOf(WorkflowStructureException.class)
                    .hasMessageContaining("start");
        }

        @Test
        void shouldRejectDuplicateNodeId() {
            assertThatThrownBy(
                            () ->
                                    resolve(
                                            workflow("w")
                                                    .node("a", NodeType.OUTPUT, Map.of())
                                                    .node("a", NodeType.OUTPUT, Map.of())))
                    .isInstanceOf(WorkflowStructureException.class)
                    .hasMessageContaining("Duplicate node id");
        }

        @Test
        void shouldRejectMismatchedClose() {
            // Given
            WorkflowFixtures fixture =
                    workflow("w")
                            .open("loop", NodeType.LOOP_START, "L", Map.of())
                            .close("end", NodeType.PARALLEL_END, "L");

            // When / Then
            assertThatThrownBy(() -> resolve(fixture))
                    .isInstanceOf(WorkflowStructureException.class)
                    .extracting("nodeId")
                    .isEqualTo("end");
        }

        @Test
        void shouldRejectCrossedBlocks() {
            // Given
            WorkflowFixtures fixture =
                    workflow("w")
                            .open("l", NodeType.LOOP_START, "L", Map.of())
                            .open("p", NodeType.PARALLEL_START, "P", Map.of())
                            .close("l_end", NodeType.LOOP_END, "L")
                            .close("p_end", NodeType.PARALLEL_END, "P");

            // When / Then
            assertThatThrownBy(() -> resolve(fixture))
                    .isInstanceOf(WorkflowStructureException.class)
                    .hasMessageContaining("innermost");
        }

        @Test
        void shouldRejectUnclosedBlock() {
            assertThatThrownBy(
                            () -> resolve(workflow("w").open("l", NodeType.LOOP_START, "L", Map.of())))
                    .isInstanceOf(WorkflowStructureException.class)
                    .hasMessageContaining("never closed");
        }

        @Test
        void shouldRejectElseOutsideCondition() {
            // Given
            WorkflowFixtures fixture =
                    workflow("w")
                            .open("l", NodeType.LOOP_START, "L", Map.of())
                            .close("else", NodeType.CONDITION_ELSE, "L")
                            .close("l_end", NodeType.LOOP_END, "L");

            // When / Then
            assertThatThrownBy(() -> resolve(fixture))
                    .isInstanceOf(WorkflowStructureException.class)
                    .hasMessageContaining("condition_else");
        }

        @Test
        void shouldRejectSecondElse() {
            // Given
            WorkflowFixtures fixture =
                    workflow("w")
                            .open("if", NodeType.CONDITION_IF, "C", Map.of())
                            .close("else1", NodeType.CONDITION_ELSE, "C")
                            .close("else2", NodeType.CONDITION_ELSE, "C")
                            .close("end", NodeType.CONDITION_END, "C");

            // When / Then
            assertThatThrownBy(() -> resolve(fixture))
                    .isInstanceOf(WorkflowStructureException.class)
                    .hasMessageContaining("more than one");
        }

        @Test
        void shouldRejectMarkerWithoutBlockId() {
            assertThatThrownBy(
                            () ->
                                    resolve(
                                            workflow("w")
                                                    .node("l", NodeType.LOOP_START, Map.of())))
                    .isInstanceOf(WorkflowStructureException.class)
                    .hasMessageContaining("block_id");
        }

        @Test
        void shouldRejectUnknownJumpTarget() {
            // Given
            WorkflowFixtures fixture =
                    workflow("w")
                            .node(
                                    "check",
                                    NodeType.CONDITION,
                                    Map.of("true_action", "jump", "true_target", "ghost"));

            // When / Then
            assertThatThrownBy(() -> resolve(fixture))
                    .isInstanceOf(WorkflowStructureException.class)
                    .hasMessageContaining("ghost");
        }

        @Test
        void shouldRejectUnknownBatchTarget() {
            assertThatThrownBy(
                            () ->
                                    resolve(
                                            workflow("w")
                                                    .node(
                                                            "b",
                                                            NodeType.BATCH,
                                                            Map.of("target_nodes", List.of("ghost")))))
                    .isInstanceOf(WorkflowStructureException.class)
                    .hasMessageContaining("ghost");
        }
    }
}
