package io.storyloom.core.execution.parallel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import io.storyloom.core.json.JsonCodec;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ResultMergerTest {

    @Mock private JsonCodec jsonCodec;

    private ResultMerger merger;
    private List<ItemResult> outOfOrder;

    @BeforeEach
    void setUp() {
        merger = new ResultMerger(jsonCodec);
        outOfOrder =
                List.of(
                        ItemResult.success(2, "third", 1),
                        ItemResult.success(0, "first", 1),
                        ItemResult.success(1, "second", 2));
    }

    @Test
    void shouldWriteArrayInItemOrder() {
        when(jsonCodec.writeStringArray(List.of("first", "second", "third")))
                .thenReturn("[\"first\",\"second\",\"third\"]");

        assertThat(merger.merge(outOfOrder, OutputMode.ARRAY, null))
                .isEqualTo("[\"first\",\"second\",\"third\"]");
    }

    @Test
    void shouldConcatWithNewlineByDefault() {
        assertThat(merger.merge(outOfOrder, OutputMode.CONCAT, null))
                .isEqualTo("first\nsecond\nthird");
    }

    @Test
    void shouldConcatWithUnescapedSeparator() {
        assertThat(merger.merge(outOfOrder, OutputMode.CONCAT, "\\n---\\n"))
                .isEqualTo("first\n---\nsecond\n---\nthird");
    }

    @Test
    void shouldConcatEmptyOutputs() {
        List<ItemResult> results = List.of(ItemResult.success(0, null, 1), ItemResult.success(1, "b", 1));

        assertThat(merger.merge(results, OutputMode.CONCAT, ",")).isEqualTo(",b");
    }
}
