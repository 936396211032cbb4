package io.storyloom.core.execution.parallel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.storyloom.core.json.JsonCodec;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ItemSplitterTest {

    @Mock private JsonCodec jsonCodec;

    private ItemSplitter splitter;

    @BeforeEach
    void setUp() {
        splitter = new ItemSplitter(jsonCodec);
    }

    @Test
    void shouldSplitLinesTrimmingAndDroppingBlanks() throws Exception {
        assertThat(splitter.split("  Dawn \r\n\n Dusk\n   \nNight", SplitMode.LINE, null))
                .containsExactly("Dawn", "Dusk", "Night");
    }

    @Test
    void shouldSplitOnLiteralSeparator() throws Exception {
        assertThat(splitter.split("a.b | c*d |  | e", SplitMode.SEPARATOR, "|"))
                .containsExactly("a.b", "c*d", "e");
    }

    @Test
    void shouldUnescapeTypedSeparator() throws Exception {
        assertThat(splitter.split("one\n\ntwo\n\nthree", SplitMode.SEPARATOR, "\\n\\n"))
                .containsExactly("one", "two", "three");
    }

    @Test
    void shouldFallBackToLinesWithoutSeparator() throws Exception {
        assertThat(splitter.split("x\ny", SplitMode.SEPARATOR, "")).containsExactly("x", "y");
    }

    @Test
    void shouldParseJsonArrayThroughCodec() throws Exception {
        // Given
        when(jsonCodec.parseArrayItems("[\"Dawn\",\"Dusk\"]")).thenReturn(List.of("Dawn", "Dusk"));

        // When / Then
        assertThat(splitter.split("  [\"Dawn\",\"Dusk\"] ", SplitMode.JSON_ARRAY, null))
                .containsExactly("Dawn", "Dusk");
    }

    @Test
    void shouldReturnNoItemsForBlankJsonInput() throws Exception {
        assertThat(splitter.split("  ", SplitMode.JSON_ARRAY, null)).isEmpty();
        verifyNoInteractions(jsonCodec);
    }
}
