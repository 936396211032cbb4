package io.storyloom.core.workflow;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class NodeConfigTest {

    @Test
    void shouldCoerceNumbersWrittenAsText() {
        // Given
        NodeConfig config =
                NodeConfig.of(Map.of("concurrency", "4", "temperature", "0.3", "limit", "many"));

        // When / Then
        assertThat(config.getInt("concurrency", 1)).isEqualTo(4);
        assertThat(config.getInteger("concurrency")).isEqualTo(4);
        assertThat(config.getDouble("temperature")).isEqualTo(0.3);
        assertThat(config.getInt("limit", 7)).isEqualTo(7);
        assertThat(config.getInteger("limit")).isNull();
        assertThat(config.getDouble("missing")).isNull();
    }

    @Test
    void shouldTreatEmptyStringAsAbsent() {
        // Given
        NodeConfig config = NodeConfig.of(Map.of("format", ""));

        // When / Then
        assertThat(config.has("format")).isFalse();
        assertThat(config.getString("format", "markdown")).isEqualTo("markdown");
        assertThat(config.getString("format")).isEmpty();
    }

    @Test
    void shouldParseBooleansWrittenAsText() {
        NodeConfig config = NodeConfig.of(Map.of("strict", "true", "enable_history", false));

        assertThat(config.getBoolean("strict", false)).isTrue();
        assertThat(config.getBoolean("enable_history", true)).isFalse();
        assertThat(config.getBoolean("missing", true)).isTrue();
    }

    @Test
    void shouldSkipNullListElements() {
        // Given
        Map<String, Object> values = new HashMap<>();
        values.put("keywords", Arrays.asList("storm", null, 3));

        // When / Then
        assertThat(NodeConfig.of(values).getStringList("keywords")).containsExactly("storm", "3");
        assertThat(NodeConfig.of(values).getStringList("missing")).isEmpty();
    }

    @Test
    void shouldWrapNestedMaps() {
        // Given
        NodeConfig config =
                NodeConfig.of(
                        Map.of(
                                "sources", List.of(Map.of("type", "variable"), "stray"),
                                "condition", Map.of("condition_type", "length")));

        // When / Then
        assertThat(config.getConfigList("sources")).hasSize(1);
        assertThat(config.getConfigList("sources").get(0).getString("type")).isEqualTo("variable");
        assertThat(config.getConfig("condition").getString("condition_type")).isEqualTo("length");
        assertThat(config.getConfig("missing").asMap()).isEmpty();
    }
}
