package io.storyloom.core.variable;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class DefaultTemplateResolverTest {

    private final DefaultTemplateResolver resolver = new DefaultTemplateResolver();
    private VariableStore store;

    @BeforeEach
    void setUp() {
        store = new VariableStore(Map.of("hero", "Ada", "price", "$5"));
        store.setInput("a storm");
        store.recordOutput("outline", "three acts");
    }

    @ParameterizedTest
    @CsvSource(
            delimiter = '|',
            value = {
                "Hello {{hero}}|Hello Ada",
                "{{ hero }} sails|Ada sails",
                "{{@outline}}|three acts",
                "{{input}} / {{previous}}|a storm / three acts",
                "{{hero > the protagonist}}|Ada",
                "{{unknown}}!|!",
                "{{@missing}}.|.",
                "no templates|no templates"
            })
    void shouldResolveReferences(String template, String expected) {
        assertThat(resolver.resolve(template, store)).isEqualTo(expected);
    }

    @Test
    void shouldInsertReplacementLiterally() {
        assertThat(resolver.resolve("costs {{price}}", store)).isEqualTo("costs $5");
    }

    @Test
    void shouldNotResolveRecursively() {
        // Given
        store.set("nested", "{{hero}}");

        // When / Then
        assertThat(resolver.resolve("{{nested}}", store)).isEqualTo("{{hero}}");
    }

    @Test
    void shouldTreatNullTemplateAsEmpty() {
        assertThat(resolver.resolve(null, store)).isEmpty();
    }
}
