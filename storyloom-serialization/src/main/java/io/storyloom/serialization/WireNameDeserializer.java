package io.storyloom.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import java.io.IOException;
import java.io.Serial;
import java.util.Optional;
import java.util.function.Function;

/// Reads an enum from its wire name; unknown names are reported as invalid input.
///
/// @param <E> enum type
/// @implNote Package-private. Registered by {@link StoryloomJacksonModule}.
class WireNameDeserializer<E extends Enum<E>> extends StdDeserializer<E> {

    @Serial private static final long serialVersionUID = 5208713464195502781L;

    private final transient Function<String, Optional<E>> fromWireName;

    WireNameDeserializer(Class<E> type, Function<String, Optional<E>> fromWireName) {
        super(type);
        this.fromWireName = fromWireName;
    }

    @Override
    @SuppressWarnings("unchecked")
    public E deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        String text = p.getValueAsString();
        Optional<E> value = fromWireName.apply(text);
        if (value.isPresent()) {
            return value.get();
        }
        return (E) ctxt.handleWeirdStringValue(handledType(), text, "unknown wire name");
    }
}
