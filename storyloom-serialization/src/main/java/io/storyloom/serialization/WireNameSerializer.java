package io.storyloom.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import java.io.IOException;
import java.io.Serial;
import java.util.function.Function;

/// Writes an enum as its lowercase wire name, e.g. `ExecutionStatus.TIMEOUT` as `"timeout"`.
///
/// @param <E> enum type
/// @implNote Package-private. Registered by {@link StoryloomJacksonModule}.
/// @see WireNameDeserializer for the inverse operation
class WireNameSerializer<E extends Enum<E>> extends StdSerializer<E> {

    @Serial private static final long serialVersionUID = -6012259349721165113L;

    private final transient Function<E, String> wireName;

    WireNameSerializer(Class<E> type, Function<E, String> wireName) {
        super(type);
        this.wireName = wireName;
    }

    @Override
    public void serialize(E value, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeString(wireName.apply(value));
    }
}
