package villagecompute.mobile.api.types.sdui;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.fasterxml.jackson.databind.util.NameTransformer;

import java.io.IOException;

/**
 * Writes a component as a single JSON object: the {@code __typename} discriminator followed by the payload's own
 * fields.
 *
 * <pre>
 * {"__typename": "SDUIDescriptionComponent", "text": "Fresh from the oven"}
 * </pre>
 *
 * <p>
 * Only applied where a section exposes its component to API consumers. Persisted content is written without the
 * discriminator, which lives in its own column.
 */
public class SduiComponentSerializer extends StdSerializer<SduiComponent> {

    public SduiComponentSerializer() {
        super(SduiComponent.class);
    }

    @Override
    public void serialize(SduiComponent value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        JsonSerializer<Object> fields = provider.findValueSerializer(value.getClass())
                .unwrappingSerializer(NameTransformer.NOP);
        gen.writeStartObject(value);
        gen.writeStringField(SduiComponent.TYPENAME_PROPERTY, value.kind().tag());
        fields.serialize(value, gen, provider);
        gen.writeEndObject();
    }
}
