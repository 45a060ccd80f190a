package villagecompute.mobile.services;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.introspect.AnnotatedMember;
import com.fasterxml.jackson.databind.introspect.BeanPropertyDefinition;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.type.LogicalType;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import villagecompute.mobile.api.types.sdui.ComponentKind;
import villagecompute.mobile.api.types.sdui.SchemaShape;
import villagecompute.mobile.api.types.sdui.SduiComponent;
import villagecompute.mobile.exceptions.ComponentDecodeException;
import villagecompute.mobile.exceptions.UnknownComponentKindException;

import java.io.IOException;
import java.lang.annotation.Annotation;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Converts between persisted component content and typed {@link SduiComponent} payloads.
 *
 * <p>
 * Decoding binds the content onto the payload record registered for the tag and then runs Bean Validation over the
 * result. Unknown properties in the content are ignored; missing or malformed required fields are reported with the
 * component tag and the offending field path ({@code cards[1].title} for nested cards). Numbers and booleans are not
 * coerced into text fields.
 *
 * <p>
 * Encoded content never carries the {@code __typename} discriminator, which is stored next to the content.
 */
@ApplicationScoped
public class SduiComponentCodec {

    public static final String UNION_NAME = "SDUIComponent";

    private static final String LIST_ELEMENT_NODE = ".<list element>";

    private static final List<Class<? extends Annotation>> REQUIRED_CONSTRAINTS = List.of(NotBlank.class,
            NotNull.class, NotEmpty.class);

    @Inject
    ObjectMapper objectMapper;

    @Inject
    Validator validator;

    private volatile ObjectMapper contentMapper;

    /**
     * Decodes component content for the given tag.
     *
     * @param tag
     *            discriminator tag
     * @param content
     *            component content without discriminator
     * @return decoded, validated payload
     * @throws UnknownComponentKindException
     *             if no component kind is registered for {@code tag}
     * @throws ComponentDecodeException
     *             if the content does not match the payload shape
     */
    public SduiComponent decode(String tag, JsonNode content) {
        ComponentKind kind = ComponentKind.fromTag(tag).orElseThrow(() -> new UnknownComponentKindException(tag));

        if (content == null || !content.isObject()) {
            throw new ComponentDecodeException(kind.tag(), null, "Component content must be a JSON object");
        }

        SduiComponent component;
        try {
            component = contentMapper().readerFor(kind.payloadType())
                    .without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES).readValue(content);
        } catch (JsonMappingException e) {
            throw new ComponentDecodeException(kind.tag(), pathOf(e.getPath()), e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ComponentDecodeException(kind.tag(), null, e.getMessage(), e);
        }

        Set<ConstraintViolation<SduiComponent>> violations = validator.validate(component);
        if (!violations.isEmpty()) {
            ConstraintViolation<SduiComponent> first = violations.stream()
                    .min(Comparator.comparing((ConstraintViolation<SduiComponent> v) -> v.getPropertyPath().toString())
                            .thenComparing(ConstraintViolation::getMessage))
                    .orElseThrow();
            String field = first.getPropertyPath().toString().replace(LIST_ELEMENT_NODE, "");
            throw new ComponentDecodeException(kind.tag(), field, field + " " + first.getMessage());
        }
        return component;
    }

    /**
     * Encodes a payload into its tag and content, the inverse of {@link #decode(String, JsonNode)}.
     *
     * @param component
     *            payload to encode
     * @return tag and content without discriminator
     */
    public EncodedComponent encode(SduiComponent component) {
        Objects.requireNonNull(component, "component is required");
        ObjectNode content = objectMapper.valueToTree(component);
        return new EncodedComponent(component.kind().tag(), content);
    }

    /**
     * Describes the component union: one variant per registered kind with its own fields.
     *
     * @return union shape in registry order
     */
    public SchemaShape describeSchema() {
        List<SchemaShape.VariantShape> variants = new ArrayList<>();
        for (ComponentKind kind : ComponentKind.values()) {
            variants.add(new SchemaShape.VariantShape(kind.tag(), fieldsOf(kind.payloadType())));
        }
        return new SchemaShape(UNION_NAME, SduiComponent.TYPENAME_PROPERTY, variants);
    }

    /**
     * Field shapes in the order and under the names the serializer writes them.
     */
    private List<SchemaShape.FieldShape> fieldsOf(Class<?> payloadType) {
        List<SchemaShape.FieldShape> fields = new ArrayList<>();
        for (BeanPropertyDefinition property : objectMapper.getSerializationConfig()
                .introspect(objectMapper.constructType(payloadType)).findProperties()) {
            fields.add(new SchemaShape.FieldShape(property.getName(), typeName(property.getPrimaryType()),
                    isRequired(property)));
        }
        return fields;
    }

    private static boolean isRequired(BeanPropertyDefinition property) {
        return Stream.<AnnotatedMember>of(property.getField(), property.getGetter()).filter(Objects::nonNull)
                .anyMatch(member -> REQUIRED_CONSTRAINTS.stream().anyMatch(member::hasAnnotation));
    }

    private static String typeName(JavaType type) {
        if (type.isCollectionLikeType()) {
            return "[" + typeName(type.getContentType()) + "!]";
        }
        Class<?> raw = type.getRawClass();
        return ComponentKind.fromPayloadType(raw).map(ComponentKind::tag).orElse(raw.getSimpleName());
    }

    private ObjectMapper contentMapper() {
        ObjectMapper mapper = contentMapper;
        if (mapper == null) {
            mapper = objectMapper.copy();
            mapper.coercionConfigFor(LogicalType.Textual).setCoercion(CoercionInputShape.Integer, CoercionAction.Fail)
                    .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
                    .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail);
            contentMapper = mapper;
        }
        return mapper;
    }

    private static String pathOf(List<JsonMappingException.Reference> references) {
        if (references == null || references.isEmpty()) {
            return null;
        }
        StringBuilder path = new StringBuilder();
        for (JsonMappingException.Reference reference : references) {
            if (reference.getFieldName() != null) {
                if (path.length() > 0) {
                    path.append('.');
                }
                path.append(reference.getFieldName());
            } else if (reference.getIndex() >= 0) {
                path.append('[').append(reference.getIndex()).append(']');
            }
        }
        return path.length() == 0 ? null : path.toString();
    }

    /**
     * @param tag
     *            discriminator tag
     * @param content
     *            component fields without discriminator
     */
    public record EncodedComponent(String tag, ObjectNode content) {
    }
}
