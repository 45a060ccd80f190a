package villagecompute.mobile.services;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import villagecompute.mobile.api.types.sdui.ComponentKind;
import villagecompute.mobile.api.types.sdui.SchemaShape;
import villagecompute.mobile.api.types.sdui.SduiCardComponent;
import villagecompute.mobile.api.types.sdui.SduiComponent;
import villagecompute.mobile.api.types.sdui.SduiDescriptionComponent;
import villagecompute.mobile.api.types.sdui.SduiJumbotronComponent;
import villagecompute.mobile.api.types.sdui.SduiScrollViewHorizontalComponent;
import villagecompute.mobile.exceptions.ComponentDecodeException;
import villagecompute.mobile.exceptions.UnknownComponentKindException;
import villagecompute.mobile.testing.TestFixtures;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link SduiComponentCodec}.
 */
class SduiComponentCodecTest {

    private SduiComponentCodec codec;

    @BeforeEach
    void setUp() {
        codec = new SduiComponentCodec();
        codec.objectMapper = TestFixtures.OBJECT_MAPPER;
        codec.validator = TestFixtures.validator();
    }

    @Test
    void testRoundTrip_everyKind() {
        List<SduiComponent> components = List.of(TestFixtures.card("Al Pastor"), TestFixtures.description(),
                TestFixtures.jumbotron(), TestFixtures.scrollView());

        for (SduiComponent component : components) {
            SduiComponentCodec.EncodedComponent encoded = codec.encode(component);
            assertEquals(component.kind().tag(), encoded.tag());
            assertEquals(component, codec.decode(encoded.tag(), encoded.content()));
        }
    }

    @Test
    void testEncode_omitsDiscriminatorAndNulls() {
        ObjectNode content = codec.encode(TestFixtures.jumbotron()).content();

        assertFalse(content.has(SduiComponent.TYPENAME_PROPERTY));
        assertFalse(content.has("image_url"));
        assertEquals("Tacos today", content.get("title").asText());
    }

    @Test
    void testEncode_usesWireFieldNames() {
        ObjectNode content = codec.encode(TestFixtures.card("Carnitas")).content();

        assertTrue(content.has("image_url"));
        assertTrue(content.has("image_background_color"));
        assertTrue(content.has("target_entrypoint_key"));
    }

    @Test
    void testDecode_unknownTag() {
        UnknownComponentKindException e = assertThrows(UnknownComponentKindException.class,
                () -> codec.decode("SDUICarouselComponent", TestFixtures.json(Map.of("title", "x"))));

        assertEquals("SDUICarouselComponent", e.getComponentTag());
        assertNull(e.getField());
    }

    @Test
    void testDecode_nullTagIsUnknown() {
        assertThrows(UnknownComponentKindException.class,
                () -> codec.decode(null, TestFixtures.json(Map.of("text", "x"))));
    }

    @Test
    void testDecode_missingRequiredField() {
        ComponentDecodeException e = assertThrows(ComponentDecodeException.class,
                () -> codec.decode(SduiCardComponent.TAG, TestFixtures.json(Map.of("image_url", "https://x.io/a.png"))));

        assertEquals(SduiCardComponent.TAG, e.getComponentTag());
        assertEquals("title", e.getField());
    }

    @Test
    void testDecode_blankRequiredField() {
        ComponentDecodeException e = assertThrows(ComponentDecodeException.class,
                () -> codec.decode(SduiDescriptionComponent.TAG, TestFixtures.json(Map.of("text", "  "))));

        assertEquals("text", e.getField());
    }

    @Test
    void testDecode_malformedOptionalField() {
        ComponentDecodeException e = assertThrows(ComponentDecodeException.class,
                () -> codec.decode(SduiCardComponent.TAG,
                        TestFixtures.json(Map.of("title", "Menu", "image_background_color", "red"))));

        assertEquals("image_background_color", e.getField());
    }

    @Test
    void testDecode_nestedCardReportsIndexedPath() {
        JsonNode content = TestFixtures.json(Map.of("title", "Specials", "cards",
                List.of(Map.of("title", "Al Pastor"), Map.of("image_url", "https://x.io/a.png"))));

        ComponentDecodeException e = assertThrows(ComponentDecodeException.class,
                () -> codec.decode(SduiScrollViewHorizontalComponent.TAG, content));

        assertEquals(SduiScrollViewHorizontalComponent.TAG, e.getComponentTag());
        assertEquals("cards[1].title", e.getField());
    }

    @Test
    void testDecode_emptyCards() {
        ComponentDecodeException e = assertThrows(ComponentDecodeException.class,
                () -> codec.decode(SduiScrollViewHorizontalComponent.TAG,
                        TestFixtures.json(Map.of("cards", List.of()))));

        assertEquals("cards", e.getField());
    }

    @Test
    void testDecode_wrongJsonShapeReportsField() {
        ComponentDecodeException e = assertThrows(ComponentDecodeException.class,
                () -> codec.decode(SduiScrollViewHorizontalComponent.TAG,
                        TestFixtures.json(Map.of("cards", "not a list"))));

        assertEquals("cards", e.getField());
    }

    @Test
    void testDecode_contentMustBeObject() {
        JsonNode array = TestFixtures.OBJECT_MAPPER.createArrayNode().add("Tacos");

        ComponentDecodeException e = assertThrows(ComponentDecodeException.class,
                () -> codec.decode(SduiJumbotronComponent.TAG, array));

        assertEquals(SduiJumbotronComponent.TAG, e.getComponentTag());
        assertThrows(ComponentDecodeException.class, () -> codec.decode(SduiJumbotronComponent.TAG, null));
    }

    @Test
    void testDecode_ignoresUnknownProperties() {
        SduiComponent decoded = codec.decode(SduiDescriptionComponent.TAG,
                TestFixtures.json(Map.of("text", "Hello", "font", "serif")));

        assertEquals(new SduiDescriptionComponent("Hello"), decoded);
    }

    @Test
    void testDescribeSchema_variantsMatchRegistry() {
        SchemaShape shape = codec.describeSchema();

        assertEquals(SduiComponentCodec.UNION_NAME, shape.unionName());
        assertEquals(SduiComponent.TYPENAME_PROPERTY, shape.discriminator());
        assertEquals(Arrays.stream(ComponentKind.values()).map(ComponentKind::tag).toList(), shape.variantNames());
    }

    @Test
    void testDescribeSchema_fieldsBelongToTheirVariantOnly() {
        SchemaShape shape = codec.describeSchema();

        SchemaShape.VariantShape description = shape.variants().stream()
                .filter(v -> v.name().equals(SduiDescriptionComponent.TAG)).findFirst().orElseThrow();
        assertEquals(List.of(new SchemaShape.FieldShape("text", "String", true)), description.fields());

        SchemaShape.VariantShape scroll = shape.variants().stream()
                .filter(v -> v.name().equals(SduiScrollViewHorizontalComponent.TAG)).findFirst().orElseThrow();
        assertEquals(List.of(new SchemaShape.FieldShape("title", "String", false),
                new SchemaShape.FieldShape("cards", "[SDUICardComponent!]", true)), scroll.fields());
    }

    @Test
    void testSchemaLanguage_matchesPublishedSnapshot() throws IOException {
        String expected;
        try (InputStream in = getClass().getResourceAsStream("/sdui/component-schema.graphql")) {
            assertNotNull(in, "schema snapshot missing from test resources");
            expected = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }

        assertEquals(expected, codec.describeSchema().toSchemaLanguage());
    }

    @Test
    void testDescribeSchema_fieldNamesMatchEncodedContent() {
        SchemaShape shape = codec.describeSchema();
        ObjectNode content = codec.encode(TestFixtures.card("Carnitas")).content();

        SchemaShape.VariantShape card = shape.variants().stream()
                .filter(v -> v.name().equals(SduiCardComponent.TAG)).findFirst().orElseThrow();
        List<String> encodedNames = new ArrayList<>();
        content.fieldNames().forEachRemaining(encodedNames::add);

        assertEquals(encodedNames, card.fields().stream().map(SchemaShape.FieldShape::name).toList());
    }

    @Test
    void testDecode_numberIsNotText() {
        ComponentDecodeException e = assertThrows(ComponentDecodeException.class,
                () -> codec.decode(SduiDescriptionComponent.TAG, TestFixtures.json(Map.of("text", 123))));

        assertEquals(SduiDescriptionComponent.TAG, e.getComponentTag());
        assertEquals("text", e.getField());
    }

    @Test
    void testDecode_booleanIsNotText() {
        ComponentDecodeException e = assertThrows(ComponentDecodeException.class,
                () -> codec.decode(SduiCardComponent.TAG, TestFixtures.json(Map.of("title", false))));

        assertEquals(SduiCardComponent.TAG, e.getComponentTag());
        assertEquals("title", e.getField());
    }

    @Test
    void testDecode_numberInNestedCardReportsIndexedPath() {
        JsonNode content = TestFixtures.json(Map.of("cards",
                List.of(Map.of("title", "Al Pastor"), Map.of("title", "Asada", "image_url", 42))));

        ComponentDecodeException e = assertThrows(ComponentDecodeException.class,
                () -> codec.decode(SduiScrollViewHorizontalComponent.TAG, content));

        assertEquals("cards[1].image_url", e.getField());
    }

    @Test
    void testUnknownKindIsDecodeException() {
        assertInstanceOf(ComponentDecodeException.class, new UnknownComponentKindException("X"));
    }
}
