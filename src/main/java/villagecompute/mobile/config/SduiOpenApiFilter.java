package villagecompute.mobile.config;

import org.eclipse.microprofile.openapi.OASFactory;
import org.eclipse.microprofile.openapi.OASFilter;
import org.eclipse.microprofile.openapi.models.Components;
import org.eclipse.microprofile.openapi.models.OpenAPI;
import org.eclipse.microprofile.openapi.models.media.Discriminator;
import org.eclipse.microprofile.openapi.models.media.Schema;
import villagecompute.mobile.api.types.sdui.ComponentKind;
import villagecompute.mobile.api.types.sdui.SduiComponent;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Publishes the component union the way {@code SduiComponentSerializer} writes it.
 *
 * <p>
 * The section's {@code component} property becomes a {@code oneOf} over the registered variants with a
 * {@code __typename} discriminator, and every variant schema declares {@code __typename} as a required string whose
 * only value is the variant's tag. Registered through {@code mp.openapi.filter}.
 */
public class SduiOpenApiFilter implements OASFilter {

    static final String SECTION_SCHEMA = "SDUISection";
    static final String COMPONENT_PROPERTY = "component";

    private static final String SCHEMA_REF_PREFIX = "#/components/schemas/";

    @Override
    public void filterOpenAPI(OpenAPI openAPI) {
        Components components = openAPI.getComponents();
        if (components == null || components.getSchemas() == null) {
            return;
        }
        Map<String, Schema> schemas = components.getSchemas();

        for (ComponentKind kind : ComponentKind.values()) {
            Schema variant = schemas.get(kind.tag());
            if (variant != null) {
                declareTypename(variant, kind);
            }
        }

        Schema section = schemas.get(SECTION_SCHEMA);
        if (section != null) {
            replaceComponentProperty(section);
        }

        // Interface schema produced for the property type; nothing references it once the union is inlined.
        if (schemas.containsKey(SduiComponent.class.getSimpleName())) {
            components.removeSchema(SduiComponent.class.getSimpleName());
        }
    }

    private static void declareTypename(Schema variant, ComponentKind kind) {
        Map<String, Schema> properties = new LinkedHashMap<>();
        properties.put(SduiComponent.TYPENAME_PROPERTY, OASFactory.createSchema().type(Schema.SchemaType.STRING)
                .enumeration(List.of(kind.tag())).description("Component variant name"));
        if (variant.getProperties() != null) {
            variant.getProperties().forEach(properties::putIfAbsent);
        }
        variant.setProperties(properties);

        List<String> required = new ArrayList<>();
        required.add(SduiComponent.TYPENAME_PROPERTY);
        if (variant.getRequired() != null) {
            variant.getRequired().stream().filter(name -> !required.contains(name)).forEach(required::add);
        }
        variant.setRequired(required);
    }

    private static void replaceComponentProperty(Schema section) {
        Map<String, Schema> properties = new LinkedHashMap<>();
        if (section.getProperties() != null) {
            properties.putAll(section.getProperties());
        }
        properties.put(COMPONENT_PROPERTY, componentUnion());
        section.setProperties(properties);

        List<String> required = section.getRequired() == null ? new ArrayList<>()
                : new ArrayList<>(section.getRequired());
        if (!required.contains(COMPONENT_PROPERTY)) {
            required.add(COMPONENT_PROPERTY);
        }
        section.setRequired(required);
    }

    private static Schema componentUnion() {
        Discriminator discriminator = OASFactory.createDiscriminator().propertyName(SduiComponent.TYPENAME_PROPERTY);
        List<Schema> variants = new ArrayList<>();
        for (ComponentKind kind : ComponentKind.values()) {
            String ref = SCHEMA_REF_PREFIX + kind.tag();
            variants.add(OASFactory.createSchema().ref(ref));
            discriminator.addMapping(kind.tag(), ref);
        }
        return OASFactory.createSchema().oneOf(variants).discriminator(discriminator)
                .description("The section's single component, discriminated by __typename");
    }
}
