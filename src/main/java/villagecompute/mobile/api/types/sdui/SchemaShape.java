package villagecompute.mobile.api.types.sdui;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Introspectable description of the component union: one named object shape per variant, each carrying only its own
 * fields.
 *
 * @param unionName
 *            name of the union type exposed to API consumers
 * @param discriminator
 *            name of the property carrying the variant name in API responses
 * @param variants
 *            variant shapes in registry order
 */
public record SchemaShape(String unionName, String discriminator, List<VariantShape> variants) {

    public SchemaShape {
        variants = List.copyOf(variants);
    }

    /**
     * @param name
     *            variant name (equal to the discriminator tag)
     * @param fields
     *            fields in declaration order
     */
    public record VariantShape(String name, List<FieldShape> fields) {

        public VariantShape {
            fields = List.copyOf(fields);
        }
    }

    /**
     * @param name
     *            wire name of the field
     * @param type
     *            type name ({@code String}, {@code [SDUICardComponent!]}, ...)
     * @param required
     *            whether the field must be present and non-empty
     */
    public record FieldShape(String name, String type, boolean required) {
    }

    public List<String> variantNames() {
        return variants.stream().map(VariantShape::name).toList();
    }

    /**
     * Renders the union in GraphQL schema language, e.g.
     *
     * <pre>
     * union SDUIComponent = SDUICardComponent | SDUIDescriptionComponent
     *
     * type SDUICardComponent {
     *   title: String!
     * }
     * </pre>
     *
     * @return schema text terminated by a newline
     */
    public String toSchemaLanguage() {
        StringBuilder sdl = new StringBuilder();
        sdl.append("union ").append(unionName).append(" = ")
                .append(variants.stream().map(VariantShape::name).collect(Collectors.joining(" | "))).append('\n');
        for (VariantShape variant : variants) {
            sdl.append('\n').append("type ").append(variant.name()).append(" {\n");
            for (FieldShape field : variant.fields()) {
                sdl.append("  ").append(field.name()).append(": ").append(field.type());
                if (field.required()) {
                    sdl.append('!');
                }
                sdl.append('\n');
            }
            sdl.append("}\n");
        }
        return sdl.toString();
    }
}
