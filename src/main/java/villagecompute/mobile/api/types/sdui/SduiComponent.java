package villagecompute.mobile.api.types.sdui;

/**
 * Closed union of server-driven UI component payloads.
 *
 * <p>
 * Every permitted payload is an immutable record registered in {@link ComponentKind}. A payload reports its own kind,
 * so adding a record to the {@code permits} clause does not compile until a matching {@link ComponentKind} constant
 * exists. {@link ComponentKind} additionally verifies at class initialization that every permitted subtype is
 * registered.
 *
 * <p>
 * Components are produced only by {@code SduiComponentCodec#decode} and are never mutated afterwards.
 *
 * @see ComponentKind for the discriminator registry
 */
public sealed interface SduiComponent permits SduiCardComponent, SduiDescriptionComponent, SduiJumbotronComponent,
        SduiScrollViewHorizontalComponent {

    /**
     * Name of the discriminator property written by the API serializer.
     */
    String TYPENAME_PROPERTY = "__typename";

    /**
     * Returns the registry entry describing this payload.
     *
     * @return component kind carrying the discriminator tag
     */
    ComponentKind kind();
}
