package villagecompute.mobile.api.types.sdui;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Registry of component kinds: one constant per {@link SduiComponent} payload record.
 *
 * <p>
 * The tag is the discriminator persisted next to the component content and returned to clients as
 * {@code __typename}. Tags are part of the wire contract with released mobile clients and must never be renamed.
 */
public enum ComponentKind {

    CARD(SduiCardComponent.TAG, SduiCardComponent.class),

    DESCRIPTION(SduiDescriptionComponent.TAG, SduiDescriptionComponent.class),

    JUMBOTRON(SduiJumbotronComponent.TAG, SduiJumbotronComponent.class),

    SCROLL_VIEW_HORIZONTAL(SduiScrollViewHorizontalComponent.TAG, SduiScrollViewHorizontalComponent.class);

    static {
        Set<String> tags = new HashSet<>();
        for (ComponentKind kind : values()) {
            if (!tags.add(kind.tag)) {
                throw new IllegalStateException("Duplicate component tag: " + kind.tag);
            }
        }
        for (Class<?> permitted : SduiComponent.class.getPermittedSubclasses()) {
            if (fromPayloadType(permitted).isEmpty()) {
                throw new IllegalStateException(
                        "Component payload " + permitted.getName() + " is not registered in ComponentKind");
            }
        }
    }

    private final String tag;
    private final Class<? extends SduiComponent> payloadType;

    ComponentKind(String tag, Class<? extends SduiComponent> payloadType) {
        this.tag = tag;
        this.payloadType = payloadType;
    }

    public String tag() {
        return tag;
    }

    public Class<? extends SduiComponent> payloadType() {
        return payloadType;
    }

    /**
     * Looks up a kind by its discriminator tag. Matching is exact and case-sensitive.
     *
     * @param tag
     *            discriminator tag (nullable)
     * @return matching kind, or empty for unknown/null tags
     */
    public static Optional<ComponentKind> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        return Arrays.stream(values()).filter(kind -> kind.tag.equals(tag)).findFirst();
    }

    /**
     * Looks up a kind by its payload record class.
     *
     * @param payloadType
     *            payload record class
     * @return matching kind, or empty when the class is not a registered payload
     */
    public static Optional<ComponentKind> fromPayloadType(Class<?> payloadType) {
        return Arrays.stream(values()).filter(kind -> kind.payloadType.equals(payloadType)).findFirst();
    }
}
