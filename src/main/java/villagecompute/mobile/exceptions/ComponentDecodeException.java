package villagecompute.mobile.exceptions;

/**
 * Exception thrown when persisted component data cannot be decoded into a component payload.
 *
 * <p>
 * Decode failures are structural and permanent: the same record fails the same way on every attempt, so callers must
 * not retry. The exception carries the discriminator tag, the offending field path (e.g. {@code cards[1].title}, null
 * when the failure is not tied to a field) and, once the section layer annotates it, the section identifier.
 */
public class ComponentDecodeException extends RuntimeException {

    private final String componentTag;
    private final String field;
    private String sectionId;

    public ComponentDecodeException(String componentTag, String field, String message) {
        super(message);
        this.componentTag = componentTag;
        this.field = field;
    }

    public ComponentDecodeException(String componentTag, String field, String message, Throwable cause) {
        super(message, cause);
        this.componentTag = componentTag;
        this.field = field;
    }

    public String getComponentTag() {
        return componentTag;
    }

    public String getField() {
        return field;
    }

    public String getSectionId() {
        return sectionId;
    }

    /**
     * Records the section whose content failed to decode.
     *
     * @param sectionId
     *            persisted section identifier
     * @return this exception, for rethrowing
     */
    public ComponentDecodeException inSection(String sectionId) {
        this.sectionId = sectionId;
        return this;
    }

    @Override
    public String getMessage() {
        String message = super.getMessage();
        return sectionId == null ? message : message + " (section " + sectionId + ")";
    }
}
