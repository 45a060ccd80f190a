package villagecompute.mobile.exceptions;

/**
 * Exception thrown when a discriminator tag does not name any registered component kind.
 */
public class UnknownComponentKindException extends ComponentDecodeException {

    public UnknownComponentKindException(String componentTag) {
        super(componentTag, null, "Unknown component kind: " + componentTag);
    }
}
