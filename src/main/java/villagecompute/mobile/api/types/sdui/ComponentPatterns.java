package villagecompute.mobile.api.types.sdui;

/**
 * Regular expressions shared by component payload constraints.
 */
final class ComponentPatterns {

    static final String HTTP_URL = "^https?://\\S+$";

    static final String HEX_COLOR = "^#[0-9A-Fa-f]{6}$";

    private ComponentPatterns() {
    }
}
