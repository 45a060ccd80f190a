package villagecompute.mobile.services;

import villagecompute.mobile.auth.Identity;
import villagecompute.mobile.data.models.SectionVisibility;

/**
 * Decides whether a section may be shown to a caller.
 */
public interface SectionVisibilityPolicy {

    boolean isVisible(SectionVisibility visibility, Identity identity);
}
