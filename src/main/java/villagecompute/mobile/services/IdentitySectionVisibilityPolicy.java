package villagecompute.mobile.services;

import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import villagecompute.mobile.auth.Identity;
import villagecompute.mobile.data.models.SectionVisibility;

/**
 * Default visibility policy keyed on the identity state.
 *
 * <ul>
 * <li>{@code PUBLIC} - everyone</li>
 * <li>{@code IDENTIFIED} - authorized and unauthorized users</li>
 * <li>{@code AUTHORIZED} - authorized users only</li>
 * </ul>
 *
 * <p>
 * With {@code village.sdui.visibility.enforce=false} every section is shown.
 */
@ApplicationScoped
@DefaultBean
public class IdentitySectionVisibilityPolicy implements SectionVisibilityPolicy {

    @ConfigProperty(
            name = "village.sdui.visibility.enforce",
            defaultValue = "true")
    boolean enforce;

    @Override
    public boolean isVisible(SectionVisibility visibility, Identity identity) {
        if (!enforce) {
            return true;
        }
        return switch (visibility) {
            case PUBLIC -> true;
            case IDENTIFIED -> switch (identity.kind()) {
                case AUTHORIZED_USER, UNAUTHORIZED_USER -> true;
                case ANONYMOUS_USER -> false;
            };
            case AUTHORIZED -> switch (identity.kind()) {
                case AUTHORIZED_USER -> true;
                case ANONYMOUS_USER, UNAUTHORIZED_USER -> false;
            };
        };
    }
}
