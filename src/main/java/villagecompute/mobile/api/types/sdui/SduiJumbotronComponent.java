package villagecompute.mobile.api.types.sdui;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Jumbotron component: the large headline block usually placed first on a screen.
 *
 * @param title
 *            headline text
 * @param subtitle
 *            secondary line under the headline (nullable)
 * @param imageUrl
 *            absolute http(s) URL of the background image (nullable)
 */
@Schema(
        name = SduiJumbotronComponent.TAG,
        description = "Large headline block, usually the first section of a screen")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SduiJumbotronComponent(@NotBlank String title, String subtitle,
        @JsonProperty("image_url") @Pattern(
                regexp = ComponentPatterns.HTTP_URL) String imageUrl)
        implements SduiComponent {

    public static final String TAG = "SDUIJumbotronComponent";

    @JsonIgnore
    @Override
    public ComponentKind kind() {
        return ComponentKind.JUMBOTRON;
    }
}
