package villagecompute.mobile.api.types.sdui;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Card component: a tappable tile with a title and an optional image.
 *
 * @param title
 *            card title shown under the image
 * @param imageUrl
 *            absolute http(s) URL of the card image (nullable)
 * @param imageBackgroundColor
 *            placeholder color rendered while the image loads, {@code #RRGGBB} (nullable)
 * @param targetEntrypointKey
 *            entrypoint opened when the card is tapped (nullable for static cards)
 */
@Schema(
        name = SduiCardComponent.TAG,
        description = "Tappable tile with a title and an optional image")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SduiCardComponent(@NotBlank String title,
        @JsonProperty("image_url") @Pattern(
                regexp = ComponentPatterns.HTTP_URL) String imageUrl,
        @JsonProperty("image_background_color") @Pattern(
                regexp = ComponentPatterns.HEX_COLOR) String imageBackgroundColor,
        @JsonProperty("target_entrypoint_key") String targetEntrypointKey) implements SduiComponent {

    public static final String TAG = "SDUICardComponent";

    @JsonIgnore
    @Override
    public ComponentKind kind() {
        return ComponentKind.CARD;
    }
}
