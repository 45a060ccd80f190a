package villagecompute.mobile.api.types.sdui;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.NotBlank;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Description component: a block of plain paragraph text.
 *
 * @param text
 *            paragraph text rendered as-is
 */
@Schema(
        name = SduiDescriptionComponent.TAG,
        description = "Block of plain paragraph text")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SduiDescriptionComponent(@NotBlank String text) implements SduiComponent {

    public static final String TAG = "SDUIDescriptionComponent";

    @JsonIgnore
    @Override
    public ComponentKind kind() {
        return ComponentKind.DESCRIPTION;
    }
}
