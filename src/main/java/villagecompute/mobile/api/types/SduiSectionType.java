package villagecompute.mobile.api.types;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import villagecompute.mobile.api.types.sdui.SduiCardComponent;
import villagecompute.mobile.api.types.sdui.SduiComponent;
import villagecompute.mobile.api.types.sdui.SduiComponentSerializer;
import villagecompute.mobile.api.types.sdui.SduiDescriptionComponent;
import villagecompute.mobile.api.types.sdui.SduiJumbotronComponent;
import villagecompute.mobile.api.types.sdui.SduiScrollViewHorizontalComponent;

/**
 * API type for one server-driven UI section.
 *
 * <p>
 * Sections are returned in the order they were persisted for the entrypoint. Position is implicit in the response
 * array; the section carries no ordering field of its own.
 *
 * <p>
 * <b>Response Format:</b>
 *
 * <pre>
 * {
 *   "id": "8d6f1c7e-3b0a-4f55-9a64-2a5d7c1b9e10",
 *   "component": {
 *     "__typename": "SDUIJumbotronComponent",
 *     "title": "Tacos today"
 *   }
 * }
 * </pre>
 *
 * @param id
 *            persisted section identifier
 * @param component
 *            the section's single component, discriminated by {@code __typename}
 */
@Schema(
        name = "SDUISection")
public record SduiSectionType(@NotBlank String id,
        @NotNull @JsonSerialize(
                using = SduiComponentSerializer.class) @Schema(
                        oneOf = {SduiCardComponent.class, SduiDescriptionComponent.class,
                                SduiJumbotronComponent.class,
                                SduiScrollViewHorizontalComponent.class}) SduiComponent component) {
}
