package villagecompute.mobile.api.types.sdui;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Horizontally scrolling row of cards.
 *
 * <p>
 * Nested cards are plain {@link SduiCardComponent} payloads without their own discriminator; every card is validated
 * with the same rules as a top-level card.
 *
 * @param title
 *            optional row heading (nullable)
 * @param cards
 *            cards in display order, at least one
 */
@Schema(
        name = SduiScrollViewHorizontalComponent.TAG,
        description = "Horizontally scrolling row of cards")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SduiScrollViewHorizontalComponent(String title,
        @NotEmpty @Valid List<@NotNull SduiCardComponent> cards) implements SduiComponent {

    public static final String TAG = "SDUIScrollViewHorizontalComponent";

    public SduiScrollViewHorizontalComponent {
        cards = cards == null ? null : Collections.unmodifiableList(new ArrayList<>(cards));
    }

    @JsonIgnore
    @Override
    public ComponentKind kind() {
        return ComponentKind.SCROLL_VIEW_HORIZONTAL;
    }
}
