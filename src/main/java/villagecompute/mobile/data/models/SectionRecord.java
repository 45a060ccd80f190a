package villagecompute.mobile.data.models;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;
import java.util.UUID;

/**
 * Raw section record as handed out by a {@code SectionRecordStore}: discriminator tag plus opaque component content.
 *
 * @param id
 *            section identifier
 * @param componentTag
 *            discriminator tag naming the component kind
 * @param content
 *            component content, undecoded
 * @param visibility
 *            audience restriction; a missing value is read as {@link SectionVisibility#AUTHORIZED}
 */
public record SectionRecord(UUID id, String componentTag, JsonNode content, SectionVisibility visibility) {

    public SectionRecord {
        Objects.requireNonNull(id, "id is required");
        visibility = visibility == null ? SectionVisibility.AUTHORIZED : visibility;
    }
}
