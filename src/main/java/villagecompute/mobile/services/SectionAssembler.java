package villagecompute.mobile.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.mobile.api.types.SduiSectionType;
import villagecompute.mobile.data.models.SectionRecord;
import villagecompute.mobile.exceptions.ComponentDecodeException;

/**
 * Turns a raw section record into the API section type by decoding its component.
 */
@ApplicationScoped
public class SectionAssembler {

    @Inject
    SduiComponentCodec codec;

    /**
     * Builds a section from a raw record.
     *
     * @param record
     *            persisted section record
     * @return section carrying the record id and decoded component
     * @throws ComponentDecodeException
     *             if the component cannot be decoded; the exception names the section
     */
    public SduiSectionType buildSection(SectionRecord record) {
        try {
            return new SduiSectionType(record.id().toString(), codec.decode(record.componentTag(), record.content()));
        } catch (ComponentDecodeException e) {
            throw e.inSection(record.id().toString());
        }
    }
}
