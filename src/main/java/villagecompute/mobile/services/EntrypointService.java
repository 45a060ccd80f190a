package villagecompute.mobile.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.mobile.api.types.SduiSectionType;
import villagecompute.mobile.auth.Identity;
import villagecompute.mobile.data.models.SectionRecord;
import villagecompute.mobile.exceptions.ComponentDecodeException;
import villagecompute.mobile.exceptions.EntrypointResolutionException;
import villagecompute.mobile.exceptions.SectionStorageException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Resolves an entrypoint key into the ordered sections a caller may see.
 *
 * <p>
 * Resolution is all-or-nothing: one malformed visible section fails the whole call. Sections hidden from the caller
 * are never decoded. Every failure is reported as an {@link EntrypointResolutionException}; logging and the mapping to
 * HTTP responses are left to the caller.
 */
@ApplicationScoped
public class EntrypointService {

    @Inject
    SectionRecordStore sectionRecordStore;

    @Inject
    SectionVisibilityPolicy visibilityPolicy;

    @Inject
    SectionAssembler sectionAssembler;

    /**
     * Resolves the sections of an entrypoint for an identity.
     *
     * @param identity
     *            caller identity
     * @param entrypointKey
     *            entrypoint key, must not be blank
     * @return visible sections in persisted order; empty when the entrypoint has no (visible) sections
     * @throws EntrypointResolutionException
     *             with reason {@code INVALID_KEY}, {@code STORAGE} or {@code DECODE}
     */
    public List<SduiSectionType> resolveSections(Identity identity, String entrypointKey) {
        Objects.requireNonNull(identity, "identity is required");
        if (entrypointKey == null || entrypointKey.isBlank()) {
            throw EntrypointResolutionException.invalidKey(entrypointKey);
        }

        List<SectionRecord> records;
        try {
            records = sectionRecordStore.fetchSectionRecords(entrypointKey, identity);
        } catch (SectionStorageException e) {
            throw EntrypointResolutionException.storage(entrypointKey, e);
        }
        if (records == null || records.isEmpty()) {
            return List.of();
        }

        List<SduiSectionType> sections = new ArrayList<>(records.size());
        for (SectionRecord record : records) {
            if (!visibilityPolicy.isVisible(record.visibility(), identity)) {
                continue;
            }
            try {
                sections.add(sectionAssembler.buildSection(record));
            } catch (ComponentDecodeException e) {
                throw EntrypointResolutionException.decode(entrypointKey, e);
            }
        }
        return List.copyOf(sections);
    }
}
