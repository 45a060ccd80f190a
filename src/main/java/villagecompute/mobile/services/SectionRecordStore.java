package villagecompute.mobile.services;

import villagecompute.mobile.auth.Identity;
import villagecompute.mobile.data.models.SectionRecord;
import villagecompute.mobile.exceptions.SectionStorageException;

import java.util.List;

/**
 * Source of raw section records for an entrypoint.
 */
public interface SectionRecordStore {

    /**
     * Fetches the section records of an entrypoint in display order.
     *
     * @param entrypointKey
     *            non-blank entrypoint key
     * @param identity
     *            caller identity, available to stores that scope records per user
     * @return records in display order; empty when the entrypoint has no sections
     * @throws SectionStorageException
     *             if the backing store is unavailable
     */
    List<SectionRecord> fetchSectionRecords(String entrypointKey, Identity identity);
}
