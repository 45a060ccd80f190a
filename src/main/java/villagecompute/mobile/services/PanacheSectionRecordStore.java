package villagecompute.mobile.services;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.narayana.jta.QuarkusTransactionException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.PersistenceException;
import org.jboss.logging.Logger;
import villagecompute.mobile.auth.Identity;
import villagecompute.mobile.data.models.SduiSection;
import villagecompute.mobile.data.models.SectionRecord;
import villagecompute.mobile.exceptions.SectionStorageException;

import java.util.List;

/**
 * Reads section records from the {@code sdui_sections} table.
 *
 * <p>
 * Runs its query in a transaction of its own so a database failure surfaces as a {@link SectionStorageException}
 * without marking a caller's transaction rollback-only.
 */
@ApplicationScoped
public class PanacheSectionRecordStore implements SectionRecordStore {

    private static final Logger LOG = Logger.getLogger(PanacheSectionRecordStore.class);

    @Inject
    ObjectMapper objectMapper;

    @Override
    public List<SectionRecord> fetchSectionRecords(String entrypointKey, Identity identity) {
        try {
            return QuarkusTransaction.requiringNew().call(() -> SduiSection.findByEntrypointKey(entrypointKey)
                    .stream().map(this::toRecord).toList());
        } catch (PersistenceException | QuarkusTransactionException e) {
            LOG.errorf(e, "Failed to load sections for entrypoint %s", entrypointKey);
            throw new SectionStorageException("Failed to load sections for entrypoint " + entrypointKey, e);
        }
    }

    private SectionRecord toRecord(SduiSection section) {
        return new SectionRecord(section.id, section.componentTag, objectMapper.valueToTree(section.componentContent),
                section.visibility);
    }
}
