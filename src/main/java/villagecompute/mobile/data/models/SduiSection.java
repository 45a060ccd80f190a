package villagecompute.mobile.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import io.quarkus.panache.common.Parameters;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.NamedQuery;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Persisted server-driven UI section implementing the Panache ActiveRecord pattern.
 *
 * <p>
 * Sections are authored outside this service; the API only reads them.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code id} (UUID, PK) - Section identifier returned to clients</li>
 * <li>{@code entrypoint_key} (TEXT) - Entrypoint the section belongs to</li>
 * <li>{@code position} (INT) - Display order within the entrypoint (ascending)</li>
 * <li>{@code component_tag} (TEXT) - Component discriminator, e.g. {@code SDUICardComponent}</li>
 * <li>{@code component_content} (JSONB) - Component fields without the discriminator</li>
 * <li>{@code visibility} (TEXT) - Audience: PUBLIC, IDENTIFIED, AUTHORIZED</li>
 * <li>{@code created_at} (TIMESTAMPTZ) - Record creation timestamp</li>
 * <li>{@code updated_at} (TIMESTAMPTZ) - Last modification timestamp</li>
 * </ul>
 */
@Entity
@Table(
        name = "sdui_sections",
        indexes = @Index(
                name = "idx_sdui_sections_entrypoint_position",
                columnList = "entrypoint_key, position"))
@NamedQuery(
        name = SduiSection.QUERY_FIND_BY_ENTRYPOINT_KEY,
        query = "SELECT s FROM SduiSection s WHERE s.entrypointKey = :entrypointKey ORDER BY s.position ASC, s.createdAt ASC, s.id ASC")
public class SduiSection extends PanacheEntityBase {

    public static final String QUERY_FIND_BY_ENTRYPOINT_KEY = "SduiSection.findByEntrypointKey";

    @Id
    @GeneratedValue
    @Column(
            nullable = false)
    public UUID id;

    @Column(
            name = "entrypoint_key",
            nullable = false)
    public String entrypointKey;

    @Column(
            nullable = false)
    public int position;

    @Column(
            name = "component_tag",
            nullable = false)
    public String componentTag;

    @Column(
            name = "component_content",
            nullable = false)
    @JdbcTypeCode(SqlTypes.JSON)
    public Map<String, Object> componentContent;

    @Enumerated(EnumType.STRING)
    @Column(
            nullable = false)
    public SectionVisibility visibility;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt;

    /**
     * Finds all sections of an entrypoint in display order.
     *
     * @param entrypointKey
     *            entrypoint key
     * @return sections ordered by position (empty list when the entrypoint has no sections)
     */
    public static List<SduiSection> findByEntrypointKey(String entrypointKey) {
        return find("#" + QUERY_FIND_BY_ENTRYPOINT_KEY, Parameters.with("entrypointKey", entrypointKey)).list();
    }

    /**
     * Builds a new, not yet persisted section.
     *
     * @param entrypointKey
     *            entrypoint the section belongs to
     * @param position
     *            display order within the entrypoint
     * @param componentTag
     *            component discriminator
     * @param componentContent
     *            component fields
     * @param visibility
     *            audience restriction
     * @return transient section entity
     */
    public static SduiSection of(String entrypointKey, int position, String componentTag,
            Map<String, Object> componentContent, SectionVisibility visibility) {
        SduiSection section = new SduiSection();
        section.entrypointKey = entrypointKey;
        section.position = position;
        section.componentTag = componentTag;
        section.componentContent = componentContent;
        section.visibility = visibility;
        section.createdAt = Instant.now();
        section.updatedAt = section.createdAt;
        return section;
    }
}
