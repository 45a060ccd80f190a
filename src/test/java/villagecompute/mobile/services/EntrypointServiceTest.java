package villagecompute.mobile.services;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import villagecompute.mobile.api.types.SduiSectionType;
import villagecompute.mobile.api.types.sdui.SduiCardComponent;
import villagecompute.mobile.auth.Identity;
import villagecompute.mobile.data.models.SectionRecord;
import villagecompute.mobile.data.models.SectionVisibility;
import villagecompute.mobile.exceptions.ComponentDecodeException;
import villagecompute.mobile.exceptions.EntrypointResolutionException;
import villagecompute.mobile.exceptions.SectionStorageException;
import villagecompute.mobile.testing.TestFixtures;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link EntrypointService}.
 */
class EntrypointServiceTest {

    private static final Identity ANONYMOUS = Identity.anonymous(UUID.randomUUID().toString());
    private static final Identity AUTHORIZED = Identity.authorized(UUID.randomUUID());

    @Mock
    SectionRecordStore sectionRecordStore;

    @InjectMocks
    EntrypointService entrypointService;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);

        SduiComponentCodec codec = new SduiComponentCodec();
        codec.objectMapper = TestFixtures.OBJECT_MAPPER;
        codec.validator = TestFixtures.validator();
        SectionAssembler assembler = new SectionAssembler();
        assembler.codec = codec;
        IdentitySectionVisibilityPolicy policy = new IdentitySectionVisibilityPolicy();
        policy.enforce = true;

        entrypointService.sectionAssembler = assembler;
        entrypointService.visibilityPolicy = policy;
    }

    @Test
    void testResolveSections_preservesOrder() {
        SectionRecord a = TestFixtures.descriptionRecord("A", SectionVisibility.PUBLIC);
        SectionRecord b = TestFixtures.descriptionRecord("B", SectionVisibility.PUBLIC);
        SectionRecord c = TestFixtures.descriptionRecord("C", SectionVisibility.PUBLIC);
        when(sectionRecordStore.fetchSectionRecords("home", ANONYMOUS)).thenReturn(List.of(a, b, c));

        List<SduiSectionType> sections = entrypointService.resolveSections(ANONYMOUS, "home");

        assertEquals(List.of(a.id().toString(), b.id().toString(), c.id().toString()),
                sections.stream().map(SduiSectionType::id).toList());
    }

    @Test
    void testResolveSections_emptyEntrypoint() {
        when(sectionRecordStore.fetchSectionRecords("empty", ANONYMOUS)).thenReturn(List.of());

        assertTrue(entrypointService.resolveSections(ANONYMOUS, "empty").isEmpty());
    }

    @Test
    void testResolveSections_failFastOnMalformedRecord() {
        SectionRecord a = TestFixtures.descriptionRecord("A", SectionVisibility.PUBLIC);
        SectionRecord b = TestFixtures.record(SduiCardComponent.TAG, Map.of("image_url", "https://x.io/a.png"),
                SectionVisibility.PUBLIC);
        SectionRecord c = TestFixtures.descriptionRecord("C", SectionVisibility.PUBLIC);
        when(sectionRecordStore.fetchSectionRecords("home", ANONYMOUS)).thenReturn(List.of(a, b, c));

        EntrypointResolutionException e = assertThrows(EntrypointResolutionException.class,
                () -> entrypointService.resolveSections(ANONYMOUS, "home"));

        assertEquals(EntrypointResolutionException.Reason.DECODE, e.getReason());
        assertEquals("home", e.getEntrypointKey());
        ComponentDecodeException cause = assertInstanceOf(ComponentDecodeException.class, e.getCause());
        assertEquals(SduiCardComponent.TAG, cause.getComponentTag());
        assertEquals("title", cause.getField());
        assertEquals(b.id().toString(), cause.getSectionId());
    }

    @Test
    void testResolveSections_unknownTagFailsResolution() {
        SectionRecord unknown = TestFixtures.record("SDUIMapComponent", Map.of("lat", 1), SectionVisibility.PUBLIC);
        when(sectionRecordStore.fetchSectionRecords("home", ANONYMOUS)).thenReturn(List.of(unknown));

        EntrypointResolutionException e = assertThrows(EntrypointResolutionException.class,
                () -> entrypointService.resolveSections(ANONYMOUS, "home"));

        assertEquals(EntrypointResolutionException.Reason.DECODE, e.getReason());
    }

    @Test
    void testResolveSections_hidesAuthorizedOnlyFromAnonymous() {
        SectionRecord a = TestFixtures.descriptionRecord("A", SectionVisibility.AUTHORIZED);
        SectionRecord b = TestFixtures.descriptionRecord("B", SectionVisibility.PUBLIC);
        when(sectionRecordStore.fetchSectionRecords("home", ANONYMOUS)).thenReturn(List.of(a, b));
        when(sectionRecordStore.fetchSectionRecords("home", AUTHORIZED)).thenReturn(List.of(a, b));

        assertEquals(List.of(b.id().toString()), entrypointService.resolveSections(ANONYMOUS, "home").stream()
                .map(SduiSectionType::id).toList());
        assertEquals(List.of(a.id().toString(), b.id().toString()), entrypointService
                .resolveSections(AUTHORIZED, "home").stream().map(SduiSectionType::id).toList());
    }

    @Test
    void testResolveSections_hiddenMalformedRecordIsNotDecoded() {
        SectionRecord hidden = TestFixtures.record(SduiCardComponent.TAG, Map.of(), SectionVisibility.AUTHORIZED);
        SectionRecord visible = TestFixtures.descriptionRecord("B", SectionVisibility.PUBLIC);
        when(sectionRecordStore.fetchSectionRecords("home", ANONYMOUS)).thenReturn(List.of(hidden, visible));

        assertEquals(1, entrypointService.resolveSections(ANONYMOUS, "home").size());
    }

    @Test
    void testResolveSections_blankKey() {
        EntrypointResolutionException blank = assertThrows(EntrypointResolutionException.class,
                () -> entrypointService.resolveSections(ANONYMOUS, "  "));
        EntrypointResolutionException missing = assertThrows(EntrypointResolutionException.class,
                () -> entrypointService.resolveSections(ANONYMOUS, null));

        assertEquals(EntrypointResolutionException.Reason.INVALID_KEY, blank.getReason());
        assertEquals(EntrypointResolutionException.Reason.INVALID_KEY, missing.getReason());
        verify(sectionRecordStore, never()).fetchSectionRecords(anyString(), any());
    }

    @Test
    void testResolveSections_storageFailure() {
        SectionStorageException failure = new SectionStorageException("connection refused", null);
        when(sectionRecordStore.fetchSectionRecords("home", ANONYMOUS)).thenThrow(failure);

        EntrypointResolutionException e = assertThrows(EntrypointResolutionException.class,
                () -> entrypointService.resolveSections(ANONYMOUS, "home"));

        assertEquals(EntrypointResolutionException.Reason.STORAGE, e.getReason());
        assertSame(failure, e.getCause());
    }
}
