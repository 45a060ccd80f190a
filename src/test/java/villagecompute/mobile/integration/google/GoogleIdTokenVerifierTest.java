package villagecompute.mobile.integration.google;

import jakarta.ws.rs.ProcessingException;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Response;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import villagecompute.mobile.api.types.GoogleTokenInfoType;
import villagecompute.mobile.exceptions.AuthenticationException;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link GoogleIdTokenVerifier}.
 */
class GoogleIdTokenVerifierTest {

    private static final String CLIENT_ID = "test-client-id";

    @Mock
    GoogleTokenInfoRestClient restClient;

    @InjectMocks
    GoogleIdTokenVerifier verifier;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        verifier.clientId = CLIENT_ID;
        verifier.issuers = List.of("accounts.google.com", "https://accounts.google.com");
    }

    private static GoogleTokenInfoType tokenInfo(String aud, String iss, String emailVerified, long expEpochSeconds) {
        return new GoogleTokenInfoType(iss, "1098765", aud, "cook@example.com", emailVerified,
                Long.toString(expEpochSeconds), "Cook", "https://lh3.example.com/cook.png");
    }

    private static long inOneHour() {
        return Instant.now().plusSeconds(3600).getEpochSecond();
    }

    @Test
    void testVerify_validToken() {
        GoogleTokenInfoType info = tokenInfo(CLIENT_ID, "https://accounts.google.com", "true", inOneHour());
        when(restClient.tokenInfo("id-token")).thenReturn(info);

        assertEquals(info, verifier.verify("id-token"));
    }

    @Test
    void testVerify_wrongAudience() {
        when(restClient.tokenInfo("id-token"))
                .thenReturn(tokenInfo("other-app", "accounts.google.com", "true", inOneHour()));

        assertThrows(AuthenticationException.class, () -> verifier.verify("id-token"));
    }

    @Test
    void testVerify_wrongIssuer() {
        when(restClient.tokenInfo("id-token"))
                .thenReturn(tokenInfo(CLIENT_ID, "https://evil.example.com", "true", inOneHour()));

        assertThrows(AuthenticationException.class, () -> verifier.verify("id-token"));
    }

    @Test
    void testVerify_unverifiedEmail() {
        when(restClient.tokenInfo("id-token"))
                .thenReturn(tokenInfo(CLIENT_ID, "accounts.google.com", "false", inOneHour()));

        assertThrows(AuthenticationException.class, () -> verifier.verify("id-token"));
    }

    @Test
    void testVerify_expired() {
        when(restClient.tokenInfo("id-token")).thenReturn(
                tokenInfo(CLIENT_ID, "accounts.google.com", "true", Instant.now().minusSeconds(60).getEpochSecond()));

        assertThrows(AuthenticationException.class, () -> verifier.verify("id-token"));
    }

    @Test
    void testVerify_rejectedByGoogle() {
        when(restClient.tokenInfo("garbage")).thenThrow(new WebApplicationException(Response.status(400).build()));

        assertThrows(AuthenticationException.class, () -> verifier.verify("garbage"));
    }

    @Test
    void testVerify_googleUnreachable() {
        when(restClient.tokenInfo("id-token")).thenThrow(new ProcessingException("connect timed out"));

        assertThrows(AuthenticationException.class, () -> verifier.verify("id-token"));
    }

    @Test
    void testVerify_blankTokenSkipsGoogle() {
        assertThrows(AuthenticationException.class, () -> verifier.verify(" "));
        verifyNoInteractions(restClient);
    }
}
