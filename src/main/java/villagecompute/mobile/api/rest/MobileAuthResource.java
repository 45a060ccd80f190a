package villagecompute.mobile.api.rest;

import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import villagecompute.mobile.api.types.AuthorizeMobileRequestType;
import villagecompute.mobile.api.types.AuthorizeMobileResultType;
import villagecompute.mobile.api.types.DeauthorizeMobileRequestType;
import villagecompute.mobile.api.types.DeauthorizeMobileResultType;
import villagecompute.mobile.exceptions.AuthenticationException;
import villagecompute.mobile.observability.LoggingConfig;
import villagecompute.mobile.observability.MobileMetrics;
import villagecompute.mobile.services.MobileAuthService;

/**
 * Mobile sign-in endpoints.
 *
 * <p>
 * Rejected sign-ins are not HTTP errors: the app receives {@code {"success": false, "session_token": null}} and keeps
 * working as an anonymous user.
 */
@Path("/api/mobile/auth")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@Tag(
        name = "Mobile - Authentication",
        description = "Google sign-in and session revocation for the mobile app")
public class MobileAuthResource {

    private static final Logger LOG = Logger.getLogger(MobileAuthResource.class);

    @Inject
    MobileAuthService mobileAuthService;

    @Inject
    MobileMetrics mobileMetrics;

    @POST
    @Path("/authorize")
    @Operation(
            summary = "Authorize with Google",
            description = "Exchange a Google ID token for a session token")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Authorization outcome",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = AuthorizeMobileResultType.class))),
                    @APIResponse(
                            responseCode = "400",
                            description = "Missing google_id_token")})
    public AuthorizeMobileResultType authorize(@Valid AuthorizeMobileRequestType request) {
        LoggingConfig.enrichWithTraceContext();
        LoggingConfig.setRequestOrigin("/api/mobile/auth/authorize");
        try {
            String sessionToken = mobileAuthService.authorize(request.googleIdToken());
            mobileMetrics.recordAuthAttempt(MobileMetrics.RESULT_SUCCESS);
            return AuthorizeMobileResultType.authorized(sessionToken);
        } catch (AuthenticationException e) {
            LOG.warnf("Mobile authorization rejected: %s", e.getMessage());
            mobileMetrics.recordAuthAttempt(MobileMetrics.RESULT_REJECTED);
            return AuthorizeMobileResultType.rejected();
        } finally {
            LoggingConfig.clearMDC();
        }
    }

    @POST
    @Path("/deauthorize")
    @Operation(
            summary = "Revoke session",
            description = "Revoke a session token issued by authorize")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Revocation outcome",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = DeauthorizeMobileResultType.class))),
                    @APIResponse(
                            responseCode = "400",
                            description = "Missing session_token")})
    public DeauthorizeMobileResultType deauthorize(@Valid DeauthorizeMobileRequestType request) {
        return new DeauthorizeMobileResultType(mobileAuthService.deauthorize(request.sessionToken()));
    }
}
