package villagecompute.mobile.api.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.security.SecurityRequirement;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import villagecompute.mobile.api.types.WhoamiType;
import villagecompute.mobile.services.MobileAuthService;

/**
 * Reports the identity the server derives from the request headers. Testing aid for app developers.
 */
@Path("/api/mobile/whoami")
@Produces(MediaType.APPLICATION_JSON)
@Tag(
        name = "Mobile - Authentication",
        description = "Google sign-in and session revocation for the mobile app")
public class WhoamiResource {

    @Inject
    MobileAuthService mobileAuthService;

    @GET
    @Operation(
            summary = "Who am I",
            description = "Describe the identity resolved from the Authorization and X-Anonymous-Id headers")
    @APIResponses(
            value = @APIResponse(
                    responseCode = "200",
                    description = "Resolved identity",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = WhoamiType.class))))
    @SecurityRequirement(
            name = "sessionToken")
    public WhoamiType whoami(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
            @HeaderParam(MobileAuthService.ANONYMOUS_ID_HEADER) String anonymousId) {
        return WhoamiType.from(mobileAuthService.resolveIdentity(authorization, anonymousId));
    }
}
