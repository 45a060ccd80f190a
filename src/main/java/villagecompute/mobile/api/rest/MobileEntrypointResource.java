/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.mobile.api.rest;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.enums.SchemaType;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.security.SecurityRequirement;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import villagecompute.mobile.api.types.SduiSectionType;
import villagecompute.mobile.auth.Identity;
import villagecompute.mobile.exceptions.EntrypointResolutionException;
import villagecompute.mobile.observability.LoggingConfig;
import villagecompute.mobile.observability.MobileMetrics;
import villagecompute.mobile.services.EntrypointService;
import villagecompute.mobile.services.MobileAuthService;

import java.util.List;
import java.util.Locale;

/**
 * REST endpoint serving server-driven UI sections to the mobile app.
 *
 * <p>
 * Responsibilities:
 * <ul>
 * <li>{@code GET /api/mobile/entrypoints/{key}/sections} - ordered sections of an entrypoint for the caller</li>
 * </ul>
 *
 * <p>
 * <b>Security:</b> Open to every caller. The identity derived from the bearer token and {@code X-Anonymous-Id} header
 * only decides which sections are visible.
 *
 * <p>
 * <b>Response Format:</b>
 *
 * <pre>
 * [
 *   {"id": "...", "component": {"__typename": "SDUIJumbotronComponent", "title": "Tacos today"}},
 *   {"id": "...", "component": {"__typename": "SDUIDescriptionComponent", "text": "Fresh from the oven"}}
 * ]
 * </pre>
 */
@Path("/api/mobile/entrypoints")
@Produces(MediaType.APPLICATION_JSON)
@Tag(
        name = "Mobile - Entrypoints",
        description = "Server-driven UI sections for the mobile app")
public class MobileEntrypointResource {

    private static final Logger LOG = Logger.getLogger(MobileEntrypointResource.class);

    @Inject
    EntrypointService entrypointService;

    @Inject
    MobileAuthService mobileAuthService;

    @Inject
    MobileMetrics mobileMetrics;

    @Inject
    Tracer tracer;

    /**
     * Returns the sections of an entrypoint visible to the caller.
     *
     * @param key
     *            entrypoint key
     * @param authorization
     *            optional {@code Bearer <session_token>}
     * @param anonymousId
     *            optional anonymous device id
     * @return 200 with sections, 400 for a blank key, 500 if a section is malformed, 503 if storage is unavailable
     */
    @GET
    @Path("/{key}/sections")
    @Operation(
            summary = "Get entrypoint sections",
            description = "Resolve an entrypoint key into its ordered, visibility-filtered sections")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Sections in display order",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    type = SchemaType.ARRAY,
                                    implementation = SduiSectionType.class))),
                    @APIResponse(
                            responseCode = "400",
                            description = "Blank entrypoint key",
                            content = @Content(
                                    mediaType = MediaType.APPLICATION_JSON,
                                    schema = @Schema(
                                            implementation = ErrorResponse.class))),
                    @APIResponse(
                            responseCode = "500",
                            description = "A section of the entrypoint is malformed",
                            content = @Content(
                                    mediaType = MediaType.APPLICATION_JSON,
                                    schema = @Schema(
                                            implementation = ErrorResponse.class))),
                    @APIResponse(
                            responseCode = "503",
                            description = "Section storage unavailable",
                            content = @Content(
                                    mediaType = MediaType.APPLICATION_JSON,
                                    schema = @Schema(
                                            implementation = ErrorResponse.class)))})
    @SecurityRequirement(
            name = "sessionToken")
    public Response getSections(@PathParam("key") String key,
            @HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
            @HeaderParam(MobileAuthService.ANONYMOUS_ID_HEADER) String anonymousId) {
        Span span = tracer.spanBuilder("mobile.entrypoint.sections").startSpan();
        try (Scope ignored = span.makeCurrent()) {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setRequestOrigin("/api/mobile/entrypoints/" + key + "/sections");
            LoggingConfig.setEntrypointKey(key);

            Identity identity = mobileAuthService.resolveIdentity(authorization, anonymousId);
            LoggingConfig.setIdentity(identity);
            span.setAttribute("entrypoint.key", key);
            span.setAttribute("identity.kind", identity.kind().name());

            List<SduiSectionType> sections = entrypointService.resolveSections(identity, key);
            span.setAttribute("sections.count", sections.size());
            mobileMetrics.recordResolution(MobileMetrics.RESULT_OK, sections.size());
            return Response.ok(sections).build();

        } catch (EntrypointResolutionException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR);
            mobileMetrics.recordResolution(e.getReason().name().toLowerCase(Locale.ROOT), 0);
            return toErrorResponse(e);
        } finally {
            LoggingConfig.clearMDC();
            span.end();
        }
    }

    private static Response toErrorResponse(EntrypointResolutionException e) {
        return switch (e.getReason()) {
            case INVALID_KEY -> {
                LOG.debugf("Rejected blank entrypoint key");
                yield Response.status(Response.Status.BAD_REQUEST).entity(new ErrorResponse(e.getMessage())).build();
            }
            case DECODE -> {
                LOG.errorf(e, "Malformed section in entrypoint %s", e.getEntrypointKey());
                yield Response.status(Response.Status.INTERNAL_SERVER_ERROR).entity(new ErrorResponse(e.getMessage()))
                        .build();
            }
            case STORAGE -> {
                LOG.errorf(e, "Section storage unavailable for entrypoint %s", e.getEntrypointKey());
                yield Response.status(Response.Status.SERVICE_UNAVAILABLE)
                        .entity(new ErrorResponse("Sections are temporarily unavailable")).build();
            }
        };
    }

    public record ErrorResponse(String error) {
    }
}
