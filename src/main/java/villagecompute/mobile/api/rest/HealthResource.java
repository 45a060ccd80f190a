package villagecompute.mobile.api.rest;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceException;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import villagecompute.mobile.api.types.sdui.ComponentKind;

/**
 * Readiness check: pings the section store and reports how many component kinds this build can serve.
 */
@Path("/api/health")
@Tag(
        name = "Health",
        description = "Health check operations")
public class HealthResource {

    private static final Logger LOG = Logger.getLogger(HealthResource.class);

    static final String UP = "UP";
    static final String DOWN = "DOWN";

    @Inject
    EntityManager entityManager;

    @GET
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(
            summary = "Health check",
            description = "Check that the mobile API is running and its section store answers")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Application is healthy",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = HealthResponse.class))),
                    @APIResponse(
                            responseCode = "503",
                            description = "Section store unreachable",
                            content = @Content(
                                    mediaType = MediaType.APPLICATION_JSON,
                                    schema = @Schema(
                                            implementation = HealthResponse.class)))})
    public Response health() {
        int componentKinds = ComponentKind.values().length;
        try {
            entityManager.createNativeQuery("SELECT 1").getSingleResult();
        } catch (PersistenceException e) {
            LOG.warnf(e, "Health check could not reach the section store");
            return Response.status(Response.Status.SERVICE_UNAVAILABLE)
                    .entity(new HealthResponse(DOWN, "Section store unreachable", DOWN, componentKinds)).build();
        }
        return Response.ok(new HealthResponse(UP, "Village Mobile API is running", UP, componentKinds)).build();
    }

    public record HealthResponse(String status, String message, String storage,
            @JsonProperty("component_kinds") int componentKinds) {
    }
}
