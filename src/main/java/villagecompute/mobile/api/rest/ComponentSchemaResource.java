package villagecompute.mobile.api.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import villagecompute.mobile.services.SduiComponentCodec;

/**
 * Publishes the component union in GraphQL schema language so app builds can generate their models from it.
 */
@Path("/api/mobile/schema/components")
@Tag(
        name = "Mobile - Schema",
        description = "Server-driven UI component schema")
public class ComponentSchemaResource {

    @Inject
    SduiComponentCodec codec;

    @GET
    @Produces(MediaType.TEXT_PLAIN)
    @Operation(
            summary = "Component schema",
            description = "GraphQL SDL of the SDUIComponent union and its variants")
    public String componentSchema() {
        return codec.describeSchema().toSchemaLanguage();
    }
}
