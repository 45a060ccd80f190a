package villagecompute.mobile.config;

import jakarta.ws.rs.core.Application;
import org.eclipse.microprofile.openapi.annotations.Components;
import org.eclipse.microprofile.openapi.annotations.OpenAPIDefinition;
import org.eclipse.microprofile.openapi.annotations.enums.SecuritySchemeIn;
import org.eclipse.microprofile.openapi.annotations.enums.SecuritySchemeType;
import org.eclipse.microprofile.openapi.annotations.info.Contact;
import org.eclipse.microprofile.openapi.annotations.info.Info;
import org.eclipse.microprofile.openapi.annotations.info.License;
import org.eclipse.microprofile.openapi.annotations.security.SecurityScheme;
import org.eclipse.microprofile.openapi.annotations.servers.Server;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

/**
 * OpenAPI 3.0 configuration for the Village Mobile API.
 *
 * <p>
 * Defines API metadata, security schemes, and endpoint groupings via tags.
 */
@OpenAPIDefinition(
        info = @Info(
                title = "Village Mobile API",
                version = "1.0.0",
                description = """
                        Backend for the Village mobile app.

                        ## Features
                        - **Server-driven UI**: entrypoints resolve to ordered sections, each wrapping one component
                        - **Authentication**: Google sign-in exchanged for opaque session tokens
                        - **Schema**: the component union published in GraphQL schema language

                        ## Identity
                        Requests carry `Authorization: Bearer <session_token>` once signed in, and an
                        `X-Anonymous-Id` device id otherwise. Expired sessions are treated as unauthorized users.
                        """,
                contact = @Contact(
                        name = "Village Compute",
                        email = "tcurran@villagecompute.com",
                        url = "https://villagecompute.com"),
                license = @License(
                        name = "Proprietary")),
        servers = {@Server(
                url = "https://mobile.villagecompute.com",
                description = "Production"),
                @Server(
                        url = "http://localhost:8080",
                        description = "Local Development")},
        tags = {@Tag(
                name = "Mobile - Entrypoints",
                description = "Server-driven UI sections for the mobile app"),
                @Tag(
                        name = "Mobile - Authentication",
                        description = "Google sign-in and session revocation for the mobile app"),
                @Tag(
                        name = "Mobile - Schema",
                        description = "Server-driven UI component schema"),
                @Tag(
                        name = "Health",
                        description = "Health checks and readiness probes")},
        components = @Components(
                securitySchemes = {@SecurityScheme(
                        securitySchemeName = "sessionToken",
                        type = SecuritySchemeType.HTTP,
                        scheme = "bearer",
                        description = "Opaque session token returned by /api/mobile/auth/authorize"),
                        @SecurityScheme(
                                securitySchemeName = "anonymousId",
                                type = SecuritySchemeType.APIKEY,
                                apiKeyName = "X-Anonymous-Id",
                                in = SecuritySchemeIn.HEADER,
                                description = "Device id sent by signed-out clients")}))
public class OpenApiConfig extends Application {
    // Configuration via annotations only - no programmatic setup needed
}
