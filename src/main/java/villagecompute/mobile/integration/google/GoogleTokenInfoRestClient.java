package villagecompute.mobile.integration.google;

import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;
import villagecompute.mobile.api.types.GoogleTokenInfoType;

/**
 * REST client for Google's ID token introspection endpoint.
 *
 * <p>
 * The base URL is configured in application.yaml as quarkus.rest-client.google-tokeninfo.url. Google answers 400 for
 * tokens it cannot parse or that have expired.
 *
 * <p>
 * See: https://developers.google.com/identity/sign-in/android/backend-auth
 */
@RegisterRestClient(
        configKey = "google-tokeninfo")
@Path("/")
public interface GoogleTokenInfoRestClient {

    @GET
    @Path("/tokeninfo")
    @Produces(MediaType.APPLICATION_JSON)
    GoogleTokenInfoType tokenInfo(@QueryParam("id_token") String idToken);
}
