package edu.washu.tag.provisioning.client;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import edu.washu.tag.provisioning.config.ProvisioningConfig;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Authenticates with the client-credentials grant. The admin handle acts as the enterprise
 * service account, the user handle as a specific enterprise user.
 */
public class ClientCredentialsSession implements Session {

    private static final Logger logger = LoggerFactory.getLogger(ClientCredentialsSession.class);

    private final ProvisioningConfig config;
    private final HttpClient httpClient;

    public ClientCredentialsSession(ProvisioningConfig config) {
        this(config, HttpClient.newBuilder()
            .connectTimeout(config.getRequestTimeout())
            .build());
    }

    public ClientCredentialsSession(ProvisioningConfig config, HttpClient httpClient) {
        this.config = config;
        this.httpClient = httpClient;
    }

    @Override
    public ContentClient adminClient() throws IOException, InterruptedException {
        logger.info("Authenticating as enterprise {}", config.getEnterpriseId());
        return clientWithToken(requestToken("enterprise", config.getEnterpriseId()));
    }

    @Override
    public ContentClient userClient(String userId) throws IOException, InterruptedException {
        logger.info("Authenticating as user {}", userId);
        return clientWithToken(requestToken("user", userId));
    }

    private ContentClient clientWithToken(String accessToken) {
        return new HttpContentClient(config.getApiUrl(), config.getUploadUrl(), accessToken,
            config.getRequestTimeout(), httpClient);
    }

    private String requestToken(String subjectType, String subjectId) throws IOException, InterruptedException {
        String body = "grant_type=client_credentials"
            + "&client_id=" + encode(config.getClientId())
            + "&client_secret=" + encode(config.getClientSecret())
            + "&box_subject_type=" + subjectType
            + "&box_subject_id=" + encode(subjectId);

        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(config.getTokenUrl()))
            .header("Content-Type", "application/x-www-form-urlencoded")
            .timeout(config.getRequestTimeout())
            .POST(HttpRequest.BodyPublishers.ofString(body))
            .build();

        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() != 200) {
            throw new ApiException("authenticate as " + subjectType + " " + subjectId,
                response.statusCode(), response.body());
        }

        JsonElement token = HttpContentClient.GSON.fromJson(response.body(), JsonObject.class).get("access_token");
        if (token == null || token.isJsonNull()) {
            throw new ApiException("authenticate as " + subjectType + " " + subjectId,
                response.statusCode(), "no access_token in response");
        }
        return token.getAsString();
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

}
