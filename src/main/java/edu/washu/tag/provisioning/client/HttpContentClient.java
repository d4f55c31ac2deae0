package edu.washu.tag.provisioning.client;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import edu.washu.tag.provisioning.client.model.FileItem;
import edu.washu.tag.provisioning.client.model.Folder;
import edu.washu.tag.provisioning.client.model.RetentionPolicy;
import edu.washu.tag.provisioning.client.model.RetentionPolicyAssignment;
import edu.washu.tag.provisioning.client.model.RetentionPolicyRequest;
import edu.washu.tag.provisioning.client.model.User;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Content service REST client.
 *
 * <p>Uses java.net.http.HttpClient with a bearer token obtained by {@link ClientCredentialsSession}.
 */
public class HttpContentClient implements ContentClient {

    private static final Logger logger = LoggerFactory.getLogger(HttpContentClient.class);
    static final Gson GSON = new GsonBuilder()
        .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
        .create();
    public static final String ROOT_FOLDER_ID = "0";

    private final String apiUrl;
    private final String uploadUrl;
    private final String accessToken;
    private final Duration requestTimeout;
    private final HttpClient httpClient;

    public HttpContentClient(String apiUrl, String uploadUrl, String accessToken, Duration requestTimeout,
        HttpClient httpClient) {
        this.apiUrl = apiUrl;
        this.uploadUrl = uploadUrl;
        this.accessToken = accessToken;
        this.requestTimeout = requestTimeout;
        this.httpClient = httpClient;
    }

    @Override
    public Folder createFolder(String name, String parentId) throws IOException, InterruptedException {
        JsonObject body = new JsonObject();
        body.addProperty("name", name);
        body.add("parent", reference(null, parentId));

        HttpResponse<String> response = send(jsonRequest("/folders").POST(jsonBody(body)));
        requireSuccess("create folder", response);
        Folder folder = GSON.fromJson(response.body(), Folder.class);
        logger.info("Created folder \"{}\" ({})", folder.name(), folder.id());
        return folder;
    }

    @Override
    public void deleteFolder(String folderId, boolean recursive) throws IOException, InterruptedException {
        delete("folder", "/folders/" + folderId + "?recursive=" + recursive, folderId);
    }

    @Override
    public FileItem uploadFile(String name, String parentId, byte[] content) throws IOException, InterruptedException {
        JsonObject attributes = new JsonObject();
        attributes.addProperty("name", name);
        attributes.add("parent", reference(null, parentId));

        String boundary = "----provisioning-" + UUID.randomUUID();
        byte[] body = multipartBody(boundary, GSON.toJson(attributes), name, content);

        HttpRequest.Builder request = HttpRequest.newBuilder()
            .uri(URI.create(uploadUrl + "/files/content"))
            .header("Content-Type", "multipart/form-data; boundary=" + boundary)
            .POST(HttpRequest.BodyPublishers.ofByteArray(body));

        HttpResponse<String> response = send(request);
        requireSuccess("upload file", response);

        JsonArray entries = GSON.fromJson(response.body(), JsonObject.class).getAsJsonArray("entries");
        if (entries == null || entries.isEmpty()) {
            throw new ApiException("upload file", response.statusCode(), "no file entry in response");
        }
        FileItem file = GSON.fromJson(entries.get(0), FileItem.class);
        logger.info("Uploaded file \"{}\" ({})", file.name(), file.id());
        return file;
    }

    @Override
    public void deleteFile(String fileId) throws IOException, InterruptedException {
        delete("file", "/files/" + fileId, fileId);
    }

    @Override
    public RetentionPolicy createRetentionPolicy(RetentionPolicyRequest request)
        throws IOException, InterruptedException {
        HttpResponse<String> response = send(jsonRequest("/retention_policies")
            .POST(HttpRequest.BodyPublishers.ofString(GSON.toJson(request))));
        requireSuccess("create retention policy", response);
        RetentionPolicy policy = GSON.fromJson(response.body(), RetentionPolicy.class);
        logger.info("Created retention policy \"{}\" ({})", policy.policyName(), policy.id());
        return policy;
    }

    @Override
    public RetentionPolicyAssignment assignRetentionPolicy(String policyId, String folderId)
        throws IOException, InterruptedException {
        JsonObject body = new JsonObject();
        body.addProperty("policy_id", policyId);
        body.add("assign_to", ROOT_FOLDER_ID.equals(folderId)
            ? reference("enterprise", null)
            : reference("folder", folderId));

        HttpResponse<String> response = send(jsonRequest("/retention_policy_assignments").POST(jsonBody(body)));
        requireSuccess("assign retention policy", response);
        return GSON.fromJson(response.body(), RetentionPolicyAssignment.class);
    }

    @Override
    public void retireRetentionPolicy(String policyId) throws IOException, InterruptedException {
        JsonObject body = new JsonObject();
        body.addProperty("status", "retired");

        HttpResponse<String> response = send(jsonRequest("/retention_policies/" + policyId).PUT(jsonBody(body)));
        if (response.statusCode() == 404) {
            logger.info("Retention policy {} already gone.", policyId);
            return;
        }
        requireSuccess("retire retention policy", response);
        logger.info("Retired retention policy {}", policyId);
    }

    @Override
    public User createEnterpriseUser(String name, boolean platformAccessOnly) throws IOException, InterruptedException {
        JsonObject body = new JsonObject();
        body.addProperty("name", name);
        body.addProperty("is_platform_access_only", platformAccessOnly);

        HttpResponse<String> response = send(jsonRequest("/users").POST(jsonBody(body)));
        requireSuccess("create user", response);
        User user = GSON.fromJson(response.body(), User.class);
        logger.info("Created user \"{}\" ({})", user.name(), user.id());
        return user;
    }

    @Override
    public void deleteEnterpriseUser(String userId, boolean notify, boolean force)
        throws IOException, InterruptedException {
        delete("user", "/users/" + userId + "?notify=" + notify + "&force=" + force, userId);
    }

    private void delete(String resourceType, String path, String id) throws IOException, InterruptedException {
        HttpResponse<String> response = send(HttpRequest.newBuilder()
            .uri(URI.create(apiUrl + path))
            .DELETE());

        if (response.statusCode() == 404) {
            logger.info("{} {} already deleted.", resourceType, id);
            return;
        }
        requireSuccess("delete " + resourceType, response);
        logger.info("Deleted {} {}", resourceType, id);
    }

    private HttpResponse<String> send(HttpRequest.Builder request) throws IOException, InterruptedException {
        return httpClient.send(request
                .header("Authorization", "Bearer " + accessToken)
                .timeout(requestTimeout)
                .build(),
            HttpResponse.BodyHandlers.ofString());
    }

    private HttpRequest.Builder jsonRequest(String path) {
        return HttpRequest.newBuilder()
            .uri(URI.create(apiUrl + path))
            .header("Content-Type", "application/json");
    }

    private static HttpRequest.BodyPublisher jsonBody(JsonObject body) {
        return HttpRequest.BodyPublishers.ofString(GSON.toJson(body));
    }

    private static JsonObject reference(String type, String id) {
        JsonObject ref = new JsonObject();
        if (type != null) {
            ref.addProperty("type", type);
        }
        if (id != null) {
            ref.addProperty("id", id);
        }
        return ref;
    }

    static void requireSuccess(String operation, HttpResponse<String> response) {
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new ApiException(operation, response.statusCode(), response.body());
        }
    }

    private static byte[] multipartBody(String boundary, String attributes, String fileName, byte[] content)
        throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        String attributesPart = "--" + boundary + "\r\n"
            + "Content-Disposition: form-data; name=\"attributes\"\r\n\r\n"
            + attributes + "\r\n";
        String filePartHeader = "--" + boundary + "\r\n"
            + "Content-Disposition: form-data; name=\"file\"; filename=\"" + fileName.replace("\"", "") + "\"\r\n"
            + "Content-Type: application/octet-stream\r\n\r\n";
        out.write(attributesPart.getBytes(StandardCharsets.UTF_8));
        out.write(filePartHeader.getBytes(StandardCharsets.UTF_8));
        out.write(content);
        out.write(("\r\n--" + boundary + "--\r\n").getBytes(StandardCharsets.UTF_8));
        return out.toByteArray();
    }

}
