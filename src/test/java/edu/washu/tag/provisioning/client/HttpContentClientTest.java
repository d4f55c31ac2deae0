package edu.washu.tag.provisioning.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.google.gson.JsonObject;
import edu.washu.tag.provisioning.client.model.FileItem;
import edu.washu.tag.provisioning.client.model.Folder;
import edu.washu.tag.provisioning.client.model.RetentionPolicy;
import edu.washu.tag.provisioning.client.model.RetentionPolicyRequest;
import edu.washu.tag.provisioning.client.model.User;
import java.io.IOException;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HttpContentClientTest {

    private MockWebServer server;
    private HttpContentClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        String baseUrl = server.url("").toString().replaceAll("/$", "");
        client = new HttpContentClient(baseUrl + "/2.0", baseUrl + "/upload", "token", Duration.ofSeconds(5),
            HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build());
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void testCreateFolder() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(201)
            .setBody("{\"type\": \"folder\", \"id\": \"11446498\", \"name\": \"Pictures\"}"));

        Folder folder = client.createFolder("Pictures", "0");

        assertThat(folder).isEqualTo(new Folder("11446498", "Pictures"));
        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath()).isEqualTo("/2.0/folders");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer token");
        JsonObject body = HttpContentClient.GSON.fromJson(request.getBody().readUtf8(), JsonObject.class);
        assertThat(body.get("name").getAsString()).isEqualTo("Pictures");
        assertThat(body.getAsJsonObject("parent").get("id").getAsString()).isEqualTo("0");
    }

    @Test
    void testDeleteFolderIsRecursive() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(204));

        client.deleteFolder("11446498", true);

        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("DELETE");
        assertThat(request.getPath()).isEqualTo("/2.0/folders/11446498?recursive=true");
    }

    @Test
    void testUploadFileSendsMultipart() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(201).setBody(
            "{\"total_count\": 1, \"entries\": [{\"type\": \"file\", \"id\": \"12345\", \"name\": \"a.pdf\", \"size\": 3}]}"));

        FileItem file = client.uploadFile("a.pdf", "77", "abc".getBytes(StandardCharsets.UTF_8));

        assertThat(file).isEqualTo(new FileItem("12345", "a.pdf", 3L));
        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/upload/files/content");
        assertThat(request.getHeader("Content-Type")).startsWith("multipart/form-data; boundary=");
        String body = request.getBody().readUtf8();
        assertThat(body)
            .contains("name=\"attributes\"")
            .contains("{\"name\":\"a.pdf\",\"parent\":{\"id\":\"77\"}}")
            .contains("name=\"file\"; filename=\"a.pdf\"")
            .contains("\r\n\r\nabc\r\n");
    }

    @Test
    void testCreateRetentionPolicyUsesSnakeCase() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(201).setBody(
            "{\"id\": \"982312\", \"policy_name\": \"Some Policy\", \"status\": \"active\"}"));

        RetentionPolicy policy = client.createRetentionPolicy(RetentionPolicyRequest.shortLived("Some Policy"));

        assertThat(policy).isEqualTo(new RetentionPolicy("982312", "Some Policy", "active"));
        JsonObject body = HttpContentClient.GSON.fromJson(server.takeRequest().getBody().readUtf8(), JsonObject.class);
        assertThat(body.get("policy_name").getAsString()).isEqualTo("Some Policy");
        assertThat(body.get("policy_type").getAsString()).isEqualTo("finite");
        assertThat(body.get("retention_length").getAsInt()).isEqualTo(1);
        assertThat(body.get("disposition_action").getAsString()).isEqualTo("remove_retention");
    }

    @Test
    void testAssignRetentionPolicyToRootTargetsEnterprise() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(201).setBody("{\"id\": \"1\"}"));
        server.enqueue(new MockResponse().setResponseCode(201).setBody("{\"id\": \"2\"}"));

        client.assignRetentionPolicy("982312", "0");
        client.assignRetentionPolicy("982312", "55");

        JsonObject enterprise = HttpContentClient.GSON.fromJson(server.takeRequest().getBody().readUtf8(), JsonObject.class);
        assertThat(enterprise.getAsJsonObject("assign_to").get("type").getAsString()).isEqualTo("enterprise");
        assertThat(enterprise.getAsJsonObject("assign_to").has("id")).isFalse();
        JsonObject folder = HttpContentClient.GSON.fromJson(server.takeRequest().getBody().readUtf8(), JsonObject.class);
        assertThat(folder.getAsJsonObject("assign_to").get("type").getAsString()).isEqualTo("folder");
        assertThat(folder.getAsJsonObject("assign_to").get("id").getAsString()).isEqualTo("55");
        assertThat(folder.get("policy_id").getAsString()).isEqualTo("982312");
    }

    @Test
    void testRetireRetentionPolicy() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"id\": \"982312\", \"status\": \"retired\"}"));

        client.retireRetentionPolicy("982312");

        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("PUT");
        assertThat(request.getPath()).isEqualTo("/2.0/retention_policies/982312");
        assertThat(request.getBody().readUtf8()).isEqualTo("{\"status\":\"retired\"}");
    }

    @Test
    void testCreateAndDeleteEnterpriseUser() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(201).setBody(
            "{\"id\": \"181216415\", \"name\": \"IT App User - x\", \"login\": \"AppUser_1@boxdevedition.com\"}"));
        server.enqueue(new MockResponse().setResponseCode(204));

        User user = client.createEnterpriseUser("IT App User - x", true);
        client.deleteEnterpriseUser(user.id(), false, true);

        JsonObject body = HttpContentClient.GSON.fromJson(server.takeRequest().getBody().readUtf8(), JsonObject.class);
        assertThat(body.get("is_platform_access_only").getAsBoolean()).isTrue();
        assertThat(server.takeRequest().getPath()).isEqualTo("/2.0/users/181216415?notify=false&force=true");
    }

    @Test
    void testDeletingMissingResourceIsNotAnError() {
        server.enqueue(new MockResponse().setResponseCode(404));

        assertThatCode(() -> client.deleteFile("404")).doesNotThrowAnyException();
    }

    @Test
    void testErrorStatusRaisesApiException() {
        server.enqueue(new MockResponse().setResponseCode(409).setBody("{\"code\": \"item_name_in_use\"}"));

        assertThatThrownBy(() -> client.createFolder("Pictures", "0"))
            .isInstanceOfSatisfying(ApiException.class, e -> {
                assertThat(e.getStatusCode()).isEqualTo(409);
                assertThat(e.getResponseBody()).contains("item_name_in_use");
                assertThat(e).hasMessageStartingWith("Failed to create folder (409)");
            });
    }

    @Test
    void testDeleteFailureRaisesApiException() {
        server.enqueue(new MockResponse().setResponseCode(403).setBody("{\"code\": \"access_denied\"}"));

        assertThatThrownBy(() -> client.deleteEnterpriseUser("1", false, true))
            .isInstanceOf(ApiException.class)
            .hasMessageContaining("delete user");
    }

}
