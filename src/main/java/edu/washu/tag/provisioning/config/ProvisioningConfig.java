package edu.washu.tag.provisioning.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import io.github.cdimascio.dotenv.Dotenv;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Connection and authentication settings for the remote content service.
 *
 * <p>The JSON is read from the {@value #CONFIG_ENV} environment variable. When that is
 * empty, it is read from the file named by {@value #CONFIG_FILE_ENV} (default
 * {@value #DEFAULT_CONFIG_FILE}), first in the working directory and then on the classpath.
 * Environment lookups go through dotenv-java, so a {@code .env} file works as well.
 */
public class ProvisioningConfig {

    private static final Logger logger = LoggerFactory.getLogger(ProvisioningConfig.class);
    private static final Gson GSON = new Gson();

    public static final String CONFIG_ENV = "INTEGRATION_TESTING_CONFIG";
    public static final String CONFIG_FILE_ENV = "INTEGRATION_TESTING_CONFIG_FILE";
    public static final String DEFAULT_CONFIG_FILE = "config.json";

    public static final String DEFAULT_API_URL = "https://api.box.com/2.0";
    public static final String DEFAULT_UPLOAD_URL = "https://upload.box.com/api/2.0";
    public static final String DEFAULT_TOKEN_URL = "https://api.box.com/oauth2/token";
    private static final int DEFAULT_REQUEST_TIMEOUT_SECONDS = 60;

    private AppSettings boxAppSettings;
    @SerializedName("enterpriseID")
    private String enterpriseId;
    @SerializedName("userID")
    private String userId;
    private String apiUrl;
    private String uploadUrl;
    private String tokenUrl;
    private Integer requestTimeoutSeconds;

    /**
     * Loads the configuration from the environment (or {@code .env}), falling back to a JSON file.
     */
    public static ProvisioningConfig load() {
        Dotenv dotenv = Dotenv.configure()
            .ignoreIfMissing()
            .load();

        String json = dotenv.get(CONFIG_ENV);
        if (json == null || json.isBlank()) {
            String fileName = dotenv.get(CONFIG_FILE_ENV, DEFAULT_CONFIG_FILE);
            logger.info("No JSON config found in {}, reading from {}", CONFIG_ENV, fileName);
            json = readConfigFile(fileName);
        }
        return fromJson(json);
    }

    /**
     * Parses and validates a JSON configuration document.
     *
     * @throws IllegalStateException if the document is malformed or a required setting is missing
     */
    public static ProvisioningConfig fromJson(String json) {
        ProvisioningConfig config;
        try {
            config = GSON.fromJson(json, ProvisioningConfig.class);
        } catch (JsonParseException e) {
            throw new IllegalStateException("Integration testing config is not valid JSON", e);
        }
        if (config == null) {
            throw new IllegalStateException("Integration testing config is empty");
        }
        config.validate();
        return config;
    }

    private static String readConfigFile(String fileName) {
        Path path = Path.of(fileName);
        try {
            if (Files.exists(path)) {
                return Files.readString(path);
            }
            try (InputStream resource = ProvisioningConfig.class.getClassLoader().getResourceAsStream(fileName)) {
                if (resource == null) {
                    throw new IllegalStateException(
                        "Neither " + CONFIG_ENV + " nor config file " + fileName + " is available");
                }
                return new String(resource.readAllBytes(), StandardCharsets.UTF_8);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read config file " + fileName, e);
        }
    }

    private void validate() {
        if (boxAppSettings == null) {
            throw new IllegalStateException("boxAppSettings is not set");
        }
        require("boxAppSettings.clientID", boxAppSettings.clientId);
        require("boxAppSettings.clientSecret", boxAppSettings.clientSecret);
        require("enterpriseID", enterpriseId);
        if (requestTimeoutSeconds != null && requestTimeoutSeconds <= 0) {
            throw new IllegalStateException("requestTimeoutSeconds must be positive");
        }
    }

    private static void require(String key, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalStateException(key + " is not set");
        }
    }

    public String getClientId() {
        return boxAppSettings.clientId;
    }

    public String getClientSecret() {
        return boxAppSettings.clientSecret;
    }

    public String getEnterpriseId() {
        return enterpriseId;
    }

    /**
     * @return the pre-existing user to run tests as, or {@code null} when one should be created
     */
    public String getUserId() {
        return hasUserId() ? userId : null;
    }

    public boolean hasUserId() {
        return userId != null && !userId.isBlank();
    }

    public String getApiUrl() {
        return withoutTrailingSlash(apiUrl, DEFAULT_API_URL);
    }

    public String getUploadUrl() {
        return withoutTrailingSlash(uploadUrl, DEFAULT_UPLOAD_URL);
    }

    public String getTokenUrl() {
        return tokenUrl != null && !tokenUrl.isBlank() ? tokenUrl : DEFAULT_TOKEN_URL;
    }

    public Duration getRequestTimeout() {
        return Duration.ofSeconds(requestTimeoutSeconds != null ? requestTimeoutSeconds : DEFAULT_REQUEST_TIMEOUT_SECONDS);
    }

    private static String withoutTrailingSlash(String value, String defaultValue) {
        String url = value != null && !value.isBlank() ? value : defaultValue;
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static class AppSettings {
        @SerializedName("clientID")
        private String clientId;
        private String clientSecret;
    }

}
