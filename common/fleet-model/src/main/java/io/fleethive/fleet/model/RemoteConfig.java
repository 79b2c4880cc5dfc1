package io.fleethive.fleet.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Configuration payload attached to an agent group.
 * <p>
 * The hash is the hex SHA-256 of the body and is what agents echo back once they applied it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RemoteConfig(String contentType, String body, String hash) {

    public static final String DEFAULT_CONTENT_TYPE = "application/yaml";

    public RemoteConfig {
        contentType = contentType == null || contentType.isBlank() ? DEFAULT_CONTENT_TYPE : contentType.trim();
        if (body == null) {
            throw new IllegalArgumentException("body must not be null");
        }
        hash = hashOf(body);
    }

    @JsonCreator
    public static RemoteConfig of(@JsonProperty("contentType") String contentType,
                                  @JsonProperty("body") String body) {
        return new RemoteConfig(contentType, body, null);
    }

    public static String hashOf(String body) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(body.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
