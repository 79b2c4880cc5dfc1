package io.fleethive.controlplane.pagination;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fleethive.fleet.error.InvalidCursorException;
import java.io.IOException;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Objects;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/**
 * Encodes and decodes the opaque continue tokens handed out by list operations.
 * <p>
 * A token is {@code base64url(json) + "." + base64url(hmac)}. The HMAC-SHA256 signature makes tokens
 * tamper-evident: anything not produced with this codec's key decodes to
 * {@link InvalidCursorException}, whatever the caller sent.
 */
public final class ContinueTokenCodec {

    private static final String ALGORITHM = "HmacSHA256";
    private static final int MIN_SECRET_BYTES = 16;
    private static final int MAX_TOKEN_LENGTH = 4096;
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private final ObjectMapper json;
    private final SecretKeySpec key;

    public ContinueTokenCodec(byte[] secret) {
        this(secret, new ObjectMapper());
    }

    public ContinueTokenCodec(byte[] secret, ObjectMapper json) {
        Objects.requireNonNull(secret, "secret");
        if (secret.length < MIN_SECRET_BYTES) {
            throw new IllegalArgumentException("secret must be at least " + MIN_SECRET_BYTES + " bytes");
        }
        this.key = new SecretKeySpec(secret.clone(), ALGORITHM);
        this.json = Objects.requireNonNull(json, "json");
    }

    /**
     * Codec keyed with a fresh random secret. Tokens do not survive a restart.
     */
    public static ContinueTokenCodec withRandomKey() {
        byte[] secret = new byte[32];
        new SecureRandom().nextBytes(secret);
        return new ContinueTokenCodec(secret);
    }

    public String encode(String lastKey, int limit) {
        Objects.requireNonNull(lastKey, "lastKey");
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0");
        }
        byte[] payload;
        try {
            payload = json.writeValueAsBytes(new Payload(lastKey, limit));
        } catch (IOException e) {
            throw new IllegalStateException("Unable to encode continue token", e);
        }
        return ENCODER.encodeToString(payload) + "." + ENCODER.encodeToString(sign(payload));
    }

    public Cursor decode(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidCursorException("continue token is empty");
        }
        if (token.length() > MAX_TOKEN_LENGTH) {
            throw new InvalidCursorException("continue token is too long");
        }
        int dot = token.indexOf('.');
        if (dot <= 0 || dot != token.lastIndexOf('.') || dot == token.length() - 1) {
            throw new InvalidCursorException("continue token is malformed");
        }
        byte[] payload;
        byte[] signature;
        try {
            payload = DECODER.decode(token.substring(0, dot));
            signature = DECODER.decode(token.substring(dot + 1));
        } catch (IllegalArgumentException e) {
            throw new InvalidCursorException("continue token is not valid base64", e);
        }
        if (!MessageDigest.isEqual(sign(payload), signature)) {
            throw new InvalidCursorException("continue token signature mismatch");
        }
        Payload decoded;
        try {
            decoded = json.readValue(payload, Payload.class);
        } catch (IOException e) {
            throw new InvalidCursorException("continue token payload is unreadable", e);
        }
        if (decoded == null || decoded.lastKey() == null || decoded.limit() < 0) {
            throw new InvalidCursorException("continue token payload is incomplete");
        }
        return new Cursor(decoded.lastKey(), decoded.limit());
    }

    private byte[] sign(byte[] payload) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(key);
            return mac.doFinal(payload);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(ALGORITHM + " not available", e);
        }
    }

    record Payload(@JsonProperty("k") String lastKey, @JsonProperty("l") int limit) {
    }
}
