package com.moldstudio.reservation.auth;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Issues and verifies access tokens of the form
 * {@code base64url(header).base64url(payload).base64url(sha256(header + "." + payload + secret))}.
 * The payload carries {@code userId, username, role} and {@code exp} in Unix seconds.
 */
@Slf4j
@Component
public class AccessTokenCodec {

    private static final String HEADER_JSON = "{\"alg\":\"HS256\",\"typ\":\"JWT\"}";
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String secret;
    private final Duration ttl;

    public AccessTokenCodec(ObjectMapper objectMapper,
                            Clock clock,
                            @Value("${studio.auth.token-secret}") String secret,
                            @Value("${studio.auth.token-ttl-hours:24}") long ttlHours) {
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.secret = secret;
        this.ttl = Duration.ofHours(ttlHours);
    }

    public String issue(AuthenticatedStaff staff) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("userId", staff.userId());
        payload.put("username", staff.username());
        payload.put("role", staff.role());
        payload.put("exp", clock.instant().plus(ttl).getEpochSecond());

        try {
            String header = encode(HEADER_JSON.getBytes(StandardCharsets.UTF_8));
            String body = encode(objectMapper.writeValueAsBytes(payload));
            return header + "." + body + "." + sign(header, body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialise token payload", e);
        }
    }

    /**
     * @return the principal, or empty if the token is malformed, tampered with or expired
     */
    public Optional<AuthenticatedStaff> verify(String token) {
        if (token == null) {
            return Optional.empty();
        }
        String[] parts = token.split("\\.", -1);
        if (parts.length != 3) {
            return Optional.empty();
        }

        byte[] expected = sign(parts[0], parts[1]).getBytes(StandardCharsets.US_ASCII);
        if (!MessageDigest.isEqual(expected, parts[2].getBytes(StandardCharsets.US_ASCII))) {
            log.debug("Rejected token with invalid signature");
            return Optional.empty();
        }

        try {
            JsonNode payload = objectMapper.readTree(DECODER.decode(parts[1]));
            JsonNode exp = payload.path("exp");
            if (!exp.canConvertToLong() || exp.asLong() < clock.instant().getEpochSecond()) {
                log.debug("Rejected expired token");
                return Optional.empty();
            }
            String userId = payload.path("userId").asText(null);
            String username = payload.path("username").asText(null);
            String role = payload.path("role").asText(null);
            if (userId == null || username == null || role == null) {
                return Optional.empty();
            }
            return Optional.of(new AuthenticatedStaff(userId, username, role));
        } catch (IllegalArgumentException | IOException e) {
            log.debug("Rejected unparsable token: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private String sign(String header, String payload) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest((header + "." + payload + secret).getBytes(StandardCharsets.UTF_8));
            return encode(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String encode(byte[] bytes) {
        return ENCODER.encodeToString(bytes);
    }
}
