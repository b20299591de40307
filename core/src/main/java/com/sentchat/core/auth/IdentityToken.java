package com.sentchat.core.auth;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.sentchat.core.hash.Hashers;
import com.sentchat.core.util.JsonUtils;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;

/**
 * Bearer identity token generation and verification.
 * <p>
 * <b>Token format:</b> {@code base64url(claims).hmac}
 * <ul>
 *   <li>{@code claims}: JSON object {@code {user_id, name, avatar, exp}}</li>
 *   <li>{@code exp}: expiry (epoch seconds)</li>
 *   <li>{@code hmac}: hex HMAC-SHA256 over the encoded claims</li>
 * </ul>
 * </p>
 * <p>
 * Tokens are issued by the login flow; socket nodes only verify them, once per
 * WebSocket upgrade.
 * </p>
 */
public final class IdentityToken {
    private static final String DELIMITER = ".";

    private IdentityToken() {
    }

    /**
     * Generates a signed token.
     *
     * @param identity  Identity to embed
     * @param expiresAt Expiry instant
     * @param secret    HMAC secret key
     * @return Token string
     */
    public static String generate(Identity identity, Instant expiresAt, String secret) {
        Claims claims = new Claims(
            identity.getUserId(), identity.getDisplayName(), identity.getAvatar(), expiresAt.getEpochSecond()
        );
        String encoded = Base64.getUrlEncoder().withoutPadding()
            .encodeToString(JsonUtils.writeValueAsString(claims).getBytes(StandardCharsets.UTF_8));
        return encoded + DELIMITER + Hashers.hmacSha256Hex(encoded, secret);
    }

    /**
     * Verifies a token and extracts the identity.
     *
     * @param token  Token string
     * @param secret HMAC secret key
     * @param now    Current instant, compared against the expiry
     * @return Identity, or null if the token is malformed, forged or expired
     */
    public static Identity verify(String token, String secret, Instant now) {
        if (token == null) {
            return null;
        }
        int split = token.lastIndexOf(DELIMITER);
        if (split <= 0 || split == token.length() - 1) {
            return null;
        }

        String encoded = token.substring(0, split);
        String providedHmac = token.substring(split + 1);
        if (!Hashers.constantTimeEquals(Hashers.hmacSha256Hex(encoded, secret), providedHmac)) {
            return null;
        }

        try {
            String json = new String(Base64.getUrlDecoder().decode(encoded), StandardCharsets.UTF_8);
            Claims claims = JsonUtils.readValue(json, Claims.class);
            if (claims.getUserId() == null || claims.getUserId().isBlank()) {
                return null;
            }
            if (now.getEpochSecond() >= claims.getExp()) {
                return null; // expired
            }
            return Identity.builder()
                .userId(claims.getUserId())
                .displayName(claims.getName())
                .avatar(claims.getAvatar())
                .build();
        } catch (RuntimeException e) {
            return null;
        }
    }

    @Getter
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    static class Claims {
        @JsonProperty("user_id")
        String userId;
        @JsonProperty("name")
        String name;
        @JsonProperty("avatar")
        String avatar;
        @JsonProperty("exp")
        long exp;
    }
}
