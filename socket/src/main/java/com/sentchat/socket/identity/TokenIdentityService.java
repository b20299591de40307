package com.sentchat.socket.identity;

import com.sentchat.core.auth.Identity;
import com.sentchat.core.auth.IdentityToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;

/**
 * Verifies HMAC-signed {@link IdentityToken}s against the node's shared secret.
 */
public class TokenIdentityService implements IIdentityService {
    private static final Logger log = LoggerFactory.getLogger(TokenIdentityService.class);

    private final String secret;
    private final Clock clock;

    public TokenIdentityService(String secret) {
        this(secret, Clock.systemUTC());
    }

    public TokenIdentityService(String secret, Clock clock) {
        this.secret = secret;
        this.clock = clock;
    }

    @Override
    public Mono<Identity> validate(String token) {
        return Mono.fromCallable(() -> {
            if (token == null || token.isBlank()) {
                return null;
            }
            Identity identity = IdentityToken.verify(token, secret, clock.instant());
            if (identity == null) {
                log.debug("Rejected identity token");
            }
            return identity;
        });
    }
}
