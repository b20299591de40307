package com.sentchat.socket.identity;

import com.sentchat.core.auth.Identity;
import reactor.core.publisher.Mono;

/**
 * Resolves the bearer token presented at WebSocket upgrade into a user identity.
 */
public interface IIdentityService {
    /**
     * @param token Raw token from the upgrade request
     * @return Identity, or empty if the token is missing, forged or expired
     */
    Mono<Identity> validate(String token);
}
