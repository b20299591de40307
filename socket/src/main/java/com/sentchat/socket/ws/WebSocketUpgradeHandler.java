package com.sentchat.socket.ws;

import com.sentchat.core.auth.Identity;
import com.sentchat.socket.config.SocketConfig;
import com.sentchat.socket.drain.DrainService;
import com.sentchat.socket.identity.IIdentityService;
import com.sentchat.socket.metrics.MetricsService;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;
import reactor.netty.http.server.WebsocketServerSpec;

import java.util.Collection;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Authenticates WebSocket upgrade requests.
 * <p>
 * The bearer token is read from the {@code token} query parameter, falling back to an
 * {@code Authorization: Bearer} header, and validated once before the upgrade. Requests
 * without a valid token get 401; a draining node answers 503.
 * </p>
 */
public class WebSocketUpgradeHandler {
    private static final Logger log = LoggerFactory.getLogger(WebSocketUpgradeHandler.class);

    private static final String BEARER_PREFIX = "Bearer ";

    private final WebSocketHandler wsHandler;
    private final IIdentityService identityService;
    private final MetricsService metricsService;
    private final DrainService drainService;
    private final WebsocketServerSpec websocketSpec;

    public WebSocketUpgradeHandler(
            SocketConfig config,
            WebSocketHandler wsHandler,
            IIdentityService identityService,
            MetricsService metricsService,
            DrainService drainService
    ) {
        this.wsHandler = wsHandler;
        this.identityService = identityService;
        this.metricsService = metricsService;
        this.drainService = drainService;
        this.websocketSpec = WebsocketServerSpec.builder()
            .maxFramePayloadLength(config.getMaxFrameBytes())
            .build();
    }

    /**
     * Handles WebSocket upgrade request.
     *
     * @param req HTTP request
     * @param res HTTP response
     * @return Mono for upgrade
     */
    public Mono<Void> handle(HttpServerRequest req, HttpServerResponse res) {
        // Reject new connections if node is draining
        if (drainService.isDraining()) {
            return reject(res, 503, "draining", "Service unavailable - node is draining");
        }

        String token = extractToken(req);
        if (token == null) {
            return reject(res, 401, "missing_token", "Missing token");
        }

        return identityService.validate(token)
            .map(Optional::of)
            .onErrorResume(err -> {
                log.error("Identity validation failed", err);
                return Mono.just(Optional.empty());
            })
            .defaultIfEmpty(Optional.empty())
            .flatMap(identity -> identity
                .map(id -> upgrade(res, id))
                .orElseGet(() -> reject(res, 401, "invalid_token", "Invalid or expired token")));
    }

    private Mono<Void> upgrade(HttpServerResponse res, Identity identity) {
        return res.sendWebsocket(
            (inbound, outbound) -> wsHandler.handle(inbound, outbound, identity),
            websocketSpec
        );
    }

    private Mono<Void> reject(HttpServerResponse res, int status, String reason, String body) {
        log.debug("Rejecting WebSocket upgrade: {}", reason);
        metricsService.recordConnectionRejected(reason);
        return res.status(status)
            .sendString(Mono.just(body))
            .then();
    }

    private static String extractToken(HttpServerRequest req) {
        QueryStringDecoder decoder = new QueryStringDecoder(req.uri());
        String token = Stream.ofNullable(decoder.parameters().get("token"))
            .flatMap(Collection::stream)
            .filter(value -> !value.isBlank())
            .findFirst()
            .orElse(null);
        if (token != null) {
            return token;
        }

        String header = req.requestHeaders().get(HttpHeaderNames.AUTHORIZATION);
        if (header != null && header.startsWith(BEARER_PREFIX) && !header.substring(BEARER_PREFIX.length()).isBlank()) {
            return header.substring(BEARER_PREFIX.length()).trim();
        }
        return null;
    }
}
