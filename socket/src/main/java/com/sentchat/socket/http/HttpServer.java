package com.sentchat.socket.http;

import com.sentchat.core.util.JsonUtils;
import com.sentchat.socket.drain.DrainService;
import com.sentchat.socket.metrics.PrometheusMetricsExporter;
import com.sentchat.socket.ws.WebSocketUpgradeHandler;
import io.netty.channel.ChannelOption;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServerResponse;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * HTTP front of a chat node: the {@code /ws} upgrade plus health, drain and scrape endpoints.
 * <p>
 * A draining node stays live but stops being ready, so the orchestrator stops routing new
 * clients to it while the connections it still holds are closed in batches.
 * </p>
 */
@RequiredArgsConstructor
public class HttpServer {
    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private static final String APPLICATION_JSON = "application/json";

    private final int port;
    private final WebSocketUpgradeHandler upgradeHandler;
    private final PrometheusMetricsExporter metricsExporter;
    private final DrainService drainService;
    private DisposableServer server;

    /**
     * Binds the server and blocks until it is listening.
     *
     * @return Bound server; its port is the actual one when {@code port} is 0
     */
    public DisposableServer start() {
        server = reactor.netty.http.server.HttpServer.create()
            .port(port)
            .option(ChannelOption.SO_REUSEADDR, true)
            .metrics(true, Function.identity())
            .route(routes -> routes
                .get("/healthz", (req, res) -> res.status(200).sendString(Mono.just("OK")))
                .get("/readyz", (req, res) -> drainService.isDraining()
                    ? res.status(503).sendString(Mono.just("Draining"))
                    : res.status(200).sendString(Mono.just("Ready")))
                // preStop hook: refuse new chat connections, hand live ones back gradually
                .post("/drain", (req, res) -> {
                    log.warn("Drain requested with {} open chat connections", drainService.getRemainingConnections());
                    return drainService.startDrain()
                        .then(sendJson(res.status(202), drainStatus()));
                })
                .get("/drain/status", (req, res) -> sendJson(res.status(200), drainStatus()))
                .get("/metrics", (req, res) ->
                    res.header("Content-Type", "text/plain; version=0.0.4; charset=utf-8")
                        .sendString(Mono.just(metricsExporter.scrape()))
                )
                .get("/ws", upgradeHandler::handle)
            )
            .bindNow(Duration.ofSeconds(45));

        log.info("Chat node listening on port {}", server.port());
        return server;
    }

    public void stop() {
        if (server != null) {
            server.disposeNow(Duration.ofSeconds(30));
        }
    }

    private Map<String, Object> drainStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("draining", drainService.isDraining());
        status.put("complete", drainService.isDrainComplete());
        status.put("remaining", drainService.getRemainingConnections());
        return status;
    }

    private static Mono<Void> sendJson(HttpServerResponse res, Object body) {
        return res.header("Content-Type", APPLICATION_JSON)
            .sendString(Mono.fromCallable(() -> JsonUtils.writeValueAsString(body)))
            .then();
    }
}
