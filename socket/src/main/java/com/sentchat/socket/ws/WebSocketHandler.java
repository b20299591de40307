package com.sentchat.socket.ws;

import com.sentchat.core.auth.Identity;
import com.sentchat.core.util.BytesUtils;
import com.sentchat.socket.config.SocketConfig;
import com.sentchat.socket.metrics.MetricsService;
import com.sentchat.socket.protocol.ProtocolHandler;
import com.sentchat.socket.session.ClientConnection;
import com.sentchat.socket.session.ConnectionLifecycle;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.netty.channel.AbortedException;
import reactor.netty.http.websocket.WebsocketInbound;
import reactor.netty.http.websocket.WebsocketOutbound;

/**
 * WebSocket handler for authenticated chat connections.
 * <p>
 * Protocol (client → server): {@code subscribe}, {@code unsubscribe}, {@code message},
 * {@code typing}, {@code read}, {@code create_thread}, each a JSON text frame.
 * </p>
 * <p>
 * Protocol (server → client): {@code message}, {@code system}, {@code typing},
 * {@code read}, {@code message_sent}, {@code thread_created}, {@code error} envelopes and
 * user notifications, all drained from the connection's delivery queue.
 * </p>
 */
public class WebSocketHandler {
	private static final Logger log = LoggerFactory.getLogger(WebSocketHandler.class);

	private final SocketConfig config;
	private final ConnectionLifecycle lifecycle;
	private final ProtocolHandler protocolHandler;
	private final MetricsService metricsService;

	public WebSocketHandler(
			SocketConfig config,
			ConnectionLifecycle lifecycle,
			ProtocolHandler protocolHandler,
			MetricsService metricsService
	) {
		this.config = config;
		this.lifecycle = lifecycle;
		this.protocolHandler = protocolHandler;
		this.metricsService = metricsService;
	}

	/**
	 * Handles one WebSocket connection from open to teardown.
	 *
	 * @param inbound  WebSocket inbound
	 * @param outbound WebSocket outbound
	 * @param identity Identity verified at upgrade
	 * @return Publisher completing when the connection is finished
	 */
	public Publisher<Void> handle(WebsocketInbound inbound, WebsocketOutbound outbound, Identity identity) {
		try (MDC.MDCCloseable ignored = MDC.putCloseable("userId", identity.getUserId())) {
			log.debug("WebSocket established for user {}", identity.getUserId());

			return lifecycle.open(identity)
					.flatMap(connection -> {
						handleConnectionStateUpdates(inbound, connection);

						// Writes end when the delivery queue completes, i.e. when the connection is closed
						return Mono.when(
								outbound.sendString(outboundFrames(connection)).then(),
								handleInboundMessages(inbound, connection)
										.then(Mono.defer(() -> lifecycle.teardown(connection)))
						).doFinally(signal -> lifecycle.teardown(connection).subscribe());
					})
					.onErrorResume(err -> {
						if (!(err instanceof AbortedException)) {
							log.error("WebSocket error for user {}", identity.getUserId(), err);
						}
						return outbound.sendClose();
					});
		}
	}

	private void handleConnectionStateUpdates(WebsocketInbound inbound, ClientConnection connection) {
		inbound.withConnection(conn -> {
			long idleTimeoutInMillis = config.getIdleTimeout() * 1000L;
			long pingIntervalInMillis = config.getPingInterval() * 1000L;

			conn.onWriteIdle(pingIntervalInMillis, () -> conn.outbound()
							.sendObject(Mono.just(new PingWebSocketFrame()))
							.then()
							.subscribe(null, err -> {
								log.debug("Ping to {} failed: {}", connection, err.getMessage());
								lifecycle.teardown(connection).subscribe();
							}))
					.onReadIdle(idleTimeoutInMillis, () -> {
						log.info("Closing idle connection {}", connection);
						lifecycle.teardown(connection).subscribe();
					});
		});
	}

	private Flux<String> outboundFrames(ClientConnection connection) {
		return connection.outboundFrames()
				.doOnNext(frame -> metricsService.recordNetworkOutboundWs(BytesUtils.getBytesLength(frame)));
	}

	private Mono<Void> handleInboundMessages(WebsocketInbound inbound, ClientConnection connection) {
		return inbound.aggregateFrames(config.getMaxFrameBytes())
				.receiveFrames()
				.ofType(TextWebSocketFrame.class)
				.map(TextWebSocketFrame::text)
				.onBackpressureBuffer(config.getPerConnBufferSize())
				.concatMap(raw -> protocolHandler.handle(connection, raw))
				.takeUntilOther(connection.onClose())
				.doOnError(err -> {
					// AbortedException is expected on close
					if (!(err instanceof AbortedException)) {
						log.error("Fatal error in inbound stream for {}", connection, err);
					}
				})
				.onErrorResume(err -> Mono.empty())
				.then();
	}
}
