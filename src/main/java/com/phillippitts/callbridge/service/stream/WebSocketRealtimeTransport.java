package com.phillippitts.callbridge.service.stream;

import com.phillippitts.callbridge.config.properties.RealtimeProperties;
import com.phillippitts.callbridge.domain.StreamPurpose;
import com.phillippitts.callbridge.exception.StreamConnectionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PingMessage;
import org.springframework.web.socket.PongMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.URI;
import java.nio.ByteBuffer;
import java.util.concurrent.CompletableFuture;

/**
 * {@link RealtimeTransport} over Spring's standard (JSR-356) WebSocket client.
 *
 * <p>Each connection authenticates with the bearer API key and is bound to the call through
 * the {@code call_id} query parameter. Outbound frames go through a
 * {@link ConcurrentWebSocketSessionDecorator} so the supervisor thread, heartbeat timer and
 * action dispatch can write without interleaving.
 */
@Component
public class WebSocketRealtimeTransport implements RealtimeTransport {

    private static final Logger LOG = LogManager.getLogger(WebSocketRealtimeTransport.class);

    static final int SEND_TIME_LIMIT_MS = 5_000;
    static final int SEND_BUFFER_LIMIT_BYTES = 512 * 1024;

    private final WebSocketClient client;
    private final RealtimeProperties properties;

    public WebSocketRealtimeTransport(WebSocketClient client, RealtimeProperties properties) {
        this.client = client;
        this.properties = properties;
    }

    @Override
    public CompletableFuture<RealtimeConnection> connect(String callId, StreamPurpose purpose,
                                                         StreamListener listener) {
        WebSocketHttpHeaders headers = new WebSocketHttpHeaders();
        headers.setBearerAuth(properties.getApiKey());
        URI uri = streamUri(callId);
        LOG.debug("Opening {} stream for call={} at {}", purpose.label(), callId, uri.getHost());
        return client.execute(new ListenerAdapter(listener), headers, uri)
                .thenApply(session -> new WebSocketConnection(callId, purpose, session));
    }

    URI streamUri(String callId) {
        return UriComponentsBuilder.fromUriString(properties.getWebsocketUrl())
                .queryParam("call_id", callId)
                .encode()
                .build()
                .toUri();
    }

    /** Forwards transport callbacks to the stream listener. */
    private static final class ListenerAdapter extends TextWebSocketHandler {

        private final StreamListener listener;

        ListenerAdapter(StreamListener listener) {
            this.listener = listener;
        }

        @Override
        protected void handleTextMessage(WebSocketSession session, TextMessage message) {
            listener.onMessage(message.getPayload());
        }

        @Override
        protected void handlePongMessage(WebSocketSession session, PongMessage message) {
            listener.onPong();
        }

        @Override
        public void handleTransportError(WebSocketSession session, Throwable exception) {
            listener.onError(exception);
        }

        @Override
        public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
            listener.onClose(status.getCode(), status.getReason());
        }
    }

    private static final class WebSocketConnection implements RealtimeConnection {

        private final String callId;
        private final StreamPurpose purpose;
        private final WebSocketSession session;

        WebSocketConnection(String callId, StreamPurpose purpose, WebSocketSession raw) {
            this.callId = callId;
            this.purpose = purpose;
            this.session = new ConcurrentWebSocketSessionDecorator(raw, SEND_TIME_LIMIT_MS, SEND_BUFFER_LIMIT_BYTES);
        }

        @Override
        public void send(String frame) {
            try {
                session.sendMessage(new TextMessage(frame));
            } catch (IOException | RuntimeException ex) {
                throw new StreamConnectionException(callId, purpose, "Send failed", ex);
            }
        }

        @Override
        public void ping() {
            try {
                session.sendMessage(new PingMessage(ByteBuffer.allocate(0)));
            } catch (IOException | RuntimeException ex) {
                throw new StreamConnectionException(callId, purpose, "Ping failed", ex);
            }
        }

        @Override
        public void close(int code) {
            if (!session.isOpen()) {
                return;
            }
            try {
                session.close(new CloseStatus(code));
            } catch (IOException ex) {
                LOG.debug("Error closing {} stream for call={}: {}", purpose.label(), callId, ex.getMessage());
            }
        }

        @Override
        public boolean isOpen() {
            return session.isOpen();
        }
    }
}
