package com.phillippitts.callbridge.config;

import com.phillippitts.callbridge.config.properties.RealtimeProperties;
import jakarta.websocket.ContainerProvider;
import jakarta.websocket.WebSocketContainer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;

/**
 * Outbound clients for the realtime AI backend: HTTP for call control, WebSocket for streams.
 */
@Configuration
public class RealtimeClientConfig {

    /** Session frames with full instructions and tool lists exceed the 8 KB container default. */
    static final int MAX_TEXT_MESSAGE_BYTES = 1024 * 1024;

    /**
     * RestTemplate used for accept and refer calls. Connect and read timeouts both come from
     * {@code callbridge.realtime.request-timeout-ms} so no outbound call waits unbounded.
     */
    @Bean
    public RestTemplate callControlRestTemplate(RealtimeProperties properties) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(properties.getRequestTimeoutMs());
        factory.setReadTimeout(properties.getRequestTimeoutMs());
        return new RestTemplate(factory);
    }

    @Bean
    public WebSocketClient realtimeWebSocketClient() {
        WebSocketContainer container = ContainerProvider.getWebSocketContainer();
        container.setDefaultMaxTextMessageBufferSize(MAX_TEXT_MESSAGE_BYTES);
        return new StandardWebSocketClient(container);
    }
}
