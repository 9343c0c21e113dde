package com.phillippitts.callbridge.service.callcontrol;

import com.phillippitts.callbridge.config.properties.RealtimeProperties;
import com.phillippitts.callbridge.exception.CallControlException;
import com.phillippitts.callbridge.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;

/**
 * {@link CallControlClient} over HTTP using {@link RestTemplate}.
 *
 * <p>Endpoints: {@code POST {api-base-url}/realtime/calls/{callId}/accept} and
 * {@code POST {api-base-url}/realtime/calls/{callId}/refer}. Requests carry the bearer API key.
 * Timeouts come from the RestTemplate's request factory.
 */
@Component
public class RestCallControlClient implements CallControlClient {

    private static final Logger LOG = LogManager.getLogger(RestCallControlClient.class);

    static final String REQUEST_ID_HEADER = "x-request-id";
    private static final int ERROR_BODY_LIMIT = 500;

    private final RestTemplate restTemplate;
    private final RealtimeProperties properties;

    public RestCallControlClient(@Qualifier("callControlRestTemplate") RestTemplate restTemplate,
                                 RealtimeProperties properties) {
        this.restTemplate = restTemplate;
        this.properties = properties;
    }

    @Override
    public void accept(String callId, JSONObject sessionConfig) {
        post("Accept", callId, "accept", sessionConfig);
    }

    @Override
    public void refer(String callId, String targetUri) {
        post("Refer", callId, "refer", new JSONObject().put("target_uri", targetUri));
    }

    private void post(String operation, String callId, String action, JSONObject body) {
        URI uri = callUri(callId, action);
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(properties.getApiKey());
        headers.setContentType(MediaType.APPLICATION_JSON);
        try {
            restTemplate.postForEntity(uri, new HttpEntity<>(body.toString(), headers), String.class);
            LOG.debug("{} succeeded for call={}", operation, callId);
        } catch (HttpStatusCodeException ex) {
            String requestId = ex.getResponseHeaders() != null
                    ? ex.getResponseHeaders().getFirst(REQUEST_ID_HEADER)
                    : null;
            throw new CallControlException(operation, ex.getStatusCode().value(), requestId,
                    LogSanitizer.truncate(ex.getResponseBodyAsString(), ERROR_BODY_LIMIT));
        } catch (ResourceAccessException ex) {
            throw new CallControlException(operation, ex);
        }
    }

    URI callUri(String callId, String action) {
        return UriComponentsBuilder.fromUriString(properties.getApiBaseUrl())
                .pathSegment("realtime", "calls", callId, action)
                .encode()
                .build()
                .toUri();
    }
}
