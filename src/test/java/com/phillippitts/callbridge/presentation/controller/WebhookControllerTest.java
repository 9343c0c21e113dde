package com.phillippitts.callbridge.presentation.controller;

import com.phillippitts.callbridge.exception.InvalidSignatureException;
import com.phillippitts.callbridge.service.lifecycle.CallLifecycleController;
import com.phillippitts.callbridge.service.lifecycle.WebhookEvent;
import com.phillippitts.callbridge.service.lifecycle.WebhookEventType;
import com.phillippitts.callbridge.service.metrics.CallMetrics;
import com.phillippitts.callbridge.service.security.WebhookSignatureVerifier;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class WebhookControllerTest {

    private static final String BODY = "{\"type\":\"realtime.call.ended\",\"data\":{\"call_id\":\"rtc_1\"}}";

    private WebhookSignatureVerifier verifier;
    private CallLifecycleController lifecycle;
    private SimpleMeterRegistry meters;
    private WebhookController controller;

    @BeforeEach
    void setUp() {
        verifier = mock(WebhookSignatureVerifier.class);
        lifecycle = mock(CallLifecycleController.class);
        meters = new SimpleMeterRegistry();
        controller = new WebhookController(verifier, lifecycle, new CallMetrics(meters));
    }

    @Test
    void verifiedEventIsHandedToLifecycle() {
        when(verifier.verify("wh_1", "1", "v1,sig", BODY)).thenReturn(true);

        ResponseEntity<String> response = controller.receive("wh_1", "1", "v1,sig", BODY);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        ArgumentCaptor<WebhookEvent> captor = ArgumentCaptor.forClass(WebhookEvent.class);
        verify(lifecycle).handle(captor.capture());
        assertThat(captor.getValue().kind()).isEqualTo(WebhookEventType.CALL_ENDED);
        assertThat(captor.getValue().callId()).contains("rtc_1");
    }

    @Test
    void failedVerificationIsRejectedBeforeParsing() {
        when(verifier.verify(anyString(), anyString(), anyString(), anyString())).thenReturn(false);

        assertThatThrownBy(() -> controller.receive("wh_1", "1", "v1,bad", BODY))
                .isInstanceOf(InvalidSignatureException.class);

        verifyNoInteractions(lifecycle);
        assertThat(meters.counter("callbridge.webhook.rejected").count()).isEqualTo(1.0);
    }

    @Test
    void missingHeadersAreRejected() {
        when(verifier.verify(isNull(), isNull(), isNull(), any())).thenReturn(false);

        assertThatThrownBy(() -> controller.receive(null, null, null, BODY))
                .isInstanceOf(InvalidSignatureException.class);
        verifyNoInteractions(lifecycle);
    }

    @Test
    void unparseableBodyIsAcknowledged() {
        when(verifier.verify("wh_1", "1", "v1,sig", "not json")).thenReturn(true);

        ResponseEntity<String> response = controller.receive("wh_1", "1", "v1,sig", "not json");

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        verifyNoInteractions(lifecycle);
    }

    @Test
    void absentBodyIsVerifiedAsEmpty() {
        when(verifier.verify("wh_1", "1", "v1,sig", "")).thenReturn(true);

        ResponseEntity<String> response = controller.receive("wh_1", "1", "v1,sig", null);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        verify(verifier).verify("wh_1", "1", "v1,sig", "");
    }
}
