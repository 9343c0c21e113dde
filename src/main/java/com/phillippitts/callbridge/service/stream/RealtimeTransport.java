package com.phillippitts.callbridge.service.stream;

import com.phillippitts.callbridge.domain.StreamPurpose;

import java.util.concurrent.CompletableFuture;

/**
 * Opens realtime stream connections bound to a call.
 *
 * <p>The returned future completes when the handshake succeeds, or exceptionally when it
 * fails. Callers apply their own connect timeout and may cancel the future.
 */
public interface RealtimeTransport {

    CompletableFuture<RealtimeConnection> connect(String callId, StreamPurpose purpose, StreamListener listener);
}
