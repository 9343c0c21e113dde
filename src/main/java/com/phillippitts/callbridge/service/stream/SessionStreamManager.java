package com.phillippitts.callbridge.service.stream;

import com.phillippitts.callbridge.domain.StreamState;
import com.phillippitts.callbridge.domain.StreamTermination;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Owns the realtime stream connections of every live call: one greeting stream and one
 * function-call stream per call at most.
 *
 * <p><b>Greeting stream:</b> single best-effort attempt. The call's {@code greeted} flag is
 * claimed with a compare-and-set before anything asynchronous happens, so concurrent triggers
 * greet once. A failed connect or send rolls the flag back. Never reconnects.
 *
 * <p><b>Function stream:</b> lives for the whole call, reconnects with capped exponential
 * backoff after abnormal disconnects, pings periodically while open, and dispatches
 * AI function calls in arrival order. A second open for the same call returns the live stream.
 *
 * @see DefaultSessionStreamManager
 * @since 1.0
 */
public interface SessionStreamManager {

    /**
     * Delivers the greeting once per call.
     *
     * @param callId       call to greet
     * @param greetingText text the AI should say
     * @return future completing with true when the greeting was sent or had already been sent,
     *         false when the call is unknown or delivery failed
     */
    CompletableFuture<Boolean> openGreetingStream(String callId, String greetingText);

    /**
     * Ensures a function-call stream is running for the call.
     *
     * @param callId call to serve
     * @return future completing when the stream ends for good; the same future is returned
     *         to every caller while the stream is live
     */
    CompletableFuture<StreamTermination> openFunctionStream(String callId);

    /**
     * Cancels reconnects and heartbeats and closes any open streams of the call. Idempotent.
     *
     * @param callId call whose streams to stop
     */
    void stopStreams(String callId);

    /**
     * Whether the call currently owns any stream (function supervisor or greeting connection).
     */
    boolean hasLiveStreams(String callId);

    /**
     * Connection state of the call's function stream, empty when there is none.
     */
    Optional<StreamState> functionStreamState(String callId);

    int activeFunctionStreamCount();
}
