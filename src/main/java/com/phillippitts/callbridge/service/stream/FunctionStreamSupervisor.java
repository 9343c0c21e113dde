package com.phillippitts.callbridge.service.stream;

import com.phillippitts.callbridge.config.properties.FunctionStreamProperties;
import com.phillippitts.callbridge.domain.StreamPurpose;
import com.phillippitts.callbridge.domain.StreamState;
import com.phillippitts.callbridge.domain.StreamTermination;
import com.phillippitts.callbridge.service.action.ActionDispatcher;
import com.phillippitts.callbridge.service.action.FunctionCallRequest;
import com.phillippitts.callbridge.service.metrics.CallMetrics;
import com.phillippitts.callbridge.service.registry.CallRegistry;
import com.phillippitts.callbridge.service.stream.event.StreamReconnectScheduledEvent;
import com.phillippitts.callbridge.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.json.JSONObject;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Supervisor loop for one call's function-call stream.
 *
 * <p>Runs on its own thread for the whole call. Each iteration opens a connection, then
 * drains a single signal queue so frames from one connection are handled strictly in
 * arrival order. Transport callbacks only enqueue.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * CONNECTING → OPEN      handshake within the connect timeout
 * CONNECTING → CLOSED    handshake failed or timed out (counts as an abnormal drop)
 * OPEN → CLOSED          close frame, transport error, or cancellation
 * </pre>
 *
 * <p>After an abnormal drop the supervisor waits {@code base * 2^(n-1)} (capped) and tries
 * again, up to {@code maxReconnectAttempts} consecutive drops. A drop counts whether or not
 * the handshake completed; the counter resets only once a connection delivers its first
 * frame. A normal-closure code ends the stream without
 * reconnecting. {@link #cancel()} interrupts any wait and closes the open connection.
 */
final class FunctionStreamSupervisor implements Runnable {

    private static final Logger LOG = LogManager.getLogger(FunctionStreamSupervisor.class);
    private static final int FRAME_LOG_LIMIT = 200;

    private enum SessionOutcome { NORMAL_CLOSE, DROPPED, CANCELLED }

    private enum SignalType { MESSAGE, CLOSED, ERROR, PONG, CANCEL }

    /** Queue item; {@code generation} ties transport callbacks to the connection that produced them. */
    private record Signal(SignalType type, int generation, String payload, int closeCode) {
        static Signal cancel() {
            return new Signal(SignalType.CANCEL, -1, null, 0);
        }
    }

    private final String callId;
    private final RealtimeTransport transport;
    private final ActionDispatcher dispatcher;
    private final CallRegistry registry;
    private final FunctionStreamProperties props;
    private final ReconnectBackoff backoff;
    private final TaskScheduler scheduler;
    private final ApplicationEventPublisher publisher;
    private final CallMetrics metrics;

    private final CompletableFuture<StreamTermination> termination = new CompletableFuture<>();
    private final BlockingQueue<Signal> signals = new LinkedBlockingQueue<>();
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private volatile StreamState state = StreamState.CONNECTING;
    private volatile CompletableFuture<RealtimeConnection> pendingConnect;
    private int generation;
    private int reconnectAttempts;
    private boolean frameReceived;
    private boolean responseInProgress;

    FunctionStreamSupervisor(String callId,
                             RealtimeTransport transport,
                             ActionDispatcher dispatcher,
                             CallRegistry registry,
                             FunctionStreamProperties props,
                             TaskScheduler scheduler,
                             ApplicationEventPublisher publisher,
                             CallMetrics metrics) {
        this.callId = callId;
        this.transport = transport;
        this.dispatcher = dispatcher;
        this.registry = registry;
        this.props = props;
        this.backoff = new ReconnectBackoff(props.getBaseDelayMs(), props.getMaxDelayMs());
        this.scheduler = scheduler;
        this.publisher = publisher;
        this.metrics = metrics;
    }

    CompletableFuture<StreamTermination> termination() {
        return termination;
    }

    StreamState state() {
        return state;
    }

    /**
     * Stops the stream: wakes any backoff wait, aborts a pending handshake and closes the
     * open connection with a normal code. Idempotent.
     */
    void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            LOG.info("Cancelling function stream for call={}", callId);
            signals.offer(Signal.cancel());
            CompletableFuture<RealtimeConnection> connecting = pendingConnect;
            if (connecting != null) {
                connecting.cancel(true);
            }
        }
    }

    /**
     * Completes the termination future exceptionally when the supervisor could not be started.
     */
    void failToStart(Throwable cause) {
        state = StreamState.CLOSED;
        termination.completeExceptionally(cause);
    }

    @Override
    public void run() {
        ThreadContext.put("callId", callId);
        ThreadContext.put("stream", StreamPurpose.FUNCTION.label());
        try {
            StreamTermination result = supervise();
            LOG.info("Function stream ended for call={} termination={}", callId, result);
            release();
            termination.complete(result);
        } catch (RuntimeException ex) {
            LOG.error("Function stream supervisor failed for call={}", callId, ex);
            release();
            termination.completeExceptionally(ex);
        } finally {
            ThreadContext.clearAll();
        }
    }

    /**
     * Clears the call's stream flag. Must run before the termination future completes, since
     * completion frees the call for a new supervisor that sets the flag again.
     */
    private void release() {
        state = StreamState.CLOSED;
        registry.update(callId, c -> c.withFunctionStream(false));
    }

    private StreamTermination supervise() {
        while (true) {
            if (cancelled.get() || !registry.contains(callId)) {
                return StreamTermination.CANCELLED;
            }
            SessionOutcome outcome = runSession();
            if (outcome == SessionOutcome.NORMAL_CLOSE) {
                return StreamTermination.CALL_ENDED;
            }
            if (outcome == SessionOutcome.CANCELLED || cancelled.get()) {
                return StreamTermination.CANCELLED;
            }
            if (reconnectAttempts >= props.getMaxReconnectAttempts()) {
                LOG.error("Function stream for call={} gave up after {} reconnect attempt(s)",
                        callId, reconnectAttempts);
                return StreamTermination.RECONNECTS_EXHAUSTED;
            }
            reconnectAttempts++;
            Duration delay = backoff.delayFor(reconnectAttempts);
            LOG.warn("Function stream for call={} dropped; reconnect {}/{} in {} ms",
                    callId, reconnectAttempts, props.getMaxReconnectAttempts(), delay.toMillis());
            metrics.incrementReconnect();
            publisher.publishEvent(new StreamReconnectScheduledEvent(callId, reconnectAttempts, delay, Instant.now()));
            if (awaitCancellation(delay)) {
                return StreamTermination.CANCELLED;
            }
        }
    }

    /**
     * Opens one connection and processes its signals until it closes.
     */
    private SessionOutcome runSession() {
        state = StreamState.CONNECTING;
        final int gen = ++generation;
        RealtimeConnection connection = connect(gen);
        if (connection == null) {
            state = StreamState.CLOSED;
            return cancelled.get() ? SessionOutcome.CANCELLED : SessionOutcome.DROPPED;
        }
        if (cancelled.get()) {
            connection.close(RealtimeConnection.NORMAL_CLOSURE);
            state = StreamState.CLOSED;
            return SessionOutcome.CANCELLED;
        }

        state = StreamState.OPEN;
        frameReceived = false;
        responseInProgress = false;
        registry.update(callId, c -> c.withFunctionStream(true));
        LOG.info("Function stream connected for call={}", callId);

        ScheduledFuture<?> heartbeat = scheduler.scheduleAtFixedRate(
                () -> sendHeartbeat(connection), Duration.ofMillis(props.getHeartbeatIntervalMs()));
        try {
            return receiveLoop(connection, gen);
        } finally {
            if (heartbeat != null) {
                heartbeat.cancel(false);
            }
            state = StreamState.CLOSED;
            registry.update(callId, c -> c.withFunctionStream(false));
            if (connection.isOpen()) {
                connection.close(RealtimeConnection.NORMAL_CLOSURE);
            }
        }
    }

    private RealtimeConnection connect(int gen) {
        CompletableFuture<RealtimeConnection> future;
        try {
            future = transport.connect(callId, StreamPurpose.FUNCTION, new QueueingListener(gen));
        } catch (RuntimeException ex) {
            LOG.warn("Function stream connect failed for call={}: {}", callId, ex.getMessage());
            return null;
        }
        pendingConnect = future;
        if (cancelled.get()) {
            future.cancel(true);
        }
        try {
            return future.get(props.getConnectTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            LOG.warn("Function stream connect timed out after {} ms for call={}", props.getConnectTimeoutMs(), callId);
            return null;
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            LOG.warn("Function stream connect failed for call={}: {}", callId, cause.getMessage());
            return null;
        } catch (CancellationException ex) {
            LOG.debug("Function stream connect cancelled for call={}", callId);
            return null;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            cancel();
            return null;
        } finally {
            pendingConnect = null;
        }
    }

    private SessionOutcome receiveLoop(RealtimeConnection connection, int gen) {
        while (true) {
            Signal signal;
            try {
                signal = signals.take();
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                cancel();
                return SessionOutcome.CANCELLED;
            }
            if (signal.type() == SignalType.CANCEL) {
                return SessionOutcome.CANCELLED;
            }
            if (signal.generation() != gen) {
                continue;
            }
            switch (signal.type()) {
                case MESSAGE -> handleFrame(connection, signal.payload());
                case PONG -> LOG.trace("Pong received for call={}", callId);
                case CLOSED -> {
                    if (signal.closeCode() == RealtimeConnection.NORMAL_CLOSURE) {
                        LOG.info("Function stream closed normally for call={}", callId);
                        return SessionOutcome.NORMAL_CLOSE;
                    }
                    LOG.warn("Function stream closed abnormally for call={} code={} reason={}",
                            callId, signal.closeCode(), signal.payload());
                    return SessionOutcome.DROPPED;
                }
                case ERROR -> {
                    LOG.warn("Function stream error for call={}: {}", callId, signal.payload());
                    return SessionOutcome.DROPPED;
                }
                default -> LOG.debug("Ignoring signal {} for call={}", signal.type(), callId);
            }
        }
    }

    private void handleFrame(RealtimeConnection connection, String payload) {
        if (!frameReceived) {
            frameReceived = true;
            if (reconnectAttempts > 0) {
                LOG.debug("Function stream for call={} stable again after {} reconnect(s)", callId, reconnectAttempts);
            }
            reconnectAttempts = 0;
        }
        registry.update(callId, c -> c.withStats(c.stats().recordMessage(Instant.now())));
        JSONObject frame = RealtimeFrames.parse(payload).orElse(null);
        if (frame == null) {
            LOG.warn("Ignoring malformed frame for call={}: {}", callId, LogSanitizer.truncate(payload, FRAME_LOG_LIMIT));
            return;
        }
        String type = RealtimeFrames.typeOf(frame);
        switch (type) {
            case RealtimeFrames.RESPONSE_CREATED -> responseInProgress = true;
            case RealtimeFrames.RESPONSE_DONE -> responseInProgress = false;
            case RealtimeFrames.SPEECH_STARTED -> onSpeechStarted(connection);
            case RealtimeFrames.SPEECH_STOPPED -> LOG.debug("Caller stopped speaking on call={}", callId);
            case RealtimeFrames.FUNCTION_CALL_ARGUMENTS_DONE -> {
                FunctionCallRequest request = FunctionCallRequest.fromFrame(frame);
                LOG.info("Function call on call={}: {} args={}", callId, request.name(),
                        LogSanitizer.truncate(request.arguments(), FRAME_LOG_LIMIT));
                dispatcher.dispatch(callId, request, connection);
            }
            default -> LOG.trace("Unhandled frame type {} on call={}", type, callId);
        }
    }

    private void onSpeechStarted(RealtimeConnection connection) {
        if (!responseInProgress) {
            return;
        }
        LOG.info("Caller barged in on call={}; clearing output buffer", callId);
        registry.update(callId, c -> c.withStats(c.stats().withInterrupted(true)));
        try {
            connection.send(RealtimeFrames.bufferClear());
        } catch (RuntimeException ex) {
            LOG.warn("Failed to send buffer clear for call={}: {}", callId, ex.getMessage());
        }
    }

    private void sendHeartbeat(RealtimeConnection connection) {
        if (!connection.isOpen()) {
            return;
        }
        try {
            connection.ping();
        } catch (RuntimeException ex) {
            LOG.debug("Heartbeat ping failed for call={}: {}", callId, ex.getMessage());
        }
    }

    /**
     * Waits out a backoff delay. Returns true if cancelled meanwhile; signals from dead
     * connections are discarded.
     */
    private boolean awaitCancellation(Duration delay) {
        long deadline = System.nanoTime() + delay.toNanos();
        try {
            while (true) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return cancelled.get();
                }
                Signal signal = signals.poll(remaining, TimeUnit.NANOSECONDS);
                if (signal != null && signal.type() == SignalType.CANCEL) {
                    return true;
                }
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            cancel();
            return true;
        }
    }

    /** Transport callbacks only enqueue; all handling happens on the supervisor thread. */
    private final class QueueingListener implements StreamListener {

        private final int gen;

        QueueingListener(int gen) {
            this.gen = gen;
        }

        @Override
        public void onMessage(String payload) {
            signals.offer(new Signal(SignalType.MESSAGE, gen, payload, 0));
        }

        @Override
        public void onClose(int code, String reason) {
            signals.offer(new Signal(SignalType.CLOSED, gen, reason, code));
        }

        @Override
        public void onError(Throwable error) {
            signals.offer(new Signal(SignalType.ERROR, gen, String.valueOf(error.getMessage()), 0));
        }

        @Override
        public void onPong() {
            signals.offer(new Signal(SignalType.PONG, gen, null, 0));
        }
    }
}
