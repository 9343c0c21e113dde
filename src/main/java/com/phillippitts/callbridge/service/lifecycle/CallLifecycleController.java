package com.phillippitts.callbridge.service.lifecycle;

import com.phillippitts.callbridge.exception.CallAcceptException;

/**
 * Drives each call through its lifecycle in response to verified control events.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * (none) → INCOMING     call.incoming for an untracked call id
 * INCOMING → ACCEPTING  accept handshake started
 * ACCEPTING → ACTIVE    accept acknowledged; function stream and greeting launched in background
 * ACCEPTING → (none)    accept failed; record removed
 * any → ENDING → (none) terminal event; streams stopped, record removed
 * </pre>
 *
 * <p>Calls are isolated: a failure on one call never affects another.
 */
public interface CallLifecycleController {

    /**
     * Applies one control event. Returns once the event is acknowledged; stream setup continues
     * in the background.
     *
     * @throws CallAcceptException when an incoming call could not be accepted
     */
    void handle(WebhookEvent event);
}
