package com.phillippitts.callbridge.service.callcontrol;

import com.phillippitts.callbridge.exception.CallControlException;
import org.json.JSONObject;

/**
 * Outbound commands to the remote call-control API.
 *
 * <p>Both operations either return normally on a 2xx answer or throw
 * {@link CallControlException}. Nothing is retried here; retry policy belongs to the caller.
 */
public interface CallControlClient {

    /**
     * Accepts an incoming call with the given session configuration.
     *
     * @throws CallControlException on a non-2xx answer or when the API is unreachable;
     *                              {@link CallControlException#isNotReady()} marks the retryable case
     */
    void accept(String callId, JSONObject sessionConfig);

    /**
     * Transfers (SIP REFER) the call to a routing address such as {@code tel:+15550100}.
     *
     * @throws CallControlException on a non-2xx answer or when the API is unreachable
     */
    void refer(String callId, String targetUri);
}
