package com.phillippitts.callbridge.domain;

/**
 * AI-requested transfer of the current call.
 *
 * @param callId         call to transfer
 * @param destinationKey configured destination key such as {@code "sales"}
 */
public record TransferRequest(String callId, String destinationKey) {
}
