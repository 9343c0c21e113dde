/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.callbridge.exception.CallBridgeException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.callbridge.exception.InvalidSignatureException} - Webhook
 *       failed HMAC verification (HTTP 401)</li>
 *   <li>{@link com.phillippitts.callbridge.exception.CallAcceptException} - Call could not
 *       be accepted (HTTP 500)</li>
 *   <li>{@link com.phillippitts.callbridge.exception.CallControlException} - Non-2xx or
 *       unreachable call-control API</li>
 *   <li>{@link com.phillippitts.callbridge.exception.StreamConnectionException} - Realtime
 *       stream connect timeout or send failure</li>
 *   <li>{@link com.phillippitts.callbridge.exception.ConfigDataException} - Unreadable
 *       configuration data file</li>
 * </ul>
 *
 * <p>Exceptions that reach the HTTP boundary are mapped by
 * {@code GlobalExceptionHandler}; none of them expose upstream bodies or stack traces.
 *
 * @see com.phillippitts.callbridge.exception.CallBridgeException
 * @since 1.0
 */
package com.phillippitts.callbridge.exception;
