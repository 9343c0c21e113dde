/**
 * Logging infrastructure and MDC (Mapped Diagnostic Context) configuration.
 *
 * <p>This package provides structured logging using Log4j2 with MDC for request and
 * call correlation across asynchronous boundaries.
 *
 * <p>MDC Keys:
 * <ul>
 *   <li>{@code requestId} - webhook delivery id, or a generated UUID</li>
 *   <li>{@code callId} - call being handled, set by the lifecycle controller and stream supervisors</li>
 *   <li>{@code stream} - stream purpose (greeting/function) on stream threads</li>
 * </ul>
 *
 * <p>Log Format:
 * <pre>
 * 2026-10-17 15:42:32.529 [thread-name] [requestId] [callId] LEVEL logger.name - message
 * </pre>
 *
 * @see com.phillippitts.callbridge.config.logging.MdcFilter
 * @since 1.0
 */
package com.phillippitts.callbridge.config.logging;
