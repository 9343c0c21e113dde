/**
 * Global exception handling for HTTP responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link com.phillippitts.callbridge.exception.InvalidSignatureException} → 401 Unauthorized</li>
 *   <li>{@link com.phillippitts.callbridge.exception.CallAcceptException} → 500 Internal Server Error</li>
 *   <li>{@link com.phillippitts.callbridge.exception.ConfigDataException} → 500 Internal Server Error</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "CallAcceptException",
 *   "message": "Accept failed",
 *   "details": "The call could not be accepted",
 *   "timestamp": "2025-10-17T15:42:32.529Z"
 * }
 * </pre>
 *
 * <p>Stack traces and upstream response bodies are logged server-side only.
 *
 * @since 1.0
 */
package com.phillippitts.callbridge.presentation.exception;
