/**
 * Presentation layer (HTTP endpoints and exception handling).
 *
 * <p>Presentation depends on service but not vice versa. Controllers are thin adapters:
 * they verify and parse requests, delegate to services, and let
 * {@code GlobalExceptionHandler} translate domain exceptions to status codes.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - webhook, health and admin endpoints</li>
 *   <li>{@code presentation.exception} - global exception handling for HTTP responses</li>
 * </ul>
 *
 * @see com.phillippitts.callbridge.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.callbridge.presentation;
