/**
 * REST controllers.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /openai-webhook} - signed control events from the call-control system</li>
 *   <li>{@code GET /health} - process status and live call/stream counts</li>
 *   <li>{@code POST /admin/config/reload} - drop and reload cached business configuration</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.callbridge.presentation.controller;
