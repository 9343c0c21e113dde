/**
 * Immutable domain model for call sessions.
 *
 * <p>{@link com.phillippitts.callbridge.domain.Call} is the single per-call record. All
 * mutation goes through the registry, which replaces snapshots atomically per call id.
 * Transfer value objects are ephemeral and never persisted.
 *
 * @since 1.0
 */
package com.phillippitts.callbridge.domain;
