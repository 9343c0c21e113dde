package com.phillippitts.callbridge.domain;

/**
 * Stored lifecycle stages of a call.
 *
 * <p>{@code Closed} is terminal and is never stored: closing a call removes its record
 * from the registry.
 *
 * <pre>
 * INCOMING → ACCEPTING → ACTIVE → ENDING → (removed)
 * </pre>
 */
public enum LifecycleStage {
    INCOMING,
    ACCEPTING,
    ACTIVE,
    ENDING
}
