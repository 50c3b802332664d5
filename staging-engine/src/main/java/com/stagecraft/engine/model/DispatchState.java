package com.stagecraft.engine.model;

/**
 * Lifecycle of one provider job issued for one stage attempt.
 *
 *   AWAITING  → ACCEPTED   (image came back and passed validation)
 *   AWAITING  → REJECTED   (image came back and failed validation)
 *   AWAITING  → FAILED     (provider reported failure or transport error)
 *   AWAITING  → TIMED_OUT  (no result within the wait budget)
 *
 * Synchronous outcomes (immediate image, dispatch error) skip AWAITING.
 */
public enum DispatchState {
    AWAITING,
    ACCEPTED,
    REJECTED,
    FAILED,
    TIMED_OUT
}
