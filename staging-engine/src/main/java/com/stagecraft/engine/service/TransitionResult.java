package com.stagecraft.engine.service;

/**
 * What the workflow did with one provider event.
 */
public enum TransitionResult {
    /** The event resolved the current attempt and the run moved on. */
    APPLIED,
    /** The job is still running; nothing changed except poll bookkeeping. */
    IGNORED_PENDING,
    /** The handle is not the current one of a running run (repeat, stale or late). */
    DUPLICATE,
    /** No dispatch is known under this handle. */
    UNKNOWN_HANDLE
}
