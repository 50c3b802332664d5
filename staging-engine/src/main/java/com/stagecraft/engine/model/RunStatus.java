package com.stagecraft.engine.model;

/**
 * Externally visible state of a staging run.
 *
 * Transitions:
 *   PENDING → RUNNING   (first dispatch of stage 0 issued)
 *   RUNNING → COMPLETED (last stage accepted)
 *   RUNNING → FAILED    (a stage failed its corrective retry)
 */
public enum RunStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
