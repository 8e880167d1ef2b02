package io.vulnscan.analysis.run;

/**
 * Run lifecycle. Transitions only move forward:
 * PENDING to RUNNING, then RUNNING to COMPLETED or FAILED.
 */
public enum RunStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    boolean canMoveTo(RunStatus next) {
        return switch (this) {
            case PENDING -> next == RUNNING || next == FAILED;
            case RUNNING -> next == COMPLETED || next == FAILED;
            case COMPLETED, FAILED -> false;
        };
    }
}
