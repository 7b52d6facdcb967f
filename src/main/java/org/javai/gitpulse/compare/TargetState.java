package org.javai.gitpulse.compare;

/**
 * Lifecycle of one target within a comparison.
 * {@code PENDING → RUNNING → SUCCEEDED | FAILED}; a pending target may also fail directly
 * when its task could not start.
 */
public enum TargetState {

    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }

    public boolean canMoveTo(TargetState next) {
        return switch (this) {
            case PENDING -> next == RUNNING || next == FAILED;
            case RUNNING -> next.isTerminal();
            case SUCCEEDED, FAILED -> false;
        };
    }
}
