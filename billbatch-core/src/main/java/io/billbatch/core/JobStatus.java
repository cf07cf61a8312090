package io.billbatch.core;

import java.util.Locale;

/**
 * Lifecycle of a batch job. Transitions only move forward:
 * QUEUED -> PROCESSING -> one of the terminal states (QUEUED may also go straight to CANCELLED).
 */
public enum JobStatus {
    QUEUED {
        @Override
        public boolean isTerminal() {
            return false;
        }
    },
    PROCESSING {
        @Override
        public boolean isTerminal() {
            return false;
        }
    },
    COMPLETED {
        @Override
        public boolean isTerminal() {
            return true;
        }
    },
    COMPLETED_WITH_ERRORS {
        @Override
        public boolean isTerminal() {
            return true;
        }
    },
    FAILED {
        @Override
        public boolean isTerminal() {
            return true;
        }
    },
    CANCELLED {
        @Override
        public boolean isTerminal() {
            return true;
        }
    };

    public abstract boolean isTerminal();

    public boolean isActive() {
        return !isTerminal();
    }

    public boolean canTransitionTo(JobStatus next) {
        if (next == null || isTerminal()) {
            return false;
        }
        if (this == QUEUED) {
            return next != QUEUED;
        }
        return next.isTerminal();
    }

    /**
     * Wire name, e.g. {@code completed_with_errors}.
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
