package com.di.indexer.metadata;

import java.util.Locale;

/**
 * Per-submission status as stored in {@code submissions.status}.
 *
 * <pre>
 *   PENDING → PROCESSING → COMPLETED
 *                        → FAILED
 * </pre>
 *
 * Terminal states never change.
 */
public enum SubmissionStatus {

    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(SubmissionStatus next) {
        return switch (this) {
            case PENDING    -> next == PROCESSING || next.isTerminal();
            case PROCESSING -> next.isTerminal();
            case COMPLETED, FAILED -> false;
        };
    }

    /** Column value ({@code pending}, {@code processing}, ...). */
    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SubmissionStatus fromDb(String value) {
        if (value == null) {
            return PENDING;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
