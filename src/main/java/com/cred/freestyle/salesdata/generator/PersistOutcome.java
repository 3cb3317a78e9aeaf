package com.cred.freestyle.salesdata.generator;

import java.util.Objects;

/**
 * Result of one isolated persistence attempt: either the produced value or the
 * kind of failure that made the attempt roll back.
 *
 * @param <T> Value type
 * @author Sales Data Team
 */
public final class PersistOutcome<T> {

    /**
     * Failure classification.
     */
    public enum FailureKind {
        /**
         * Database rejected the write (constraint, schema mismatch, commit failure).
         */
        PERSISTENCE,

        /**
         * Anything else thrown inside the unit of work.
         */
        UNEXPECTED
    }

    private final T value;
    private final FailureKind failureKind;
    private final String message;

    private PersistOutcome(T value, FailureKind failureKind, String message) {
        this.value = value;
        this.failureKind = failureKind;
        this.message = message;
    }

    public static <T> PersistOutcome<T> success(T value) {
        return new PersistOutcome<>(value, null, null);
    }

    public static <T> PersistOutcome<T> failure(FailureKind kind, String message) {
        return new PersistOutcome<>(null, Objects.requireNonNull(kind, "kind"), message);
    }

    public boolean isSuccess() {
        return failureKind == null;
    }

    /**
     * @return produced value; null on failure (and for units of work that return nothing)
     */
    public T getValue() {
        return value;
    }

    public FailureKind getFailureKind() {
        return failureKind;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return isSuccess() ? "PersistOutcome[success]" : "PersistOutcome[" + failureKind + ": " + message + "]";
    }
}
