package io.github.drompincen.habitnotifier.runtime.delivery;

public enum DeliveryOutcome {
    SENT,
    /** Habit was gone at fire time; reminder removed, nothing sent. */
    REMOVED_ORPHAN,
    /** Recipient blocked or invalid; reminder removed. */
    REMOVED_UNDELIVERABLE,
    /** Left intact, tomorrow's fire is the retry. */
    FAILED_TRANSIENT,
    REJECTED
}
