package io.github.drompincen.bugtrackr.runtime.saga;

import java.time.Instant;

/**
 * A primary write, a required follow-up write, and the action that undoes the primary
 * write when the follow-up fails.
 *
 * @param <T> result of the primary write
 */
public interface CompensableWrite<T> {

    /** Short name used in logs and fatal errors, e.g. "add comment". */
    String operation();

    /** Runs before anything is written; throwing here aborts with nothing persisted. */
    default void checkPreconditions() {
    }

    T apply(Instant at);

    /** Receives the same {@code at} the primary write used. */
    void followUp(T written, Instant at);

    void compensate(T written);

    ItemRef locate(T written);
}
