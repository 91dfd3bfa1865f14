// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retrying;

import java.util.Objects;
import software.amazon.retrying.exception.RetryException;
import software.amazon.retrying.util.ExceptionHelper;

/**
 * Outcome of a single invocation of a retried operation.
 *
 * <p>An attempt either ended with a result value (which may be {@code null}) or with a captured exception, never both.
 * The captured exception is kept as the original instance so it can be re-signaled later with its type and stack
 * trace intact.
 *
 * @param <V> the result type of the operation
 */
public final class Attempt<V> {
    private final V result;
    private final Throwable exception;
    private final int attemptNumber;

    private Attempt(V result, Throwable exception, int attemptNumber) {
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("attemptNumber must be positive, got: " + attemptNumber);
        }
        this.result = result;
        this.exception = exception;
        this.attemptNumber = attemptNumber;
    }

    /**
     * Creates an attempt that returned normally.
     *
     * @param result the returned value, may be null
     * @param attemptNumber 1-based attempt number
     * @return the attempt
     */
    public static <V> Attempt<V> success(V result, int attemptNumber) {
        return new Attempt<>(result, null, attemptNumber);
    }

    /**
     * Creates an attempt that ended with an exception.
     *
     * @param exception the captured exception
     * @param attemptNumber 1-based attempt number
     * @return the attempt
     */
    public static <V> Attempt<V> failure(Throwable exception, int attemptNumber) {
        if (exception == null) {
            throw new IllegalArgumentException("exception cannot be null");
        }
        return new Attempt<>(null, exception, attemptNumber);
    }

    public boolean hasException() {
        return exception != null;
    }

    public int getAttemptNumber() {
        return attemptNumber;
    }

    /** @return the returned value, or null if this attempt ended with an exception */
    public V getResult() {
        return result;
    }

    /** @return the captured exception, or null if this attempt returned normally */
    public Throwable getException() {
        return exception;
    }

    /**
     * Returns the result of this attempt or re-throws the captured exception unchanged.
     *
     * @return the result value
     */
    public V get() {
        return get(false);
    }

    /**
     * Returns the result of this attempt or throws.
     *
     * @param wrapException if true, a captured exception is wrapped in a {@link RetryException}; otherwise the original
     *     exception is re-thrown as is, checked or not
     * @return the result value
     */
    public V get(boolean wrapException) {
        if (hasException()) {
            if (wrapException) {
                throw new RetryException(this);
            }
            ExceptionHelper.sneakyThrow(exception);
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Attempt<?> other)) return false;
        return attemptNumber == other.attemptNumber
                && Objects.equals(result, other.result)
                && Objects.equals(exception, other.exception);
    }

    @Override
    public int hashCode() {
        return Objects.hash(result, exception, attemptNumber);
    }

    @Override
    public String toString() {
        if (hasException()) {
            return String.format("Attempts: %d, Error: %s", attemptNumber, ExceptionHelper.describe(exception));
        }
        return String.format("Attempts: %d, Value: %s", attemptNumber, result);
    }
}
