// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retrying.exception;

import software.amazon.retrying.Attempt;

/**
 * Terminal error raised when a retryer gives up. Encapsulates the last {@link Attempt} right before giving up.
 *
 * <p>When the last attempt ended with an exception, that exception is also the cause of this one. When the last
 * attempt returned a rejected result there is no cause, and the rejected value is available through
 * {@code getLastAttempt().getResult()}.
 */
public class RetryException extends RetryingException {
    private final transient Attempt<?> lastAttempt;

    public RetryException(Attempt<?> lastAttempt) {
        super(
                "RetryException[" + lastAttempt + "]",
                lastAttempt.hasException() ? lastAttempt.getException() : null);
        this.lastAttempt = lastAttempt;
    }

    public Attempt<?> getLastAttempt() {
        return lastAttempt;
    }

    /** @return number of attempts made before giving up */
    public int getAttemptNumber() {
        return lastAttempt.getAttemptNumber();
    }
}
