// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retrying.exception;

import software.amazon.retrying.Attempt;

/**
 * Exception thrown when the calling thread is interrupted, either by the operation itself throwing
 * {@link InterruptedException} or while a retryer is sleeping between attempts. The thread's interrupt flag is restored
 * before this is thrown, and no further attempt is made.
 */
public class RetryInterruptedException extends RetryingException {
    private final String retryName;
    private final transient Attempt<?> lastAttempt;

    public RetryInterruptedException(String retryName, Attempt<?> lastAttempt, InterruptedException cause) {
        super(formatMessage(retryName, lastAttempt, cause), cause);
        this.retryName = retryName;
        this.lastAttempt = lastAttempt;
    }

    public String getRetryName() {
        return retryName;
    }

    public Attempt<?> getLastAttempt() {
        return lastAttempt;
    }

    public int getAttemptNumber() {
        return lastAttempt.getAttemptNumber();
    }

    private static String formatMessage(String retryName, Attempt<?> lastAttempt, InterruptedException cause) {
        if (cause != null && lastAttempt.getException() == cause) {
            return String.format(
                    "Retry '%s' was interrupted during attempt %d", retryName, lastAttempt.getAttemptNumber());
        }
        return String.format(
                "Retry '%s' was interrupted while waiting after attempt %d",
                retryName, lastAttempt.getAttemptNumber());
    }
}
