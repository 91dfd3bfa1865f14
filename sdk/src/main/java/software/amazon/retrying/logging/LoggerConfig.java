// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retrying.logging;

/**
 * Configuration for RetryLogger behavior.
 *
 * @param logAttempts whether the retryer logs rejected attempts and its give-up decision
 * @param populateMdc whether the retry name and attempt number are put in the SLF4J MDC while an attempt runs
 */
public record LoggerConfig(boolean logAttempts, boolean populateMdc) {

    /** Default configuration: log attempts and populate the MDC. */
    public static LoggerConfig defaults() {
        return new LoggerConfig(true, true);
    }

    /** Configuration that keeps the retryer silent but still populates the MDC. */
    public static LoggerConfig quiet() {
        return new LoggerConfig(false, true);
    }
}
