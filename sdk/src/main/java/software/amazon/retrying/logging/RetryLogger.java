// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retrying.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Logger wrapper that adds retry context to log entries via MDC and optionally suppresses the retryer's own logs.
 *
 * <p>While an attempt is running the MDC carries {@value #MDC_RETRY_NAME} and {@value #MDC_ATTEMPT}, so log lines
 * written by the retried operation itself are tagged with the attempt they belong to.
 */
public class RetryLogger {
    static final String MDC_RETRY_NAME = "retryName";
    static final String MDC_ATTEMPT = "attempt";

    private final Logger delegate;
    private final String retryName;
    private final LoggerConfig config;

    public RetryLogger(Logger delegate, String retryName, LoggerConfig config) {
        this.delegate = delegate;
        this.retryName = retryName;
        this.config = config;
    }

    public void debug(String format, Object... args) {
        if (config.logAttempts()) {
            delegate.debug(format, args);
        }
    }

    public void info(String format, Object... args) {
        if (config.logAttempts()) {
            delegate.info(format, args);
        }
    }

    public void warn(String format, Object... args) {
        if (config.logAttempts()) {
            delegate.warn(format, args);
        }
    }

    public boolean isDebugEnabled() {
        return config.logAttempts() && delegate.isDebugEnabled();
    }

    /**
     * Tags the current thread with the retry name and attempt number.
     *
     * @param attemptNumber the attempt about to run
     */
    public void setAttemptContext(int attemptNumber) {
        if (!config.populateMdc()) {
            return;
        }
        MDC.put(MDC_RETRY_NAME, retryName);
        MDC.put(MDC_ATTEMPT, String.valueOf(attemptNumber));
    }

    /** Removes the retry tags from the current thread. */
    public void clearAttemptContext() {
        if (!config.populateMdc()) {
            return;
        }
        MDC.remove(MDC_RETRY_NAME);
        MDC.remove(MDC_ATTEMPT);
    }
}
