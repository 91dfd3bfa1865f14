// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retrying;

/**
 * Observer notified around attempts, typically for logging or metrics.
 *
 * <p>Listeners are notifications, not control points: they cannot influence the retry decision. An exception thrown
 * by a listener propagates to the caller of the retryer.
 */
@FunctionalInterface
public interface AttemptListener {

    /** @param attemptNumber the current attempt number (1-based) */
    void onAttempt(int attemptNumber);
}
