// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retrying.reject;

import software.amazon.retrying.Attempt;

/**
 * Functional interface deciding whether the outcome of an attempt is retryable.
 *
 * <p>A rejected attempt is retried (subject to the stop strategy); an accepted attempt ends the retry sequence and its
 * result, or its exception, goes straight back to the caller.
 */
@FunctionalInterface
public interface RejectStrategy {

    /**
     * @param attempt the attempt that just completed
     * @return true if the attempt should be retried
     */
    boolean shouldReject(Attempt<?> attempt);
}
