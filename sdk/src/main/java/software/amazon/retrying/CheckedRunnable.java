// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retrying;

/** An action without result that may throw a checked exception. */
@FunctionalInterface
public interface CheckedRunnable {
    void run() throws Exception;
}
