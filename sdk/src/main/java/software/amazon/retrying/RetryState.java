// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retrying;

/** States of a single {@link Retryer#execute} call. */
public enum RetryState {
    /** Invoking the operation or evaluating its outcome. */
    RUNNING,

    /** An attempt was accepted; its result or exception goes back to the caller. */
    ACCEPTED,

    /** The stop strategy ended the sequence; the last rejected attempt is surfaced. */
    GIVING_UP
}
