// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retrying.exception;

/** Base class of the unchecked exceptions raised by the retrying SDK itself. */
public class RetryingException extends RuntimeException {
    public RetryingException(String message, Throwable cause) {
        super(message, cause);
    }

    public RetryingException(String message) {
        super(message);
    }
}
