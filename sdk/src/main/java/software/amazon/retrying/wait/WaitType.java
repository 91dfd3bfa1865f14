// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retrying.wait;

/** The built-in wait strategies, as named in declarative configuration. */
public enum WaitType {
    /** No delay between attempts. */
    NONE,

    /** Constant delay. */
    FIXED,

    /** Uniformly random delay between a minimum and a maximum, both inclusive. */
    RANDOM,

    /** Delay growing linearly with the attempt number. */
    INCREMENTING,

    /** Delay growing exponentially with the attempt number. */
    EXPONENTIAL
}
