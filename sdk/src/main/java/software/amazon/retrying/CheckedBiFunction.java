// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retrying;

/**
 * A two-argument function that may throw a checked exception.
 *
 * @param <T> first argument type
 * @param <U> second argument type
 * @param <R> result type
 */
@FunctionalInterface
public interface CheckedBiFunction<T, U, R> {
    R apply(T first, U second) throws Exception;
}
