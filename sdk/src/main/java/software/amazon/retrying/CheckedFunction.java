// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retrying;

/**
 * A function that may throw a checked exception.
 *
 * @param <T> argument type
 * @param <R> result type
 */
@FunctionalInterface
public interface CheckedFunction<T, R> {
    R apply(T argument) throws Exception;
}
