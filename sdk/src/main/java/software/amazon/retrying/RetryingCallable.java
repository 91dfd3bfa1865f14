// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retrying;

import java.util.concurrent.Callable;

/**
 * A {@link Callable} bound to a {@link Retryer}: every call runs the wrapped operation with retries.
 *
 * <p>The wrapper is transparent for introspection: {@link #toString()} and {@link #getDelegate()} expose the wrapped
 * operation.
 *
 * @param <V> the result type
 */
public final class RetryingCallable<V> implements Callable<V> {
    private final Retryer retryer;
    private final Callable<V> delegate;

    RetryingCallable(Retryer retryer, Callable<V> delegate) {
        this.retryer = retryer;
        this.delegate = delegate;
    }

    /**
     * Runs the wrapped operation with retries. Exceptions are thrown as described in {@link Retryer}.
     *
     * @return the accepted result
     */
    @Override
    public V call() {
        return retryer.execute(delegate);
    }

    public Callable<V> getDelegate() {
        return delegate;
    }

    public Retryer getRetryer() {
        return retryer;
    }

    @Override
    public String toString() {
        return delegate.toString();
    }
}
