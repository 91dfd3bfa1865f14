// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retrying.proxy;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import software.amazon.retrying.wait.WaitType;

/**
 * Marks an interface method, or every method of an interface, as retried when called through a proxy created by
 * {@link RetryProxy}. A method-level annotation takes precedence over the type-level one.
 *
 * <p>Stop attributes set to {@code -1}, {@link WaitType#NONE}, a zero jitter, {@code wrapException = false} and an
 * empty {@code retryOn} are unset: the proxy's base configuration applies, which by default retries every exception
 * without bound and without waiting.
 *
 * <pre>{@code
 * interface InventoryClient {
 *     @Retryable(stopAfterAttempt = 3, waitType = WaitType.FIXED, waitMillis = 200, retryOn = IOException.class)
 *     Stock fetch(String sku) throws IOException;
 * }
 * }</pre>
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.METHOD, ElementType.TYPE})
public @interface Retryable {
    /** Retry name used in logs; defaults to the method name. */
    String name() default "";

    int stopAfterAttempt() default -1;

    long stopAfterDelayMillis() default -1;

    WaitType waitType() default WaitType.NONE;

    /** Wait of {@link WaitType#FIXED}. */
    long waitMillis() default 0;

    /** Lower bound of {@link WaitType#RANDOM}. */
    long waitMinMillis() default 0;

    /** Upper bound of {@link WaitType#RANDOM}. */
    long waitRandomMaxMillis() default 1000;

    /** Cap of {@link WaitType#INCREMENTING} and {@link WaitType#EXPONENTIAL}. */
    long waitMaxMillis() default 1073741823L;

    long waitStartMillis() default 0;

    long waitIncrementMillis() default 100;

    long waitMultiplierMillis() default 1;

    int waitExponentialBase() default 2;

    long waitJitterMaxMillis() default 0;

    boolean wrapException() default false;

    /** Exception types to retry; empty retries every exception. */
    Class<? extends Throwable>[] retryOn() default {};
}
