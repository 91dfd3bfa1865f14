// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retrying.reject;

import java.util.List;
import java.util.function.Predicate;
import software.amazon.retrying.validation.ParameterValidator;

/** Factory class for reject strategies built from an exception predicate and a result predicate. */
public final class RejectStrategies {

    /** Exception predicate used when none is given: every exception is retried. */
    public static final Predicate<Throwable> ALWAYS_REJECT = error -> true;

    /** Result predicate used when none is given: every returned value is accepted. */
    public static final Predicate<Object> NEVER_REJECT = result -> false;

    private static final RejectStrategy DEFAULTS = of(null, null);

    private RejectStrategies() {}

    /**
     * Default strategy: retry on any exception, accept any returned value.
     *
     * @return the default RejectStrategy
     */
    public static RejectStrategy defaults() {
        return DEFAULTS;
    }

    /**
     * Combines an exception predicate and a result predicate.
     *
     * <p>For an attempt that ended with an exception only {@code retryOnException} is evaluated; for an attempt that
     * returned only {@code retryOnResult} is. A null predicate falls back to its default ({@link #ALWAYS_REJECT} for
     * exceptions, {@link #NEVER_REJECT} for results).
     *
     * @param retryOnException decides whether an exception is retryable, or null
     * @param retryOnResult decides whether a returned value is retryable, or null
     * @return the combined RejectStrategy
     */
    public static RejectStrategy of(Predicate<? super Throwable> retryOnException, Predicate<Object> retryOnResult) {
        Predicate<? super Throwable> onException = retryOnException != null ? retryOnException : ALWAYS_REJECT;
        Predicate<Object> onResult = retryOnResult != null ? retryOnResult : NEVER_REJECT;
        return attempt -> attempt.hasException()
                ? onException.test(attempt.getException())
                : onResult.test(attempt.getResult());
    }

    /**
     * Strategy that retries only exceptions of the given types (or their subtypes) and accepts any returned value.
     *
     * @param exceptionTypes the retryable exception types
     * @return RejectStrategy keyed on exception type
     */
    @SafeVarargs
    public static RejectStrategy retryOnExceptionTypes(Class<? extends Throwable>... exceptionTypes) {
        return of(exceptionTypePredicate(exceptionTypes), null);
    }

    /**
     * Builds an exception predicate matching instances of any of the given types.
     *
     * @param exceptionTypes the exception types, at least one
     * @return the predicate
     */
    @SafeVarargs
    public static Predicate<Throwable> exceptionTypePredicate(Class<? extends Throwable>... exceptionTypes) {
        ParameterValidator.validateNotNull(exceptionTypes, "exceptionTypes");
        if (exceptionTypes.length == 0) {
            throw new IllegalArgumentException("exceptionTypes must not be empty");
        }
        List<Class<? extends Throwable>> types = List.of(exceptionTypes);
        return error -> types.stream().anyMatch(type -> type.isInstance(error));
    }
}
