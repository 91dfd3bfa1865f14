// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retrying.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import software.amazon.retrying.RetryConfig;
import software.amazon.retrying.validation.ParameterValidator;

/**
 * Declarative form of a {@link RetryConfig}, as read from a JSON document by {@link RetryPolicies}.
 *
 * <pre>{@code
 * {
 *   "name": "inventory-client",
 *   "stop": { "afterAttempt": 5, "afterDelay": "PT30S" },
 *   "wait": { "type": "EXPONENTIAL", "multiplier": "PT0.1S", "max": "PT10S" },
 *   "waitJitterMax": "PT0.05S",
 *   "wrapException": false,
 *   "retryOn": [ "java.io.IOException" ]
 * }
 * }</pre>
 *
 * <p>Result predicates, attempt listeners, clock and sleeper have no textual form; set them on the builder returned by
 * {@link #toRetryConfig()}.
 *
 * @param name retry name used in logs, optional
 * @param stopPolicy stop condition, required
 * @param waitPolicy wait between attempts, optional (no wait)
 * @param waitJitterMax upper bound of the random jitter, optional
 * @param wrapException whether to wrap the last exception when giving up, optional (false)
 * @param retryOn fully qualified names of the retryable exception types, optional (all exceptions)
 */
public record RetryPolicy(
        String name,
        @JsonProperty("stop") StopPolicy stopPolicy,
        @JsonProperty("wait") WaitPolicy waitPolicy,
        Duration waitJitterMax,
        Boolean wrapException,
        List<String> retryOn) {

    /**
     * Converts this policy into a configuration builder.
     *
     * @return a builder holding every setting of this policy
     * @throws IllegalArgumentException if the policy is incomplete or names an unknown exception type
     */
    public RetryConfig.Builder toRetryConfig() {
        ParameterValidator.validateNotNull(stopPolicy, "stop");
        var builder = RetryConfig.builder()
                .withStopStrategy(stopPolicy.toStopStrategy())
                .withWaitJitterMax(waitJitterMax)
                .withWrapException(Boolean.TRUE.equals(wrapException));
        if (name != null) {
            builder.withName(name);
        }
        if (waitPolicy != null) {
            builder.withWaitStrategy(waitPolicy.toWaitStrategy());
        }
        if (retryOn != null && !retryOn.isEmpty()) {
            builder.withRetryOnExceptionTypes(resolveExceptionTypes(retryOn));
        }
        return builder;
    }

    @SuppressWarnings("unchecked")
    private static Class<? extends Throwable>[] resolveExceptionTypes(List<String> classNames) {
        var loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = RetryPolicy.class.getClassLoader();
        }
        var types = new ArrayList<Class<? extends Throwable>>();
        for (var className : classNames) {
            Class<?> type;
            try {
                type = Class.forName(className, false, loader);
            } catch (ClassNotFoundException e) {
                throw new IllegalArgumentException("Unknown exception type in retryOn: " + className, e);
            }
            if (!Throwable.class.isAssignableFrom(type)) {
                throw new IllegalArgumentException("retryOn type is not a Throwable: " + className);
            }
            types.add((Class<? extends Throwable>) type);
        }
        return types.toArray(new Class[0]);
    }
}
