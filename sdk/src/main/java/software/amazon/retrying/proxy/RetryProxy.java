// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retrying.proxy;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Proxy;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import software.amazon.retrying.RetryConfig;
import software.amazon.retrying.Retryer;
import software.amazon.retrying.stop.StopStrategies;
import software.amazon.retrying.stop.StopStrategy;
import software.amazon.retrying.util.ExceptionHelper;
import software.amazon.retrying.validation.ParameterValidator;
import software.amazon.retrying.wait.WaitStrategies;
import software.amazon.retrying.wait.WaitStrategy;
import software.amazon.retrying.wait.WaitType;

/**
 * Decorates an interface implementation so that methods annotated with {@link Retryable} run through a
 * {@link Retryer}. Methods without the annotation, and the methods of {@link Object}, are forwarded directly.
 *
 * <p>Each annotated method gets its own retryer, built when the proxy is created so that invalid annotation attributes
 * fail in {@code create} rather than on the first call. Exceptions thrown by the target reach the caller unchanged, as
 * they would without the proxy.
 */
public final class RetryProxy {

    private RetryProxy() {}

    /**
     * Creates a retrying proxy.
     *
     * @param type the interface to proxy
     * @param target the implementation to decorate
     * @return a proxy implementing {@code type}
     */
    public static <T> T create(Class<T> type, T target) {
        return create(type, target, RetryConfig.defaultConfig());
    }

    /**
     * Creates a retrying proxy whose retryers start from {@code baseConfig}. Annotation attributes that are set override
     * its stop, wait, jitter, wrapping and exception settings; unset attributes keep the base values. Clock, sleeper,
     * listeners and logger settings always come from the base.
     *
     * @param type the interface to proxy
     * @param target the implementation to decorate
     * @param baseConfig configuration the per-method retryers are derived from
     * @return a proxy implementing {@code type}
     * @throws IllegalArgumentException if {@code type} is not an interface or a {@link Retryable} attribute is invalid
     */
    public static <T> T create(Class<T> type, T target, RetryConfig baseConfig) {
        ParameterValidator.validateNotNull(type, "type");
        ParameterValidator.validateNotNull(target, "target");
        ParameterValidator.validateNotNull(baseConfig, "baseConfig");
        if (!type.isInterface()) {
            throw new IllegalArgumentException("type must be an interface, got: " + type.getName());
        }
        var handler = new RetryInvocationHandler(type, target, baseConfig);
        return type.cast(Proxy.newProxyInstance(type.getClassLoader(), new Class<?>[] {type}, handler));
    }

    static RetryConfig toRetryConfig(Retryable retryable, String defaultName, RetryConfig baseConfig) {
        var builder = baseConfig.toBuilder().withName(retryable.name().isEmpty() ? defaultName : retryable.name());
        var stopStrategy = toStopStrategy(retryable);
        if (stopStrategy != null) {
            builder.withStopStrategy(stopStrategy);
        }
        if (retryable.waitType() != WaitType.NONE) {
            builder.withWaitStrategy(toWaitStrategy(retryable));
        }
        if (retryable.waitJitterMaxMillis() > 0) {
            builder.withWaitJitterMax(Duration.ofMillis(retryable.waitJitterMaxMillis()));
        }
        if (retryable.wrapException()) {
            builder.withWrapException(true);
        }
        if (retryable.retryOn().length > 0) {
            builder.withRejectStrategy(null).withRetryOnExceptionTypes(retryable.retryOn());
        }
        return builder.build();
    }

    private static StopStrategy toStopStrategy(Retryable retryable) {
        var strategies = new ArrayList<StopStrategy>();
        if (retryable.stopAfterAttempt() != -1) {
            strategies.add(StopStrategies.afterAttempt(retryable.stopAfterAttempt()));
        }
        if (retryable.stopAfterDelayMillis() != -1) {
            strategies.add(StopStrategies.afterDelay(Duration.ofMillis(retryable.stopAfterDelayMillis())));
        }
        return strategies.isEmpty() ? null : StopStrategies.anyOf(strategies.toArray(new StopStrategy[0]));
    }

    private static WaitStrategy toWaitStrategy(Retryable retryable) {
        return switch (retryable.waitType()) {
            case NONE -> WaitStrategies.none();
            case FIXED -> WaitStrategies.fixed(Duration.ofMillis(retryable.waitMillis()));
            case RANDOM -> WaitStrategies.random(
                    Duration.ofMillis(retryable.waitMinMillis()), Duration.ofMillis(retryable.waitRandomMaxMillis()));
            case INCREMENTING -> WaitStrategies.incrementing(
                    Duration.ofMillis(retryable.waitStartMillis()),
                    Duration.ofMillis(retryable.waitIncrementMillis()),
                    Duration.ofMillis(retryable.waitMaxMillis()));
            case EXPONENTIAL -> WaitStrategies.exponential(
                    Duration.ofMillis(retryable.waitMultiplierMillis()),
                    Duration.ofMillis(retryable.waitMaxMillis()),
                    retryable.waitExponentialBase());
        };
    }

    private static final class RetryInvocationHandler implements InvocationHandler {
        private final Class<?> type;
        private final Object target;
        private final RetryConfig baseConfig;
        private final Map<Method, Retryer> retryers = new ConcurrentHashMap<>();

        RetryInvocationHandler(Class<?> type, Object target, RetryConfig baseConfig) {
            this.type = type;
            this.target = target;
            this.baseConfig = baseConfig;
            for (var method : type.getMethods()) {
                var retryable = findAnnotation(method);
                if (retryable != null && method.getDeclaringClass() != Object.class) {
                    retryers.put(method, Retryer.create(toRetryConfig(retryable, method.getName(), baseConfig)));
                }
            }
        }

        @Override
        public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
            if (method.getDeclaringClass() == Object.class) {
                return invokeObjectMethod(proxy, method, args);
            }
            var retryable = findAnnotation(method);
            if (retryable == null) {
                return invokeTarget(method, args);
            }
            var retryer = retryers.computeIfAbsent(
                    method, m -> Retryer.create(toRetryConfig(retryable, m.getName(), baseConfig)));
            return retryer.execute(() -> invokeTarget(method, args));
        }

        private Retryable findAnnotation(Method method) {
            var onMethod = method.getAnnotation(Retryable.class);
            if (onMethod != null) {
                return onMethod;
            }
            var onDeclaringType = method.getDeclaringClass().getAnnotation(Retryable.class);
            return onDeclaringType != null ? onDeclaringType : type.getAnnotation(Retryable.class);
        }

        private Object invokeObjectMethod(Object proxy, Method method, Object[] args) throws Exception {
            switch (method.getName()) {
                case "equals":
                    return proxy == args[0];
                case "hashCode":
                    return System.identityHashCode(proxy);
                case "toString":
                    return "RetryProxy{" + type.getName() + " -> " + target + "}";
                default:
                    return invokeTarget(method, args);
            }
        }

        private Object invokeTarget(Method method, Object[] args) throws Exception {
            if (!Modifier.isPublic(method.getDeclaringClass().getModifiers())) {
                method.setAccessible(true);
            }
            try {
                return method.invoke(target, args);
            } catch (InvocationTargetException e) {
                ExceptionHelper.sneakyThrow(ExceptionHelper.unwrapReflection(e));
                return null;
            }
        }
    }
}
