// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.retrying.util;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.UndeclaredThrowableException;

/** Utility class for handling exceptions */
public final class ExceptionHelper {

    private ExceptionHelper() {}

    /**
     * Throws any exception as if it were unchecked using type erasure. This preserves the original exception type and
     * stack trace.
     *
     * @param exception the exception to throw
     * @param <T> the exception type (erased at runtime)
     * @throws T the exception as an unchecked exception
     */
    @SuppressWarnings("unchecked")
    public static <T extends Throwable> void sneakyThrow(Throwable exception) throws T {
        throw (T) exception;
    }

    /**
     * unwrap the exception that is wrapped by reflective invocation
     *
     * @param throwable the throwable to unwrap
     * @return the original Throwable thrown by the invoked method
     */
    public static Throwable unwrapReflection(Throwable throwable) {
        while (true) {
            if (throwable instanceof InvocationTargetException ite && ite.getCause() != null) {
                throwable = ite.getCause();
            } else if (throwable instanceof UndeclaredThrowableException ute && ute.getCause() != null) {
                throwable = ute.getCause();
            } else {
                return throwable;
            }
        }
    }

    /**
     * Short description of a throwable for log lines and messages: {@code type: message}.
     *
     * @param throwable the throwable to describe
     * @return the description
     */
    public static String describe(Throwable throwable) {
        if (throwable == null) {
            return "null";
        }
        var message = throwable.getMessage();
        return message == null
                ? throwable.getClass().getName()
                : throwable.getClass().getName() + ": " + message;
    }
}
