package io.kubeclient.util;

import org.jspecify.annotations.Nullable;

/**
 * Argument checks shared by every module.
 */
public final class Assert {

    private Assert() {
    }

    /**
     * Checks that a parameter is not {@code null}.
     *
     * @param name the parameter name, used in the exception message
     * @param value the parameter value
     * @param <T> the parameter type
     * @return the value, never {@code null}
     * @throws IllegalArgumentException if {@code value} is {@code null}
     */
    public static <T> T checkNotNullParam(String name, @Nullable T value) {
        if (value == null) {
            throw new IllegalArgumentException("Parameter '" + name + "' may not be null");
        }
        return value;
    }

    /**
     * Checks that a string parameter is neither {@code null} nor blank.
     *
     * @param name the parameter name, used in the exception message
     * @param value the parameter value
     * @return the value
     * @throws IllegalArgumentException if {@code value} is {@code null} or blank
     */
    public static String checkNotBlankParam(String name, @Nullable String value) {
        checkNotNullParam(name, value);
        if (value.isBlank()) {
            throw new IllegalArgumentException("Parameter '" + name + "' may not be blank");
        }
        return value;
    }
}
