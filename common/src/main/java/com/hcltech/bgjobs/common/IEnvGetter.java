package com.hcltech.bgjobs.common;

import com.hcltech.bgjobs.common.errorsor.ErrorsOr;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;

/**
 * Abstraction for reading environment variables or configuration values.
 * <p>
 * Used to avoid direct calls to {@link System#getenv(String)} in code,
 * so that unit tests can provide their own environment source.
 * <p>
 * The typed getters return {@link ErrorsOr} rather than throwing, so a caller reading
 * several variables can report every problem at once.
 */
@FunctionalInterface
public interface IEnvGetter {
    /**
     * Default implementation backed by {@link System#getenv(String)}.
     */
    IEnvGetter env = System::getenv;

    /**
     * Returns the value of the given environment variable, or {@code null} if unset.
     */
    String get(String name);

    static IEnvGetter fromMap(Map<String, String> map) {
        return map::get;
    }

    // ------------------------------------------------------------------------
    // Required getters (error if missing or blank)
    // ------------------------------------------------------------------------

    static ErrorsOr<String> string(IEnvGetter env, String name) {
        String value = env.get(name);
        if (value == null || value.isBlank()) {
            return ErrorsOr.error("Missing required environment variable: " + name);
        }
        return ErrorsOr.lift(value);
    }

    static ErrorsOr<Integer> intValue(IEnvGetter env, String name) {
        return string(env, name).flatMap(value -> parseInt(name, value));
    }

    // ------------------------------------------------------------------------
    // Optional getters (default fallback when missing or blank)
    // ------------------------------------------------------------------------

    static ErrorsOr<String> stringOr(IEnvGetter env, String name, String defaultValue) {
        String value = env.get(name);
        return ErrorsOr.lift((value != null && !value.isBlank()) ? value : defaultValue);
    }

    static ErrorsOr<Integer> intOr(IEnvGetter env, String name, int defaultValue) {
        String value = env.get(name);
        if (value == null || value.isBlank()) return ErrorsOr.lift(defaultValue);
        return parseInt(name, value);
    }

    /** Only "true" or "false" (any case) are accepted; anything else is an error rather than a silent false. */
    static ErrorsOr<Boolean> booleanOr(IEnvGetter env, String name, boolean defaultValue) {
        String value = env.get(name);
        if (value == null || value.isBlank()) return ErrorsOr.lift(defaultValue);
        String trimmed = value.trim();
        if (trimmed.equalsIgnoreCase("true")) return ErrorsOr.lift(true);
        if (trimmed.equalsIgnoreCase("false")) return ErrorsOr.lift(false);
        return ErrorsOr.error("Invalid boolean for environment variable: " + name + " = '" + value + "'");
    }

    static <E extends Enum<E>> ErrorsOr<E> enumOr(IEnvGetter env, String name, Class<E> type, E defaultValue) {
        String value = env.get(name);
        if (value == null || value.isBlank()) return ErrorsOr.lift(defaultValue);
        try {
            return ErrorsOr.lift(Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return ErrorsOr.error("Invalid value for environment variable: " + name + " = '" + value
                    + "', expected one of " + Arrays.toString(type.getEnumConstants()));
        }
    }

    private static ErrorsOr<Integer> parseInt(String name, String value) {
        try {
            return ErrorsOr.lift(Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
            return ErrorsOr.error("Invalid integer for environment variable: " + name + " = '" + value + "'");
        }
    }
}
