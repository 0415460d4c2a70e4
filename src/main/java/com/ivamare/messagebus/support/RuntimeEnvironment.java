package com.ivamare.messagebus.support;

import java.util.Locale;
import java.util.Set;

/**
 * Environment the application runs in, as named by the {@code ENV} variable or
 * by {@code messagebus.environment}.
 *
 * <p>Only production changes behaviour: failure logs drop their stack traces.
 */
public enum RuntimeEnvironment {

    DEVELOPMENT("dev", "development"),
    STAGING("staging"),
    TEST("test"),
    PRODUCTION("prod", "production"),
    UNKNOWN;

    /**
     * Environment variable consulted by {@link #current()}.
     */
    public static final String ENV_VARIABLE = "ENV";

    private final Set<String> names;

    RuntimeEnvironment(String... names) {
        this.names = Set.of(names);
    }

    /**
     * Resolve an environment name, ignoring case and surrounding whitespace.
     *
     * @param name Name such as "prod" or "Development"; may be null
     * @return The environment, {@link #UNKNOWN} if the name is null or unrecognised
     */
    public static RuntimeEnvironment fromName(String name) {
        if (name == null) {
            return UNKNOWN;
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (RuntimeEnvironment environment : values()) {
            if (environment.names.contains(normalized)) {
                return environment;
            }
        }
        return UNKNOWN;
    }

    /**
     * @return The environment named by the {@code ENV} variable
     */
    public static RuntimeEnvironment current() {
        return fromName(System.getenv(ENV_VARIABLE));
    }

    public boolean isProduction() {
        return this == PRODUCTION;
    }
}
