package com.example.requirements;

import com.example.requirements.application.Configuration;
import com.example.requirements.application.ContextGenerator;
import com.example.requirements.application.DiffGenerator;
import com.example.requirements.infrastructure.ColorSchemes;
import com.example.requirements.infrastructure.ConfigurationLoader;

import java.util.Objects;

/**
 * Verifies requirements, throwing {@code IllegalArgumentException} on failure.
 * <p>
 * Example: {@code new Requirements().requireThat(name, "name").isEqualTo("Alice");}
 */
public final class Requirements {
    private final Configuration config;

    /**
     * Creates requirements configured from system properties and the current terminal.
     */
    public Requirements() {
        this(ConfigurationLoader.fromSystem().load());
    }

    public Requirements(Configuration config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public Configuration getConfiguration() {
        return config;
    }

    /**
     * @param value the value to verify
     * @param name  the name of the value
     * @param <T>   the type of the value
     * @return a verifier for the value
     * @throws NullPointerException     if {@code name} is null
     * @throws IllegalArgumentException if {@code name} is empty
     */
    public <T> ObjectRequirement<T> requireThat(T value, String name) {
        Objects.requireNonNull(name, "name");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("name may not be empty");
        }
        DiffGenerator diffGenerator = new DiffGenerator(ColorSchemes.forEncoding(config.getTerminalEncoding()));
        return new ObjectRequirement<>(config, new ContextGenerator(config, diffGenerator), value, name);
    }
}
