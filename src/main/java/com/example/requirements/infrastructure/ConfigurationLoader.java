package com.example.requirements.infrastructure;

import com.example.requirements.application.Configuration;
import com.example.requirements.domain.TerminalEncoding;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Builds the default configuration from system properties, falling back to the terminal the
 * process runs in.
 * <ul>
 *     <li>{@code requirements.diff}: {@code true} or {@code false}</li>
 *     <li>{@code requirements.terminal-encoding}: the name of a {@link TerminalEncoding}</li>
 *     <li>{@code requirements.terminal-width}: the number of characters per line</li>
 * </ul>
 */
public class ConfigurationLoader {
    public static final String DIFF_PROPERTY = "requirements.diff";
    public static final String TERMINAL_ENCODING_PROPERTY = "requirements.terminal-encoding";
    public static final String TERMINAL_WIDTH_PROPERTY = "requirements.terminal-width";
    private static final Logger log = LogManager.getLogger(ConfigurationLoader.class);

    private final Properties properties;
    private final Map<String, String> environment;
    private final Terminal terminal;

    public ConfigurationLoader(Properties properties, Map<String, String> environment, Terminal terminal) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.environment = Objects.requireNonNull(environment, "environment");
        this.terminal = Objects.requireNonNull(terminal, "terminal");
    }

    /**
     * @return a loader that reads the properties and environment of the current process
     */
    public static ConfigurationLoader fromSystem() {
        return new ConfigurationLoader(System.getProperties(), System.getenv(), Terminal.current());
    }

    /**
     * @return the configuration
     * @throws IllegalArgumentException if a property has an invalid value
     */
    public Configuration load() {
        Configuration result = new Configuration()
                .withTerminalEncoding(loadTerminalEncoding())
                .withTerminalWidth(loadTerminalWidth());
        if (!loadDiffEnabled()) {
            result = result.withoutDiff();
        }
        log.debug(
                "Loaded configuration: diff={}, encoding={}, width={}",
                result.isDiffEnabled(),
                result.getTerminalEncoding(),
                result.getTerminalWidth());
        return result;
    }

    private boolean loadDiffEnabled() {
        String value = properties.getProperty(DIFF_PROPERTY);
        if (value == null) {
            return true;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "true" -> true;
            case "false" -> false;
            default -> throw new IllegalArgumentException(
                    DIFF_PROPERTY + " must be true or false.\nActual: " + value);
        };
    }

    private TerminalEncoding loadTerminalEncoding() {
        String value = properties.getProperty(TERMINAL_ENCODING_PROPERTY);
        if (value == null) {
            return terminal.getBestEncoding();
        }
        try {
            return TerminalEncoding.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    TERMINAL_ENCODING_PROPERTY + " must be one of "
                            + Arrays.toString(TerminalEncoding.values()) + ".\nActual: " + value,
                    e);
        }
    }

    private int loadTerminalWidth() {
        String value = properties.getProperty(TERMINAL_WIDTH_PROPERTY);
        if (value != null) {
            return parseWidth(TERMINAL_WIDTH_PROPERTY, value);
        }
        String columns = environment.get("COLUMNS");
        if (columns != null) {
            try {
                return parseWidth("COLUMNS", columns);
            } catch (IllegalArgumentException e) {
                log.debug("Ignoring COLUMNS={}", columns, e);
            }
        }
        return Configuration.DEFAULT_TERMINAL_WIDTH;
    }

    private static int parseWidth(String name, String value) {
        int width;
        try {
            width = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer.\nActual: " + value, e);
        }
        if (width <= 0) {
            throw new IllegalArgumentException(name + " must be positive.\nActual: " + value);
        }
        return width;
    }
}
