package com.example.requirements.infrastructure;

import com.example.requirements.domain.TerminalEncoding;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The terminal that the process is attached to.
 */
public class Terminal {
    private static final Logger log = LogManager.getLogger(Terminal.class);

    private final Map<String, String> environment;
    private final boolean consoleAttached;

    /**
     * @param environment     the environment variables of the process
     * @param consoleAttached true if the process is connected to an interactive console
     */
    public Terminal(Map<String, String> environment, boolean consoleAttached) {
        this.environment = Objects.requireNonNull(environment, "environment");
        this.consoleAttached = consoleAttached;
    }

    /**
     * @return the terminal of the current process
     */
    public static Terminal current() {
        return new Terminal(System.getenv(), System.console() != null);
    }

    /**
     * @return the encodings supported by the terminal, sorted by decreasing rank
     */
    public List<TerminalEncoding> getSupportedTypes() {
        List<TerminalEncoding> result = new ArrayList<>();
        result.add(TerminalEncoding.NONE);
        String term = environment.get("TERM");
        if (!consoleAttached) {
            log.debug("No console attached; colors disabled");
            return result;
        }
        if (term == null || term.equals("dumb")) {
            log.debug("TERM={}; colors disabled", term);
            return result;
        }
        result.add(TerminalEncoding.ANSI_16_COLORS);
        String colorTerm = environment.get("COLORTERM");
        if ("truecolor".equals(colorTerm) || "24bit".equals(colorTerm)) {
            log.debug("COLORTERM={}", colorTerm);
            result.add(TerminalEncoding.ANSI_256_COLORS);
            result.add(TerminalEncoding.ANSI_16MILLION_COLORS);
        } else if (term.contains("256color")) {
            log.debug("TERM={}", term);
            result.add(TerminalEncoding.ANSI_256_COLORS);
        }
        result.sort(TerminalEncoding.sortByDecreasingRank());
        return result;
    }

    /**
     * @return the encoding supporting the most colors
     */
    public TerminalEncoding getBestEncoding() {
        TerminalEncoding result = getSupportedTypes().get(0);
        log.debug("Best encoding: {}", result);
        return result;
    }
}
