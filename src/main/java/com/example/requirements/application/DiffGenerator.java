package com.example.requirements.application;

import com.example.requirements.domain.Delta;
import com.example.requirements.domain.DiffResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;

/**
 * Generates the diff of two strings.
 * <p>
 * The result shows the actual value, the expected value and (for encodings without colors) a line of
 * diff symbols:
 * <pre>
 * Actual   = "The dog is brown"
 * Expected = "The fox is down"
 *
 * Actual  : The dog/// is br/own\0
 * Diff    : ====---+++====--+=====
 * Expected: The ///fox is //down\0
 * </pre>
 * Padding ({@code /} without colors) is not part of either value; it keeps the two values aligned.
 * Every value ends with {@code \0}, and {@code \n} replaces each line terminator. Display line
 * {@code N} holds line {@code N} of both values:
 * <pre>
 * Actual   = "\nactual"
 * Expected = "expected"
 *
 * Actual@0  : \n//////////
 * Diff      : --++++++++==
 * Expected@0: //expected\0
 *
 * Actual@1  : actual\0
 * Diff      : ------==
 * Expected  : ////////
 * </pre>
 */
public class DiffGenerator {
    private static final Logger log = LogManager.getLogger(DiffGenerator.class);

    private final ColorScheme colorScheme;

    public DiffGenerator(ColorScheme colorScheme) {
        this.colorScheme = Objects.requireNonNull(colorScheme, "colorScheme");
    }

    public ColorScheme getColorScheme() {
        return colorScheme;
    }

    /**
     * @param actual   the actual value
     * @param expected the expected value
     * @return the calculated diff
     * @throws NullPointerException if any of the arguments are null
     */
    public DiffResult diff(String actual, String expected) {
        Objects.requireNonNull(actual, "actual");
        Objects.requireNonNull(expected, "expected");

        List<Delta> deltas = calculateDeltas(actual, expected);
        DiffLineWriter writer = new DiffLineWriter(colorScheme);
        for (Delta delta : deltas) {
            writer.write(delta);
        }
        DiffResult result = writer.close();
        log.debug(
                "Diffed {} against {} characters: {} deltas, {} lines, encoding {}",
                actual.length(),
                expected.length(),
                deltas.size(),
                result.getActualLines().size(),
                colorScheme.getEncoding());
        return result;
    }

    /**
     * @param actual   the actual value
     * @param expected the expected value
     * @return the edit script that turns {@code actual} into {@code expected}
     * @throws NullPointerException if any of the arguments are null
     */
    public List<Delta> calculateDeltas(String actual, String expected) {
        Objects.requireNonNull(actual, "actual");
        Objects.requireNonNull(expected, "expected");
        return DeltaCalculator.calculate(actual, expected);
    }

    /**
     * @param line a line returned by {@link #diff(String, String)}
     * @return true if the line contains padding only
     */
    public boolean isEmpty(String line) {
        return colorScheme.isPadding(line);
    }
}
