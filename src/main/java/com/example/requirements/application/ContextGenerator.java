package com.example.requirements.application;

import com.example.requirements.domain.ContextLine;
import com.example.requirements.domain.Delta;
import com.example.requirements.domain.DiffResult;
import com.example.requirements.domain.ValueKind;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Returns the difference between two values as the context of a failure message.
 */
public class ContextGenerator {
    private static final Logger log = LogManager.getLogger(ContextGenerator.class);
    static final String DIFF_LABEL = "Diff";
    static final String SKIPPED_LINES = "[...]";

    private final Configuration config;
    private final DiffGenerator diffGenerator;

    public ContextGenerator(Configuration config, DiffGenerator diffGenerator) {
        this.config = Objects.requireNonNull(config, "config");
        this.diffGenerator = Objects.requireNonNull(diffGenerator, "diffGenerator");
    }

    /**
     * @param actualName               the name of the actual value
     * @param actualValue              the actual value
     * @param expectedName             the name of the expected value
     * @param expectedValue            the expected value
     * @param expectedAlreadyInMessage true if the failure message already mentions the expected value
     * @return the name-value pairs to append to the failure message
     * @throws NullPointerException     if {@code actualName} or {@code expectedName} are null
     * @throws IllegalArgumentException if {@code actualName} or {@code expectedName} are empty
     */
    public List<ContextLine> getContext(
            String actualName,
            Object actualValue,
            String expectedName,
            Object expectedValue,
            boolean expectedAlreadyInMessage) {
        return getContextForObjects(
                actualName, actualValue, expectedName, expectedValue, expectedAlreadyInMessage, true);
    }

    private List<ContextLine> getContextForObjects(
            String actualName,
            Object actualValue,
            String expectedName,
            Object expectedValue,
            boolean expectedAlreadyInMessage,
            boolean mayCompareTypes) {
        requireThatNameIsValid(actualName, "actualName");
        requireThatNameIsValid(expectedName, "expectedName");

        ValueKind actualKind = ValueKind.of(actualValue);
        ValueKind expectedKind = ValueKind.of(expectedValue);
        if (actualKind == ValueKind.ARRAY && expectedKind == ValueKind.ARRAY) {
            return getContextForArrays(
                    actualName, actualValue, expectedName, expectedValue, expectedAlreadyInMessage);
        }
        // Don't diff booleans
        if (actualKind == ValueKind.BOOLEAN || !config.isDiffEnabled()) {
            return getFlatContext(
                    actualName, actualValue, expectedName, expectedValue, expectedAlreadyInMessage);
        }
        String actualAsString = config.convertToString(actualValue);
        String expectedAsString = config.convertToString(expectedValue);
        DiffResult diff = diffGenerator.diff(actualAsString, expectedAsString);
        List<String> actualLines = diff.getActualLines();
        List<String> expectedLines = diff.getExpectedLines();
        List<String> diffLines = diff.getDiffLines();
        requireThatNumberOfLinesAreEqual(actualLines, expectedLines);

        if (actualLines.size() == 1) {
            log.trace("Comparing {} to {} on a single line", actualName, expectedName);
            String actualLine = actualLines.get(0);
            String expectedLine = expectedLines.get(0);
            String diffLine = diffLines.isEmpty() ? "" : diffLines.get(0);
            boolean linesAreEqual = linesAreEqual(actualLine, expectedLine, diffLine);

            List<ContextLine> result = new ArrayList<>();
            result.add(ContextLine.separator());
            result.add(new ContextLine(actualName, actualLine));
            if (!diffLine.isEmpty() && !linesAreEqual) {
                result.add(new ContextLine(DIFF_LABEL, diffLine));
            }
            result.add(new ContextLine(expectedName, expectedLine));
            if (mayCompareTypes && linesAreEqual) {
                // The string representations match, so show the types if they differ
                result.addAll(compareTypes(actualName, actualValue, expectedName, expectedValue));
            }
            return result;
        }
        log.trace("Comparing {} to {} across {} lines", actualName, expectedName, actualLines.size());
        return getContextForLines(actualName, expectedName, actualLines, expectedLines, diffLines);
    }

    private List<ContextLine> getContextForLines(
            String actualName,
            String expectedName,
            List<String> actualLines,
            List<String> expectedLines,
            List<String> diffLines) {
        List<ContextLine> result = new ArrayList<>();
        int numberOfLines = actualLines.size();
        boolean skippedDuplicates = false;
        for (int i = 0; i < numberOfLines; ++i) {
            String actualLine = actualLines.get(i);
            String expectedLine = expectedLines.get(i);
            String diffLine = diffLines.isEmpty() ? "" : diffLines.get(i);
            boolean currentLineIsEqual = linesAreEqual(actualLine, expectedLine, diffLine);
            if (i != 0 && i != numberOfLines - 1 && currentLineIsEqual) {
                // Skip identical lines, unless they are the first or last line
                skippedDuplicates = true;
                continue;
            }
            // Display line i holds line i of each value, or padding past the end of a value
            String actualNameForLine = getNameForLine(actualName, actualLine, i);
            String expectedNameForLine = getNameForLine(expectedName, expectedLine, i);
            if (skippedDuplicates) {
                skippedDuplicates = false;
                skipDuplicateLines(result);
            }
            result.add(ContextLine.separator());
            result.add(new ContextLine(actualNameForLine, actualLine));
            if (!diffLine.isEmpty() && !currentLineIsEqual) {
                result.add(new ContextLine(DIFF_LABEL, diffLine));
            }
            result.add(new ContextLine(expectedNameForLine, expectedLine));
        }
        return result;
    }

    private List<ContextLine> getContextForArrays(
            String actualName,
            Object actualValue,
            String expectedName,
            Object expectedValue,
            boolean expectedAlreadyInMessage) {
        if (!config.isDiffEnabled()) {
            return getFlatContext(
                    actualName, actualValue, expectedName, expectedValue, expectedAlreadyInMessage);
        }
        List<?> actualElements = toList(actualValue);
        List<?> expectedElements = toList(expectedValue);
        int actualSize = actualElements.size();
        int expectedSize = expectedElements.size();
        int maxSize = Math.max(actualSize, expectedSize);
        log.trace("Comparing {} to {} element by element ({} vs {})", actualName, expectedName, actualSize,
                expectedSize);

        List<ContextLine> result = new ArrayList<>();
        boolean skippedDuplicates = false;
        for (int i = 0; i < maxSize; ++i) {
            boolean elementsAreEqual = true;
            String actualValueAsString;
            String actualNameForElement;
            if (i < actualSize) {
                actualValueAsString = config.convertToString(actualElements.get(i));
                actualNameForElement = actualName + "[" + i + "]";
            } else {
                actualValueAsString = "";
                actualNameForElement = actualName;
                elementsAreEqual = false;
            }
            String expectedValueAsString;
            String expectedNameForElement;
            if (i < expectedSize) {
                expectedValueAsString = config.convertToString(expectedElements.get(i));
                expectedNameForElement = expectedName + "[" + i + "]";
            } else {
                expectedValueAsString = "";
                expectedNameForElement = expectedName;
                elementsAreEqual = false;
            }
            if (elementsAreEqual) {
                elementsAreEqual = Objects.deepEquals(actualElements.get(i), expectedElements.get(i));
            }
            if (i != 0 && i != maxSize - 1 && elementsAreEqual) {
                // Skip identical elements, unless they are the first or last element
                skippedDuplicates = true;
                continue;
            }
            if (skippedDuplicates) {
                skippedDuplicates = false;
                skipDuplicateLines(result);
            }
            result.addAll(
                    getContextForObjects(
                            actualNameForElement,
                            actualValueAsString,
                            expectedNameForElement,
                            expectedValueAsString,
                            false,
                            false));
        }
        return result;
    }

    private List<ContextLine> getFlatContext(
            String actualName,
            Object actualValue,
            String expectedName,
            Object expectedValue,
            boolean expectedAlreadyInMessage) {
        List<ContextLine> result = new ArrayList<>();
        result.add(new ContextLine(actualName, config.convertToString(actualValue)));
        if (!expectedAlreadyInMessage) {
            result.add(new ContextLine(expectedName, config.convertToString(expectedValue)));
        }
        return result;
    }

    private List<ContextLine> compareTypes(
            String actualName, Object actualValue, String expectedName, Object expectedValue) {
        String actualType = getTypeName(actualValue);
        String expectedType = getTypeName(expectedValue);
        if (actualType.equals(expectedType)) {
            return List.of();
        }
        return getContextForObjects(
                actualName + ".class", actualType, expectedName + ".class", expectedType, false, false);
    }

    private static String getTypeName(Object value) {
        if (value == null) {
            return "null";
        }
        return value.getClass().getName();
    }

    private static List<?> toList(Object value) {
        if (value instanceof List<?> list) {
            return list;
        }
        int length = Array.getLength(value);
        List<Object> result = new ArrayList<>(length);
        for (int i = 0; i < length; ++i) {
            result.add(Array.get(value, i));
        }
        return result;
    }

    /**
     * @return true if the lines being compared are equal to each other
     */
    private boolean linesAreEqual(String actualLine, String expectedLine, String diffLine) {
        if (!diffLine.isEmpty()) {
            char equal = diffGenerator.getColorScheme().getDiffSymbol(Delta.Type.EQUAL);
            return diffLine.chars().allMatch(c -> c == equal);
        }
        return actualLine.equals(expectedLine);
    }

    private String getNameForLine(String name, String line, int lineNumber) {
        if (diffGenerator.isEmpty(line)) {
            return name;
        }
        return name + "@" + lineNumber;
    }

    /**
     * Marks the lines omitted since the last displayed line.
     */
    private static void skipDuplicateLines(List<ContextLine> context) {
        context.add(ContextLine.separator());
        context.add(new ContextLine("", SKIPPED_LINES));
    }

    private static void requireThatNumberOfLinesAreEqual(List<String> actualLines, List<String> expectedLines) {
        if (actualLines.size() != expectedLines.size()) {
            throw new AssertionError(
                    "actualLines.size() != expectedLines.size()\n"
                            + "actualLines  : " + actualLines.size() + "\n"
                            + "expectedLines: " + expectedLines.size());
        }
    }

    private static void requireThatNameIsValid(String name, String parameterName) {
        Objects.requireNonNull(name, parameterName);
        if (name.isEmpty()) {
            throw new IllegalArgumentException(parameterName + " may not be empty");
        }
    }
}
