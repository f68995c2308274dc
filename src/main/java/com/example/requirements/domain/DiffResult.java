package com.example.requirements.domain;

import lombok.Getter;

import java.util.List;
import java.util.Objects;

/**
 * The display lines produced by diffing two strings.
 */
@Getter
public class DiffResult {
    private final List<String> actualLines;
    /**
     * Lines to display between the actual and expected lines. Empty if the encoding does not
     * render diff symbols.
     */
    private final List<String> diffLines;
    private final List<String> expectedLines;
    private final char paddingMarker;

    public DiffResult(
            List<String> actualLines,
            List<String> diffLines,
            List<String> expectedLines,
            char paddingMarker) {
        Objects.requireNonNull(actualLines, "actualLines");
        Objects.requireNonNull(diffLines, "diffLines");
        Objects.requireNonNull(expectedLines, "expectedLines");
        if (actualLines.size() != expectedLines.size()) {
            throw new IllegalArgumentException(
                    "actualLines and expectedLines must have the same size.\n"
                            + "actualLines  : " + actualLines.size() + "\n"
                            + "expectedLines: " + expectedLines.size());
        }
        if (!diffLines.isEmpty() && diffLines.size() != actualLines.size()) {
            throw new IllegalArgumentException(
                    "diffLines must be empty or have the same size as actualLines.\n"
                            + "actualLines: " + actualLines.size() + "\n"
                            + "diffLines  : " + diffLines.size());
        }
        this.actualLines = List.copyOf(actualLines);
        this.diffLines = List.copyOf(diffLines);
        this.expectedLines = List.copyOf(expectedLines);
        this.paddingMarker = paddingMarker;
    }
}
