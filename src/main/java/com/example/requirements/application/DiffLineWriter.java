package com.example.requirements.application;

import com.example.requirements.domain.Delta;
import com.example.requirements.domain.DiffResult;

import java.util.ArrayList;
import java.util.List;

/**
 * Lays out deltas as vertically aligned display lines.
 * <p>
 * Display line {@code N} holds line {@code N} of the actual value and line {@code N} of the expected
 * value. Equal text ends a line of both values, deleted text ends a line of the actual value only and
 * inserted text ends a line of the expected value only. Whenever text is written to one value, the
 * same display line of the other value receives padding of the same width.
 */
final class DiffLineWriter {
    private final ColorScheme colorScheme;
    private final List<LineBuilder> actualLines = new ArrayList<>();
    private final List<LineBuilder> expectedLines = new ArrayList<>();
    private final List<StringBuilder> diffLines = new ArrayList<>();
    private int actualLineNumber;
    private int expectedLineNumber;
    private boolean closed;

    DiffLineWriter(ColorScheme colorScheme) {
        this.colorScheme = colorScheme;
    }

    void write(Delta delta) {
        if (closed) {
            throw new IllegalStateException("Writer must be open");
        }
        String[] lines = DiffConstants.NEWLINE_PATTERN.split(delta.text(), -1);
        for (int i = 0; i < lines.length; ++i) {
            boolean endOfLine = i < lines.length - 1;
            String text = lines[i];
            if (endOfLine) {
                text += DiffConstants.NEWLINE_MARKER;
            }
            if (!text.isEmpty()) {
                append(delta.type(), text);
            }
            if (endOfLine) {
                writeNewline(delta.type());
            }
        }
    }

    /**
     * Marks the end of both values and returns the lines written so far.
     */
    DiffResult close() {
        if (closed) {
            throw new IllegalStateException("Writer was already closed");
        }
        append(Delta.Type.EQUAL, DiffConstants.EOS_MARKER);
        closed = true;

        List<String> actual = new ArrayList<>(actualLines.size());
        List<String> expected = new ArrayList<>(expectedLines.size());
        List<String> diff = new ArrayList<>(diffLines.size());
        for (int i = 0; i < actualLines.size(); ++i) {
            actual.add(actualLines.get(i).toLine());
            expected.add(expectedLines.get(i).toLine());
            if (colorScheme.rendersDiffLines()) {
                diff.add(diffLines.get(i).toString());
            }
        }
        return new DiffResult(actual, diff, expected, colorScheme.getPaddingMarker());
    }

    private void append(Delta.Type type, String text) {
        int width = text.codePointCount(0, text.length());
        switch (type) {
            case EQUAL -> {
                ensureLineExists(Math.max(actualLineNumber, expectedLineNumber));
                actualLines.get(actualLineNumber).append(Decoration.EQUAL, text);
                expectedLines.get(expectedLineNumber).append(Decoration.EQUAL, text);
                appendDiffSymbol(actualLineNumber, type, width);
                if (actualLineNumber != expectedLineNumber) {
                    expectedLines.get(actualLineNumber).appendPadding(width);
                    actualLines.get(expectedLineNumber).appendPadding(width);
                    appendDiffSymbol(expectedLineNumber, type, width);
                }
            }
            case DELETE -> {
                ensureLineExists(actualLineNumber);
                actualLines.get(actualLineNumber).append(Decoration.DELETED, text);
                expectedLines.get(actualLineNumber).appendPadding(width);
                appendDiffSymbol(actualLineNumber, type, width);
            }
            case INSERT -> {
                ensureLineExists(expectedLineNumber);
                actualLines.get(expectedLineNumber).appendPadding(width);
                expectedLines.get(expectedLineNumber).append(Decoration.INSERTED, text);
                appendDiffSymbol(expectedLineNumber, type, width);
            }
            default -> throw new AssertionError(type);
        }
    }

    private void writeNewline(Delta.Type type) {
        switch (type) {
            case EQUAL -> {
                ++actualLineNumber;
                ++expectedLineNumber;
            }
            case DELETE -> ++actualLineNumber;
            case INSERT -> ++expectedLineNumber;
            default -> throw new AssertionError(type);
        }
    }

    private void ensureLineExists(int lineNumber) {
        while (actualLines.size() <= lineNumber) {
            actualLines.add(new LineBuilder(colorScheme));
            expectedLines.add(new LineBuilder(colorScheme));
            diffLines.add(new StringBuilder());
        }
    }

    private void appendDiffSymbol(int lineNumber, Delta.Type type, int width) {
        if (colorScheme.rendersDiffLines()) {
            diffLines.get(lineNumber).append(String.valueOf(colorScheme.getDiffSymbol(type)).repeat(width));
        }
    }

    private enum Decoration {
        EQUAL,
        INSERTED,
        DELETED,
        PADDING
    }

    /**
     * One side of a display line, kept as runs of equally decorated text until the line is rendered.
     */
    private static final class LineBuilder {
        private final ColorScheme colorScheme;
        private final StringBuilder line = new StringBuilder();
        private final StringBuilder run = new StringBuilder();
        private Decoration runDecoration;
        private int runPadding;

        LineBuilder(ColorScheme colorScheme) {
            this.colorScheme = colorScheme;
        }

        void append(Decoration decoration, String text) {
            if (decoration != runDecoration) {
                flushRun();
                runDecoration = decoration;
            }
            run.append(text);
        }

        void appendPadding(int width) {
            if (runDecoration != Decoration.PADDING) {
                flushRun();
                runDecoration = Decoration.PADDING;
            }
            runPadding += width;
        }

        String toLine() {
            flushRun();
            return line.toString();
        }

        private void flushRun() {
            if (runDecoration == null) {
                return;
            }
            String text = run.toString();
            switch (runDecoration) {
                case EQUAL -> line.append(colorScheme.decorateEqualText(text));
                case INSERTED -> line.append(colorScheme.decorateInsertedText(text));
                case DELETED -> line.append(colorScheme.decorateDeletedText(text));
                case PADDING -> line.append(colorScheme.decoratePadding(runPadding));
                default -> throw new AssertionError(runDecoration);
            }
            run.setLength(0);
            runPadding = 0;
            runDecoration = null;
        }
    }
}
