package com.example.requirements.application;

import com.example.requirements.domain.Delta;
import com.github.difflib.DiffUtils;
import com.github.difflib.patch.AbstractDelta;
import com.github.difflib.patch.DeltaType;
import com.github.difflib.patch.Patch;

import java.util.ArrayList;
import java.util.List;

/**
 * Calculates the edit script that turns the actual value into the expected value.
 * <p>
 * The values are compared word by word. A word replaced by another word is compared character by
 * character, and the result is kept only if it contains a single change; otherwise the whole word is
 * deleted and its replacement inserted. Within every change, deleted text precedes inserted text.
 */
final class DeltaCalculator {
    private DeltaCalculator() {
    }

    static List<Delta> calculate(String actual, String expected) {
        List<String> actualTokens = WordTokenizer.tokenize(actual);
        List<String> expectedTokens = WordTokenizer.tokenize(expected);
        DeltaListBuilder builder = new DeltaListBuilder();
        int actualIndex = 0;
        for (ChangeRegion region : diff(actualTokens, expectedTokens)) {
            builder.equal(join(actualTokens, actualIndex, region.actualStart()));
            List<String> deleted = actualTokens.subList(region.actualStart(), region.actualEnd());
            List<String> inserted = expectedTokens.subList(region.expectedStart(), region.expectedEnd());
            if (isWordReplacement(deleted, inserted)) {
                reduceWord(deleted.get(0), inserted.get(0), builder);
            } else {
                builder.delete(String.join("", deleted));
                builder.insert(String.join("", inserted));
            }
            actualIndex = region.actualEnd();
        }
        builder.equal(join(actualTokens, actualIndex, actualTokens.size()));
        return builder.build();
    }

    /**
     * Returns the regions that differ between two sequences.
     * <p>
     * The patch turns {@code expected} into {@code actual}. Among edit scripts of equal length this
     * prefers the one that keeps the leading units of {@code actual}, e.g. {@code foo} when comparing
     * {@code foo\nbar} to {@code bar\nfoo}.
     */
    private static List<ChangeRegion> diff(List<String> actual, List<String> expected) {
        return ChangeRegion.of(DiffUtils.diff(expected, actual));
    }

    private static boolean isWordReplacement(List<String> deleted, List<String> inserted) {
        return deleted.size() == 1
                && inserted.size() == 1
                && WordTokenizer.isWord(deleted.get(0))
                && WordTokenizer.isWord(inserted.get(0));
    }

    private static void reduceWord(String actualWord, String expectedWord, DeltaListBuilder builder) {
        List<String> actualChars = WordTokenizer.toCodePoints(actualWord);
        List<String> expectedChars = WordTokenizer.toCodePoints(expectedWord);
        List<ChangeRegion> regions = diff(actualChars, expectedChars);
        if (regions.size() > 1) {
            builder.delete(actualWord);
            builder.insert(expectedWord);
            return;
        }
        int actualIndex = 0;
        for (ChangeRegion region : regions) {
            builder.equal(join(actualChars, actualIndex, region.actualStart()));
            builder.delete(join(actualChars, region.actualStart(), region.actualEnd()));
            builder.insert(join(expectedChars, region.expectedStart(), region.expectedEnd()));
            actualIndex = region.actualEnd();
        }
        builder.equal(join(actualChars, actualIndex, actualChars.size()));
    }

    private static String join(List<String> units, int start, int end) {
        return String.join("", units.subList(start, end));
    }

    /**
     * A maximal run of adjacent patch deltas. Indexes are half-open.
     */
    private record ChangeRegion(int actualStart, int actualEnd, int expectedStart, int expectedEnd) {
        /**
         * @param patch a patch from the expected units to the actual units
         */
        static List<ChangeRegion> of(Patch<String> patch) {
            List<ChangeRegion> regions = new ArrayList<>();
            ChangeRegion current = null;
            for (AbstractDelta<String> delta : patch.getDeltas()) {
                if (delta.getType() == DeltaType.EQUAL) {
                    continue;
                }
                int actualStart = delta.getTarget().getPosition();
                int actualEnd = actualStart + delta.getTarget().size();
                int expectedStart = delta.getSource().getPosition();
                int expectedEnd = expectedStart + delta.getSource().size();
                if (current != null
                        && current.actualEnd() == actualStart
                        && current.expectedEnd() == expectedStart) {
                    current = new ChangeRegion(current.actualStart(), actualEnd, current.expectedStart(), expectedEnd);
                    regions.set(regions.size() - 1, current);
                } else {
                    current = new ChangeRegion(actualStart, actualEnd, expectedStart, expectedEnd);
                    regions.add(current);
                }
            }
            return regions;
        }
    }

    /**
     * Merges adjacent deltas of the same type and emits every change as its deletions followed by its
     * insertions.
     */
    private static final class DeltaListBuilder {
        private final List<Delta> deltas = new ArrayList<>();
        private final StringBuilder pendingDelete = new StringBuilder();
        private final StringBuilder pendingInsert = new StringBuilder();

        void equal(String text) {
            if (text.isEmpty()) {
                return;
            }
            flushChanges();
            append(Delta.Type.EQUAL, text);
        }

        void delete(String text) {
            pendingDelete.append(text);
        }

        void insert(String text) {
            pendingInsert.append(text);
        }

        List<Delta> build() {
            flushChanges();
            return List.copyOf(deltas);
        }

        private void flushChanges() {
            if (pendingDelete.length() > 0) {
                append(Delta.Type.DELETE, pendingDelete.toString());
                pendingDelete.setLength(0);
            }
            if (pendingInsert.length() > 0) {
                append(Delta.Type.INSERT, pendingInsert.toString());
                pendingInsert.setLength(0);
            }
        }

        private void append(Delta.Type type, String text) {
            int last = deltas.size() - 1;
            if (last >= 0 && deltas.get(last).type() == type) {
                deltas.set(last, new Delta(type, deltas.get(last).text() + text));
                return;
            }
            deltas.add(new Delta(type, text));
        }
    }
}
