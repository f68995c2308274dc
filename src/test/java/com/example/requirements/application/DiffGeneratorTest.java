package com.example.requirements.application;

import com.example.requirements.domain.Delta;
import com.example.requirements.domain.DiffResult;
import com.example.requirements.infrastructure.TextOnlyColorScheme;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DiffGeneratorTest {

    private final DiffGenerator generator = new DiffGenerator(new TextOnlyColorScheme());

    @Test
    void diffShowsDeletionsBeforeInsertions() {
        DiffResult result = generator.diff("actual", "expected");

        assertEquals(List.of("actual////////\\0"), result.getActualLines());
        assertEquals(List.of("------++++++++=="), result.getDiffLines());
        assertEquals(List.of("//////expected\\0"), result.getExpectedLines());
        assertEquals('/', result.getPaddingMarker());
    }

    @Test
    void calculateDeltasEmitsDeleteThenInsert() {
        List<Delta> deltas = generator.calculateDeltas("actual", "expected");

        assertEquals(
                List.of(new Delta(Delta.Type.DELETE, "actual"), new Delta(Delta.Type.INSERT, "expected")),
                deltas);
    }

    @Test
    void diffKeepsSharedInfixBetweenChangedWords() {
        DiffResult result = generator.diff("different-same-different", "maybe-same-maybe");

        assertEquals(List.of("different/////-same-different/////\\0"), result.getActualLines());
        assertEquals(List.of("---------+++++======---------+++++=="), result.getDiffLines());
        assertEquals(List.of("/////////maybe-same-/////////maybe\\0"), result.getExpectedLines());
    }

    @Test
    void calculateDeltasKeepsSharedInfixAsSingleEqualDelta() {
        List<Delta> deltas = generator.calculateDeltas("different-same-different", "maybe-same-maybe");

        assertThat(deltas)
                .extracting(Delta::type)
                .containsExactly(
                        Delta.Type.DELETE,
                        Delta.Type.INSERT,
                        Delta.Type.EQUAL,
                        Delta.Type.DELETE,
                        Delta.Type.INSERT);
        assertEquals(new Delta(Delta.Type.EQUAL, "-same-"), deltas.get(2));
    }

    @Test
    void diffReducesWordWithSingleChangeToCharacters() {
        DiffResult result = generator.diff("I lice dogs", "I like dogs");

        assertEquals(List.of("I lic/e dogs\\0"), result.getActualLines());
        assertEquals(List.of("====-+========"), result.getDiffLines());
        assertEquals(List.of("I li/ke dogs\\0"), result.getExpectedLines());
    }

    @Test
    void diffReplacesWordsThatDifferInSeveralPlaces() {
        DiffResult result = generator.diff("The dog is brown", "The fox is down");

        assertEquals(List.of("The dog/// is br/own\\0"), result.getActualLines());
        assertEquals(List.of("====---+++====--+====="), result.getDiffLines());
        assertEquals(List.of("The ///fox is //down\\0"), result.getExpectedLines());
    }

    @Test
    void diffMarksMissingSuffix() {
        DiffResult result = generator.diff("I like dog", "I like dogs");

        assertEquals(List.of("I like dog/\\0"), result.getActualLines());
        assertEquals(List.of("==========+=="), result.getDiffLines());
        assertEquals(List.of("I like dogs\\0"), result.getExpectedLines());
    }

    @Test
    void diffMarksMissingPrefix() {
        DiffResult result = generator.diff("you like me?", "Don't you like me?");

        assertEquals(List.of("//////you like me?\\0"), result.getActualLines());
        assertEquals(List.of("++++++=============="), result.getDiffLines());
        assertEquals(List.of("Don't you like me?\\0"), result.getExpectedLines());
    }

    @Test
    void diffShowsTrailingWhitespace() {
        DiffResult result = generator.diff("\"key\": \"value \"", "\"key\": \"value\"");

        assertEquals(List.of("=============-==="), result.getDiffLines());
        assertEquals(List.of("\"key\": \"value \"\\0"), result.getActualLines());
        assertEquals(List.of("\"key\": \"value/\"\\0"), result.getExpectedLines());
    }

    @Test
    void deletedLineTerminatorEndsActualLineOnly() {
        DiffResult result = generator.diff("Foo\nBar", "Bar");

        assertEquals(List.of("Foo\\n/////", "Bar\\0"), result.getActualLines());
        assertEquals(List.of("-----=====", "====="), result.getDiffLines());
        assertEquals(List.of("/////Bar\\0", "/////"), result.getExpectedLines());
    }

    @Test
    void insertedLineTerminatorEndsExpectedLineOnly() {
        DiffResult result = generator.diff("expected", "\nexpected");

        assertEquals(List.of("//expected\\0", "//////////"), result.getActualLines());
        assertEquals(List.of("++==========", "=========="), result.getDiffLines());
        assertEquals(List.of("\\n//////////", "expected\\0"), result.getExpectedLines());
    }

    @Test
    void diffKeepsLeadingTextOfActualValueWhenMatchesTie() {
        DiffResult result = generator.diff("foo\nbar", "bar\nfoo");

        assertEquals(List.of("/////foo\\n", "///bar\\0"), result.getActualLines());
        assertEquals(List.of("+++++===--", "===---=="), result.getDiffLines());
        assertEquals(List.of("bar\\n/////", "foo///\\0"), result.getExpectedLines());
    }

    @Test
    void diffOfMultilineValues() {
        DiffResult result = generator.diff("1\n2\n3\n4\n5", "1\n2\n9\n4\n5");

        assertEquals(List.of("1\\n", "2\\n", "3/\\n", "4\\n", "5\\0"), result.getActualLines());
        assertEquals(List.of("===", "===", "-+==", "===", "==="), result.getDiffLines());
        assertEquals(List.of("1\\n", "2\\n", "/9\\n", "4\\n", "5\\0"), result.getExpectedLines());
    }

    @Test
    void diffOfEqualValuesContainsOnlyEqualSymbols() {
        String value = "same text\nacross lines";

        DiffResult result = generator.diff(value, value);

        assertEquals(result.getActualLines(), result.getExpectedLines());
        for (String line : result.getDiffLines()) {
            assertTrue(line.chars().allMatch(c -> c == '='), line);
        }
        assertEquals(List.of(new Delta(Delta.Type.EQUAL, value)), generator.calculateDeltas(value, value));
    }

    @Test
    void diffOfEmptyValues() {
        DiffResult result = generator.diff("", "");

        assertEquals(List.of("\\0"), result.getActualLines());
        assertEquals(List.of("=="), result.getDiffLines());
        assertEquals(List.of("\\0"), result.getExpectedLines());
        assertThat(generator.calculateDeltas("", "")).isEmpty();
    }

    @Test
    void diffKeepsLinesAligned() {
        List<String[]> pairs =
                List.of(
                        new String[] {"", "expected"},
                        new String[] {"line one\nline two", "line one\nline 2\nline three"},
                        new String[] {"a, b, c", "a; b; c; d"},
                        new String[] {"café 😀", "cafe 😁"},
                        new String[] {"windows\r\nline", "unix\nline"});
        for (String[] pair : pairs) {
            DiffResult result = generator.diff(pair[0], pair[1]);

            assertEquals(result.getActualLines().size(), result.getExpectedLines().size());
            assertEquals(result.getActualLines().size(), result.getDiffLines().size());
            for (int i = 0; i < result.getActualLines().size(); ++i) {
                int width = codePoints(result.getDiffLines().get(i));
                assertEquals(width, codePoints(result.getActualLines().get(i)), pair[0]);
                assertEquals(width, codePoints(result.getExpectedLines().get(i)), pair[1]);
            }
        }
    }

    @Test
    void linesReconstructOriginalValues() {
        String actual = "first line\nsecond line\nthird";
        String expected = "first line\nnew line\nsecond line\nthird!";

        DiffResult result = generator.diff(actual, expected);

        assertEquals(actual, reconstruct(result.getActualLines()));
        assertEquals(expected, reconstruct(result.getExpectedLines()));
    }

    @Test
    void isEmptyDetectsPaddingOnlyLines() {
        assertTrue(generator.isEmpty("/////"));
        assertThat(generator.isEmpty("Foo\\n")).isFalse();
        assertThat(generator.isEmpty("")).isFalse();
    }

    @Test
    void diffRejectsNull() {
        assertThrows(NullPointerException.class, () -> generator.diff(null, "expected"));
        assertThrows(NullPointerException.class, () -> generator.diff("actual", null));
    }

    private static int codePoints(String text) {
        return text.codePointCount(0, text.length());
    }

    private static String reconstruct(List<String> lines) {
        String joined = String.join("", lines).replace("/", "");
        assertTrue(joined.endsWith(DiffConstants.EOS_MARKER), joined);
        return joined.substring(0, joined.length() - DiffConstants.EOS_MARKER.length())
                .replace(DiffConstants.NEWLINE_MARKER, "\n");
    }
}
