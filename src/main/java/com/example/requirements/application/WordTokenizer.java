package com.example.requirements.application;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits text into the units compared by {@link DeltaCalculator}.
 * <p>
 * A run of letters and digits is one token, {@code \r\n} is one token and every other code point is a
 * token of its own.
 */
final class WordTokenizer {
    private static final Pattern TOKEN = Pattern.compile("[\\p{L}\\p{Nd}]+|\\r\\n|.", Pattern.DOTALL);

    private WordTokenizer() {
    }

    static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        Matcher matcher = TOKEN.matcher(text);
        while (matcher.find()) {
            tokens.add(matcher.group());
        }
        return tokens;
    }

    /**
     * @return the code points of {@code text}, one string per code point
     */
    static List<String> toCodePoints(String text) {
        List<String> result = new ArrayList<>(text.length());
        text.codePoints().forEach(codePoint -> result.add(new String(Character.toChars(codePoint))));
        return result;
    }

    static boolean isWord(String token) {
        return !token.isEmpty() && Character.isLetterOrDigit(token.codePointAt(0));
    }
}
