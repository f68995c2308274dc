package com.example.requirements.application;

import com.example.requirements.domain.Delta;
import com.example.requirements.domain.TerminalEncoding;

/**
 * Decorates the parts of a diff for one terminal encoding.
 * <p>
 * Implementations are stateless and may be shared across threads.
 */
public interface ColorScheme {
    TerminalEncoding getEncoding();

    /**
     * @return the character used to align the actual and expected values vertically
     */
    char getPaddingMarker();

    String decorateEqualText(String text);

    String decorateInsertedText(String text);

    String decorateDeletedText(String text);

    /**
     * @param length the number of padding markers
     * @return the (possibly decorated) padding, or an empty string if {@code length} is zero
     */
    String decoratePadding(int length);

    /**
     * @return true if a line of diff symbols is displayed between the actual and expected lines
     */
    boolean rendersDiffLines();

    /**
     * @param type the type of a delta
     * @return the symbol denoting {@code type} in a diff line
     * @throws UnsupportedOperationException if the scheme does not render diff lines
     */
    char getDiffSymbol(Delta.Type type);

    /**
     * @param line a line produced by {@link #decoratePadding(int)} and the decorate methods
     * @return true if the line consists of padding only
     */
    boolean isPadding(String line);
}
