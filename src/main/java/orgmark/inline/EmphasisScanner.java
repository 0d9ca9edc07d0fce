// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package orgmark.inline;

import orgmark.util.annotation.Nullable;

/**
 * Finds the extent of a span enclosed in a pair of identical delimiters, like {@code *bold*} or {@code ~code~}.
 * <p>
 * A span is rejected when:
 * <ul>
 * <li>whitespace follows the opening delimiter, or the span is empty;
 * <li>a line ends before the closing delimiter;
 * <li>whitespace precedes the first closing delimiter;
 * <li>the closing delimiter is followed by anything but the end of input, whitespace or a character of
 * {@link #allowedFollowers}.
 * </ul>
 */
final class EmphasisScanner {
    private EmphasisScanner() {
    }

    /**
     * Scans the span starting with the opening delimiter at {@code position}.
     *
     * @return The span, or {@code null} if there is no valid one.
     */
    static @Nullable DelimitedSpan scan(final String input, final int position, final char delimiter) {
        assert input.charAt(position) == delimiter;
        final var contentStart = position + 1;
        final var length = input.length();
        if (contentStart >= length || Chars.isWhitespace(input.charAt(contentStart))) {
            return null;
        }
        // The previously seen character lives only in this loop, so scans never leak state into each other.
        var previous = delimiter;
        for (int i = contentStart; i < length; i += 1) {
            final var ch = input.charAt(i);
            if (Chars.isEol(ch)) {
                return null;
            }
            if (ch == delimiter) {
                if (i == contentStart || Chars.isWhitespace(previous)) {
                    return null;
                }
                final var end = i + 1;
                return acceptsFollower(input, end) ? new DelimitedSpan(input.substring(contentStart, i), end) : null;
            }
            previous = ch;
        }
        return null;
    }

    private static boolean acceptsFollower(final String input, final int index) {
        if (index >= input.length()) {
            return true;
        }
        final var ch = input.charAt(index);
        return Chars.isWhitespace(ch) || allowedFollowers.indexOf(ch) >= 0;
    }

    private static final String allowedFollowers = ".,!?\"')-:;[}";

    /**
     * The content between the delimiters and the index just past the closing delimiter.
     */
    record DelimitedSpan(String content, int end) {
    }
}
