// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package orgmark.inline;

/**
 * Character classes shared by the grammar rules.
 */
final class Chars {
    private Chars() {
    }

    static boolean isWhitespace(final char ch) {
        return ch == ' ' || ch == '\t' || isEol(ch) || ch == '\f' || ch == '\u000B';
    }

    static boolean isEol(final char ch) {
        return ch == '\n' || ch == '\r';
    }

    static boolean isBlank(final char ch) {
        return ch == ' ' || ch == '\t';
    }

    static boolean isAsciiLetter(final char ch) {
        return (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z');
    }

    static boolean isAsciiDigit(final char ch) {
        return ch >= '0' && ch <= '9';
    }

    /**
     * Returns the index of the first character at or after {@code start} that fails {@code predicate}, or the input
     * length if all of them pass.
     */
    static int skipWhile(final String input, final int start, final CharPredicate predicate) {
        final var length = input.length();
        int i = start;
        while (i < length && predicate.test(input.charAt(i))) {
            i += 1;
        }
        return i;
    }

    @FunctionalInterface
    interface CharPredicate {
        boolean test(char ch);
    }
}
