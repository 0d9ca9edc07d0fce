// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package orgmark.sexp.reader;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import orgmark.sexp.Sexp;
import orgmark.sexp.SymbolTable;
import orgmark.util.UnreachableCodeReachedError;
import orgmark.util.annotation.Nullable;
import orgmark.util.condition.ConditionContext;
import orgmark.util.condition.UnhandledErrorError;

/**
 * The S-expression reader: the primary means of converting text into a stream of {@link Sexp} objects.
 */
public final class Reader {
    /**
     * Initializes a new S-expression reader that will read the given text from the beginning.
     * <p>
     * All symbols read will be interned into the given symbol table.
     */
    public Reader(final String text, final SymbolTable symbolTable) {
        this.text = text;
        this.symbolTable = symbolTable;
    }

    /**
     * Attempts to parse the next top-level S-expression.
     *
     * <ul>
     * <li>If an S-expression was correctly parsed, its object representation in the form of a {@link Sexp} is returned.
     * <li>If the end of input is reached, {@code null} is returned.
     * <li>If a parse error occurs, a fatal {@link ReadErrorCondition} condition is signaled.
     * </ul>
     */
    public @Nullable Sexp readTopLevelForm() {
        if (skipSkippables().hitEof()) {
            return null;
        }
        topLevelFormLine = lineNumber;
        currentDepth = 0;
        return readForm();
    }

    private HitEof skipSkippables() {
        while (true) {
            if (reachedEnd()) {
                return HitEof.YES;
            }
            final var ch = peek();
            if (CharClass.of(ch) != CharClass.SKIPPABLE) {
                return HitEof.NO;
            }
            if (ch == ';') {
                while (!reachedEnd() && peek() != '\n') {
                    discardPeek();
                }
            } else {
                discardPeek();
            }
        }
    }

    private @Nullable Sexp readForm() {
        currentDepth += 1;
        try {
            if (currentDepth > maxDepth) {
                throw signalReadError("Recursion limit reached, try to limit nesting");
            }

            if (reachedEnd()) {
                return null;
            }
            final var ch = peek();
            switch (CharClass.of(ch)) {
                case RESERVED -> throw signalReservedCharacterError(ch);
                case SKIPPABLE -> throw new UnreachableCodeReachedError(
                    "readForm called without preceding skipSkippables");
                default -> {
                }
            }
            discardPeek();

            return switch (ch) {
                case ')' -> throw signalReadError("Expected a form, but found ')' instead");
                case '(' -> readList();
                case '"' -> readString();
                default -> readSymbol(ch);
            };
        } finally {
            currentDepth -= 1;
        }
    }

    private Sexp.List readList() {
        final var list = new ArrayList<Sexp>();
        while (true) {
            if (skipSkippables().hitEof()) {
                throw signalUnterminatedListError();
            }
            if (peek() == ')') {
                discardPeek();
                break;
            }
            final var form = readForm();
            if (form != null) {
                list.add(form);
            } else {
                throw signalUnterminatedListError();
            }
        }
        return new Sexp.List(list);
    }

    private Sexp.String readString() {
        final var contents = new StringBuilder(initialStringCapacity);
        var inEscapeSequence = false;
        outerLoop:
        while (true) {
            if (reachedEnd()) {
                throw signalReadError("Expected closing '\"' but found end of input instead");
            }
            final var ch = peek();
            discardPeek();
            if (inEscapeSequence) {
                inEscapeSequence = false;
                contents.append(ch);
            } else {
                switch (ch) {
                    case '"' -> {
                        break outerLoop;
                    }
                    case '\\' -> inEscapeSequence = true;
                    default -> contents.append(ch);
                }
            }
        }

        return new Sexp.String(contents.toString());
    }

    private Sexp readSymbol(final char firstChar) {
        final var symbolName = new StringBuilder(initialSymbolCapacity);
        symbolName.append(firstChar);
        while (!reachedEnd()) {
            final var ch = peek();
            if (CharClass.of(ch) != CharClass.REGULAR) {
                break;
            }
            discardPeek();
            symbolName.append(ch);
        }
        return resolveSymbol(symbolName.toString());
    }

    private Sexp resolveSymbol(final String symbolName) {
        final var hasSign = symbolName.startsWith("+") || symbolName.startsWith("-");
        final var digitsStart = hasSign ? 1 : 0;
        final var isNumeric = symbolName.length() > digitsStart && allAsciiDigits(symbolName, digitsStart);
        if (isNumeric) {
            try {
                return new Sexp.Integer(new BigInteger(symbolName));
            } catch (final NumberFormatException e) {
                // The string consists only of an optional sign followed by ASCII digits at this point.
                throw new UnreachableCodeReachedError();
            }
        } else {
            return symbolTable.intern(symbolName);
        }
    }

    private boolean reachedEnd() {
        return position >= text.length();
    }

    private char peek() {
        return text.charAt(position);
    }

    private void discardPeek() {
        if (text.charAt(position) == '\n') {
            lineNumber += 1;
            lineStart = position + 1;
        }
        position += 1;
    }

    private UnhandledErrorError signalUnterminatedListError() {
        throw signalReadError("Expected closing ')' but found end of input instead");
    }

    private UnhandledErrorError signalReservedCharacterError(final char ch) {
        final var message = (ch <= lastControlChar)
            ? String.format("Reserved control character U+%04X found", (int) ch)
            : ("Reserved character '" + ch + "' found");
        throw signalReadError(message);
    }

    private UnhandledErrorError signalReadError(final String message) {
        final var location = new SourceLocation(lineNumber, position - lineStart + 1, topLevelFormLine);
        throw ConditionContext.error(new ReadErrorCondition(message, location));
    }

    private static boolean allAsciiDigits(final String string, final int startIndex) {
        final var length = string.length();
        for (int i = startIndex; i < length; i += 1) {
            final var ch = string.charAt(i);
            if (ch < '0' || ch > '9') {
                return false;
            }
        }
        return true;
    }

    private static final char lastControlChar = 0x1F;
    private static final int initialStringCapacity = 64;
    private static final int initialSymbolCapacity = 16;
    private static final int maxDepth = 150;

    private final String text;
    private final SymbolTable symbolTable;
    private int position = 0;
    private int lineStart = 0;
    private int lineNumber = 1;
    private int topLevelFormLine = 0;
    private int currentDepth = 0;

    private enum HitEof {
        NO,
        YES;

        private boolean hitEof() {
            return this == YES;
        }
    }

    private enum CharClass {
        REGULAR,
        SKIPPABLE,
        SEPARATOR,
        RESERVED;

        private static CharClass of(final char ch) {
            return (ch < asciiClasses.length) ? asciiClasses[ch] : REGULAR;
        }

        private static final CharClass[] asciiClasses;

        static {
            final var classes = new CharClass[128];
            Arrays.fill(classes, REGULAR);
            for (int i = 0; i <= lastControlChar; i += 1) {
                classes[i] = RESERVED;
            }
            classes[0x7F] = RESERVED;
            classes[' '] = SKIPPABLE;
            classes['\r'] = SKIPPABLE;
            classes['\n'] = SKIPPABLE;
            classes['\t'] = SKIPPABLE;
            classes['\u000B'] = SKIPPABLE;
            classes['\u000C'] = SKIPPABLE;
            classes[';'] = SKIPPABLE;
            classes['('] = SEPARATOR;
            classes[')'] = SEPARATOR;
            classes['"'] = SEPARATOR;
            classes['\''] = RESERVED;
            classes['#'] = RESERVED;
            classes['|'] = RESERVED;
            classes['\\'] = RESERVED;
            asciiClasses = classes;
        }
    }
}
