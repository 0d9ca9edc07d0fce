// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package orgmark.sexp;

import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import java.math.BigInteger;
import java.util.List;
import orgmark.util.UnreachableCodeReachedError;
import orgmark.util.annotation.Nullable;

/**
 * A utility class containing common operations on S-expressions.
 */
public final class Sexps {
    private Sexps() {
    }

    /**
     * Returns the integer the given {@code sexp} represents, or {@code null} if it doesn't represent an integer.
     */
    @CheckReturnValue
    public static @Nullable BigInteger asInteger(final Sexp sexp) {
        return (sexp instanceof Sexp.Integer integer) ? integer.value() : null;
    }

    /**
     * Returns the string the given {@code sexp} represents, or {@code null} if it doesn't represent a string.
     */
    @CheckReturnValue
    public static @Nullable String asString(final Sexp sexp) {
        return (sexp instanceof Sexp.String string) ? string.value() : null;
    }

    /**
     * Returns the list the given {@code sexp} represents, or {@code null} if it doesn't represent a list.
     * <p>
     * Note that the known symbol {@code nil} represents an empty list.
     */
    @CheckReturnValue
    public static @Nullable List<Sexp> asList(final Sexp sexp) {
        if (sexp instanceof Sexp.List list) {
            return list.value();
        } else if (sexp == Sexp.KnownSymbol.NIL) {
            return List.of();
        } else {
            return null;
        }
    }

    /**
     * Returns the symbol the given {@code sexp} represents, or {@code null} if it doesn't represent a symbol.
     * <p>
     * Note that empty lists represent the known symbol {@code nil}.
     */
    @CheckReturnValue
    public static @Nullable Sexp.Symbol asSymbol(final Sexp sexp) {
        if (sexp instanceof Sexp.Symbol symbol) {
            return symbol;
        } else if (sexp instanceof Sexp.List list && list.value().isEmpty()) {
            return Sexp.KnownSymbol.NIL;
        } else {
            return null;
        }
    }

    /**
     * Returns {@code true} iff the given {@code sexp} represents the symbol {@code nil}.
     * <p>
     * Note that empty lists represent {@code nil}.
     */
    @CheckReturnValue
    public static boolean isNil(final Sexp sexp) {
        return sexp == Sexp.KnownSymbol.NIL || (sexp instanceof Sexp.List list && list.value().isEmpty());
    }

    /**
     * Prints the given S-expression on a single line, in a form the reader accepts back.
     */
    @CheckReturnValue
    public static String print(final Sexp sexp) {
        final var printer = new Printer();
        printer.appendDispatch(sexp);
        return printer.builder.toString();
    }

    private static final class Printer {
        private Printer() {
        }

        private void appendDispatch(final Sexp sexp) {
            if (sexp instanceof Sexp.Integer integer) {
                append(integer.value());
            } else if (sexp instanceof Sexp.String string) {
                append(string.value());
            } else if (sexp instanceof Sexp.List list) {
                append(list.value());
            } else if (sexp instanceof Sexp.Symbol symbol) {
                append(symbol);
            } else {
                throw new UnreachableCodeReachedError("Unknown sexp type " + sexp.getClass().getName());
            }
        }

        private void append(final BigInteger integer) {
            builder.append(integer);
        }

        private void append(final String string) {
            final var replaced = string.replace("\\", "\\\\").replace("\"", "\\\"");
            builder.append('"');
            builder.append(replaced);
            builder.append('"');
        }

        private void append(final List<Sexp> list) {
            final var iterator = list.iterator();
            if (!iterator.hasNext()) {
                builder.append("()");
                return;
            }
            builder.append('(');
            appendDispatch(iterator.next());
            while (iterator.hasNext()) {
                builder.append(' ');
                appendDispatch(iterator.next());
            }
            builder.append(')');
        }

        private void append(final Sexp.Symbol symbol) {
            builder.append(symbol.symbolName());
        }

        private final StringBuilder builder = new StringBuilder();
    }
}
