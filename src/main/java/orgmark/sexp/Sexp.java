// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package orgmark.sexp;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;
import orgmark.util.annotation.Nullable;

/**
 * Base type of S-expression objects.
 * <p>
 * S-expression objects are immutable.
 */
public sealed interface Sexp {
    /**
     * Base interface of symbols.
     * <p>
     * Symbols obtained from the same {@link SymbolTable} are equal iff they are identical.
     */
    sealed interface Symbol extends Sexp {
        java.lang.String symbolName();
    }

    record Integer(BigInteger value) implements Sexp {
        public static Integer of(final long value) {
            return new Integer(BigInteger.valueOf(value));
        }
    }

    /**
     * A proper list; dotted lists don't exist here.
     */
    record List(java.util.List<Sexp> value) implements Sexp {
        public List {
            value = java.util.List.copyOf(value);
        }

        public static List of(final Sexp... elements) {
            return new List(java.util.List.of(elements));
        }
    }

    record String(java.lang.String value) implements Sexp {
    }

    /**
     * A symbol that Java code doesn't know about.
     */
    final class RegularSymbol implements Sexp.Symbol {
        /**
         * Initializes a new <em>uninterned</em> symbol; normally {@link SymbolTable#intern(java.lang.String)} is what
         * you want instead.
         */
        public RegularSymbol(final java.lang.String name) {
            this.name = name;
        }

        @Override
        public java.lang.String symbolName() {
            return name;
        }

        @Override
        public java.lang.String toString() {
            return name;
        }

        private final java.lang.String name;
    }

    /**
     * Symbols that Java code refers to: the tags and keywords of serialized inline trees.
     */
    enum KnownSymbol implements Sexp.Symbol {
        NIL("nil"),
        T("t"),

        PLAIN("plain"),
        EMPHASIS("emphasis"),
        CODE("code"),
        VERBATIM("verbatim"),
        BREAK_LINE("break-line"),
        LINK("link"),
        TARGET("target"),
        RADIO_TARGET("radio-target"),
        SUBSCRIPT("subscript"),
        SUPERSCRIPT("superscript"),
        FOOTNOTE_REFERENCE("footnote-reference"),
        COOKIE("cookie"),
        LATEX_FRAGMENT("latex-fragment"),
        MACRO("macro"),
        ENTITY("entity"),
        TIMESTAMP("timestamp"),
        EXPORT_SNIPPET("export-snippet"),

        BOLD("bold"),
        ITALIC("italic"),
        UNDERLINE("underline"),
        STRIKE_THROUGH("strike-through"),

        FILE("file"),
        SEARCH("search"),
        COMPLEX("complex"),

        PERCENT("percent"),
        ABSOLUTE("absolute"),

        INLINE("inline"),
        DISPLAYED("displayed"),

        SCHEDULED("scheduled"),
        DEADLINE("deadline"),
        DATE("date"),
        CLOSED("closed"),
        CLOCK_STARTED("clock-started"),
        CLOCK_STOPPED("clock-stopped"),
        RANGE("range"),
        STAMP("stamp"),

        CUMULATIVE("cumulative"),
        CATCH_UP("catch-up"),
        RESTART("restart"),
        HOUR("hour"),
        DAY("day"),
        WEEK("week"),
        MONTH("month"),
        YEAR("year"),

        KW_DEFINITION(":definition"),
        KW_DATE(":date"),
        KW_TIME(":time"),
        KW_REPEAT(":repeat"),
        KW_ACTIVE(":active");

        KnownSymbol(final java.lang.String name) {
            this.name = name;
        }

        /**
         * Returns the known symbol with the given name, or {@code null} if there's none.
         */
        public static @Nullable KnownSymbol byName(final java.lang.String name) {
            return Holder.byName.get(name);
        }

        @Override
        public java.lang.String symbolName() {
            return name;
        }

        @Override
        public java.lang.String toString() {
            return name;
        }

        private final java.lang.String name;

        // Enum constants can't see static fields of their own class during construction, hence the holder.
        private static final class Holder {
            private static final Map<java.lang.String, KnownSymbol> byName = buildIndex();

            private static Map<java.lang.String, KnownSymbol> buildIndex() {
                final var index = new HashMap<java.lang.String, KnownSymbol>();
                for (final var symbol : values()) {
                    index.put(symbol.name, symbol);
                }
                return Map.copyOf(index);
            }
        }
    }
}
