// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package orgmark.codec;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import orgmark.entity.Entity;
import orgmark.inline.Node;
import orgmark.sexp.Sexp;
import orgmark.sexp.Sexps;
import orgmark.sexp.SymbolTable;
import orgmark.sexp.reader.ReadErrorCondition;
import orgmark.sexp.reader.Reader;
import orgmark.timestamp.Repetition;
import orgmark.timestamp.TimestampData;
import orgmark.timestamp.TimestampRange;
import orgmark.util.Trace;
import orgmark.util.annotation.Nullable;
import orgmark.util.condition.ConditionContext;
import orgmark.util.condition.UnhandledErrorError;

/**
 * Reconstructs inline nodes from the text {@link TreeWriter} produces.
 */
public final class TreeReader {
    private TreeReader() {
    }

    /**
     * Reads the node sequence serialized in the given text, which must hold exactly one list form.
     * <p>
     * On error, a fatal condition is signaled:
     * <ul>
     * <li>{@link ReadErrorCondition} if the text isn't valid S-expression syntax.
     * <li>{@link TreeFormatErrorCondition} if the S-expressions don't describe inline nodes.
     * </ul>
     */
    public static List<Node> read(final String text) {
        try (final var trace = new Trace("Reading serialized inline tree")) {
            trace.use();
            final var reader = new Reader(text, new SymbolTable());
            final var form = reader.readTopLevelForm();
            if (form == null) {
                throw signalError("Cannot turn empty input into an inline tree");
            }
            final var extra = reader.readTopLevelForm();
            if (extra != null) {
                throw signalError("Unexpected form after the inline tree: " + Sexps.print(extra));
            }
            return fromSexp(form);
        }
    }

    /**
     * Converts an S-expression list of node forms into nodes.
     */
    public static List<Node> fromSexp(final Sexp sexp) {
        final var list = Sexps.asList(sexp);
        if (list == null) {
            throw signalError("This doesn't appear to be a list of inline nodes: " + Sexps.print(sexp));
        }
        return convertAll(list, 0);
    }

    private static List<Node> convertAll(final List<Sexp> forms, final int startIndex) {
        final var result = new ArrayList<Node>(forms.size());
        for (int i = startIndex; i < forms.size(); i += 1) {
            result.add(convert(forms.get(i)));
        }
        return result;
    }

    private static Node convert(final Sexp form) {
        final var list = Sexps.asList(form);
        if (list == null || list.isEmpty()) {
            throw signalError("This doesn't appear to be a node form: " + Sexps.print(form));
        }
        final var head = list.get(0);
        if (!(Sexps.asSymbol(head) instanceof Sexp.KnownSymbol tag)) {
            throw signalError("Unknown node tag: " + Sexps.print(head));
        }
        try (final var trace = new Trace(() -> "Reading " + tag + " node")) {
            trace.use();
            return convertTagged(tag, list);
        }
    }

    private static Node convertTagged(final Sexp.KnownSymbol tag, final List<Sexp> form) {
        return switch (tag) {
            case PLAIN -> new Node.Plain(stringAt(form, 1, 2));
            case CODE -> new Node.Code(stringAt(form, 1, 2));
            case VERBATIM -> new Node.Verbatim(stringAt(form, 1, 2));
            case TARGET -> new Node.Target(stringAt(form, 1, 2));
            case RADIO_TARGET -> new Node.RadioTarget(stringAt(form, 1, 2));
            case BREAK_LINE -> {
                requireSize(form, 1);
                yield new Node.BreakLine();
            }
            case EMPHASIS -> new Node.Emphasis(emphasisKind(elementAt(form, 1)), convertAll(form, 2));
            case LINK -> new Node.Link(url(elementAt(form, 1)), convertAll(form, 2));
            case SUBSCRIPT -> new Node.Subscript(convertAll(form, 1));
            case SUPERSCRIPT -> new Node.Superscript(convertAll(form, 1));
            case FOOTNOTE_REFERENCE -> footnoteReference(form);
            case COOKIE -> new Node.Cookie(cookie(form));
            case LATEX_FRAGMENT -> new Node.LatexFragment(latexMode(elementAt(form, 1)), stringAt(form, 2, 3));
            case MACRO -> macro(form);
            case ENTITY -> new Node.EntityReference(entity(form));
            case TIMESTAMP -> new Node.Timestamp(stamp(form));
            case EXPORT_SNIPPET -> {
                requireSize(form, 3);
                yield new Node.ExportSnippet(string(form.get(1)), string(form.get(2)));
            }
            default -> throw signalError("Unknown node tag: " + tag);
        };
    }

    private static Node footnoteReference(final List<Sexp> form) {
        final var name = string(elementAt(form, 1));
        if (form.size() == 2) {
            return new Node.FootnoteReference(name, null);
        }
        if (form.get(2) != Sexp.KnownSymbol.KW_DEFINITION) {
            throw signalError("Expected :definition but found " + Sexps.print(form.get(2)));
        }
        return new Node.FootnoteReference(name, convertAll(form, 3));
    }

    private static Node.StatisticsCookie cookie(final List<Sexp> form) {
        final var kind = elementAt(form, 1);
        if (kind == Sexp.KnownSymbol.PERCENT) {
            requireSize(form, 3);
            return new Node.StatisticsCookie.Percent(intValue(form.get(2), "Percentage"));
        } else if (kind == Sexp.KnownSymbol.ABSOLUTE) {
            requireSize(form, 4);
            return new Node.StatisticsCookie.Absolute(
                intValue(form.get(2), "Current count"),
                intValue(form.get(3), "Maximum count"));
        } else {
            throw signalError("Unknown cookie kind: " + Sexps.print(kind));
        }
    }

    private static Node macro(final List<Sexp> form) {
        final var name = string(elementAt(form, 1));
        final var arguments = new ArrayList<String>();
        for (int i = 2; i < form.size(); i += 1) {
            arguments.add(string(form.get(i)));
        }
        return new Node.Macro(name, arguments);
    }

    private static Entity entity(final List<Sexp> form) {
        requireSize(form, 8);
        return new Entity(
            string(form.get(1)),
            string(form.get(2)),
            bool(form.get(3)),
            string(form.get(4)),
            string(form.get(5)),
            string(form.get(6)),
            string(form.get(7))
        );
    }

    private static Node.Url url(final Sexp sexp) {
        final var list = Sexps.asList(sexp);
        if (list == null || list.isEmpty()) {
            throw signalError("This doesn't appear to be a link destination: " + Sexps.print(sexp));
        }
        final var kind = list.get(0);
        if (kind == Sexp.KnownSymbol.FILE) {
            return new Node.Url.File(stringAt(list, 1, 2));
        } else if (kind == Sexp.KnownSymbol.SEARCH) {
            return new Node.Url.Search(stringAt(list, 1, 2));
        } else if (kind == Sexp.KnownSymbol.COMPLEX) {
            requireSize(list, 3);
            return new Node.Url.Complex(string(list.get(1)), string(list.get(2)));
        } else {
            throw signalError("Unknown link destination kind: " + Sexps.print(kind));
        }
    }

    private static Node.Stamp stamp(final List<Sexp> form) {
        final var kind = elementAt(form, 1);
        if (kind == Sexp.KnownSymbol.CLOCK_STOPPED || kind == Sexp.KnownSymbol.RANGE) {
            requireSize(form, 4);
            final var range = new TimestampRange(data(form.get(2)), data(form.get(3)));
            return (kind == Sexp.KnownSymbol.RANGE) ? new Node.Stamp.Range(range) : new Node.Stamp.ClockStopped(range);
        }
        requireSize(form, 3);
        final var data = data(form.get(2));
        if (kind == Sexp.KnownSymbol.SCHEDULED) {
            return new Node.Stamp.Scheduled(data);
        } else if (kind == Sexp.KnownSymbol.DEADLINE) {
            return new Node.Stamp.Deadline(data);
        } else if (kind == Sexp.KnownSymbol.DATE) {
            return new Node.Stamp.Date(data);
        } else if (kind == Sexp.KnownSymbol.CLOSED) {
            return new Node.Stamp.Closed(data);
        } else if (kind == Sexp.KnownSymbol.CLOCK_STARTED) {
            return new Node.Stamp.ClockStarted(data);
        } else {
            throw signalError("Unknown timestamp kind: " + Sexps.print(kind));
        }
    }

    private static TimestampData data(final Sexp sexp) {
        final var list = Sexps.asList(sexp);
        if (list == null || list.size() != 9 || list.get(0) != Sexp.KnownSymbol.STAMP) {
            throw signalError("This doesn't appear to be a stamp form: " + Sexps.print(sexp));
        }
        final var date = property(list, 1, Sexp.KnownSymbol.KW_DATE);
        final var time = property(list, 3, Sexp.KnownSymbol.KW_TIME);
        final var repeat = property(list, 5, Sexp.KnownSymbol.KW_REPEAT);
        final var active = property(list, 7, Sexp.KnownSymbol.KW_ACTIVE);
        return new TimestampData(
            date(string(date)),
            Sexps.isNil(time) ? null : time(string(time)),
            repetition(repeat),
            bool(active)
        );
    }

    private static Sexp property(final List<Sexp> list, final int keyIndex, final Sexp.KnownSymbol key) {
        if (list.get(keyIndex) != key) {
            throw signalError("Expected property " + key + " but found " + Sexps.print(list.get(keyIndex)));
        }
        return list.get(keyIndex + 1);
    }

    private static @Nullable Repetition repetition(final Sexp sexp) {
        if (Sexps.isNil(sexp)) {
            return null;
        }
        final var list = Sexps.asList(sexp);
        if (list == null || list.size() != 3) {
            throw signalError("This doesn't appear to be a repeater: " + Sexps.print(sexp));
        }
        final var kindSexp = list.get(0);
        final Repetition.Kind kind;
        if (kindSexp == Sexp.KnownSymbol.CUMULATIVE) {
            kind = Repetition.Kind.CUMULATIVE;
        } else if (kindSexp == Sexp.KnownSymbol.CATCH_UP) {
            kind = Repetition.Kind.CATCH_UP;
        } else if (kindSexp == Sexp.KnownSymbol.RESTART) {
            kind = Repetition.Kind.RESTART;
        } else {
            throw signalError("Unknown repeater kind: " + Sexps.print(kindSexp));
        }
        final var value = intValue(list.get(1), "Repeater interval");
        if (value < 0) {
            throw signalError("Repeater interval cannot be negative: " + value);
        }
        final var unitSexp = list.get(2);
        final Repetition.Unit unit;
        if (unitSexp == Sexp.KnownSymbol.HOUR) {
            unit = Repetition.Unit.HOUR;
        } else if (unitSexp == Sexp.KnownSymbol.DAY) {
            unit = Repetition.Unit.DAY;
        } else if (unitSexp == Sexp.KnownSymbol.WEEK) {
            unit = Repetition.Unit.WEEK;
        } else if (unitSexp == Sexp.KnownSymbol.MONTH) {
            unit = Repetition.Unit.MONTH;
        } else if (unitSexp == Sexp.KnownSymbol.YEAR) {
            unit = Repetition.Unit.YEAR;
        } else {
            throw signalError("Unknown repeater unit: " + Sexps.print(unitSexp));
        }
        return new Repetition(kind, value, unit);
    }

    private static Node.EmphasisKind emphasisKind(final Sexp sexp) {
        if (sexp == Sexp.KnownSymbol.BOLD) {
            return Node.EmphasisKind.BOLD;
        } else if (sexp == Sexp.KnownSymbol.ITALIC) {
            return Node.EmphasisKind.ITALIC;
        } else if (sexp == Sexp.KnownSymbol.UNDERLINE) {
            return Node.EmphasisKind.UNDERLINE;
        } else if (sexp == Sexp.KnownSymbol.STRIKE_THROUGH) {
            return Node.EmphasisKind.STRIKE_THROUGH;
        } else {
            throw signalError("Unknown emphasis kind: " + Sexps.print(sexp));
        }
    }

    private static Node.LatexMode latexMode(final Sexp sexp) {
        if (sexp == Sexp.KnownSymbol.INLINE) {
            return Node.LatexMode.INLINE;
        } else if (sexp == Sexp.KnownSymbol.DISPLAYED) {
            return Node.LatexMode.DISPLAYED;
        } else {
            throw signalError("Unknown LaTeX fragment mode: " + Sexps.print(sexp));
        }
    }

    private static LocalDate date(final String text) {
        try {
            return LocalDate.parse(text);
        } catch (final DateTimeParseException e) {
            throw signalError("This doesn't appear to be a date: " + text);
        }
    }

    private static LocalTime time(final String text) {
        try {
            return LocalTime.parse(text);
        } catch (final DateTimeParseException e) {
            throw signalError("This doesn't appear to be a time: " + text);
        }
    }

    private static Sexp elementAt(final List<Sexp> form, final int index) {
        if (index >= form.size()) {
            throw signalError("Node form is missing element #" + index + ": " + Sexps.print(new Sexp.List(form)));
        }
        return form.get(index);
    }

    private static String stringAt(final List<Sexp> form, final int index, final int expectedSize) {
        requireSize(form, expectedSize);
        return string(form.get(index));
    }

    private static void requireSize(final List<Sexp> form, final int expectedSize) {
        if (form.size() != expectedSize) {
            throw signalError("Expected a form of " + expectedSize + " elements, but found "
                + Sexps.print(new Sexp.List(form)));
        }
    }

    private static String string(final Sexp sexp) {
        final var string = Sexps.asString(sexp);
        if (string == null) {
            throw signalError("This doesn't appear to be a string: " + Sexps.print(sexp));
        }
        return string;
    }

    private static boolean bool(final Sexp sexp) {
        if (Sexps.isNil(sexp)) {
            return false;
        } else if (sexp == Sexp.KnownSymbol.T) {
            return true;
        } else {
            throw signalError("This doesn't appear to be a boolean: " + Sexps.print(sexp));
        }
    }

    private static int intValue(final Sexp sexp, final String fieldName) {
        final var integer = Sexps.asInteger(sexp);
        if (integer == null) {
            throw signalError(fieldName + " doesn't appear to be an integer: " + Sexps.print(sexp));
        }
        try {
            return integer.intValueExact();
        } catch (final ArithmeticException e) {
            throw signalError(fieldName + " is too big: " + integer);
        }
    }

    private static UnhandledErrorError signalError(final String message) {
        return ConditionContext.error(new TreeFormatErrorCondition(message));
    }
}
