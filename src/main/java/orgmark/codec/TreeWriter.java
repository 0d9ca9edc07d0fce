// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package orgmark.codec;

import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import java.util.ArrayList;
import java.util.List;
import orgmark.inline.Node;
import orgmark.sexp.Sexp;
import orgmark.sexp.Sexps;
import orgmark.timestamp.Repetition;
import orgmark.timestamp.TimestampData;
import orgmark.util.UnreachableCodeReachedError;
import orgmark.util.annotation.Nullable;

/**
 * Converts inline nodes into their tagged S-expression form, the inverse of {@link TreeReader}.
 * <p>
 * A node sequence becomes a list of node forms, each of which is {@code (tag payload...)}, for example
 * {@code ((plain "a ") (emphasis bold (plain "b")))}.
 */
public final class TreeWriter {
    private TreeWriter() {
    }

    /**
     * Returns the single-line text of the given node sequence.
     */
    @CheckReturnValue
    public static String write(final List<Node> nodes) {
        return Sexps.print(toSexp(nodes));
    }

    /**
     * Returns the given node sequence as an S-expression list.
     */
    @CheckReturnValue
    public static Sexp.List toSexp(final List<Node> nodes) {
        return new Sexp.List(convertAll(nodes));
    }

    private static List<Sexp> convertAll(final List<Node> nodes) {
        final var result = new ArrayList<Sexp>(nodes.size());
        for (final var node : nodes) {
            result.add(convert(node));
        }
        return result;
    }

    private static Sexp convert(final Node node) {
        if (node instanceof Node.Plain plain) {
            return form(Sexp.KnownSymbol.PLAIN, string(plain.text()));
        } else if (node instanceof Node.Emphasis emphasis) {
            return form(Sexp.KnownSymbol.EMPHASIS, List.of(emphasisKind(emphasis.kind())), emphasis.children());
        } else if (node instanceof Node.Code code) {
            return form(Sexp.KnownSymbol.CODE, string(code.text()));
        } else if (node instanceof Node.Verbatim verbatim) {
            return form(Sexp.KnownSymbol.VERBATIM, string(verbatim.text()));
        } else if (node instanceof Node.BreakLine) {
            return form(Sexp.KnownSymbol.BREAK_LINE);
        } else if (node instanceof Node.Link link) {
            return form(Sexp.KnownSymbol.LINK, List.of(url(link.url())), link.label());
        } else if (node instanceof Node.Target target) {
            return form(Sexp.KnownSymbol.TARGET, string(target.name()));
        } else if (node instanceof Node.RadioTarget radioTarget) {
            return form(Sexp.KnownSymbol.RADIO_TARGET, string(radioTarget.name()));
        } else if (node instanceof Node.Subscript subscript) {
            return form(Sexp.KnownSymbol.SUBSCRIPT, List.of(), subscript.children());
        } else if (node instanceof Node.Superscript superscript) {
            return form(Sexp.KnownSymbol.SUPERSCRIPT, List.of(), superscript.children());
        } else if (node instanceof Node.FootnoteReference footnote) {
            return footnoteReference(footnote);
        } else if (node instanceof Node.Cookie cookie) {
            return cookie(cookie.value());
        } else if (node instanceof Node.LatexFragment latex) {
            final var mode = (latex.mode() == Node.LatexMode.INLINE)
                ? Sexp.KnownSymbol.INLINE
                : Sexp.KnownSymbol.DISPLAYED;
            return form(Sexp.KnownSymbol.LATEX_FRAGMENT, mode, string(latex.content()));
        } else if (node instanceof Node.Macro macro) {
            final var payload = new ArrayList<Sexp>();
            payload.add(string(macro.name()));
            for (final var argument : macro.arguments()) {
                payload.add(string(argument));
            }
            return form(Sexp.KnownSymbol.MACRO, payload.toArray(new Sexp[0]));
        } else if (node instanceof Node.EntityReference reference) {
            final var entity = reference.entity();
            return form(
                Sexp.KnownSymbol.ENTITY,
                string(entity.name()),
                string(entity.latex()),
                bool(entity.latexMath()),
                string(entity.html()),
                string(entity.ascii()),
                string(entity.latin1()),
                string(entity.unicode())
            );
        } else if (node instanceof Node.Timestamp timestamp) {
            return timestamp(timestamp.stamp());
        } else if (node instanceof Node.ExportSnippet snippet) {
            return form(Sexp.KnownSymbol.EXPORT_SNIPPET, string(snippet.backend()), string(snippet.content()));
        } else {
            throw new UnreachableCodeReachedError("Unknown node type " + node.getClass().getName());
        }
    }

    private static Sexp footnoteReference(final Node.FootnoteReference footnote) {
        final var definition = footnote.definition();
        if (definition == null) {
            return form(Sexp.KnownSymbol.FOOTNOTE_REFERENCE, string(footnote.name()));
        }
        return form(
            Sexp.KnownSymbol.FOOTNOTE_REFERENCE,
            List.of(string(footnote.name()), Sexp.KnownSymbol.KW_DEFINITION),
            definition
        );
    }

    private static Sexp cookie(final Node.StatisticsCookie cookie) {
        if (cookie instanceof Node.StatisticsCookie.Percent percent) {
            return form(Sexp.KnownSymbol.COOKIE, Sexp.KnownSymbol.PERCENT, Sexp.Integer.of(percent.percent()));
        } else if (cookie instanceof Node.StatisticsCookie.Absolute absolute) {
            return form(
                Sexp.KnownSymbol.COOKIE,
                Sexp.KnownSymbol.ABSOLUTE,
                Sexp.Integer.of(absolute.current()),
                Sexp.Integer.of(absolute.max())
            );
        } else {
            throw new UnreachableCodeReachedError("Unknown cookie type " + cookie.getClass().getName());
        }
    }

    private static Sexp url(final Node.Url url) {
        if (url instanceof Node.Url.File file) {
            return form(Sexp.KnownSymbol.FILE, string(file.path()));
        } else if (url instanceof Node.Url.Search search) {
            return form(Sexp.KnownSymbol.SEARCH, string(search.term()));
        } else if (url instanceof Node.Url.Complex complex) {
            return form(Sexp.KnownSymbol.COMPLEX, string(complex.protocol()), string(complex.link()));
        } else {
            throw new UnreachableCodeReachedError("Unknown url type " + url.getClass().getName());
        }
    }

    private static Sexp timestamp(final Node.Stamp stamp) {
        if (stamp instanceof Node.Stamp.Scheduled scheduled) {
            return form(Sexp.KnownSymbol.TIMESTAMP, Sexp.KnownSymbol.SCHEDULED, data(scheduled.data()));
        } else if (stamp instanceof Node.Stamp.Deadline deadline) {
            return form(Sexp.KnownSymbol.TIMESTAMP, Sexp.KnownSymbol.DEADLINE, data(deadline.data()));
        } else if (stamp instanceof Node.Stamp.Date date) {
            return form(Sexp.KnownSymbol.TIMESTAMP, Sexp.KnownSymbol.DATE, data(date.data()));
        } else if (stamp instanceof Node.Stamp.Closed closed) {
            return form(Sexp.KnownSymbol.TIMESTAMP, Sexp.KnownSymbol.CLOSED, data(closed.data()));
        } else if (stamp instanceof Node.Stamp.ClockStarted started) {
            return form(Sexp.KnownSymbol.TIMESTAMP, Sexp.KnownSymbol.CLOCK_STARTED, data(started.data()));
        } else if (stamp instanceof Node.Stamp.ClockStopped stopped) {
            return form(
                Sexp.KnownSymbol.TIMESTAMP,
                Sexp.KnownSymbol.CLOCK_STOPPED,
                data(stopped.range().start()),
                data(stopped.range().stop())
            );
        } else if (stamp instanceof Node.Stamp.Range range) {
            return form(
                Sexp.KnownSymbol.TIMESTAMP,
                Sexp.KnownSymbol.RANGE,
                data(range.range().start()),
                data(range.range().stop())
            );
        } else {
            throw new UnreachableCodeReachedError("Unknown stamp type " + stamp.getClass().getName());
        }
    }

    private static Sexp data(final TimestampData data) {
        final var time = data.time();
        return form(
            Sexp.KnownSymbol.STAMP,
            Sexp.KnownSymbol.KW_DATE,
            string(data.date().toString()),
            Sexp.KnownSymbol.KW_TIME,
            (time != null) ? string(time.toString()) : Sexp.KnownSymbol.NIL,
            Sexp.KnownSymbol.KW_REPEAT,
            repetition(data.repetition()),
            Sexp.KnownSymbol.KW_ACTIVE,
            bool(data.active())
        );
    }

    private static Sexp repetition(final @Nullable Repetition repetition) {
        if (repetition == null) {
            return Sexp.KnownSymbol.NIL;
        }
        final var kind = switch (repetition.kind()) {
            case CUMULATIVE -> Sexp.KnownSymbol.CUMULATIVE;
            case CATCH_UP -> Sexp.KnownSymbol.CATCH_UP;
            case RESTART -> Sexp.KnownSymbol.RESTART;
        };
        final var unit = switch (repetition.unit()) {
            case HOUR -> Sexp.KnownSymbol.HOUR;
            case DAY -> Sexp.KnownSymbol.DAY;
            case WEEK -> Sexp.KnownSymbol.WEEK;
            case MONTH -> Sexp.KnownSymbol.MONTH;
            case YEAR -> Sexp.KnownSymbol.YEAR;
        };
        return Sexp.List.of(kind, Sexp.Integer.of(repetition.value()), unit);
    }

    private static Sexp emphasisKind(final Node.EmphasisKind kind) {
        return switch (kind) {
            case BOLD -> Sexp.KnownSymbol.BOLD;
            case ITALIC -> Sexp.KnownSymbol.ITALIC;
            case UNDERLINE -> Sexp.KnownSymbol.UNDERLINE;
            case STRIKE_THROUGH -> Sexp.KnownSymbol.STRIKE_THROUGH;
        };
    }

    private static Sexp form(final Sexp.KnownSymbol tag, final Sexp... payload) {
        final var elements = new ArrayList<Sexp>(payload.length + 1);
        elements.add(tag);
        elements.addAll(List.of(payload));
        return new Sexp.List(elements);
    }

    private static Sexp form(final Sexp.KnownSymbol tag, final List<Sexp> leading, final List<Node> children) {
        final var elements = new ArrayList<Sexp>(leading.size() + children.size() + 1);
        elements.add(tag);
        elements.addAll(leading);
        elements.addAll(convertAll(children));
        return new Sexp.List(elements);
    }

    private static Sexp string(final String value) {
        return new Sexp.String(value);
    }

    private static Sexp bool(final boolean value) {
        return value ? Sexp.KnownSymbol.T : Sexp.KnownSymbol.NIL;
    }
}
