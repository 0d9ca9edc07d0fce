// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package orgmark.inline;

import java.util.List;
import java.util.function.Function;
import orgmark.util.UnreachableCodeReachedError;
import orgmark.util.annotation.Nullable;

/**
 * Rules for delimiter-based markup: emphasis, code, verbatim, scripts, line breaks, and the plain text fallback.
 */
final class MarkupRules {
    private MarkupRules() {
    }

    static @Nullable Match emphasis(final ParseSession session, final String input, final int position) {
        final var kind = Node.EmphasisKind.byDelimiter(input.charAt(position));
        if (kind == null) {
            return null;
        }
        final var span = EmphasisScanner.scan(input, position, kind.delimiter());
        if (span == null) {
            return null;
        }
        return new Match(resolveNesting(session, kind, span.content()), span.end());
    }

    static @Nullable Match code(final ParseSession session, final String input, final int position) {
        return verbatimLike(input, position, '~', Node.Code::new);
    }

    static @Nullable Match verbatim(final ParseSession session, final String input, final int position) {
        return verbatimLike(input, position, '=', Node.Verbatim::new);
    }

    static @Nullable Match subscript(final ParseSession session, final String input, final int position) {
        return script(session, input, position, "_{", Node.Subscript::new);
    }

    static @Nullable Match superscript(final ParseSession session, final String input, final int position) {
        return script(session, input, position, "^{", Node.Superscript::new);
    }

    static @Nullable Match lineBreak(final ParseSession session, final String input, final int position) {
        return switch (input.charAt(position)) {
            case '\n' -> new Match(breakLine, position + 1);
            case '\r' -> new Match(breakLine, input.startsWith("\r\n", position) ? position + 2 : position + 1);
            default -> null;
        };
    }

    /**
     * The fallback rule: never fails, and always consumes at least one character.
     * <p>
     * Consumes text up to the next character that may introduce markup. If the very first character is such a
     * character, which means every other rule has already failed here, it is consumed on its own.
     */
    static Match plain(final ParseSession session, final String input, final int position) {
        var end = scanPlain(input, position);
        if (end == position) {
            end = position + Character.charCount(input.codePointAt(position));
        }
        return new Match(new Node.Plain(input.substring(position, end)), end);
    }

    private static Node.Emphasis resolveNesting(
        final ParseSession session,
        final Node.EmphasisKind kind,
        final String content
    ) {
        // Inner spans come from this very rule, so they are already resolved by the time we see them.
        final var children = session.parseSequence(content, InlineRule.emphasisInterior());
        if (children.size() == 1 && children.get(0) instanceof final Node.Plain plain && plain.text().equals(content)) {
            return new Node.Emphasis(kind, List.of(plain));
        }
        for (final var child : children) {
            if (!(child instanceof Node.Plain) && !(child instanceof Node.Emphasis)) {
                throw new UnreachableCodeReachedError("Unexpected node inside an emphasis span: " + child);
            }
        }
        return new Node.Emphasis(kind, children);
    }

    private static @Nullable Match verbatimLike(
        final String input,
        final int position,
        final char delimiter,
        final Function<String, Node> constructor
    ) {
        if (input.charAt(position) != delimiter) {
            return null;
        }
        final var span = EmphasisScanner.scan(input, position, delimiter);
        return (span == null) ? null : new Match(constructor.apply(span.content()), span.end());
    }

    private static @Nullable Match script(
        final ParseSession session,
        final String input,
        final int position,
        final String opener,
        final Function<List<Node>, Node> constructor
    ) {
        if (!input.startsWith(opener, position)) {
            return null;
        }
        final var bodyStart = position + opener.length();
        final var bodyEnd = Chars.skipWhile(input, bodyStart, ch -> !Chars.isWhitespace(ch) && ch != '}');
        if (bodyEnd == bodyStart || bodyEnd >= input.length() || input.charAt(bodyEnd) != '}') {
            return null;
        }
        final var body = session.parseSequence(input.substring(bodyStart, bodyEnd), InlineRule.scriptBody());
        return new Match(constructor.apply(body), bodyEnd + 1);
    }

    private static int scanPlain(final String input, final int position) {
        final var length = input.length();
        for (int i = position; i < length; i += 1) {
            final var ch = input.charAt(i);
            if (Chars.isEol(ch) || plainStoppers.indexOf(ch) >= 0) {
                return i;
            }
            if (i > position && isWordStart(input, i) && startsWordRule(input, i)) {
                return i;
            }
        }
        return length;
    }

    private static boolean isWordStart(final String input, final int index) {
        final var previous = input.charAt(index - 1);
        return Chars.isAsciiLetter(input.charAt(index))
            && !Chars.isAsciiLetter(previous)
            && !Chars.isAsciiDigit(previous);
    }

    private static boolean startsWordRule(final String input, final int index) {
        return TimestampRules.startsKeyword(input, index) || LinkRules.startsBareLink(input, index);
    }

    // Every character that may start a rule other than PLAIN, besides newlines and words.
    private static final String plainStoppers = "*/_+~=[<{$\\^@";
    private static final Node.BreakLine breakLine = new Node.BreakLine();
}
