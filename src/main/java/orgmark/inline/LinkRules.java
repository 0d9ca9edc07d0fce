// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package orgmark.inline;

import java.util.List;
import orgmark.util.annotation.Nullable;

/**
 * Rules for references to other places: bracketed links, bare links and footnote references.
 */
final class LinkRules {
    private LinkRules() {
    }

    /**
     * {@code [[url]]} or {@code [[url][label]]}.
     */
    static @Nullable Match link(final ParseSession session, final String input, final int position) {
        if (!input.startsWith("[[", position)) {
            return null;
        }
        final var urlStart = position + 2;
        final var urlEnd = Chars.skipWhile(input, urlStart, ch -> ch != ']');
        if (urlEnd == urlStart) {
            return null;
        }
        var labelStart = urlEnd;
        if (input.startsWith("][", urlEnd)) {
            labelStart = urlEnd + 2;
        }
        final var labelEnd = Chars.skipWhile(input, labelStart, ch -> ch != ']');
        if (!input.startsWith("]]", labelEnd)) {
            return null;
        }
        final var label = input.substring(labelStart, labelEnd);
        final var labelNodes = label.isEmpty() ? List.<Node>of() : session.parseSequence(label, InlineRule.linkLabel());
        final var url = classifyUrl(input.substring(urlStart, urlEnd));
        return new Match(new Node.Link(url, labelNodes), labelEnd + 2);
    }

    /**
     * {@code protocol://rest} outside of brackets, like {@code https://example.org/page}.
     */
    static @Nullable Match bareLink(final ParseSession session, final String input, final int position) {
        final var protocolEnd = Chars.skipWhile(input, position, Chars::isAsciiLetter);
        if (protocolEnd == position || !input.startsWith(bareLinkSeparator, protocolEnd)) {
            return null;
        }
        final var restStart = protocolEnd + bareLinkSeparator.length();
        final var restEnd = Chars.skipWhile(input, restStart, LinkRules::isBareLinkCharacter);
        if (restEnd == restStart) {
            return null;
        }
        final var protocol = input.substring(position, protocolEnd);
        final var rest = input.substring(restStart, restEnd);
        final var url = new Node.Url.Complex(protocol, "//" + rest);
        final var label = List.<Node>of(new Node.Plain(input.substring(position, restEnd)));
        return new Match(new Node.Link(url, label), restEnd);
    }

    /**
     * {@code [fn::definition]}, {@code [fn:name]} or {@code [fn:name:definition]}.
     */
    static @Nullable Match footnoteReference(final ParseSession session, final String input, final int position) {
        if (!input.startsWith(footnotePrefix, position)) {
            return null;
        }
        final var anonymous = anonymousFootnote(session, input, position);
        return (anonymous != null) ? anonymous : namedFootnote(session, input, position);
    }

    /**
     * Returns {@code true} iff a bare link may start at the given index.
     */
    static boolean startsBareLink(final String input, final int index) {
        final var protocolEnd = Chars.skipWhile(input, index, Chars::isAsciiLetter);
        return protocolEnd > index && input.startsWith(bareLinkSeparator, protocolEnd);
    }

    static Node.Url classifyUrl(final String url) {
        final var first = url.charAt(0);
        if (first == '/' || first == '.') {
            return new Node.Url.File(url);
        }
        final var colon = url.indexOf(':');
        if (colon > 0 && colon + 1 < url.length() && url.indexOf('\n', colon) < 0) {
            return new Node.Url.Complex(url.substring(0, colon), url.substring(colon + 1));
        }
        return new Node.Url.Search(url);
    }

    private static @Nullable Match anonymousFootnote(
        final ParseSession session,
        final String input,
        final int position
    ) {
        if (!input.startsWith(anonymousFootnotePrefix, position)) {
            return null;
        }
        final var bodyStart = position + anonymousFootnotePrefix.length();
        final var bodyEnd = Chars.skipWhile(input, bodyStart, LinkRules::isFootnoteBodyCharacter);
        if (bodyEnd == bodyStart || !isClosingBracket(input, bodyEnd)) {
            return null;
        }
        final var definition = parseDefinition(session, input.substring(bodyStart, bodyEnd));
        final var name = session.nextAnonymousFootnoteName();
        return new Match(new Node.FootnoteReference(name, definition), bodyEnd + 1);
    }

    private static @Nullable Match namedFootnote(final ParseSession session, final String input, final int position) {
        final var nameStart = position + footnotePrefix.length();
        final var nameEnd = Chars.skipWhile(input, nameStart, ch -> ch != ':' && isFootnoteBodyCharacter(ch));
        if (nameEnd == nameStart) {
            return null;
        }
        var bodyStart = nameEnd;
        if (bodyStart < input.length() && input.charAt(bodyStart) == ':') {
            bodyStart += 1;
        }
        final var bodyEnd = Chars.skipWhile(input, bodyStart, LinkRules::isFootnoteBodyCharacter);
        if (!isClosingBracket(input, bodyEnd)) {
            return null;
        }
        final var name = input.substring(nameStart, nameEnd);
        final var definition = (bodyEnd == bodyStart)
            ? null
            : parseDefinition(session, input.substring(bodyStart, bodyEnd));
        return new Match(new Node.FootnoteReference(name, definition), bodyEnd + 1);
    }

    private static List<Node> parseDefinition(final ParseSession session, final String definition) {
        return session.parseSequence(definition, InlineRule.footnoteDefinition());
    }

    private static boolean isClosingBracket(final String input, final int index) {
        return index < input.length() && input.charAt(index) == ']';
    }

    private static boolean isFootnoteBodyCharacter(final char ch) {
        return ch != ']' && !Chars.isEol(ch);
    }

    private static boolean isBareLinkCharacter(final char ch) {
        return !Chars.isWhitespace(ch) && bareLinkStoppers.indexOf(ch) < 0;
    }

    private static final String footnotePrefix = "[fn:";
    private static final String anonymousFootnotePrefix = "[fn::";
    private static final String bareLinkSeparator = "://";
    private static final String bareLinkStoppers = "[]<>{}()*$";
}
