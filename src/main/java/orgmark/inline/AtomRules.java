// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package orgmark.inline;

import java.util.ArrayList;
import java.util.List;
import orgmark.util.annotation.Nullable;
import orgmark.util.condition.ConditionContext;

/**
 * Rules for self-contained constructs that don't nest other markup: LaTeX fragments, entities, macros, export
 * snippets, statistics cookies and targets.
 */
final class AtomRules {
    private AtomRules() {
    }

    /**
     * {@code $inline$}, {@code $$displayed$$}, {@code \(inline\)} or {@code \[displayed\]}.
     */
    static @Nullable Match latexFragment(final ParseSession session, final String input, final int position) {
        if (input.startsWith("$$", position)) {
            return dollarFragment(input, position + 2, "$$", Node.LatexMode.DISPLAYED);
        } else if (input.startsWith("$", position)) {
            return dollarFragment(input, position + 1, "$", Node.LatexMode.INLINE);
        } else if (input.startsWith("\\(", position)) {
            return bracketFragment(input, position + 2, "\\)", Node.LatexMode.INLINE);
        } else if (input.startsWith("\\[", position)) {
            return bracketFragment(input, position + 2, "\\]", Node.LatexMode.DISPLAYED);
        } else {
            return null;
        }
    }

    /**
     * {@code \name}, resolved through the session's entity table.
     */
    static @Nullable Match entity(final ParseSession session, final String input, final int position) {
        if (input.charAt(position) != '\\') {
            return null;
        }
        final var nameStart = position + 1;
        final var nameEnd = Chars.skipWhile(input, nameStart, Chars::isAsciiLetter);
        if (nameEnd == nameStart) {
            return null;
        }
        final var name = input.substring(nameStart, nameEnd);
        final var entity = session.entities().lookup(name);
        if (entity == null) {
            ConditionContext.signal(new UnknownEntityCondition(name));
            return new Match(new Node.Plain(name), nameEnd);
        }
        return new Match(new Node.EntityReference(entity), nameEnd);
    }

    /**
     * {@code {{{name(arg1, arg2)}}}} or {@code {{{name}}}}.
     */
    static @Nullable Match macro(final ParseSession session, final String input, final int position) {
        if (!input.startsWith(macroOpener, position)) {
            return null;
        }
        final var nameStart = position + macroOpener.length();
        final var nameEnd = Chars.skipWhile(input, nameStart, ch -> ch != '(' && ch != '}' && !Chars.isEol(ch));
        if (nameEnd == nameStart) {
            return null;
        }
        final var name = input.substring(nameStart, nameEnd);
        if (input.startsWith(macroCloser, nameEnd)) {
            return new Match(new Node.Macro(name, List.of()), nameEnd + macroCloser.length());
        }
        if (!input.startsWith("(", nameEnd)) {
            return null;
        }
        final var argumentsStart = nameEnd + 1;
        final var argumentsEnd = input.indexOf(argumentsCloser, argumentsStart);
        if (argumentsEnd < 0) {
            return null;
        }
        final var arguments = splitArguments(input.substring(argumentsStart, argumentsEnd));
        return new Match(new Node.Macro(name, arguments), argumentsEnd + argumentsCloser.length());
    }

    /**
     * {@code @@backend:content@@}.
     */
    static @Nullable Match exportSnippet(final ParseSession session, final String input, final int position) {
        if (!input.startsWith(snippetDelimiter, position)) {
            return null;
        }
        final var backendStart = position + snippetDelimiter.length();
        final var backendEnd = Chars.skipWhile(
            input,
            backendStart,
            ch -> Chars.isAsciiLetter(ch) || Chars.isAsciiDigit(ch) || ch == '-'
        );
        if (backendEnd == backendStart || !input.startsWith(":", backendEnd)) {
            return null;
        }
        final var contentStart = backendEnd + 1;
        final var contentEnd = input.indexOf(snippetDelimiter, contentStart);
        if (contentEnd < 0) {
            return null;
        }
        final var snippet = new Node.ExportSnippet(
            input.substring(backendStart, backendEnd),
            input.substring(contentStart, contentEnd)
        );
        return new Match(snippet, contentEnd + snippetDelimiter.length());
    }

    /**
     * {@code [current/max]} or {@code [percent%]}.
     */
    static @Nullable Match statisticsCookie(final ParseSession session, final String input, final int position) {
        if (input.charAt(position) != '[') {
            return null;
        }
        final var contentStart = position + 1;
        final var contentEnd = Chars.skipWhile(
            input,
            contentStart,
            ch -> Chars.isAsciiDigit(ch) || ch == '/' || ch == '%'
        );
        if (contentEnd == contentStart || contentEnd >= input.length() || input.charAt(contentEnd) != ']') {
            return null;
        }
        final var cookie = interpretCookie(input.substring(contentStart, contentEnd));
        return (cookie == null) ? null : new Match(new Node.Cookie(cookie), contentEnd + 1);
    }

    /**
     * {@code <<<name>>>}.
     */
    static @Nullable Match radioTarget(final ParseSession session, final String input, final int position) {
        return anchor(input, position, "<<<", ">>>", Node.RadioTarget::new);
    }

    /**
     * {@code <<name>>}.
     */
    static @Nullable Match target(final ParseSession session, final String input, final int position) {
        return anchor(input, position, "<<", ">>", Node.Target::new);
    }

    // Reads "digits/digits" or else "digits%", ignoring whatever follows; the content is known to consist of digits,
    // slashes and percent signs only.
    static Node.@Nullable StatisticsCookie interpretCookie(final String content) {
        final var firstEnd = Chars.skipWhile(content, 0, Chars::isAsciiDigit);
        if (firstEnd == 0 || firstEnd == content.length()) {
            return null;
        }
        final var first = parseNumber(content, 0, firstEnd);
        if (first == null) {
            return null;
        }
        if (content.charAt(firstEnd) == '/') {
            final var secondEnd = Chars.skipWhile(content, firstEnd + 1, Chars::isAsciiDigit);
            final var second = parseNumber(content, firstEnd + 1, secondEnd);
            return (second == null) ? null : new Node.StatisticsCookie.Absolute(first, second);
        }
        return (content.charAt(firstEnd) == '%') ? new Node.StatisticsCookie.Percent(first) : null;
    }

    private static @Nullable Integer parseNumber(final String content, final int start, final int end) {
        if (start == end) {
            return null;
        }
        try {
            return Integer.parseInt(content, start, end, 10);
        } catch (final NumberFormatException e) {
            return null;
        }
    }

    private static @Nullable Match dollarFragment(
        final String input,
        final int contentStart,
        final String closer,
        final Node.LatexMode mode
    ) {
        final var contentEnd = Chars.skipWhile(input, contentStart, ch -> ch != '$');
        if (contentEnd == contentStart || !input.startsWith(closer, contentEnd)) {
            return null;
        }
        final var fragment = new Node.LatexFragment(mode, input.substring(contentStart, contentEnd));
        return new Match(fragment, contentEnd + closer.length());
    }

    private static @Nullable Match bracketFragment(
        final String input,
        final int contentStart,
        final String closer,
        final Node.LatexMode mode
    ) {
        final var contentEnd = input.indexOf(closer, contentStart);
        if (contentEnd <= contentStart) {
            return null;
        }
        final var fragment = new Node.LatexFragment(mode, input.substring(contentStart, contentEnd));
        return new Match(fragment, contentEnd + closer.length());
    }

    private static @Nullable Match anchor(
        final String input,
        final int position,
        final String opener,
        final String closer,
        final AnchorConstructor constructor
    ) {
        if (!input.startsWith(opener, position)) {
            return null;
        }
        final var nameStart = position + opener.length();
        final var nameEnd = Chars.skipWhile(input, nameStart, ch -> ch != '>' && !Chars.isEol(ch));
        if (nameEnd == nameStart || !input.startsWith(closer, nameEnd)) {
            return null;
        }
        return new Match(constructor.create(input.substring(nameStart, nameEnd)), nameEnd + closer.length());
    }

    private static List<String> splitArguments(final String arguments) {
        if (arguments.isBlank()) {
            return List.of();
        }
        final var result = new ArrayList<String>();
        int start = 0;
        while (true) {
            final var comma = arguments.indexOf(',', start);
            if (comma < 0) {
                result.add(arguments.substring(start).strip());
                return result;
            }
            result.add(arguments.substring(start, comma).strip());
            start = comma + 1;
        }
    }

    private static final String macroOpener = "{{{";
    private static final String macroCloser = "}}}";
    private static final String argumentsCloser = ")}}}";
    private static final String snippetDelimiter = "@@";

    @FunctionalInterface
    private interface AnchorConstructor {
        Node create(String name);
    }
}
