// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package orgmark.inline;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import orgmark.entity.EntityTable;
import orgmark.entity.StandardEntities;
import orgmark.timestamp.DateTimeParser;
import orgmark.timestamp.IsoDateTimeParser;
import orgmark.util.Trace;
import orgmark.util.UnreachableCodeReachedError;

/**
 * A parsing session: the primary means of turning raw inline text into {@link Node}s.
 * <p>
 * A session owns the state that outlives a single rule application, which is the counter naming anonymous
 * footnotes: within one session every anonymous footnote gets a distinct {@code _anon_<n>} name. Parse all inline
 * text of one document with the same session, and use separate sessions for unrelated documents.
 * <p>
 * Parsing never fails: malformed markup degrades to {@link Node.Plain} text. An entity name missing from the
 * entity table is reported as a non-fatal {@link UnknownEntityCondition}.
 * <p>
 * Sessions are not thread-safe. The collaborators passed in must be pure, as the shipped ones are.
 */
public final class ParseSession {
    /**
     * Initializes a new session resolving entities with {@code entities} and timestamp contents with
     * {@code dateTimeParser}.
     */
    public ParseSession(final EntityTable entities, final DateTimeParser dateTimeParser) {
        this.entities = entities;
        this.dateTimeParser = dateTimeParser;
    }

    /**
     * Returns a new session using {@link StandardEntities} and {@link IsoDateTimeParser}.
     */
    public static ParseSession withDefaults() {
        return new ParseSession(StandardEntities.table(), IsoDateTimeParser.instance());
    }

    /**
     * Parses the given text into a normalized node sequence.
     * <p>
     * Every character of the input is accounted for by exactly one of the returned nodes, and no two adjacent nodes
     * are both {@link Node.Plain}. Empty input yields an empty list.
     */
    public List<Node> parse(final String input) {
        return nodesOf(parseWithSpans(input));
    }

    /**
     * Like {@link #parse(String)}, but also tells which part of the input each top-level node came from.
     * <p>
     * The spans are contiguous: the first starts at 0, each next one starts where the previous one ends, and the last
     * ends at the input length.
     */
    public List<Spanned> parseWithSpans(final String input) {
        try (final var trace = new Trace(() -> "Parsing inline markup " + abbreviate(input))) {
            trace.use();
            return parseSpans(input, InlineRule.all());
        }
    }

    /**
     * Returns how many anonymous footnotes this session has named so far.
     */
    public long anonymousFootnoteCount() {
        return anonymousFootnoteCounter;
    }

    List<Node> parseSequence(final String input, final Set<InlineRule> rules) {
        return nodesOf(parseSpans(input, rules));
    }

    String nextAnonymousFootnoteName() {
        anonymousFootnoteCounter += 1;
        return anonymousFootnotePrefix + anonymousFootnoteCounter;
    }

    EntityTable entities() {
        return entities;
    }

    DateTimeParser dateTimeParser() {
        return dateTimeParser;
    }

    private List<Spanned> parseSpans(final String input, final Set<InlineRule> rules) {
        final var spans = new ArrayList<Spanned>();
        final var length = input.length();
        int position = 0;
        while (position < length) {
            final var match = applyFirstMatching(input, position, rules);
            assert match.end() > position : "Rule matched without consuming input";
            spans.add(new Spanned(match.node(), position, match.end()));
            position = match.end();
        }
        return Normalizer.concatPlainSpans(spans);
    }

    private Match applyFirstMatching(final String input, final int position, final Set<InlineRule> rules) {
        for (final var rule : rules) {
            final var match = rule.apply(this, input, position);
            if (match != null) {
                return match;
            }
        }
        throw new UnreachableCodeReachedError("No rule matched, is PLAIN missing from the rule set?");
    }

    private static List<Node> nodesOf(final List<Spanned> spans) {
        final var nodes = new ArrayList<Node>(spans.size());
        for (final var span : spans) {
            nodes.add(span.node());
        }
        return List.copyOf(nodes);
    }

    private static String abbreviate(final String input) {
        final var firstLine = input.lines().findFirst().orElse("");
        return (firstLine.length() > maxTracedInputLength || firstLine.length() != input.length())
            ? ('"' + firstLine.substring(0, Math.min(firstLine.length(), maxTracedInputLength)) + "...\"")
            : ('"' + firstLine + '"');
    }

    private static final String anonymousFootnotePrefix = "_anon_";
    private static final int maxTracedInputLength = 40;

    private final EntityTable entities;
    private final DateTimeParser dateTimeParser;
    private long anonymousFootnoteCounter = 0;
}
