// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package orgmark.inline;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import orgmark.util.annotation.Nullable;

/**
 * The dispatch table of the inline grammar.
 * <p>
 * At every position, rules are tried in declaration order and the first one that matches wins; a failing rule
 * consumes nothing. The order decides ambiguous prefixes, so it must not be changed casually:
 * <ul>
 * <li>LaTeX fragments and timestamps come first, because they claim {@code $ \ < [}, which other rules use too;
 * LaTeX beats entities on {@code \(} and {@code \[}.
 * <li>Statistics cookies, footnote references and links all start with {@code [}, and are tried in that order.
 * <li>Radio targets ({@code <<<}) are tried before targets ({@code <<}).
 * <li>Line breaks are tried before emphasis, so that a newline never ends up inside a span.
 * <li>Emphasis beats subscripts on {@code _}: {@code _{x}_} is underlined.
 * <li>Plain text is last and always matches.
 * </ul>
 * Nested contexts use subsets of this table, see {@link #emphasisInterior()} and friends.
 */
enum InlineRule {
    LATEX_FRAGMENT(AtomRules::latexFragment),
    TIMESTAMP(TimestampRules::timestamp),
    ENTITY(AtomRules::entity),
    MACRO(AtomRules::macro),
    EXPORT_SNIPPET(AtomRules::exportSnippet),
    STATISTICS_COOKIE(AtomRules::statisticsCookie),
    FOOTNOTE_REFERENCE(LinkRules::footnoteReference),
    LINK(LinkRules::link),
    BARE_LINK(LinkRules::bareLink),
    RADIO_TARGET(AtomRules::radioTarget),
    TARGET(AtomRules::target),
    VERBATIM(MarkupRules::verbatim),
    CODE(MarkupRules::code),
    LINE_BREAK(MarkupRules::lineBreak),
    EMPHASIS(MarkupRules::emphasis),
    SUBSCRIPT(MarkupRules::subscript),
    SUPERSCRIPT(MarkupRules::superscript),
    PLAIN(MarkupRules::plain);

    InlineRule(final RuleParser parser) {
        this.parser = parser;
    }

    /**
     * Applies this rule at the given position, which must be inside the input.
     *
     * @return The match, or {@code null} if this rule doesn't match there.
     */
    @Nullable Match apply(final ParseSession session, final String input, final int position) {
        return parser.parse(session, input, position);
    }

    /**
     * The full table, used for top-level input.
     */
    static Set<InlineRule> all() {
        return all;
    }

    /**
     * Rules for the inside of an emphasis span.
     */
    static Set<InlineRule> emphasisInterior() {
        return emphasisInterior;
    }

    /**
     * Rules for link labels.
     */
    static Set<InlineRule> linkLabel() {
        return linkLabel;
    }

    /**
     * Rules for inline footnote definitions.
     */
    static Set<InlineRule> footnoteDefinition() {
        return footnoteDefinition;
    }

    /**
     * Rules for the bodies of subscripts and superscripts.
     */
    static Set<InlineRule> scriptBody() {
        return scriptBody;
    }

    private static Set<InlineRule> ruleSet(final InlineRule first, final InlineRule... rest) {
        final var set = EnumSet.of(first, rest);
        assert set.contains(PLAIN) : "A rule set without PLAIN cannot guarantee progress";
        return Collections.unmodifiableSet(set);
    }

    private static final Set<InlineRule> all = Collections.unmodifiableSet(EnumSet.allOf(InlineRule.class));
    private static final Set<InlineRule> emphasisInterior = ruleSet(EMPHASIS, PLAIN);
    private static final Set<InlineRule> linkLabel =
        ruleSet(LATEX_FRAGMENT, ENTITY, CODE, EMPHASIS, SUBSCRIPT, SUPERSCRIPT, PLAIN);
    private static final Set<InlineRule> footnoteDefinition =
        ruleSet(LATEX_FRAGMENT, ENTITY, LINK, BARE_LINK, TARGET, CODE, EMPHASIS, SUBSCRIPT, SUPERSCRIPT, PLAIN);
    private static final Set<InlineRule> scriptBody = ruleSet(ENTITY, EMPHASIS, PLAIN);

    private final RuleParser parser;

    @FunctionalInterface
    private interface RuleParser {
        @Nullable Match parse(ParseSession session, String input, int position);
    }
}
