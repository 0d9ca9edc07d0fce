// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package orgmark.test;

import java.util.List;
import java.util.stream.LongStream;
import orgmark.inline.Node;
import orgmark.inline.ParseSession;
import orgmark.inline.Spanned;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

final class ParserPropertiesTest {
    static LongStream provideSeeds() {
        return LongStream.generate(RandomUtils::generateRandomSeed).limit(8);
    }

    @Test
    void emptyInputYieldsNoNodes() {
        assertThat(ParseSession.withDefaults().parse("")).isEmpty();
        assertThat(ParseSession.withDefaults().parseWithSpans("")).isEmpty();
    }

    @ParameterizedTest
    @MethodSource("provideSeeds")
    void spansCoverInputExactly(final long seed) {
        final var random = RandomUtils.createGenerator(seed);
        for (int i = 0; i < iterationsPerSeed; i += 1) {
            final var input = RandomUtils.generateMarkup(random, maxInputLength);
            final var spans = ParseSession.withDefaults().parseWithSpans(input);
            var expectedStart = 0;
            final var reassembled = new StringBuilder();
            for (final var span : spans) {
                assertThat(span.start()).as("seed %d, input %s", seed, input).isEqualTo(expectedStart);
                assertThat(span.end()).isGreaterThan(span.start());
                reassembled.append(span.sourceText(input));
                expectedStart = span.end();
            }
            assertThat(expectedStart).isEqualTo(input.length());
            assertThat(reassembled.toString()).isEqualTo(input);
            assertThat(spans.stream().map(Spanned::node).toList()).isEqualTo(ParseSession.withDefaults().parse(input));
        }
    }

    @ParameterizedTest
    @MethodSource("provideSeeds")
    void adjacentPlainNodesAreAlwaysMerged(final long seed) {
        final var random = RandomUtils.createGenerator(seed);
        final var session = ParseSession.withDefaults();
        for (int i = 0; i < iterationsPerSeed; i += 1) {
            final var input = RandomUtils.generateMarkup(random, maxInputLength);
            assertNormalized(session.parse(input), input);
        }
    }

    @Test
    void plainTextIsReturnedUnchanged() {
        final var input = "Just some text, with punctuation; and (parentheses).";
        assertThat(ParseSession.withDefaults().parse(input)).containsExactly(new Node.Plain(input));
    }

    private static void assertNormalized(final List<Node> nodes, final String input) {
        for (int i = 1; i < nodes.size(); i += 1) {
            final var bothPlain = nodes.get(i - 1) instanceof Node.Plain && nodes.get(i) instanceof Node.Plain;
            assertThat(bothPlain).as("adjacent plain nodes at %d for input %s", i, input).isFalse();
        }
        for (final var node : nodes) {
            if (node instanceof Node.Emphasis emphasis) {
                assertNormalized(emphasis.children(), input);
            } else if (node instanceof Node.Link link) {
                assertNormalized(link.label(), input);
            } else if (node instanceof Node.Subscript subscript) {
                assertNormalized(subscript.children(), input);
            } else if (node instanceof Node.Superscript superscript) {
                assertNormalized(superscript.children(), input);
            } else if (node instanceof Node.FootnoteReference footnote && footnote.definition() != null) {
                assertNormalized(footnote.definition(), input);
            }
        }
    }

    private static final int iterationsPerSeed = 500;
    private static final int maxInputLength = 120;
}
