// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package orgmark.test;

import java.util.List;
import orgmark.inline.Node;
import orgmark.inline.Normalizer;
import orgmark.inline.ParseSession;
import orgmark.inline.PlainText;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

final class PlainTextTest {
    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '\'', value = {
        "*bold* and /it/                   | bold and it",
        "[[https://x.org][label]]          | label",
        "[[https://x.org]]                 | ''",
        "H_{2}O x^{n}                      | H2O xn",
        "$x$ and $$y$$                     | 'x and '",
        "[fn::note] a                      | note a",
        "=verb= ~code~                     | 'verb '",
        "\\alpha\\to\\beta                 | α→β",
    })
    void projectsContributingNodes(final String input, final String expected) {
        assertThat(PlainText.of(ParseSession.withDefaults().parse(input))).isEqualTo(expected);
    }

    @Test
    void nonTextualNodesContributeNothing() {
        final var nodes = ParseSession.withDefaults().parse("<<t>>[50%]{{{m}}}<2018-10-16 Tue>@@html:x@@a\nb");
        assertThat(PlainText.of(nodes)).isEqualTo("ab");
    }

    @Test
    void projectionOfSingleNode() {
        final var emphasis = new Node.Emphasis(
            Node.EmphasisKind.BOLD,
            List.of(new Node.Plain("a"), new Node.Emphasis(Node.EmphasisKind.ITALIC, List.of(new Node.Plain("b"))))
        );
        assertThat(PlainText.of(emphasis)).isEqualTo("ab");
        assertThat(PlainText.of(new Node.FootnoteReference("n", null))).isEmpty();
    }

    @Test
    void projectionIsNotReparsed() {
        final var nodes = List.<Node>of(new Node.Verbatim("*not bold*"));
        assertThat(PlainText.of(nodes)).isEqualTo("*not bold*");
    }

    @Test
    void normalizerMergesAdjacentPlainNodes() {
        final var nodes = List.<Node>of(
            new Node.Plain("a"),
            new Node.Plain("b"),
            new Node.Code("c"),
            new Node.Plain("d"),
            new Node.Plain(""),
            new Node.Plain("e")
        );
        assertThat(Normalizer.concatPlains(nodes))
            .containsExactly(new Node.Plain("ab"), new Node.Code("c"), new Node.Plain("de"));
        assertThat(Normalizer.concatPlains(List.of())).isEmpty();
    }
}
