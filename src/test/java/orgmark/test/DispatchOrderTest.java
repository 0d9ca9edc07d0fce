// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package orgmark.test;

import java.time.LocalDate;
import java.util.List;
import java.util.stream.Stream;
import orgmark.entity.StandardEntities;
import orgmark.inline.Node;
import orgmark.inline.ParseSession;
import orgmark.timestamp.TimestampData;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

/**
 * Inputs whose first character could start several constructs.
 */
final class DispatchOrderTest {
    static Stream<Arguments> ambiguousPrefixes() {
        final var date = LocalDate.of(2018, 10, 16);
        final var alpha = StandardEntities.table().lookup("alpha");
        assert alpha != null;
        return Stream.of(
            Arguments.of("[50%]", List.of(new Node.Cookie(new Node.StatisticsCookie.Percent(50)))),
            Arguments.of("[fn:x]", List.of(new Node.FootnoteReference("x", null))),
            Arguments.of("[[x]]", List.of(new Node.Link(new Node.Url.Search("x"), List.of()))),
            Arguments.of("[2018-10-16 Tue]", List.of(
                new Node.Timestamp(new Node.Stamp.Date(new TimestampData(date, null, null, false))))),
            Arguments.of("<2018-10-16 Tue>", List.of(
                new Node.Timestamp(new Node.Stamp.Date(new TimestampData(date, null, null, true))))),
            Arguments.of("<<x>>", List.of(new Node.Target("x"))),
            Arguments.of("<<<x>>>", List.of(new Node.RadioTarget("x"))),
            Arguments.of("\\(x\\)", List.of(new Node.LatexFragment(Node.LatexMode.INLINE, "x"))),
            Arguments.of("\\alpha", List.of(new Node.EntityReference(alpha))),
            Arguments.of("_{x}_", List.of(
                new Node.Emphasis(Node.EmphasisKind.UNDERLINE, List.of(new Node.Plain("{x}"))))),
            Arguments.of("a_{x}", List.of(new Node.Plain("a"), new Node.Subscript(List.of(new Node.Plain("x"))))),
            Arguments.of("=~x~=", List.of(new Node.Verbatim("~x~"))),
            Arguments.of("~=x=~", List.of(new Node.Code("=x="))),
            Arguments.of("$$x$", List.of(new Node.Plain("$"), new Node.LatexFragment(Node.LatexMode.INLINE, "x")))
        );
    }

    @ParameterizedTest
    @MethodSource("ambiguousPrefixes")
    void firstMatchingRuleWins(final String input, final List<Node> expected) {
        assertThat(ParseSession.withDefaults().parse(input)).isEqualTo(expected);
    }
}
