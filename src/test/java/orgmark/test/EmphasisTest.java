// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package orgmark.test;

import java.util.List;
import orgmark.inline.Node;
import orgmark.inline.ParseSession;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

final class EmphasisTest {
    @Test
    void boldIsRecognized() {
        assertThat(parse("*bold*")).containsExactly(bold(plain("bold")));
    }

    @ParameterizedTest
    @ValueSource(strings = {"* bold*", "*bold *", "*bold*x", "**", "*", "*unterminated", "*a\tb *"})
    void invalidSpansStayLiteral(final String input) {
        assertThat(parse(input)).containsExactly(plain(input));
    }

    @Test
    void punctuationMayFollowClosingDelimiter() {
        assertThat(parse("*bold*.")).containsExactly(bold(plain("bold")), plain("."));
        assertThat(parse("(*bold*)")).containsExactly(plain("("), bold(plain("bold")), plain(")"));
    }

    @Test
    void allKindsAreRecognized() {
        assertThat(parse("/italic/ _under_ +strike+")).containsExactly(
            new Node.Emphasis(Node.EmphasisKind.ITALIC, List.of(plain("italic"))),
            plain(" "),
            new Node.Emphasis(Node.EmphasisKind.UNDERLINE, List.of(plain("under"))),
            plain(" "),
            new Node.Emphasis(Node.EmphasisKind.STRIKE_THROUGH, List.of(plain("strike")))
        );
    }

    @Test
    void emphasisNests() {
        assertThat(parse("*bold /italic/ bold*")).containsExactly(new Node.Emphasis(
            Node.EmphasisKind.BOLD,
            List.of(
                plain("bold "),
                new Node.Emphasis(Node.EmphasisKind.ITALIC, List.of(plain("italic"))),
                plain(" bold")
            )
        ));
    }

    @Test
    void emphasisInteriorOnlyNestsEmphasis() {
        assertThat(parse("*see [[x]]*")).containsExactly(bold(plain("see [[x]]")));
    }

    @Test
    void spansNeverCrossLines() {
        assertThat(parse("*a\nb*")).containsExactly(plain("*a"), new Node.BreakLine(), plain("b*"));
    }

    @Test
    void codeAndVerbatimAreKeptVerbatim() {
        assertThat(parse("~*code*~ and =/verb/="))
            .containsExactly(new Node.Code("*code*"), plain(" and "), new Node.Verbatim("/verb/"));
    }

    @Test
    void lineBreaksAreRecognized() {
        assertThat(parse("a\nb\r\nc\rd")).containsExactly(
            plain("a"),
            new Node.BreakLine(),
            plain("b"),
            new Node.BreakLine(),
            plain("c"),
            new Node.BreakLine(),
            plain("d")
        );
    }

    @Test
    void scriptsAreRecognized() {
        assertThat(parse("H_{2}O")).containsExactly(
            plain("H"),
            new Node.Subscript(List.of(plain("2"))),
            plain("O")
        );
        assertThat(parse("x^{\\alpha}")).hasSize(2).element(1).isInstanceOf(Node.Superscript.class);
        assertThat(parse("x^{a b}")).containsExactly(plain("x^{a b}"));
    }

    private static List<Node> parse(final String input) {
        return ParseSession.withDefaults().parse(input);
    }

    private static Node bold(final Node... children) {
        return new Node.Emphasis(Node.EmphasisKind.BOLD, List.of(children));
    }

    private static Node plain(final String text) {
        return new Node.Plain(text);
    }
}
