// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package orgmark.test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.LongStream;
import orgmark.codec.TreeFormatErrorCondition;
import orgmark.codec.TreeReader;
import orgmark.codec.TreeWriter;
import orgmark.inline.Node;
import orgmark.inline.ParseSession;
import orgmark.sexp.reader.ReadErrorCondition;
import orgmark.util.condition.Condition;
import orgmark.util.condition.ConditionContext;
import orgmark.util.condition.Handler;
import orgmark.util.condition.UnhandledErrorError;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

final class CodecTest {
    static LongStream provideSeeds() {
        return LongStream.generate(RandomUtils::generateRandomSeed).limit(8);
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '\'', value = {
        "*bold* text                     | ((emphasis bold (plain \"bold\")) (plain \" text\"))",
        "[[./a.png]]                     | ((link (file \"./a.png\")))",
        "[[https://x.org][label]]        | ((link (complex \"https\" \"//x.org\") (plain \"label\")))",
        "[50%]                           | ((cookie percent 50))",
        "[3/10]                          | ((cookie absolute 3 10))",
        "[fn:n]                          | ((footnote-reference \"n\"))",
        "[fn:n:x]                        | ((footnote-reference \"n\" :definition (plain \"x\")))",
        "{{{name(a, b)}}}                | ((macro \"name\" \"a\" \"b\"))",
        "@@html:<b>@@                    | ((export-snippet \"html\" \"<b>\"))",
        "$x$                             | ((latex-fragment inline \"x\"))",
        "\\alpha                         | ((entity \"alpha\" \"\\\\alpha\" t \"&alpha;\" \"alpha\" \"alpha\" \"α\"))",
        "''                              | ()",
    })
    void writesDocumentedForms(final String input, final String expected) {
        assertThat(TreeWriter.write(ParseSession.withDefaults().parse(input))).isEqualTo(expected);
    }

    @Test
    void writesTimestamps() {
        assertThat(TreeWriter.write(ParseSession.withDefaults().parse("DEADLINE: <2008-02-10 Sun +1w>"))).isEqualTo(
            "((timestamp deadline (stamp :date \"2008-02-10\" :time nil :repeat (cumulative 1 week) :active t)))");
        assertThat(TreeWriter.write(ParseSession.withDefaults().parse("<2004-08-23 Mon 9:05>--<2004-08-26 Thu>")))
            .isEqualTo("((timestamp range"
                + " (stamp :date \"2004-08-23\" :time \"09:05\" :repeat nil :active t)"
                + " (stamp :date \"2004-08-26\" :time nil :repeat nil :active t)))");
    }

    @Test
    void writesLineBreaksAndEscapes() {
        assertThat(TreeWriter.write(ParseSession.withDefaults().parse("a \"q\"\nb")))
            .isEqualTo("((plain \"a \\\"q\\\"\") (break-line) (plain \"b\"))");
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "*bold /italic/* and ~code~ =verb=",
        "[[https://x.org][*label* \\alpha $x$]] and https://bare.org/x",
        "[fn::anon *def*] [fn:named] [fn:n:with [[term]] link]",
        "SCHEDULED: <2007-05-16 Wed 12:30 ++2d> CLOSED: [2007-05-16 Wed .+1m]",
        "CLOCK: [2018-09-25 Tue 13:49]--[2018-09-25 Tue 13:51] CLOCK: [2018-09-25 Tue 13:49]",
        "<2004-08-23 Mon>--<2004-08-26 Thu> <2018-10-16 Tue 1:00 +3h> <2018-10-16 Tue +1y>",
        "<<target>> <<<radio>>> [50%] [3/10] {{{m}}} {{{m(a,b)}}} @@latex:\\\\@@",
        "H_{2}O x^{\\alpha} \\[x\\] $$y$$ line\r\nbreak",
    })
    void roundTripsParsedTrees(final String input) {
        final var nodes = ParseSession.withDefaults().parse(input);
        assertThat(TreeReader.read(TreeWriter.write(nodes))).isEqualTo(nodes);
    }

    @ParameterizedTest
    @MethodSource("provideSeeds")
    void roundTripsRandomTrees(final long seed) {
        final var random = RandomUtils.createGenerator(seed);
        final var session = ParseSession.withDefaults();
        for (int i = 0; i < 200; i += 1) {
            final var nodes = session.parse(RandomUtils.generateMarkup(random, 120));
            assertThat(TreeReader.read(TreeWriter.write(nodes))).as("seed %d", seed).isEqualTo(nodes);
        }
    }

    @Test
    void readsNilAsEmptyTree() {
        assertThat(TreeReader.read("nil")).isEmpty();
        assertThat(TreeReader.read(" ; nothing here\n()")).isEmpty();
    }

    @ParameterizedTest
    @ValueSource(strings = {"((plain \"a\")", "((plain \"a))", "((plain #x))", "(plain \"a\"))", ")"})
    void malformedSyntaxSignalsReadError(final String text) {
        assertThat(readCapturingError(text)).isInstanceOf(ReadErrorCondition.class);
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "",
        "(plain \"a\")",
        "((bogus \"a\"))",
        "((() \"a\"))",
        "((\"plain\" \"a\"))",
        "((plain 5))",
        "((plain \"a\" \"b\"))",
        "((emphasis shiny (plain \"x\")))",
        "((cookie percent 99999999999))",
        "((cookie fraction 1 2))",
        "((link (ftp \"x\")))",
        "((footnote-reference \"n\" :body (plain \"x\")))",
        "((timestamp date (stamp :date \"2018-02-30\" :time nil :repeat nil :active t)))",
        "((timestamp date (stamp :date \"2018-02-03\" :time nil :repeat (cumulative -1 week) :active t)))",
        "((timestamp date (stamp :time nil :date \"2018-02-03\" :repeat nil :active t)))",
        "((entity \"alpha\"))",
        "() ()",
    })
    void malformedTreesSignalFormatError(final String text) {
        assertThat(readCapturingError(text)).isInstanceOf(TreeFormatErrorCondition.class);
    }

    @Test
    void unhandledErrorIsThrown() {
        final var error = catchThrowableOfType(() -> TreeReader.read("((bogus))"), UnhandledErrorError.class);
        assertThat(error).isNotNull();
        assertThat(error.condition()).isInstanceOf(TreeFormatErrorCondition.class);
    }

    @Test
    void readErrorsCarryLocation() {
        final var condition = readCapturingError("(\n(plain \"a\")\n(plain #))");
        assertThat(condition).isInstanceOf(ReadErrorCondition.class);
        final var location = ((ReadErrorCondition) condition).sourceLocation();
        assertThat(location.lineNumber()).isEqualTo(3);
        assertThat(location.column()).isEqualTo(8);
        assertThat(location.topLevelFormLine()).isEqualTo(1);
    }

    private static Condition readCapturingError(final String text) {
        final var captured = new ArrayList<Condition>();
        final var result = ConditionContext.withRestart("use-empty-tree", restart -> {
            try (final var handler = new Handler(c -> {
                if (c.isFatal()) {
                    captured.add(c.condition());
                    restart.unwindTo();
                }
            })) {
                handler.use();
                return TreeReader.read(text);
            }
        });
        assertThat(result).isNull();
        assertThat(captured).hasSize(1);
        return captured.get(0);
    }
}
