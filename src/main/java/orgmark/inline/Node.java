// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package orgmark.inline;

import java.util.List;
import orgmark.entity.Entity;
import orgmark.timestamp.TimestampData;
import orgmark.timestamp.TimestampRange;
import orgmark.util.annotation.Nullable;

/**
 * The base interface of inline nodes.
 * <p>
 * Nodes are immutable: child lists are copied into unmodifiable lists on construction.
 */
public sealed interface Node {
    /**
     * A styled span whose children are themselves parsed markup.
     */
    record Emphasis(EmphasisKind kind, List<Node> children) implements Node {
        public Emphasis {
            children = List.copyOf(children);
        }
    }

    /**
     * {@code ~code~}, kept verbatim.
     */
    record Code(String text) implements Node {
    }

    /**
     * {@code =verbatim=}, kept verbatim.
     */
    record Verbatim(String text) implements Node {
    }

    /**
     * Literal text.
     */
    record Plain(String text) implements Node {
    }

    /**
     * An explicit line break.
     */
    record BreakLine() implements Node {
    }

    /**
     * A link; the label may be empty when the source gave none.
     */
    record Link(Url url, List<Node> label) implements Node {
        public Link {
            label = List.copyOf(label);
        }
    }

    /**
     * {@code <<target>>}.
     */
    record Target(String name) implements Node {
    }

    /**
     * {@code <<<radio target>>>}.
     */
    record RadioTarget(String name) implements Node {
    }

    record Subscript(List<Node> children) implements Node {
        public Subscript {
            children = List.copyOf(children);
        }
    }

    record Superscript(List<Node> children) implements Node {
        public Superscript {
            children = List.copyOf(children);
        }
    }

    /**
     * A footnote reference, optionally carrying an inline definition.
     *
     * @param name       The user-given name, or a generated one for anonymous footnotes.
     * @param definition The parsed inline definition, {@code null} if the reference has none.
     */
    record FootnoteReference(String name, @Nullable List<Node> definition) implements Node {
        public FootnoteReference {
            if (definition != null) {
                definition = List.copyOf(definition);
            }
        }
    }

    /**
     * A statistics cookie, {@code [50%]} or {@code [3/10]}.
     */
    record Cookie(StatisticsCookie value) implements Node {
    }

    record LatexFragment(LatexMode mode, String content) implements Node {
    }

    /**
     * A macro call, {@code {{{name(arg1, arg2)}}}}. Recognized, never expanded.
     */
    record Macro(String name, List<String> arguments) implements Node {
        public Macro {
            arguments = List.copyOf(arguments);
        }
    }

    /**
     * A resolved entity. Unresolved ones become {@link Plain} nodes instead.
     */
    record EntityReference(Entity entity) implements Node {
    }

    record Timestamp(Stamp stamp) implements Node {
    }

    /**
     * {@code @@backend:content@@}, raw content meant for one export backend.
     */
    record ExportSnippet(String backend, String content) implements Node {
    }

    enum EmphasisKind {
        BOLD('*'),
        ITALIC('/'),
        UNDERLINE('_'),
        STRIKE_THROUGH('+');

        EmphasisKind(final char delimiter) {
            this.delimiter = delimiter;
        }

        /**
         * Returns the character delimiting spans of this kind on both sides.
         */
        public char delimiter() {
            return delimiter;
        }

        /**
         * Returns the kind delimited by the given character, or {@code null} if it doesn't delimit emphasis.
         */
        public static @Nullable EmphasisKind byDelimiter(final char delimiter) {
            return switch (delimiter) {
                case '*' -> BOLD;
                case '/' -> ITALIC;
                case '_' -> UNDERLINE;
                case '+' -> STRIKE_THROUGH;
                default -> null;
            };
        }

        private final char delimiter;
    }

    enum LatexMode {
        /**
         * {@code $...$} or {@code \(...\)}.
         */
        INLINE,
        /**
         * {@code $$...$$} or {@code \[...\]}.
         */
        DISPLAYED
    }

    /**
     * Link destinations.
     */
    sealed interface Url {
        /**
         * A path, recognized by a leading {@code /} or {@code .}.
         */
        record File(String path) implements Url {
        }

        /**
         * Anything that is neither a path nor {@code protocol:rest}; resolved by searching the document.
         */
        record Search(String term) implements Url {
        }

        /**
         * {@code protocol:link}, like {@code https://example.org}, where {@code link} is {@code //example.org}.
         */
        record Complex(String protocol, String link) implements Url {
        }
    }

    sealed interface StatisticsCookie {
        record Percent(int percent) implements StatisticsCookie {
        }

        record Absolute(int current, int max) implements StatisticsCookie {
        }
    }

    /**
     * The meaning of a timestamp, given by its keyword or by being a range.
     */
    sealed interface Stamp {
        record Scheduled(TimestampData data) implements Stamp {
        }

        record Deadline(TimestampData data) implements Stamp {
        }

        /**
         * A bare timestamp without any keyword.
         */
        record Date(TimestampData data) implements Stamp {
        }

        record Closed(TimestampData data) implements Stamp {
        }

        /**
         * {@code CLOCK: [...]}, a clock that is still running.
         */
        record ClockStarted(TimestampData data) implements Stamp {
        }

        /**
         * {@code CLOCK: [...]--[...]}.
         */
        record ClockStopped(TimestampRange range) implements Stamp {
        }

        /**
         * {@code <...>--<...>}.
         */
        record Range(TimestampRange range) implements Stamp {
        }
    }
}
