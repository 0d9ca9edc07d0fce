// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package orgmark.inline;

import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import java.util.List;
import orgmark.util.UnreachableCodeReachedError;

/**
 * Projects nodes to their canonical literal text, as used for labels, alt text and the like.
 * <p>
 * Only some nodes contribute text:
 * <ul>
 * <li>plain text, verbatim text and inline LaTeX fragments contribute their content;
 * <li>resolved entities contribute their Unicode glyph;
 * <li>emphasis, subscripts and superscripts contribute the text of their children, links that of their label,
 * footnote references that of their definition;
 * <li>everything else, code included, contributes nothing.
 * </ul>
 * The result is just text: nothing in it is markup any more.
 */
public final class PlainText {
    private PlainText() {
    }

    /**
     * Returns the concatenated text of the given nodes.
     */
    @CheckReturnValue
    public static String of(final List<Node> nodes) {
        final var builder = new StringBuilder();
        appendAll(builder, nodes);
        return builder.toString();
    }

    /**
     * Returns the text of the given node.
     */
    @CheckReturnValue
    public static String of(final Node node) {
        final var builder = new StringBuilder();
        append(builder, node);
        return builder.toString();
    }

    private static void appendAll(final StringBuilder builder, final List<Node> nodes) {
        for (final var node : nodes) {
            append(builder, node);
        }
    }

    private static void append(final StringBuilder builder, final Node node) {
        if (node instanceof final Node.Plain plain) {
            builder.append(plain.text());
        } else if (node instanceof final Node.Verbatim verbatim) {
            builder.append(verbatim.text());
        } else if (node instanceof final Node.LatexFragment latex) {
            if (latex.mode() == Node.LatexMode.INLINE) {
                builder.append(latex.content());
            }
        } else if (node instanceof final Node.EntityReference entity) {
            builder.append(entity.entity().unicode());
        } else if (node instanceof final Node.Emphasis emphasis) {
            appendAll(builder, emphasis.children());
        } else if (node instanceof final Node.Subscript subscript) {
            appendAll(builder, subscript.children());
        } else if (node instanceof final Node.Superscript superscript) {
            appendAll(builder, superscript.children());
        } else if (node instanceof final Node.Link link) {
            appendAll(builder, link.label());
        } else if (node instanceof final Node.FootnoteReference footnote) {
            final var definition = footnote.definition();
            if (definition != null) {
                appendAll(builder, definition);
            }
        } else if (!contributesNothing(node)) {
            throw new UnreachableCodeReachedError("Unknown node type " + node.getClass().getName());
        }
    }

    private static boolean contributesNothing(final Node node) {
        return node instanceof Node.Code
            || node instanceof Node.BreakLine
            || node instanceof Node.Target
            || node instanceof Node.RadioTarget
            || node instanceof Node.Cookie
            || node instanceof Node.Macro
            || node instanceof Node.Timestamp
            || node instanceof Node.ExportSnippet;
    }
}
