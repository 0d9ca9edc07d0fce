// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package orgmark.inline;

import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import java.util.ArrayList;
import java.util.List;

/**
 * Merges runs of adjacent {@link Node.Plain} nodes into single nodes.
 * <p>
 * Only the given level is merged; child sequences are expected to be normalized already, which holds for everything
 * a {@link ParseSession} produces.
 */
public final class Normalizer {
    private Normalizer() {
    }

    /**
     * Returns the given sequence with each run of adjacent plain nodes replaced by one plain node holding their
     * concatenated text.
     */
    @CheckReturnValue
    public static List<Node> concatPlains(final List<Node> nodes) {
        final var result = new ArrayList<Node>(nodes.size());
        for (final var node : nodes) {
            final var lastIndex = result.size() - 1;
            if (node instanceof final Node.Plain plain
                && lastIndex >= 0
                && result.get(lastIndex) instanceof final Node.Plain previous) {
                result.set(lastIndex, new Node.Plain(previous.text() + plain.text()));
            } else {
                result.add(node);
            }
        }
        return List.copyOf(result);
    }

    /**
     * Like {@link #concatPlains(List)}, merging the source spans of merged nodes as well.
     */
    static List<Spanned> concatPlainSpans(final List<Spanned> spans) {
        final var result = new ArrayList<Spanned>(spans.size());
        for (final var span : spans) {
            final var lastIndex = result.size() - 1;
            if (span.node() instanceof final Node.Plain plain
                && lastIndex >= 0
                && result.get(lastIndex).node() instanceof final Node.Plain previous) {
                final var merged = new Node.Plain(previous.text() + plain.text());
                result.set(lastIndex, new Spanned(merged, result.get(lastIndex).start(), span.end()));
            } else {
                result.add(span);
            }
        }
        return List.copyOf(result);
    }
}
