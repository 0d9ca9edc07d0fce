// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package orgmark.inline;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * A top-level node together with the half-open range of input characters it was parsed from.
 *
 * @param node  The parsed node.
 * @param start Index of the first input character covered by the node.
 * @param end   Index just past the last input character covered by the node.
 */
@SuppressFBWarnings(value = "EQ_UNUSUAL", justification = "SpotBugs doesn't understand equals() of records yet")
public record Spanned(Node node, int start, int end) {
    public Spanned {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
    }

    /**
     * Returns the part of {@code input} this node was parsed from.
     */
    public String sourceText(final String input) {
        return input.substring(start, end);
    }
}
