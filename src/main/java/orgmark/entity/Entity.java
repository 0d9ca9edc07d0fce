// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package orgmark.entity;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * A named symbolic glyph, with its renderings for the usual export targets.
 *
 * @param name      The entity name, as written after the backslash.
 * @param latex     The LaTeX rendering.
 * @param latexMath {@code true} iff {@link #latex} is only valid in math mode.
 * @param html      The HTML rendering.
 * @param ascii     The plain ASCII rendering.
 * @param latin1    The Latin-1 rendering.
 * @param unicode   The Unicode glyph.
 */
@SuppressFBWarnings(value = "EQ_UNUSUAL", justification = "SpotBugs doesn't understand equals() of records yet")
public record Entity(
    String name,
    String latex,
    boolean latexMath,
    String html,
    String ascii,
    String latin1,
    String unicode
) {
}
