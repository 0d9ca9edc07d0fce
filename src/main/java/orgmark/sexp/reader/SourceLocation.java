// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package orgmark.sexp.reader;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * Where in the reader's input something happened. Lines and columns both count from 1; columns count UTF-16 code
 * units.
 */
@SuppressFBWarnings(value = "EQ_UNUSUAL", justification = "SpotBugs doesn't understand equals() of records yet")
public record SourceLocation(int lineNumber, int column, int topLevelFormLine) {
    @Override
    public String toString() {
        return "In line " + lineNumber + ", column " + column + ", within top-level form starting at line "
            + topLevelFormLine;
    }
}
