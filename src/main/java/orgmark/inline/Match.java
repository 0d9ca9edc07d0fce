// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package orgmark.inline;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * A successful rule application: the node produced and the input index just past the text it covers.
 */
@SuppressFBWarnings(value = "EQ_UNUSUAL", justification = "SpotBugs doesn't understand equals() of records yet")
record Match(Node node, int end) {
}
