// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package orgmark.timestamp;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * Two timestamps delimiting a period, written {@code <start>--<stop>}.
 */
@SuppressFBWarnings(value = "EQ_UNUSUAL", justification = "SpotBugs doesn't understand equals() of records yet")
public record TimestampRange(TimestampData start, TimestampData stop) {
}
