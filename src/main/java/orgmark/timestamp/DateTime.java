// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package orgmark.timestamp;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.LocalDate;
import java.time.LocalTime;
import orgmark.util.annotation.Nullable;

/**
 * What {@link DateTimeParser#parseRepeater(String, LocalDate, LocalTime, char)} hands back: the date and time, possibly
 * adjusted, and the repeater.
 */
@SuppressFBWarnings(value = "EQ_UNUSUAL", justification = "SpotBugs doesn't understand equals() of records yet")
public record DateTime(LocalDate date, @Nullable LocalTime time, @Nullable Repetition repetition) {
}
