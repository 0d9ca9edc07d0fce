// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package orgmark.timestamp;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.LocalDate;
import java.time.LocalTime;
import orgmark.util.annotation.Nullable;

/**
 * The date, time and repeater of one timestamp.
 *
 * @param date       The calendar date.
 * @param time       The clock time, if one was given.
 * @param repetition The repeater, if one was given.
 * @param active     {@code true} for {@code <...>} timestamps, {@code false} for {@code [...]} ones.
 */
@SuppressFBWarnings(value = "EQ_UNUSUAL", justification = "SpotBugs doesn't understand equals() of records yet")
public record TimestampData(
    LocalDate date,
    @Nullable LocalTime time,
    @Nullable Repetition repetition,
    boolean active
) {
}
