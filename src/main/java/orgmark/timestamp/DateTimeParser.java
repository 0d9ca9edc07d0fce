// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package orgmark.timestamp;

import java.time.LocalDate;
import java.time.LocalTime;
import orgmark.util.annotation.Nullable;

/**
 * The date/time sub-grammar consumed by the timestamp rule.
 * <p>
 * Implementations must be pure functions without shared mutable state, so that one instance can serve any number of
 * parse sessions.
 */
public interface DateTimeParser {
    /**
     * Parses a date token, returning {@code null} if it isn't a valid date.
     */
    @Nullable LocalDate parseDate(String token);

    /**
     * Parses a clock time token, returning {@code null} if it isn't a valid time.
     */
    @Nullable LocalTime parseTime(String token);

    /**
     * Parses a repeater token following the given date and time.
     *
     * @param token    The repeater token, including its leading mark.
     * @param date     The date of the timestamp.
     * @param time     The time of the timestamp, if any.
     * @param leadChar The first character of {@code token}.
     * @return The date and time of the timestamp with the repeater; the repeater is {@code null} if the token isn't
     * a valid one.
     */
    DateTime parseRepeater(String token, LocalDate date, @Nullable LocalTime time, char leadChar);
}
