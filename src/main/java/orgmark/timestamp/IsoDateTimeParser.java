// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package orgmark.timestamp;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import orgmark.util.annotation.Nullable;

/**
 * The default date/time sub-grammar.
 * <ul>
 * <li>Dates are ISO calendar dates, {@code 2018-10-16}.
 * <li>Times are {@code H:mm} or {@code HH:mm}, 24-hour clock.
 * <li>Repeaters are a mark ({@code +}, {@code ++} or {@code .+}), a decimal interval and a unit letter
 * ({@code h d w m y}), like {@code .+2w}.
 * </ul>
 */
public final class IsoDateTimeParser implements DateTimeParser {
    private IsoDateTimeParser() {
    }

    /**
     * Returns the shared instance.
     */
    public static IsoDateTimeParser instance() {
        return instance;
    }

    @Override
    public @Nullable LocalDate parseDate(final String token) {
        try {
            return LocalDate.parse(token, dateFormatter);
        } catch (final DateTimeParseException e) {
            return null;
        }
    }

    @Override
    public @Nullable LocalTime parseTime(final String token) {
        try {
            return LocalTime.parse(token, timeFormatter);
        } catch (final DateTimeParseException e) {
            return null;
        }
    }

    @Override
    public DateTime parseRepeater(
        final String token,
        final LocalDate date,
        final @Nullable LocalTime time,
        final char leadChar
    ) {
        return new DateTime(date, time, parseRepetition(token, leadChar));
    }

    private static @Nullable Repetition parseRepetition(final String token, final char leadChar) {
        final Repetition.Kind kind;
        if (leadChar == '+') {
            kind = token.startsWith("++") ? Repetition.Kind.CATCH_UP : Repetition.Kind.CUMULATIVE;
        } else if (leadChar == '.' && token.startsWith(".+")) {
            kind = Repetition.Kind.RESTART;
        } else {
            return null;
        }
        final var digitsStart = kind.mark().length();
        final var unitIndex = token.length() - 1;
        if (unitIndex <= digitsStart) {
            return null;
        }
        final var unit = Repetition.Unit.byLetter(token.charAt(unitIndex));
        if (unit == null) {
            return null;
        }
        for (int i = digitsStart; i < unitIndex; i += 1) {
            final var ch = token.charAt(i);
            if (ch < '0' || ch > '9') {
                return null;
            }
        }
        try {
            return new Repetition(kind, Integer.parseInt(token, digitsStart, unitIndex, 10), unit);
        } catch (final NumberFormatException e) {
            return null;
        }
    }

    private static final IsoDateTimeParser instance = new IsoDateTimeParser();
    private static final DateTimeFormatter dateFormatter =
        DateTimeFormatter.ofPattern("uuuu-MM-dd").withResolverStyle(ResolverStyle.STRICT);
    private static final DateTimeFormatter timeFormatter =
        DateTimeFormatter.ofPattern("H:mm").withResolverStyle(ResolverStyle.STRICT);
}
