// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package orgmark.inline;

import java.time.LocalTime;
import orgmark.timestamp.DateTimeParser;
import orgmark.timestamp.TimestampData;
import orgmark.timestamp.TimestampRange;
import orgmark.util.annotation.Nullable;

/**
 * The timestamp rule: bare timestamps, keyword timestamps and ranges.
 * <pre>
 * &lt;2018-10-16 Tue&gt;                     a date
 * [2018-10-16 Tue 21:20]                an inactive date with a time
 * DEADLINE: &lt;2008-02-10 Sun +1w&gt;       a deadline repeating every week
 * SCHEDULED: &lt;2007-05-16 Wed 12:30 +1w&gt;
 * &lt;2004-08-23 Mon&gt;--&lt;2004-08-26 Thu&gt;   a range
 * CLOCK: [2018-09-25 Tue 13:49]         a running clock
 * CLOCK: [2018-09-25 Tue 13:49]--[2018-09-25 Tue 13:51]
 * </pre>
 * The tokens inside the brackets are interpreted by the session's {@link DateTimeParser}; the day name is ignored.
 */
final class TimestampRules {
    private TimestampRules() {
    }

    static @Nullable Match timestamp(final ParseSession session, final String input, final int position) {
        final var range = range(session, input, position);
        return (range != null) ? range : single(session, input, position);
    }

    /**
     * Returns {@code true} iff a keyword timestamp may start at the given index.
     */
    static boolean startsKeyword(final String input, final int index) {
        return Keyword.at(input, index) != null;
    }

    private static @Nullable Match range(final ParseSession session, final String input, final int position) {
        var startPosition = position;
        final var isClock = input.startsWith(Keyword.CLOCK.text, position);
        if (isClock) {
            startPosition = skipBlanks(input, position + Keyword.CLOCK.text.length());
        }
        final var start = single(session, input, startPosition);
        if (start == null || !input.startsWith(rangeSeparator, start.end())) {
            return null;
        }
        final var stop = single(session, input, start.end() + rangeSeparator.length());
        if (stop == null) {
            return null;
        }
        final var startData = extractData(start.node());
        final var stopData = extractData(stop.node());
        if (startData == null || stopData == null) {
            return null;
        }
        final var range = new TimestampRange(startData, stopData);
        final Node.Stamp stamp = isClock ? new Node.Stamp.ClockStopped(range) : new Node.Stamp.Range(range);
        return new Match(new Node.Timestamp(stamp), stop.end());
    }

    private static @Nullable Match single(final ParseSession session, final String input, final int position) {
        if (position >= input.length()) {
            return null;
        }
        final var keyword = Keyword.at(input, position);
        final var bracketPosition = (keyword == null)
            ? position
            : skipBlanks(input, position + keyword.text.length());
        if (bracketPosition >= input.length()) {
            return null;
        }
        final var closeChar = switch (input.charAt(bracketPosition)) {
            case '<' -> '>';
            case '[' -> ']';
            default -> '\0';
        };
        if (closeChar == '\0') {
            return null;
        }
        final var body = parseBody(session.dateTimeParser(), input, bracketPosition + 1, closeChar);
        if (body == null) {
            return null;
        }
        final var stamp = wrap(keyword, body.data);
        return new Match(new Node.Timestamp(stamp), body.end);
    }

    // Body: date, a blank, day name, then up to two blank-separated tokens, then the closing bracket.
    private static @Nullable Body parseBody(
        final DateTimeParser dateTimeParser,
        final String input,
        final int start,
        final char closeChar
    ) {
        final var length = input.length();
        final var dateEnd = tokenEnd(input, start, closeChar);
        if (dateEnd == start || dateEnd >= length || !Chars.isBlank(input.charAt(dateEnd))) {
            return null;
        }
        final var dayNameStart = dateEnd + 1;
        final var dayNameEnd = Chars.skipWhile(input, dayNameStart, Character::isLetter);
        if (dayNameEnd == dayNameStart) {
            return null;
        }
        final var firstToken = optionalToken(input, dayNameEnd, closeChar);
        final var afterFirst = (firstToken == null) ? dayNameEnd : firstToken.end;
        final var secondToken = (firstToken == null) ? null : optionalToken(input, afterFirst, closeChar);
        final var afterSecond = (secondToken == null) ? afterFirst : secondToken.end;
        if (afterSecond >= length || input.charAt(afterSecond) != closeChar) {
            return null;
        }

        final var date = dateTimeParser.parseDate(input.substring(start, dateEnd));
        if (date == null) {
            return null;
        }
        final var active = closeChar == '>';
        final TimestampData data;
        if (firstToken == null) {
            data = new TimestampData(date, null, null, active);
        } else if (secondToken == null) {
            final var token = firstToken.text;
            final var leadChar = token.charAt(0);
            if (leadChar == '+' || leadChar == '.') {
                final var repeated = dateTimeParser.parseRepeater(token, date, null, leadChar);
                data = new TimestampData(repeated.date(), repeated.time(), repeated.repetition(), active);
            } else {
                data = new TimestampData(date, dateTimeParser.parseTime(token), null, active);
            }
        } else {
            final LocalTime time = dateTimeParser.parseTime(firstToken.text);
            final var token = secondToken.text;
            final var repeated = dateTimeParser.parseRepeater(token, date, time, token.charAt(0));
            data = new TimestampData(repeated.date(), repeated.time(), repeated.repetition(), active);
        }
        return new Body(data, afterSecond + 1);
    }

    private static @Nullable Token optionalToken(final String input, final int position, final char closeChar) {
        if (position >= input.length() || !Chars.isBlank(input.charAt(position))) {
            return null;
        }
        final var tokenStart = position + 1;
        final var tokenEnd = tokenEnd(input, tokenStart, closeChar);
        return (tokenEnd == tokenStart) ? null : new Token(input.substring(tokenStart, tokenEnd), tokenEnd);
    }

    private static int tokenEnd(final String input, final int start, final char closeChar) {
        return Chars.skipWhile(input, start, ch -> !Chars.isWhitespace(ch) && ch != closeChar);
    }

    private static int skipBlanks(final String input, final int start) {
        return Chars.skipWhile(input, start, Chars::isBlank);
    }

    private static Node.Stamp wrap(final @Nullable Keyword keyword, final TimestampData data) {
        if (keyword == null) {
            return new Node.Stamp.Date(data);
        }
        return switch (keyword) {
            case SCHEDULED -> new Node.Stamp.Scheduled(data);
            case DEADLINE -> new Node.Stamp.Deadline(data);
            case CLOSED -> new Node.Stamp.Closed(data);
            case CLOCK -> new Node.Stamp.ClockStarted(data);
        };
    }

    // Range endpoints may carry a keyword, which is dropped; a clock entry can't be an endpoint.
    private static @Nullable TimestampData extractData(final Node node) {
        if (!(node instanceof final Node.Timestamp timestamp)) {
            return null;
        }
        final var stamp = timestamp.stamp();
        if (stamp instanceof final Node.Stamp.Date date) {
            return date.data();
        } else if (stamp instanceof final Node.Stamp.Scheduled scheduled) {
            return scheduled.data();
        } else if (stamp instanceof final Node.Stamp.Deadline deadline) {
            return deadline.data();
        } else if (stamp instanceof final Node.Stamp.Closed closed) {
            return closed.data();
        } else {
            return null;
        }
    }

    private static final String rangeSeparator = "--";

    private enum Keyword {
        SCHEDULED("SCHEDULED:"),
        DEADLINE("DEADLINE:"),
        CLOSED("CLOSED:"),
        CLOCK("CLOCK:");

        Keyword(final String text) {
            this.text = text;
        }

        private static @Nullable Keyword at(final String input, final int index) {
            for (final var keyword : values()) {
                if (input.startsWith(keyword.text, index)) {
                    return keyword;
                }
            }
            return null;
        }

        private final String text;
    }

    private record Token(String text, int end) {
    }

    private record Body(TimestampData data, int end) {
    }
}
