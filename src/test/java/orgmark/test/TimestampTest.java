// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package orgmark.test;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import orgmark.inline.Node;
import orgmark.inline.ParseSession;
import orgmark.timestamp.Repetition;
import orgmark.timestamp.TimestampData;
import orgmark.timestamp.TimestampRange;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

final class TimestampTest {
    @Test
    void activeDateIsRecognized() {
        assertThat(parse("<2018-10-16 Tue>")).containsExactly(timestamp(new Node.Stamp.Date(
            new TimestampData(LocalDate.of(2018, 10, 16), null, null, true))));
    }

    @Test
    void inactiveDateWithTimeIsRecognized() {
        assertThat(parse("[2018-10-16 Tue 21:20]")).containsExactly(timestamp(new Node.Stamp.Date(
            new TimestampData(LocalDate.of(2018, 10, 16), LocalTime.of(21, 20), null, false))));
    }

    @Test
    void deadlineWithRepeaterIsRecognized() {
        final var repetition = new Repetition(Repetition.Kind.CUMULATIVE, 1, Repetition.Unit.WEEK);
        assertThat(parse("DEADLINE: <2008-02-10 Sun +1w>")).containsExactly(timestamp(new Node.Stamp.Deadline(
            new TimestampData(LocalDate.of(2008, 2, 10), null, repetition, true))));
    }

    @Test
    void scheduledWithTimeAndRepeaterIsRecognized() {
        final var repetition = new Repetition(Repetition.Kind.CATCH_UP, 2, Repetition.Unit.DAY);
        assertThat(parse("SCHEDULED: <2007-05-16 Wed 12:30 ++2d>")).containsExactly(timestamp(
            new Node.Stamp.Scheduled(
                new TimestampData(LocalDate.of(2007, 5, 16), LocalTime.of(12, 30), repetition, true))));
    }

    @Test
    void closedWithRestartRepeaterIsRecognized() {
        final var repetition = new Repetition(Repetition.Kind.RESTART, 1, Repetition.Unit.MONTH);
        assertThat(parse("CLOSED: [2007-05-16 Wed .+1m]")).containsExactly(timestamp(new Node.Stamp.Closed(
            new TimestampData(LocalDate.of(2007, 5, 16), null, repetition, false))));
    }

    @Test
    void rangeIsRecognized() {
        final var range = new TimestampRange(
            new TimestampData(LocalDate.of(2004, 8, 23), null, null, true),
            new TimestampData(LocalDate.of(2004, 8, 26), null, null, true)
        );
        assertThat(parse("<2004-08-23 Mon>--<2004-08-26 Thu>"))
            .containsExactly(timestamp(new Node.Stamp.Range(range)));
    }

    @Test
    void runningClockIsRecognized() {
        assertThat(parse("CLOCK: [2018-09-25 Tue 13:49]")).containsExactly(timestamp(new Node.Stamp.ClockStarted(
            new TimestampData(LocalDate.of(2018, 9, 25), LocalTime.of(13, 49), null, false))));
    }

    @Test
    void stoppedClockIsRecognized() {
        final var range = new TimestampRange(
            new TimestampData(LocalDate.of(2018, 9, 25), LocalTime.of(13, 49), null, false),
            new TimestampData(LocalDate.of(2018, 9, 25), LocalTime.of(13, 51), null, false)
        );
        assertThat(parse("CLOCK: [2018-09-25 Tue 13:49]--[2018-09-25 Tue 13:51]"))
            .containsExactly(timestamp(new Node.Stamp.ClockStopped(range)));
    }

    @Test
    void keywordInsideTextStartsTimestamp() {
        assertThat(parse("Due DEADLINE: <2008-02-10 Sun>")).containsExactly(
            new Node.Plain("Due "),
            timestamp(new Node.Stamp.Deadline(new TimestampData(LocalDate.of(2008, 2, 10), null, null, true)))
        );
    }

    @Test
    void invalidRepeaterLeavesRepetitionAbsent() {
        assertThat(parse("<2018-10-16 Tue +1x>")).containsExactly(timestamp(new Node.Stamp.Date(
            new TimestampData(LocalDate.of(2018, 10, 16), null, null, true))));
    }

    @ParameterizedTest
    @ValueSource(strings = {"<2018-13-45 Tue>", "<2018-10-16>", "[2018-10-16 Tue", "<2018-10-16 Tue 1 2 3>"})
    void malformedTimestampsStayLiteral(final String input) {
        assertThat(parse(input)).containsExactly(new Node.Plain(input));
    }

    private static List<Node> parse(final String input) {
        return ParseSession.withDefaults().parse(input);
    }

    private static Node timestamp(final Node.Stamp stamp) {
        return new Node.Timestamp(stamp);
    }
}
