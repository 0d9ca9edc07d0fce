// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package orgmark.timestamp;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import orgmark.util.annotation.Nullable;

/**
 * A repeater: how a timestamp advances each time it is done.
 *
 * @param kind  How the next occurrence is computed.
 * @param value How many {@code unit}s to advance by.
 * @param unit  The unit of {@code value}.
 */
@SuppressFBWarnings(value = "EQ_UNUSUAL", justification = "SpotBugs doesn't understand equals() of records yet")
public record Repetition(Kind kind, int value, Unit unit) {
    public Repetition {
        if (value < 0) {
            throw new IllegalArgumentException("Negative repeater interval: " + value);
        }
    }

    /**
     * Repeater kinds, named after their effect.
     */
    public enum Kind {
        /**
         * {@code +}: shift by the interval once per completion, possibly still leaving the date in the past.
         */
        CUMULATIVE("+"),
        /**
         * {@code ++}: shift by the interval until the date is in the future.
         */
        CATCH_UP("++"),
        /**
         * {@code .+}: restart the interval from today.
         */
        RESTART(".+");

        Kind(final String mark) {
            this.mark = mark;
        }

        /**
         * Returns the mark written in front of the interval.
         */
        public String mark() {
            return mark;
        }

        private final String mark;
    }

    /**
     * Interval units, with the letter used for them in timestamps.
     */
    public enum Unit {
        HOUR('h'),
        DAY('d'),
        WEEK('w'),
        MONTH('m'),
        YEAR('y');

        Unit(final char letter) {
            this.letter = letter;
        }

        public char letter() {
            return letter;
        }

        /**
         * Returns the unit written with the given letter, or {@code null} if there is none.
         */
        public static @Nullable Unit byLetter(final char letter) {
            for (final var unit : values()) {
                if (unit.letter == letter) {
                    return unit;
                }
            }
            return null;
        }

        private final char letter;
    }

    @Override
    public String toString() {
        return kind.mark() + value + unit.letter();
    }
}
