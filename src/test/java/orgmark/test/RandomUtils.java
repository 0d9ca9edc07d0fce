// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package orgmark.test;

import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;
import java.nio.ByteOrder;
import java.security.SecureRandom;
import java.util.random.RandomGenerator;
import java.util.random.RandomGeneratorFactory;

final class RandomUtils {
    private RandomUtils() {
    }

    static RandomGenerator createGenerator(final long seed) {
        return factory.create(seed);
    }

    static long generateRandomSeed() {
        return SeedGenerator.generateSeed();
    }

    /**
     * Returns a random string of up to {@code maxLength} characters, built from fragments that are likely to trigger
     * some inline rule, partially or fully.
     */
    static String generateMarkup(final RandomGenerator random, final int maxLength) {
        final var builder = new StringBuilder();
        final var targetLength = random.nextInt(maxLength + 1);
        while (builder.length() < targetLength) {
            builder.append(markupFragments[random.nextInt(markupFragments.length)]);
        }
        return builder.toString();
    }

    private static final RandomGeneratorFactory<?> factory = RandomGeneratorFactory.of("L32X64MixRandom");

    private static final String[] markupFragments = {
        "*", "/", "_", "+", "~", "=", "[", "]", "<", ">", "{", "}", "(", ")", "$", "$$", "\\", "^", "@@", ":",
        "%", "-", "--", ".", ",", " ", " ", " ", "\t", "\n", "\r\n", "a", "bc", "word", "12", "0", "/3", "α",
        "[[", "]]", "][", "[fn:", "[fn::", "<<", ">>", "<<<", ">>>", "{{{", "}}}", "_{", "^{", "\\(", "\\)",
        "\\[", "\\]", "\\alpha", "\\bogus", "https://", "x.org", "./a.png", "SCHEDULED:", "DEADLINE:", "CLOSED:",
        "CLOCK:", "<2018-10-16 Tue>", "[2018-10-16 Tue 21:20]", "2018-10-16", " Tue", " +1w", " .+2d", " 9:30",
        "@@html:", "[50%]", "[3/10]", "{{{m(a, b)}}}",
    };

    private static final class SeedGenerator {
        private static long generateSeed() {
            final var bytes = new byte[Long.BYTES];
            secureRandom.nextBytes(bytes);
            return (long) longView.get(bytes, 0);
        }

        private static final SecureRandom secureRandom = new SecureRandom();
        private static final VarHandle longView =
            MethodHandles.byteArrayViewVarHandle(long[].class, ByteOrder.nativeOrder()).withInvokeExactBehavior();
    }
}
