// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package orgmark.util;

import org.jetbrains.annotations.NotNull;

/**
 * Lets checked throwables cross method boundaries that don't declare them.
 * <p>
 * Only {@link orgmark.util.condition.Unwind} is thrown this way, so that restarts can unwind through grammar and codec
 * code without every signature mentioning it.
 */
public final class SneakyThrow {
    private SneakyThrow() {
    }

    /**
     * Throws the given throwable as if it were unchecked.
     * <p>
     * Never returns normally; the declared return type lets call sites write {@code throw SneakyThrow.doThrow(t)}.
     */
    public static @NotNull UnreachableCodeReachedError doThrow(final @NotNull Throwable throwable) {
        throw doThrowImpl(throwable);
    }

    /**
     * Does nothing, but lets the caller catch a checked throwable of type {@code E} that was thrown sneakily.
     */
    @SuppressWarnings({"RedundantThrows", "EmptyMethod"})
    public static <E extends Throwable> void pretendThrows() throws E {
    }

    // E is erased to Throwable, so the cast disappears at runtime, while the compiler infers E as RuntimeException at
    // call sites that don't specify it.
    @SuppressWarnings("unchecked")
    private static <E extends Throwable> @NotNull UnreachableCodeReachedError doThrowImpl(
        final @NotNull Throwable throwable
    ) throws E {
        throw (E) throwable;
    }
}
