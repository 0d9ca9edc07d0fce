// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package orgmark.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * Carries a non-local transfer of control to a {@link Restart}.
 * <p>
 * Public only so that methods can declare it. Code should neither catch nor throw it by hand.
 * <p>
 * It is neither an {@link Exception} nor an {@link Error}: it is plain control flow, so generic
 * {@code catch (Exception e)} blocks must not intercept it.
 */
@SuppressWarnings("ExtendsThrowable")
public final class Unwind extends Throwable {
    Unwind(final @NotNull Restart target) {
        super("Unwinding to a restart point", null, false, false);
        this.target = target;
    }

    @NotNull Restart target() {
        return target;
    }

    private final transient @NotNull Restart target;
}
