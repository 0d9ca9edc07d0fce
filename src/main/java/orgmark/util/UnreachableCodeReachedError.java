// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package orgmark.util;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown when control flow reaches a point that a program invariant says cannot be reached.
 * <p>
 * It signals a bug, not bad input, hence it is an {@link AssertionError}.
 */
public final class UnreachableCodeReachedError extends AssertionError {
    public UnreachableCodeReachedError() {
        super("Execution reached a point expected to be unreachable");
    }

    public UnreachableCodeReachedError(final @NotNull String message) {
        super(message);
    }
}
