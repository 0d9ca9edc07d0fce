// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package orgmark.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * Base type of everything that can be signaled through {@link ConditionContext}.
 * <p>
 * Handlers run before the stack unwinds, so a handler can decide to ignore a condition, record it, or transfer control
 * to a restart point established after the handler itself.
 */
public abstract class Condition {
    protected Condition(final @NotNull String message) {
        this.message = message;
    }

    /**
     * Returns the short user-readable message.
     */
    public final @NotNull String message() {
        return message;
    }

    /**
     * Returns the full user-readable message, which may span several lines. Defaults to {@link #message()}.
     */
    public @NotNull String detailedMessage() {
        return message;
    }

    @Override
    public @NotNull String toString() {
        return getClass().getName() + ": " + message;
    }

    private final @NotNull String message;
}
