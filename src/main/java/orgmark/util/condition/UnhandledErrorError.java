// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package orgmark.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown by {@link ConditionContext#error(Condition)} when every handler declined the condition.
 * <p>
 * Nobody was prepared for the error, which is a programming error, hence an {@link AssertionError}.
 */
public final class UnhandledErrorError extends AssertionError {
    UnhandledErrorError(final @NotNull Condition condition) {
        super("Fatal condition signaled, but no condition handler unwound; condition: " + condition);
        this.condition = condition;
    }

    /**
     * Returns the condition nobody handled.
     */
    public @NotNull Condition condition() {
        return condition;
    }

    // Conditions aren't serializable; neither is this error in any meaningful way.
    private final transient @NotNull Condition condition;
}
