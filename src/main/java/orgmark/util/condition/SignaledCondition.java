// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package orgmark.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * What a handler receives: the condition and whether it was signaled as an error.
 *
 * @param condition The condition being signaled.
 * @param isFatal   {@code true} iff it was signaled with {@link ConditionContext#error(Condition)}.
 */
public record SignaledCondition(@NotNull Condition condition, boolean isFatal) {
}
