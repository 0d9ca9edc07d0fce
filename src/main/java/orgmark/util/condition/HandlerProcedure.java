// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package orgmark.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * The body of a {@link Handler}.
 */
@FunctionalInterface
public interface HandlerProcedure {
    /**
     * Looks at the given condition. Returning normally declines it; handling it means transferring control elsewhere,
     * usually with {@link Restart#unwindTo()}, which throws {@link Unwind} without declaring it.
     */
    void handle(@NotNull SignaledCondition condition);
}
