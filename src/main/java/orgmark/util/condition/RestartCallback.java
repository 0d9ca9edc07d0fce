// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package orgmark.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * Code run under a restart point; receives the restart so it can unwind to it directly.
 */
@FunctionalInterface
public interface RestartCallback<T> {
    T call(@NotNull Restart restart) throws Unwind;
}
