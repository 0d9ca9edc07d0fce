// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package orgmark.entity;

import orgmark.util.annotation.Nullable;

/**
 * Resolves entity names to glyphs.
 * <p>
 * Implementations must be pure: the same name always resolves to the same result.
 */
@FunctionalInterface
public interface EntityTable {
    /**
     * Returns the entity with the given name, or {@code null} if the name is unknown.
     */
    @Nullable Entity lookup(String name);

    /**
     * Returns a table that knows no entities at all.
     */
    static EntityTable empty() {
        return name -> null;
    }
}
