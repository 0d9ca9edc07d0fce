// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package orgmark.inline;

import orgmark.util.condition.Condition;

/**
 * A non-fatal condition signaled when {@code \name} doesn't name an entity the session's table knows.
 * <p>
 * The parse goes on regardless, producing a {@link Node.Plain} node with the name.
 */
public final class UnknownEntityCondition extends Condition {
    UnknownEntityCondition(final String entityName) {
        super("Unknown entity \\" + entityName + ", treating it as plain text");
        this.entityName = entityName;
    }

    /**
     * Returns the name that couldn't be resolved, without the backslash.
     */
    public String entityName() {
        return entityName;
    }

    private final String entityName;
}
