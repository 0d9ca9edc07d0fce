// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package orgmark.codec;

import orgmark.util.condition.Condition;

/**
 * A condition type indicating that well-formed S-expressions couldn't be turned into inline nodes, because of an
 * unknown tag or a payload of the wrong shape.
 */
public final class TreeFormatErrorCondition extends Condition {
    TreeFormatErrorCondition(final String message) {
        super(message);
    }
}
