// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package orgmark.sexp.reader;

import orgmark.util.condition.Condition;

/**
 * A condition type indicating that the S-expression text could not be parsed.
 */
public final class ReadErrorCondition extends Condition {
    /**
     * Initializes a new read error with the given user-readable message and associated error location.
     */
    ReadErrorCondition(final String rawMessage, final SourceLocation location) {
        super(rawMessage);
        sourceLocation = location;
    }

    /**
     * Returns where the reader gave up.
     */
    public SourceLocation sourceLocation() {
        return sourceLocation;
    }

    @Override
    public String detailedMessage() {
        return message() + '\n' + sourceLocation;
    }

    private final SourceLocation sourceLocation;
}
