// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package orgmark.cli;

import java.io.IOException;
import orgmark.util.condition.Condition;

/**
 * A condition type indicating that standard input couldn't be read.
 */
final class InputErrorCondition extends Condition {
    InputErrorCondition(final IOException cause) {
        super("Couldn't read standard input: " + cause.getMessage());
        this.cause = cause;
    }

    @Override
    public String detailedMessage() {
        return message() + '\n' + cause;
    }

    private final IOException cause;
}
