// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Condition and restart system used to report problems without unwinding first.
 * <p>
 * Grammar code signals non-fatal conditions for things worth noticing, like an unknown entity name. The tree codec
 * signals fatal conditions for malformed input; a caller that wants to recover establishes a {@link Handler} that
 * unwinds to a {@link Restart}.
 */
@NonNullByDefault
package orgmark.util.condition;

import orgmark.util.annotation.NonNullByDefault;
