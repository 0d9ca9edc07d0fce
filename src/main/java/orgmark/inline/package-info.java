// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The inline markup grammar: turns one line or paragraph of text into a sequence of {@link orgmark.inline.Node}s.
 * <p>
 * Start with {@link orgmark.inline.ParseSession}.
 */
@NonNullByDefault
package orgmark.inline;

import orgmark.util.annotation.NonNullByDefault;
