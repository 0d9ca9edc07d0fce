// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Serialized inline trees: converting {@link orgmark.inline.Node} sequences to and from tagged S-expressions.
 */
@NonNullByDefault
package orgmark.codec;

import orgmark.util.annotation.NonNullByDefault;
