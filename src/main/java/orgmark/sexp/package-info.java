// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * S-expressions as Java objects: the external representation that serialized inline trees are written in.
 */
@NonNullByDefault
package orgmark.sexp;

import orgmark.util.annotation.NonNullByDefault;
