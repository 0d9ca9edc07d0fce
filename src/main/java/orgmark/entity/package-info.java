// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Named entities such as {@code \alpha}: the glyph records and the tables resolving names to them.
 */
@NonNullByDefault
package orgmark.entity;

import orgmark.util.annotation.NonNullByDefault;
