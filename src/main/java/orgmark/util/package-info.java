// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Small utilities shared by all packages: diagnostics traces and programming error types.
 */
@NonNullByDefault
package orgmark.util;

import orgmark.util.annotation.NonNullByDefault;
