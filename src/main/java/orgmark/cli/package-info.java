// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The command line filter: inline markup on standard input, serialized inline trees on standard output.
 */
@NonNullByDefault
package orgmark.cli;

import orgmark.util.annotation.NonNullByDefault;
