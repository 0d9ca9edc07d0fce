// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The S-expression reader, converting text into {@link orgmark.sexp.Sexp} objects.
 */
@NonNullByDefault
package orgmark.sexp.reader;

import orgmark.util.annotation.NonNullByDefault;
