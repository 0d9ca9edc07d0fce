// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Values carried by timestamps and the date/time sub-grammar that produces them.
 * <p>
 * The inline grammar only recognizes the bracket and keyword structure of a timestamp; the tokens inside are handed to
 * a {@link orgmark.timestamp.DateTimeParser}.
 */
@NonNullByDefault
package orgmark.timestamp;

import orgmark.util.annotation.NonNullByDefault;
