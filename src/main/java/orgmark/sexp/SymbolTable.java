// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package orgmark.sexp;

import java.util.concurrent.ConcurrentHashMap;

/**
 * Interns symbols, so that symbols can be compared by identity.
 * <p>
 * Thread-safe: any number of readers may intern into the same table concurrently.
 */
public final class SymbolTable {
    /**
     * Returns the canonical symbol with the given name: the known symbol if there's one, otherwise the symbol this
     * table created for that name the first time it was asked for it.
     */
    public Sexp.Symbol intern(final String symbolName) {
        final var knownSymbol = Sexp.KnownSymbol.byName(symbolName);
        if (knownSymbol != null) {
            return knownSymbol;
        }
        return symbols.computeIfAbsent(symbolName, Sexp.RegularSymbol::new);
    }

    private final ConcurrentHashMap<String, Sexp.RegularSymbol> symbols = new ConcurrentHashMap<>();
}
