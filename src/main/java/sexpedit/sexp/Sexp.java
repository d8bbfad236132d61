// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package sexpedit.sexp;

import java.math.BigInteger;
import sexpedit.util.annotation.Nullable;
import sexpedit.util.collection.ConsList;

/**
 * Marker interface serving as the base type of S-expression objects.
 * <p>
 * S-expression objects are guaranteed to be immutable.
 */
public sealed interface Sexp {
    /**
     * Base interface for Lisp symbols.
     * <p>
     * Symbol equality is guaranteed to be the same as object identity for symbols interned in the same
     * {@link SymbolTable}.
     */
    sealed interface Symbol extends Sexp {
        /**
         * Retrieves the name of this symbol.
         */
        java.lang.String symbolName();
    }

    /**
     * An S-expression integer object.
     */
    record Integer(BigInteger value) implements Sexp {
    }

    /**
     * An S-expression string object.
     */
    record String(java.lang.String value) implements Sexp {
    }

    /**
     * An S-expression character object, such as {@code \a}.
     */
    record Character(char value) implements Sexp {
    }

    /**
     * An S-expression list object, {@code (a b c)}.
     */
    record List(ConsList<Sexp> value) implements Sexp {
    }

    /**
     * An S-expression vector object, {@code [a b c]}.
     */
    record Vector(ConsList<Sexp> value) implements Sexp {
    }

    /**
     * An S-expression set object, {@code #{a b c}}.
     * <p>
     * Elements keep the order they were written in; duplicates are not allowed.
     */
    record Set(ConsList<Sexp> value) implements Sexp {
    }

    /**
     * An S-expression map object, {@code {k1 v1 k2 v2}}.
     * <p>
     * Keys and values alternate, in the order they were written in, so the list always has an even number of
     * elements.
     */
    record Map(ConsList<Sexp> value) implements Sexp {
    }

    /**
     * A regular Lisp symbol, not directly used by Java code.
     */
    final class RegularSymbol implements Sexp.Symbol {
        /**
         * Initializes a new, <em>uninterned</em> symbol.
         * <p>
         * Prefer {@link SymbolTable#intern(java.lang.String)}.
         */
        public RegularSymbol(final java.lang.String name) {
            this.name = name;
        }

        @Override
        public java.lang.String symbolName() {
            return name;
        }

        @Override
        public java.lang.String toString() {
            return name;
        }

        private final java.lang.String name;
    }

    /**
     * Lisp symbols with a fixed meaning.
     */
    enum KnownSymbol implements Sexp.Symbol {
        NIL("nil"),
        TRUE("true"),
        FALSE("false");

        KnownSymbol(final java.lang.String name) {
            this.name = name;
        }

        /**
         * Returns the known symbol with the given name, or {@code null} if there is none.
         */
        public static @Nullable KnownSymbol byName(final java.lang.String name) {
            for (final var symbol : values()) {
                if (symbol.name.equals(name)) {
                    return symbol;
                }
            }
            return null;
        }

        @Override
        public java.lang.String symbolName() {
            return name;
        }

        @Override
        public java.lang.String toString() {
            return name;
        }

        private final java.lang.String name;
    }
}
