// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package sexpedit.sexp;

import java.math.BigInteger;
import sexpedit.util.annotation.Nullable;
import sexpedit.util.collection.ConsList;

/**
 * A utility class containing common operations on S-expressions.
 */
public final class Sexps {
    private Sexps() {
    }

    /**
     * Returns the integer the given {@code sexp} represents, or {@code null} if it doesn't represent an integer.
     */
    public static @Nullable BigInteger asInteger(final Sexp sexp) {
        return (sexp instanceof Sexp.Integer integer) ? integer.value() : null;
    }

    /**
     * Returns {@code true} iff the given {@code sexp} is the symbol {@code nil}.
     */
    public static boolean isNil(final Sexp sexp) {
        return sexp == Sexp.KnownSymbol.NIL;
    }

    /**
     * Prints the given S-expression into a string on a single line. Intended for diagnostics, not for writing
     * source code back out.
     */
    public static String prettyPrint(final Sexp sexp) {
        final var printer = new PrettyPrinter();
        printer.appendDispatch(sexp);
        return printer.builder.toString();
    }

    private static final class PrettyPrinter {
        private void appendDispatch(final Sexp sexp) {
            if (sexp instanceof Sexp.Integer integer) {
                builder.append(integer.value());
            } else if (sexp instanceof Sexp.String string) {
                append(string.value());
            } else if (sexp instanceof Sexp.Character character) {
                builder.append('\\').append(character.value());
            } else if (sexp instanceof Sexp.Symbol symbol) {
                builder.append(symbol.symbolName());
            } else if (sexp instanceof Sexp.List list) {
                append("(", list.value(), ")");
            } else if (sexp instanceof Sexp.Vector vector) {
                append("[", vector.value(), "]");
            } else if (sexp instanceof Sexp.Set set) {
                append("#{", set.value(), "}");
            } else if (sexp instanceof Sexp.Map map) {
                append("{", map.value(), "}");
            }
        }

        private void append(final String string) {
            final var replaced = string.replace("\\", "\\\\").replace("\"", "\\\"");
            builder.append('"');
            builder.append(replaced);
            builder.append('"');
        }

        private void append(final String open, final ConsList<Sexp> elements, final String close) {
            builder.append(open);
            var first = true;
            for (final var element : elements) {
                if (!first) {
                    builder.append(' ');
                }
                appendDispatch(element);
                first = false;
            }
            builder.append(close);
        }

        private final StringBuilder builder = new StringBuilder();
    }
}
