// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package sexpedit.convert;

import java.math.BigInteger;
import java.util.HashSet;
import sexpedit.sexp.Sexp;
import sexpedit.sexp.Sexps;
import sexpedit.sexp.SymbolTable;
import sexpedit.tree.Node;
import sexpedit.tree.NodeKind;
import sexpedit.tree.Nodes;
import sexpedit.util.Trace;
import sexpedit.util.collection.ConsList;
import sexpedit.util.condition.ConditionContext;

/**
 * Converts between syntax tree nodes and {@link Sexp} values.
 * <p>
 * Going to the tree, composite children are separated by single spaces. Going to the host side, whitespace and
 * comments are dropped, integral token literals of any width become {@link Sexp.Integer}, and symbols are
 * re-interned into this converter's symbol table.
 * <p>
 * A map must have an even number of forms, a set must not contain duplicates, and only tokens holding integers,
 * strings, characters or symbols can be converted; anything else signals a fatal {@link ConversionErrorCondition}.
 */
public final class SexpConverter implements Converter<Sexp> {
    /**
     * Initializes a new converter that interns the symbols it produces into the given table.
     */
    public SexpConverter(final SymbolTable symbolTable) {
        this.symbolTable = symbolTable;
    }

    @Override
    public Node toNode(final Sexp value) {
        if (value instanceof Sexp.Integer integer) {
            return Nodes.token(integer.value());
        } else if (value instanceof Sexp.String string) {
            return Nodes.token(string.value());
        } else if (value instanceof Sexp.Character character) {
            return Nodes.token(character.value());
        } else if (value instanceof Sexp.Symbol symbol) {
            return Nodes.token(symbol);
        } else if (value instanceof Sexp.List list) {
            return compositeToNode(NodeKind.LIST, list.value());
        } else if (value instanceof Sexp.Vector vector) {
            return compositeToNode(NodeKind.VECTOR, vector.value());
        } else if (value instanceof Sexp.Set set) {
            checkNoDuplicates(set.value(), value);
            return compositeToNode(NodeKind.SET, set.value());
        } else if (value instanceof Sexp.Map map) {
            checkEvenCount(map.value(), value);
            return compositeToNode(NodeKind.MAP, map.value());
        }
        throw ConditionContext.error(new ConversionErrorCondition("Unknown S-expression type " + value.getClass()));
    }

    @Override
    public Sexp toHostValue(final Node node) {
        if (node instanceof Node.Token token) {
            return tokenToHostValue(token.value());
        } else if (node instanceof Node.Branching branching) {
            return compositeToHostValue(branching);
        }
        throw ConditionContext.error(new ConversionErrorCondition("A " + node.kind() + " node has no host value"));
    }

    private Node compositeToNode(final NodeKind kind, final ConsList<Sexp> elements) {
        try (final var trace = new Trace(() -> "Converting a " + kind + " to a syntax tree node")) {
            trace.use();
            return Nodes.composite(kind, Nodes.spaced(elements.map(this::toNode)));
        }
    }

    private Sexp compositeToHostValue(final Node.Branching node) {
        try (final var trace = new Trace(() -> "Converting a " + node.kind() + " node to a host value")) {
            trace.use();
            final var elements = Nodes.significantChildren(node).map(this::toHostValue);
            if (node instanceof Node.List) {
                return new Sexp.List(elements);
            } else if (node instanceof Node.Vector) {
                return new Sexp.Vector(elements);
            } else if (node instanceof Node.Set) {
                final var set = new Sexp.Set(elements);
                checkNoDuplicates(elements, set);
                return set;
            } else {
                final var map = new Sexp.Map(elements);
                checkEvenCount(elements, map);
                return map;
            }
        }
    }

    private Sexp tokenToHostValue(final Object literal) {
        if (literal instanceof BigInteger integer) {
            return new Sexp.Integer(integer);
        } else if (literal instanceof Long || literal instanceof Integer || literal instanceof Short
            || literal instanceof Byte) {
            return new Sexp.Integer(BigInteger.valueOf(((Number) literal).longValue()));
        } else if (literal instanceof String string) {
            return new Sexp.String(string);
        } else if (literal instanceof Character character) {
            return new Sexp.Character(character);
        } else if (literal instanceof Sexp.Symbol symbol) {
            return symbolTable.intern(symbol.symbolName());
        }
        throw ConditionContext.error(new ConversionErrorCondition(
            "Token literal " + literal + " of type " + literal.getClass().getName() + " has no host value"
        ));
    }

    private static void checkNoDuplicates(final ConsList<Sexp> elements, final Sexp set) {
        final var seen = new HashSet<Sexp>();
        for (final var element : elements) {
            if (!seen.add(element)) {
                throw ConditionContext.error(new ConversionErrorCondition(
                    "Set " + Sexps.prettyPrint(set) + " contains " + Sexps.prettyPrint(element) + " more than once"
                ));
            }
        }
    }

    private static void checkEvenCount(final ConsList<Sexp> elements, final Sexp map) {
        if (elements.exactSize() % 2 != 0) {
            throw ConditionContext.error(new ConversionErrorCondition(
                "Map " + Sexps.prettyPrint(map) + " has an odd number of forms"
            ));
        }
    }

    private final SymbolTable symbolTable;
}
