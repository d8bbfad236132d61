// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package sexpedit.zip;

import java.util.function.BiFunction;
import java.util.function.Function;
import sexpedit.convert.Converter;
import sexpedit.tree.Node;
import sexpedit.util.Trace;
import sexpedit.util.condition.ConditionContext;
import sexpedit.zipper.Location;

/**
 * Edits that go through host-level values: the current node is converted to a host value, transformed, and
 * converted back.
 * <p>
 * Conversion failures are signaled as fatal conditions. While an edit is in progress, a restart named
 * {@value #LEAVE_UNCHANGED_RESTART} is active; a handler that unwinds to it makes the edit return the location it
 * was given, untouched. If no handler does, the failure escapes as an
 * {@link sexpedit.util.condition.UnhandledErrorError}.
 *
 * @param <V> the host value type
 */
public final class Editor<V> {
    /**
     * Initializes a new editor converting values with the given converter.
     */
    public Editor(final Converter<V> converter) {
        this.converter = converter;
    }

    /**
     * Returns the host value of the node at the given location.
     */
    public V sexpr(final Location<Node> location) {
        try (final var trace = new Trace(() -> "Converting the " + Zip.tag(location) + " at the cursor")) {
            trace.use();
            return converter.toHostValue(location.node());
        }
    }

    /**
     * Replaces the node at the given location with the node representing {@code value}.
     */
    public Location<Node> replace(final Location<Node> location, final V value) {
        return withLeaveUnchangedRestart(location, () -> location.replace(converter.toNode(value)));
    }

    /**
     * Replaces the node at the given location with the result of applying {@code function} to its host value.
     */
    public Location<Node> edit(final Location<Node> location, final Function<? super V, ? extends V> function) {
        return withLeaveUnchangedRestart(location, () -> {
            final var value = function.apply(sexpr(location));
            return location.replace(converter.toNode(value));
        });
    }

    /**
     * Replaces the node at the given location with the result of applying {@code function} to its host value and
     * {@code argument}.
     */
    public <A> Location<Node> edit(
        final Location<Node> location,
        final BiFunction<? super V, ? super A, ? extends V> function,
        final A argument
    ) {
        return edit(location, value -> function.apply(value, argument));
    }

    private static Location<Node> withLeaveUnchangedRestart(
        final Location<Node> location,
        final EditBody body
    ) {
        try (final var trace = new Trace(() -> "Editing the " + Zip.tag(location) + " at the cursor")) {
            trace.use();
            final var result = ConditionContext.withRestart(LEAVE_UNCHANGED_RESTART, restart -> body.run());
            return (result != null) ? result : location;
        }
    }

    /**
     * The name of the restart that abandons an edit, leaving the location as it was.
     */
    public static final String LEAVE_UNCHANGED_RESTART = "Leave the location unchanged";

    private final Converter<V> converter;

    @FunctionalInterface
    private interface EditBody {
        Location<Node> run();
    }
}
