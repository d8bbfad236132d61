// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package sexpedit.test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.LongStream;
import sexpedit.tree.Node;
import sexpedit.tree.NodeKind;
import sexpedit.tree.Nodes;
import sexpedit.zip.Navigation;
import sexpedit.zip.Zip;
import sexpedit.zipper.Location;
import static org.assertj.core.api.Assertions.assertThat;
import static sexpedit.test.TestTrees.symbol;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

final class NavigationTest {
    static LongStream provideSeeds() {
        return RandomUtils.provideSeeds();
    }

    private final Node.Token a = symbol("a");
    private final Node.Token b = symbol("b");
    private final Node.Token c = symbol("c");

    @Test
    void downThenRightVisitsSignificantChildren() {
        final var root = Nodes.list(a, Nodes.space(), b);
        final var first = Navigation.down(Zip.of(root));
        assertThat(Zip.value(first)).contains(a.value());
        final var second = first.flatMap(Navigation::right);
        assertThat(Zip.value(second)).contains(b.value());
        assertThat(second.flatMap(Navigation::right)).isEmpty();
        assertThat(second.flatMap(Navigation::up).map(Location::node)).contains(root);
    }

    @Test
    void movesSkipWhitespaceAndComments() {
        final var root = Nodes.vector(
            Nodes.whitespace("\n  "),
            a,
            Nodes.comment("; between\n"),
            b,
            Nodes.whitespace(" "),
            Nodes.comment("; trailing\n")
        );
        final var first = Navigation.down(Zip.of(root)).orElseThrow();
        assertThat(first.node()).isEqualTo(a);
        final var second = Navigation.right(first).orElseThrow();
        assertThat(second.node()).isEqualTo(b);
        assertThat(Navigation.right(second)).isEmpty();
        assertThat(Navigation.left(second).map(Location::node)).contains(a);
        assertThat(Navigation.left(first)).isEmpty();
        assertThat(Navigation.rightmost(first).map(Location::node)).contains(b);
        assertThat(Navigation.leftmost(second).map(Location::node)).contains(a);
    }

    @Test
    void downFailsWhenThereAreOnlyInsignificantChildren() {
        assertThat(Navigation.down(Zip.of(Nodes.vector()))).isEmpty();
        assertThat(Navigation.down(Zip.of(Nodes.list(Nodes.space(), Nodes.comment(";\n"))))).isEmpty();
        assertThat(Navigation.down(Zip.of(a))).isEmpty();
    }

    @Test
    void nextAndPrevWalkSignificantNodesInPreOrder() {
        final var inner = Nodes.vector(Nodes.space(), b, Nodes.space());
        final var root = Nodes.list(a, Nodes.comment("; x\n"), inner, Nodes.space(), c);
        final var visited = walk(Zip.of(root), Navigation::next);
        assertThat(visited).extracting(Location::node).containsExactly(root, a, inner, b, c);
        final var last = visited.get(visited.size() - 1);
        assertThat(walk(last, Navigation::prev)).extracting(Location::node).containsExactly(c, b, inner, a, root);
    }

    @Test
    void skipWhitespaceStaysOnSignificantLocations() {
        final var location = Zip.of(Nodes.list(Nodes.space(), a, Nodes.space())).down().orElseThrow();
        final var skipped = Navigation.skipWhitespace(location).orElseThrow();
        assertThat(skipped.node()).isEqualTo(a);
        assertThat(Navigation.skipWhitespace(skipped)).containsSame(skipped);
        final var trailing = skipped.right().orElseThrow();
        assertThat(Navigation.skipWhitespace(trailing)).isEmpty();
        assertThat(Navigation.skipWhitespaceLeft(trailing).map(Location::node)).contains(a);
    }

    @Test
    void removeDelegatesToTheCursor() {
        final var location = Navigation.down(Zip.of(Nodes.list(a, Nodes.space(), b))).flatMap(Navigation::right);
        final var removed = location.flatMap(Navigation::remove).orElseThrow();
        assertThat(removed.node()).isEqualTo(Nodes.space());
        assertThat(removed.root()).isEqualTo(Nodes.list(a, Nodes.space()));
    }

    @Test
    void accessorsHandleAbsentLocations() {
        final Optional<Location<Node>> nowhere = Optional.empty();
        assertThat(Zip.node(nowhere)).isEmpty();
        assertThat(Zip.tag(nowhere)).isEmpty();
        assertThat(Zip.value(nowhere)).isEmpty();
        assertThat(Zip.isWhitespace(nowhere)).isFalse();
        assertThat(Zip.tag(Navigation.down(Zip.of(Nodes.map(a, Nodes.space(), b))))).contains(NodeKind.TOKEN);
    }

    @ParameterizedTest
    @MethodSource("provideSeeds")
    void movesNeverLandOnWhitespace(final long seed) {
        final var random = RandomUtils.createGenerator(seed);
        final var root = TestTrees.randomTree(random, 4);
        final List<Function<Location<Node>, Optional<Location<Node>>>> moves = List.of(
            Navigation::right,
            Navigation::left,
            Navigation::down,
            Navigation::up,
            Navigation::next,
            Navigation::prev,
            Navigation::leftmost,
            Navigation::rightmost
        );
        for (final var location : allLocations(root)) {
            if (Zip.isWhitespace(location)) {
                continue;
            }
            for (final var move : moves) {
                final var moved = move.apply(location);
                assertThat(Zip.isWhitespace(moved)).as("%s from %s", moved, location).isFalse();
            }
        }
    }

    @ParameterizedTest
    @MethodSource("provideSeeds")
    void prevUndoesNext(final long seed) {
        final var random = RandomUtils.createGenerator(seed);
        final var root = TestTrees.randomTree(random, 4);
        for (final var location : allLocations(root)) {
            if (Zip.isWhitespace(location)) {
                continue;
            }
            final var next = Navigation.next(location);
            next.ifPresent(moved -> assertThat(Navigation.prev(moved)).contains(location));
        }
    }

    private static List<Location<Node>> allLocations(final Node root) {
        return walk(Zip.of(root), Location::next);
    }

    private static List<Location<Node>> walk(
        final Location<Node> start,
        final Function<Location<Node>, Optional<Location<Node>>> move
    ) {
        final var result = new ArrayList<Location<Node>>();
        for (var current = Optional.of(start); current.isPresent(); current = current.flatMap(move)) {
            result.add(current.get());
        }
        return result;
    }
}
