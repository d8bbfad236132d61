// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package sexpedit.test;

import java.util.ArrayList;
import java.util.Optional;
import java.util.stream.LongStream;
import sexpedit.tree.Node;
import sexpedit.tree.Nodes;
import sexpedit.zip.Insertion;
import sexpedit.zip.Navigation;
import sexpedit.zip.Zip;
import sexpedit.zipper.Location;
import static org.assertj.core.api.Assertions.assertThat;
import static sexpedit.test.TestTrees.symbol;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

final class InsertionTest {
    static LongStream provideSeeds() {
        return RandomUtils.provideSeeds();
    }

    private final Node.Token a = symbol("a");
    private final Node.Token b = symbol("b");
    private final Node.Token c = symbol("c");
    private final Node.Whitespace newline = Nodes.whitespace("\n");

    @Test
    void insertRightBetweenSignificantSiblingsAddsTwoSpaces() {
        final var location = Navigation.down(Zip.of(Nodes.vector(a, b))).orElseThrow();
        final var inserted = Insertion.insertRight(location, c).orElseThrow();
        assertThat(inserted.node()).isEqualTo(a);
        assertThat(inserted.root()).isEqualTo(Nodes.vector(a, Nodes.space(), c, Nodes.space(), b));
    }

    @Test
    void insertRightReusesExistingWhitespace() {
        final var location = Navigation.down(Zip.of(Nodes.vector(a, newline, b))).orElseThrow();
        final var inserted = Insertion.insertRight(location, c).orElseThrow();
        assertThat(inserted.root()).isEqualTo(Nodes.vector(a, Nodes.space(), c, newline, b));
    }

    @Test
    void insertRightAtTheEnd() {
        final var location = Navigation.down(Zip.of(Nodes.vector(a))).orElseThrow();
        final var inserted = Insertion.insertRight(location, b).orElseThrow();
        assertThat(inserted.root()).isEqualTo(Nodes.vector(a, Nodes.space(), b));
    }

    @Test
    void insertLeftMirrorsInsertRight() {
        final var spaced = Navigation.down(Zip.of(Nodes.vector(a, newline, b))).flatMap(Navigation::right);
        assertThat(spaced.flatMap(l -> Insertion.insertLeft(l, c)).map(Location::root))
            .contains(Nodes.vector(a, newline, c, Nodes.space(), b));

        final var tight = Navigation.down(Zip.of(Nodes.vector(a, b))).flatMap(Location::right);
        assertThat(tight.flatMap(l -> Insertion.insertLeft(l, c)).map(Location::root))
            .contains(Nodes.vector(a, Nodes.space(), c, Nodes.space(), b));

        final var first = Navigation.down(Zip.of(Nodes.vector(b)));
        assertThat(first.flatMap(l -> Insertion.insertLeft(l, a)).map(Location::root))
            .contains(Nodes.vector(a, Nodes.space(), b));
    }

    @Test
    void insertedSiblingsAreReachable() {
        final var location = Navigation.down(Zip.of(Nodes.list(a, b))).orElseThrow();
        final var right = Insertion.insertRight(location, c).flatMap(Navigation::right);
        assertThat(right.map(Location::node)).contains(c);
        final var left = Navigation.right(location).flatMap(l -> Insertion.insertLeft(l, c)).flatMap(Navigation::left);
        assertThat(left.map(Location::node)).contains(c);
    }

    @Test
    void siblingInsertionsFailAtTheRoot() {
        assertThat(Insertion.insertRight(Zip.of(Nodes.list(a)), b)).isEmpty();
        assertThat(Insertion.insertLeft(Zip.of(Nodes.list(a)), b)).isEmpty();
    }

    @Test
    void insertChildIntoEmptyCompositeAddsNoWhitespace() {
        final var inserted = Insertion.insertChild(Zip.of(Nodes.vector()), a).orElseThrow();
        assertThat(inserted.node()).isEqualTo(Nodes.vector(a));
        assertThat(Insertion.appendChild(Zip.of(Nodes.set()), a).map(Location::node)).contains(Nodes.set(a));
    }

    @Test
    void insertChildSeparatesFromTheFirstChild() {
        final var inserted = Insertion.insertChild(Zip.of(Nodes.list(b, Nodes.space(), c)), a);
        assertThat(inserted.map(Location::node)).contains(Nodes.list(a, Nodes.space(), b, Nodes.space(), c));

        final var indented = Insertion.insertChild(Zip.of(Nodes.list(newline, b)), a);
        assertThat(indented.map(Location::node)).contains(Nodes.list(a, newline, b));
    }

    @Test
    void appendChildSeparatesFromTheLastChild() {
        final var appended = Insertion.appendChild(Zip.of(Nodes.list(a, Nodes.space(), b)), c);
        assertThat(appended.map(Location::node)).contains(Nodes.list(a, Nodes.space(), b, Nodes.space(), c));

        final var comment = Nodes.comment("; done\n");
        final var afterComment = Insertion.appendChild(Zip.of(Nodes.list(a, comment)), c);
        assertThat(afterComment.map(Location::node)).contains(Nodes.list(a, comment, c));
    }

    @Test
    void childInsertionsFailOnAtoms() {
        final var token = Navigation.down(Zip.of(Nodes.list(a))).orElseThrow();
        assertThat(Insertion.insertChild(token, b)).isEmpty();
        assertThat(Insertion.appendChild(token, b)).isEmpty();
    }

    @Test
    void insertingIntoNothingReplacesThePlaceholder() {
        assertThat(Insertion.insertRight(Zip.ofNothing(), a).map(Location::root)).contains(a);
        assertThat(Insertion.insertLeft(Zip.ofNothing(), Nodes.list()).map(Location::root)).contains(Nodes.list());
    }

    @ParameterizedTest
    @MethodSource("provideSeeds")
    void insertionsKeepTreesWellSpaced(final long seed) {
        final var random = RandomUtils.createGenerator(seed);
        final var root = TestTrees.randomWellSpacedTree(random, 3);
        assertThat(TestTrees.isWellSpaced(root)).isTrue();
        final var item = symbol("inserted");
        final var results = new ArrayList<Optional<Location<Node>>>();
        for (var current = Optional.of(Zip.of(root)); current.isPresent(); current = current.flatMap(Navigation::next)) {
            final var location = current.get();
            results.add(Insertion.insertRight(location, item));
            results.add(Insertion.insertLeft(location, item));
            results.add(Insertion.insertChild(location, item));
            results.add(Insertion.appendChild(location, item));
        }
        for (final var result : results) {
            result.ifPresent(location -> assertThat(TestTrees.isWellSpaced(location.root()))
                .as("%s", location.root())
                .isTrue());
        }
    }
}
