// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package sexpedit.test;

import java.math.BigInteger;
import sexpedit.tree.Node;
import sexpedit.tree.NodeKind;
import sexpedit.tree.Nodes;
import sexpedit.zip.Find;
import sexpedit.zip.Navigation;
import sexpedit.zip.Zip;
import sexpedit.zipper.Location;
import static org.assertj.core.api.Assertions.assertThat;
import static sexpedit.test.TestTrees.symbol;
import org.junit.jupiter.api.Test;

final class FindTest {
    private final Node.Token a = symbol("a");
    private final Node.Token b = symbol("b");
    private final Node inner = Nodes.vector(Nodes.token(BigInteger.ONE), Nodes.space(), Nodes.token("text"));
    private final Node root = Nodes.list(a, Nodes.space(), inner, Nodes.comment("; c\n"), b, Nodes.space(), Nodes.map());

    private Location<Node> first() {
        return Navigation.down(Zip.of(root)).orElseThrow();
    }

    @Test
    void findTestsTheStartingLocationFirst() {
        final var start = first();
        assertThat(Find.find(start, location -> true)).containsSame(start);
    }

    @Test
    void findMovesRightBySignificantSiblings() {
        final var found = Find.find(first(), location -> location.node() == b);
        assertThat(found.map(Location::node)).containsSame(b);
        assertThat(Find.find(first(), location -> false)).isEmpty();
    }

    @Test
    void findAcceptsOtherMoves() {
        final var found = Find.find(Zip.of(root), Navigation::next, location -> Zip.tag(location) == NodeKind.TOKEN
            && Zip.value(location).filter(String.class::isInstance).isPresent());
        assertThat(Zip.value(found)).contains("text");
    }

    @Test
    void findByTagSearchesFromTheStart() {
        assertThat(Find.findByTag(first(), NodeKind.VECTOR).map(Location::node)).contains(inner);
        assertThat(Find.findByTag(first(), NodeKind.TOKEN).map(Location::node)).containsSame(a);
        assertThat(Find.findByTag(first(), NodeKind.SET)).isEmpty();
        assertThat(Find.findByTag(first(), NodeKind.COMMENT)).isEmpty();
    }

    @Test
    void findNextByTagExcludesTheStart() {
        final var next = Find.findNextByTag(first(), NodeKind.TOKEN);
        assertThat(next.map(Location::node)).containsSame(b);
        assertThat(next.flatMap(location -> Find.findNextByTag(location, NodeKind.TOKEN))).isEmpty();
    }

    @Test
    void findPreviousByTagSearchesLeftwards() {
        final var last = Navigation.rightmost(first()).orElseThrow();
        assertThat(Zip.tag(last)).isEqualTo(NodeKind.MAP);
        assertThat(Find.findPreviousByTag(last, NodeKind.VECTOR).map(Location::node)).contains(inner);
        assertThat(Find.findPreviousByTag(last, NodeKind.MAP)).isEmpty();
    }

    @Test
    void findTokenMatchesLiteralValues() {
        final var found = Find.findToken(Zip.of(root), Navigation::next, value -> value instanceof BigInteger);
        assertThat(Zip.value(found)).contains(BigInteger.ONE);
        assertThat(Find.findToken(first(), value -> value instanceof String)).isEmpty();
    }

    @Test
    void findValueUsesEquality() {
        assertThat(Find.findValue(Zip.of(root), Navigation::next, "text").map(Location::node))
            .contains(Nodes.token("text"));
        assertThat(Find.findValue(first(), b.value()).map(Location::node)).containsSame(b);
        assertThat(Find.findValue(first(), "missing")).isEmpty();
    }
}
