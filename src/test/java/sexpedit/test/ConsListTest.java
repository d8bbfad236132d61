// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package sexpedit.test;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import sexpedit.util.collection.ConsList;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

final class ConsListTest {
    @Test
    void toStringWorks() {
        assertThat(ConsList.empty()).asString().isEqualTo("[]");
        assertThat(ConsList.of(0, 1, 2, 3)).asString().isEqualTo("[0, 1, 2, 3]");
        assertThat(ConsList.of("abc", "def", "")).asString().isEqualTo("[abc, def, ]");
    }

    @Test
    void equalsWorks() {
        assertThat(ConsList.empty()).isEqualTo(ConsList.empty());
        assertThat(ConsList.empty()).isNotEqualTo(ConsList.of(5));
        assertThat(ConsList.of(5)).isNotSameAs(ConsList.of(5));
        assertThat(ConsList.of(5)).isEqualTo(ConsList.of(5));
        assertThat(ConsList.of(5, 10)).isNotEqualTo(ConsList.of(10, 5));
        assertThat(ConsList.of(1, null)).isEqualTo(ConsList.of(1, null));
    }

    @Test
    void hashCodeMatchesJavaUtilList() {
        assertThat(ConsList.of(1, 2, 3).hashCode()).isEqualTo(List.of(1, 2, 3).hashCode());
        assertThat(ConsList.empty().hashCode()).isEqualTo(List.of().hashCode());
    }

    @Test
    void frontOperationsShareStructure() {
        final var tail = ConsList.of(2, 3);
        final var list = tail.prepended(1);
        assertThat(list).containsExactly(1, 2, 3);
        assertThat(list.first()).isEqualTo(1);
        assertThat(list.withoutFirst()).isSameAs(tail);
        assertThat(list.exactSize()).isEqualTo(3);
        assertThat(tail).containsExactly(2, 3);
    }

    @Test
    void reversedOntoSharesTheRest() {
        final var rest = ConsList.of(4, 5);
        final var result = ConsList.of(3, 2, 1).reversedOnto(rest);
        assertThat(result).containsExactly(1, 2, 3, 4, 5);
        assertThat(result.withoutFirst().withoutFirst().withoutFirst()).isSameAs(rest);
    }

    @Test
    void backOperationsWork() {
        final var list = ConsList.of(1, 2, 3);
        assertThat(list.last()).isEqualTo(3);
        assertThat(list.appended(4)).containsExactly(1, 2, 3, 4);
        assertThat(list.reversed()).containsExactly(3, 2, 1);
        assertThat(list).containsExactly(1, 2, 3);
    }

    @Test
    void emptyListAccessThrows() {
        final var empty = ConsList.<Integer>empty();
        assertThat(empty.isEmpty()).isTrue();
        assertThatExceptionOfType(NoSuchElementException.class).isThrownBy(empty::first);
        assertThatExceptionOfType(NoSuchElementException.class).isThrownBy(empty::last);
        assertThatExceptionOfType(NoSuchElementException.class).isThrownBy(empty::withoutFirst);
        assertThatExceptionOfType(NoSuchElementException.class).isThrownBy(() -> empty.iterator().next());
    }

    @Test
    void mapFilterAndAnySatisfyWork() {
        final var list = ConsList.of(1, 2, 3, 4);
        assertThat(list.map(i -> i * 10)).containsExactly(10, 20, 30, 40);
        assertThat(list.filter(i -> i % 2 == 0)).containsExactly(2, 4);
        assertThat(list.anySatisfies(i -> i > 3)).isTrue();
        assertThat(list.anySatisfies(i -> i > 4)).isFalse();
    }

    @Test
    void fromIterableReturnsConsListsAsIs() {
        final var list = ConsList.of(1, 2);
        assertThat(ConsList.fromIterable(list)).isSameAs(list);
        assertThat(ConsList.fromIterable(List.of(1, 2, 3))).containsExactly(1, 2, 3);
    }

    @ParameterizedTest(name = "size = {0}")
    @ValueSource(ints = {0, 1, 25, 2_500, 250_000})
    void iterationWorks(final int size) {
        final var expected = new ArrayList<Integer>(size);
        var list = ConsList.<Integer>empty();
        for (int i = size - 1; i >= 0; i -= 1) {
            list = list.prepended(i);
        }
        for (int i = 0; i < size; i += 1) {
            expected.add(i);
        }
        final var actual = new ArrayList<Integer>(size);
        list.forEach(actual::add);
        assertThat(actual).isEqualTo(expected);
        assertThat(list.exactSize()).isEqualTo(size);
        assertThat(list.reversed().reversed()).isEqualTo(list);
    }
}
