// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package sexpedit.util.collection;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A persistent (immutable with structural sharing) singly-linked list.
 * <p>
 * Cons lists are the backbone of zipper paths: sibling lists are only ever extended or shortened at the front, so
 * every move of a cursor allocates at most one cell, and every list produced by an update shares its tail with the
 * list it was derived from.
 * <p>
 * {@code null} elements are permitted.
 * <p>
 * Unless noted otherwise, complexity guarantees are worst-case. Operations at the front execute in constant time,
 * operations at the back or by position execute in linear time. The size is cached in every cell, so
 * {@link #exactSize()} is constant time.
 * <p>
 * Immutability is shallow: it doesn't extend to the elements themselves.
 *
 * @param <T> the type of elements in this list
 */
public final class ConsList<T> implements Iterable<T> {
    private ConsList(final T head, final @Nullable ConsList<T> tail, final long size) {
        this.head = head;
        this.tail = tail;
        this.size = size;
    }

    /**
     * Returns an empty list pretending to contain objects of the given type.
     * <p>
     * Complexity: constant time.
     */
    @SuppressWarnings("unchecked")
    public static <T> @NotNull ConsList<T> empty() {
        return (ConsList<T>) EMPTY;
    }

    /**
     * Returns a new list containing the given elements, in order.
     * <p>
     * Complexity: linear time.
     */
    @SafeVarargs
    public static <T> @NotNull ConsList<T> of(final T @NotNull ... elements) {
        var result = ConsList.<T>empty();
        for (int i = elements.length - 1; i >= 0; i -= 1) {
            result = result.prepended(elements[i]);
        }
        return result;
    }

    /**
     * Returns a new list containing the elements of the given iterable in iteration order.
     * <p>
     * Complexity: constant time if the iterable is already a {@code ConsList}, linear time otherwise.
     */
    @SuppressWarnings("unchecked")
    public static <T> @NotNull ConsList<T> fromIterable(final @NotNull Iterable<? extends T> iterable) {
        if (iterable instanceof ConsList<? extends T> list) {
            return (ConsList<T>) list; // Fine, lists are immutable.
        }
        var reversed = ConsList.<T>empty();
        for (final var element : iterable) {
            reversed = reversed.prepended(element);
        }
        return reversed.reversed();
    }

    /**
     * Returns {@code true} iff this list contains no elements.
     * <p>
     * Complexity: constant time.
     */
    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * Returns the number of elements in this list.
     * <p>
     * Complexity: constant time.
     */
    public long exactSize() {
        return size;
    }

    /**
     * Returns the first element of this list.
     * <p>
     * Complexity: constant time.
     *
     * @throws NoSuchElementException if this list is empty
     */
    public T first() {
        if (isEmpty()) {
            throw noSuchElement("first() called on an empty list");
        }
        return head;
    }

    /**
     * Returns the last element of this list.
     * <p>
     * Complexity: linear time.
     *
     * @throws NoSuchElementException if this list is empty
     */
    public T last() {
        if (isEmpty()) {
            throw noSuchElement("last() called on an empty list");
        }
        var cell = this;
        while (cell.size > 1) {
            cell = cell.nonEmptyTail();
        }
        return cell.head;
    }

    /**
     * Returns a copy of this list with the first element removed. The result shares all of its cells with this list.
     * <p>
     * Complexity: constant time.
     *
     * @throws NoSuchElementException if this list is empty
     */
    @CheckReturnValue
    public @NotNull ConsList<T> withoutFirst() {
        if (isEmpty()) {
            throw noSuchElement("withoutFirst() called on an empty list");
        }
        return nonEmptyTail();
    }

    /**
     * Returns a copy of this list with the given element added as the new first element.
     * <p>
     * Complexity: constant time.
     */
    @CheckReturnValue
    public @NotNull ConsList<T> prepended(final T element) {
        return new ConsList<>(element, this, size + 1);
    }

    /**
     * Returns a copy of this list with the given element added as the new last element.
     * <p>
     * Complexity: linear time.
     */
    @CheckReturnValue
    public @NotNull ConsList<T> appended(final T element) {
        return reversed().prepended(element).reversed();
    }

    /**
     * Returns a list containing the elements of this list in reverse order.
     * <p>
     * Complexity: linear time.
     */
    @CheckReturnValue
    public @NotNull ConsList<T> reversed() {
        return reversedOnto(empty());
    }

    /**
     * Returns a list containing the elements of this list in reverse order, followed by the elements of the given
     * list. The result shares all the cells of {@code rest}.
     * <p>
     * This is the operation a zipper uses to put a child list back together out of its nearest-first left siblings
     * and its right siblings.
     * <p>
     * Complexity: linear in the size of this list.
     */
    @CheckReturnValue
    public @NotNull ConsList<T> reversedOnto(final @NotNull ConsList<T> rest) {
        var result = rest;
        for (var cell = this; !cell.isEmpty(); cell = cell.nonEmptyTail()) {
            result = result.prepended(cell.head);
        }
        return result;
    }

    /**
     * Returns a list containing the results of applying the given function to the elements of this list, in
     * iteration order.
     * <p>
     * Exceptions thrown by the given function are passed through to the caller.
     * <p>
     * Complexity: linear time.
     */
    @CheckReturnValue
    public <U> @NotNull ConsList<U> map(final @NotNull Function<? super T, ? extends U> function) {
        var reversed = ConsList.<U>empty();
        for (final var element : this) {
            reversed = reversed.prepended(function.apply(element));
        }
        return reversed.reversed();
    }

    /**
     * Returns a list containing only the elements of this list that satisfy the given predicate, in iteration
     * order.
     * <p>
     * Complexity: linear time.
     */
    @CheckReturnValue
    public @NotNull ConsList<T> filter(final @NotNull Predicate<? super T> predicate) {
        var reversed = ConsList.<T>empty();
        for (final var element : this) {
            if (predicate.test(element)) {
                reversed = reversed.prepended(element);
            }
        }
        return reversed.reversed();
    }

    /**
     * Returns {@code true} iff this list contains an element that satisfies the given predicate.
     * <p>
     * Elements are tested in iteration order, stopping at the first match.
     * <p>
     * Complexity: linear time.
     */
    public boolean anySatisfies(final @NotNull Predicate<? super T> predicate) {
        for (final var element : this) {
            if (predicate.test(element)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns a new iterator over the elements of this list, from the first to the last.
     * <p>
     * Complexity: constant time.
     */
    @Override
    public @NotNull Iterator<T> iterator() {
        return new Itr<>(this);
    }

    /**
     * Returns the hash code of this list, following the algorithm specified by {@link java.util.List#hashCode()}.
     * <p>
     * Complexity: linear time.
     */
    @Override
    public int hashCode() {
        int hash = 1;
        for (final var element : this) {
            hash = 31 * hash + Objects.hashCode(element);
        }
        return hash;
    }

    /**
     * Returns {@code true} iff the given object is a cons list of the same size, containing equal elements in the
     * same order.
     * <p>
     * Complexity: constant time if the sizes differ or the lists share their cells, linear time otherwise.
     */
    @Override
    public boolean equals(final @Nullable Object object) {
        if (!(object instanceof ConsList<?> other) || other.size != size) {
            return false;
        }
        ConsList<?> right = other;
        for (var left = this; !left.isEmpty(); left = left.nonEmptyTail()) {
            if (left == right) {
                return true;
            }
            if (!Objects.equals(left.head, right.head)) {
                return false;
            }
            right = right.nonEmptyTail();
        }
        return true;
    }

    /**
     * Returns a string representation of this list: the string representations of its elements, separated by
     * {@code ", "}, enclosed in square brackets.
     * <p>
     * Complexity: linear time.
     */
    @Override
    public @NotNull String toString() {
        if (isEmpty()) {
            return "[]";
        }
        final var builder = new StringBuilder();
        builder.append('[');
        for (final var element : this) {
            builder.append(element).append(", ");
        }
        builder.setLength(builder.length() - 2); // Remove final separator.
        builder.append(']');
        return builder.toString();
    }

    private @NotNull ConsList<T> nonEmptyTail() {
        assert tail != null : "Tail of the empty list requested";
        return tail;
    }

    private static @NotNull NoSuchElementException noSuchElement(final @NotNull String message) {
        throw new NoSuchElementException(message);
    }

    private static final ConsList<?> EMPTY = new ConsList<>(null, null, 0);

    private final T head;
    private final @Nullable ConsList<T> tail;
    private final long size;

    private static final class Itr<T> implements Iterator<T> {
        private Itr(final @NotNull ConsList<T> list) {
            current = list;
        }

        @Override
        public boolean hasNext() {
            return !current.isEmpty();
        }

        @Override
        public T next() {
            final var cell = current;
            if (cell.isEmpty()) {
                throw noSuchElement("No more elements left");
            }
            current = cell.nonEmptyTail();
            return cell.head;
        }

        private @NotNull ConsList<T> current;
    }
}
