// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package sexpedit.util;

import java.util.Iterator;
import java.util.NoSuchElementException;
import sexpedit.util.condition.MessageSupplier;
import org.checkerframework.checker.nullness.qual.NonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A trace message, intended to be used within try-with-resources.
 * <p>
 * Traces describe, in user-readable terms, what an operation was doing when a condition got signaled, such as
 * "Converting a map node to a host value". Condition handlers and detailed condition messages read the active chain
 * with {@link #activeTraces()}.
 * <p>
 * Trace objects should <em>never</em> be used outside the thread they were created by.
 */
public final class Trace implements AutoCloseable {
    /**
     * Initializes a new trace with the given <em>lazily evaluated</em> message and registers it as the first active
     * trace in the calling thread.
     * <p>
     * The message supplier is called at most once, and only if someone asks for the active traces.
     */
    public Trace(final MessageSupplier supplier) {
        this((Object) supplier);
    }

    /**
     * Initializes a new trace with the given message and registers it as the first active trace in the calling
     * thread.
     */
    public Trace(final String message) {
        this((Object) message);
    }

    private Trace(final Object object) {
        final var context = localContext();
        next = context.firstTrace;
        messageOrSupplier = object;
        ownerContext = context;
        context.firstTrace = this;
    }

    /**
     * Returns an iterable over the calling thread's active trace messages, most recently established first.
     */
    public static Iterable<String> activeTraces() {
        return IterableImpl.instance;
    }

    /**
     * Does nothing. Silences compiler warnings about unreferenced auto-closeable resources.
     */
    @SuppressWarnings("EmptyMethod")
    public void use() {
    }

    /**
     * Unregisters the trace from the current thread's trace chain. Use try-with-resources instead of calling this
     * manually.
     */
    @Override
    public void close() {
        assert ownerContext == localContext() : "Trace closed by a different thread";
        assert ownerContext.firstTrace == this : "Trace chain corrupt";
        ownerContext.firstTrace = next;
    }

    private String message() {
        if (messageOrSupplier instanceof final String string) {
            return string;
        }
        final var string = ((MessageSupplier) messageOrSupplier).get();
        messageOrSupplier = string;
        return string;
    }

    private static Context localContext() {
        return context.get();
    }

    @SuppressWarnings("nullness:type.argument") // Not actually nullable, CF doesn't understand withInitial.
    private static final ThreadLocal<Context> context = ThreadLocal.withInitial(Context::new);

    private final @Nullable Trace next;
    // Either the message itself or the MessageSupplier producing it.
    private Object messageOrSupplier;
    private final Context ownerContext;

    private static final class Context {
        private @Nullable Trace firstTrace = null;
    }

    private static final class IterableImpl implements Iterable<String> {
        @Override
        public @NonNull Iterator<String> iterator() {
            return new IteratorImpl(localContext().firstTrace);
        }

        private static final IterableImpl instance = new IterableImpl();
    }

    private static final class IteratorImpl implements Iterator<String> {
        private IteratorImpl(final @Nullable Trace firstTrace) {
            current = firstTrace;
        }

        @Override
        public boolean hasNext() {
            return current != null;
        }

        @Override
        public String next() {
            final var result = current;
            if (result == null) {
                throw new NoSuchElementException("No more traces left");
            }
            current = result.next;
            return result.message();
        }

        private @Nullable Trace current;
    }
}
