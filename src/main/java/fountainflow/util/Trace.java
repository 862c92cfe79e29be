// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package fountainflow.util;

import java.util.Iterator;
import java.util.NoSuchElementException;
import fountainflow.util.condition.MessageSupplier;
import org.checkerframework.checker.nullness.qual.NonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A trace message, intended to be used within try-with-resources.
 * <p>
 * Traces describe the operation in progress in terms a script author understands, such as "Parsing line 12 of the
 * Twee source" or "Generating Ren'Py output for node #7 (Logic)". Condition handlers print the active traces next to
 * a diagnostic, so the author can find the construct that caused it.
 * <p>
 * Trace objects should <em>never</em> be used outside the thread they were created by.
 */
public final class Trace implements AutoCloseable {
    /**
     * Initializes a new trace with the given <em>lazily evaluated</em> message and registers it as the innermost
     * active trace of the calling thread.
     * <p>
     * The message supplier is called at most once, and only if someone asks for the active traces.
     */
    public Trace(final MessageSupplier supplier) {
        this((Object) supplier);
    }

    /**
     * Initializes a new trace with the given message and registers it as the innermost active trace of the calling
     * thread.
     */
    public Trace(final String message) {
        this((Object) message);
    }

    private Trace(final Object object) {
        final var context = localContext();
        next = context.innermost;
        messageOrSupplier = object;
        ownerContext = context;
        context.innermost = this;
    }

    /**
     * Returns an iterable over the calling thread's active trace messages, innermost first.
     */
    public static Iterable<String> activeTraces() {
        return IterableImpl.instance;
    }

    /**
     * Dummy method that does nothing, to silence compiler warnings about unreferenced auto-closeable resources.
     */
    @SuppressWarnings("EmptyMethod")
    public void use() {
    }

    /**
     * Unregisters the trace from the current thread's trace chain.
     */
    @Override
    public void close() {
        assert ownerContext == localContext() : "Trace closed by a different thread";
        assert ownerContext.innermost == this : "Trace chain corrupt";
        ownerContext.innermost = next;
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
    // Either the message itself or a MessageSupplier producing it.
    private Object messageOrSupplier;
    private final Context ownerContext;

    private static final class Context {
        private @Nullable Trace innermost = null;
    }

    private static final class IterableImpl implements Iterable<String> {
        @Override
        public @NonNull Iterator<String> iterator() {
            return new IteratorImpl(localContext().innermost);
        }

        private static final IterableImpl instance = new IterableImpl();
    }

    private static final class IteratorImpl implements Iterator<String> {
        private IteratorImpl(final @Nullable Trace innermost) {
            current = innermost;
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
