// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package grafter.util;

import java.util.Iterator;
import java.util.NoSuchElementException;
import grafter.util.condition.MessageSupplier;
import org.checkerframework.checker.nullness.qual.NonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A user-readable note about what the current thread is doing, active for the extent of a try-with-resources block.
 * <p>
 * Traces describe operations ("parsing config.gr", "reading top-level item #3"), so that whoever reports a condition
 * can tell the user where it happened. They are not stack traces.
 * <p>
 * A trace belongs to the thread that created it and must be closed by that thread.
 */
public final class Trace implements AutoCloseable {
    /**
     * Registers a trace whose message is computed on first use, at most once.
     */
    public Trace(final MessageSupplier supplier) {
        this((Object) supplier);
    }

    /**
     * Registers a trace with a fixed message.
     */
    public Trace(final String message) {
        this((Object) message);
    }

    private Trace(final Object messageOrSupplier) {
        final var context = localContext();
        next = context.firstTrace;
        this.messageOrSupplier = messageOrSupplier;
        ownerContext = context;
        context.firstTrace = this;
    }

    /**
     * Returns the calling thread's active trace messages, most recent first.
     */
    public static Iterable<String> activeTraces() {
        return () -> new TraceIterator(localContext().firstTrace);
    }

    /**
     * Does nothing; referencing the resource silences unused-resource warnings.
     */
    @SuppressWarnings("EmptyMethod")
    public void use() {
    }

    /**
     * Unregisters the trace. Only ever called by try-with-resources.
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
        final var computed = ((MessageSupplier) messageOrSupplier).get();
        messageOrSupplier = computed;
        return computed;
    }

    private static Context localContext() {
        return context.get();
    }

    @SuppressWarnings("nullness:type.argument") // withInitial never yields null.
    private static final ThreadLocal<Context> context = ThreadLocal.withInitial(Context::new);

    private final @Nullable Trace next;
    // Either the message itself, or the MessageSupplier that computes it.
    private Object messageOrSupplier;
    private final Context ownerContext;

    private static final class Context {
        private @Nullable Trace firstTrace = null;
    }

    private static final class TraceIterator implements Iterator<String> {
        private TraceIterator(final @Nullable Trace first) {
            current = first;
        }

        @Override
        public boolean hasNext() {
            return current != null;
        }

        @Override
        public @NonNull String next() {
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
