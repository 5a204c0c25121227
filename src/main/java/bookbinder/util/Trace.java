// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bookbinder.util;

import java.util.ArrayList;
import java.util.List;
import bookbinder.util.condition.MessageSupplier;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A user-readable description of the operation in progress, established with try-with-resources.
 * <p>
 * Traces nest: while a pipeline step runs, the chain of open traces reads like "Publishing to out/ → Emitting page
 * intro → Writing out.staging/intro.json". Whoever reports a condition can attach that chain to the message. They are
 * not stack traces and should name things the author of the document recognizes.
 * <p>
 * A trace belongs to the thread that opened it.
 */
public final class Trace implements AutoCloseable {
    /**
     * Opens a trace whose message is computed only if somebody asks for it.
     */
    public Trace(final MessageSupplier supplier) {
        this((Object) supplier);
    }

    /**
     * Opens a trace with a fixed message.
     */
    public Trace(final String message) {
        this((Object) message);
    }

    private Trace(final Object messageOrSupplier) {
        final var context = localContext.get();
        outer = context.innermost;
        this.messageOrSupplier = messageOrSupplier;
        owner = context;
        context.innermost = this;
    }

    /**
     * Returns the messages of the calling thread's open traces, innermost first.
     */
    public static List<String> activeTraces() {
        final var result = new ArrayList<String>();
        for (var trace = localContext.get().innermost; trace != null; trace = trace.outer) {
            result.add(trace.message());
        }
        return result;
    }

    /**
     * Does nothing; referencing the resource silences unused-variable warnings.
     */
    @SuppressWarnings("EmptyMethod")
    public void use() {
    }

    @Override
    public void close() {
        assert owner == localContext.get() : "Trace closed by a different thread";
        assert owner.innermost == this : "Traces closed out of order";
        owner.innermost = outer;
    }

    private String message() {
        if (messageOrSupplier instanceof final String string) {
            return string;
        }
        final var string = ((MessageSupplier) messageOrSupplier).get();
        messageOrSupplier = string;
        return string;
    }

    @SuppressWarnings("nullness:type.argument") // withInitial never yields null.
    private static final ThreadLocal<Context> localContext = ThreadLocal.withInitial(Context::new);

    private final @Nullable Trace outer;
    // A String once evaluated, a MessageSupplier before.
    private Object messageOrSupplier;
    private final Context owner;

    private static final class Context {
        private @Nullable Trace innermost = null;
    }
}
