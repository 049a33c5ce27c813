package edu.stanford.futuredata.uniquery.utilities;

import io.grpc.Context;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Ties a pending asynchronous step to a gRPC {@link Context}.  When the context is cancelled the step is cancelled
 * and the returned future completes with {@link CancellationException}; a value arriving after that is handed to
 * the abandon callback instead of being dropped.
 */
public class Cancellations {

    public static <T> CompletableFuture<T> cancelled() {
        CompletableFuture<T> f = new CompletableFuture<>();
        f.cancel(false);
        return f;
    }

    public static <T, R> CompletableFuture<R> bind(Context cancellation, CompletableFuture<T> pending,
                                                   Function<T, R> onResult, Consumer<T> onAbandoned) {
        CompletableFuture<R> result = new CompletableFuture<>();
        Context.CancellationListener listener = context -> {
            result.cancel(false);
            pending.cancel(true);
        };
        cancellation.addListener(listener, Runnable::run);
        pending.whenComplete((value, throwable) -> {
            cancellation.removeListener(listener);
            if (result.isDone()) {
                if (value != null) {
                    onAbandoned.accept(value);
                }
                return;
            }
            if (throwable != null) {
                Throwable cause = unwrap(throwable);
                if (cause instanceof CancellationException) {
                    result.cancel(false);
                } else {
                    result.completeExceptionally(cause);
                }
                return;
            }
            try {
                result.complete(onResult.apply(value));
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        });
        return result;
    }

    public static Throwable unwrap(Throwable t) {
        while (t instanceof CompletionException && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
