package cz.vut.fit.domaincheck.checker;

import org.jetbrains.annotations.NotNull;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Helpers for composing {@link CompletableFuture}s so that cancelling a derived future reaches the
 * operation it was derived from.
 */
public final class CompletableFutures {
    private CompletableFutures() {
    }

    /**
     * Makes a cancellation of {@code derived} cancel {@code source} as well.
     *
     * @param derived The future returned to the caller.
     * @param source  The future or task representing the underlying operation.
     * @return The {@code derived} future.
     */
    public static <T> CompletableFuture<T> propagateCancellation(@NotNull CompletableFuture<T> derived,
                                                                 @NotNull Future<?> source) {
        derived.whenComplete((result, error) -> {
            if (derived.isCancelled())
                source.cancel(true);
        });
        return derived;
    }

    /**
     * Runs a blocking task on an executor. Cancelling the returned future interrupts the task.
     *
     * @param task     The task to run.
     * @param executor The executor to run the task on.
     * @return A future completed with the task's result or exception.
     */
    public static <T> CompletableFuture<T> supplyCancellable(@NotNull Callable<T> task,
                                                             @NotNull ExecutorService executor) {
        final var result = new CompletableFuture<T>();
        final Future<?> submitted = executor.submit(() -> {
            try {
                result.complete(task.call());
            } catch (Throwable e) {
                result.completeExceptionally(e);
            }
        });
        return propagateCancellation(result, submitted);
    }

    /**
     * Waits for all the futures to complete, or for the first one to fail. When one of them fails,
     * the others are cancelled.
     *
     * @param futures The futures to join.
     * @return A future completed when all the futures succeed, or failed with the first failure.
     */
    public static CompletableFuture<Void> allOrFirstFailure(@NotNull CompletableFuture<?>... futures) {
        final var all = CompletableFuture.allOf(futures);
        for (var future : futures) {
            future.whenComplete((result, error) -> {
                if (error != null)
                    all.completeExceptionally(error);
            });
        }

        all.whenComplete((result, error) -> {
            if (error != null) {
                for (var future : futures) {
                    future.cancel(true);
                }
            }
        });
        return all;
    }

    /**
     * Strips the {@link CompletionException} and {@link ExecutionException} wrappers from an exception.
     *
     * @param error The exception received from a future.
     * @return The underlying cause.
     */
    public static @NotNull Throwable unwrap(@NotNull Throwable error) {
        var current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
