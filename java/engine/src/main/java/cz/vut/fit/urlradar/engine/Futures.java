package cz.vut.fit.urlradar.engine;

import cz.vut.fit.urlradar.ResultCodes;
import org.jetbrains.annotations.NotNull;

import java.util.Collection;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeoutException;

/**
 * Helpers for the asynchronous collaborator calls.
 *
 * @author URLRadar developers
 */
public final class Futures {
    private Futures() {
    }

    /**
     * Strips the {@link CompletionException} and {@link ExecutionException} wrappers.
     */
    public static @NotNull Throwable unwrap(@NotNull Throwable error) {
        var current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Maps a failure of a collaborator future to a result code.
     */
    public static int codeOf(@NotNull Throwable error) {
        final var cause = unwrap(error);
        if (cause instanceof CollaboratorException collaboratorException)
            return collaboratorException.getCode();
        if (cause instanceof TimeoutException)
            return ResultCodes.TIMEOUT;
        return ResultCodes.INTERNAL_ERROR;
    }

    /**
     * Describes a failure of a collaborator future.
     */
    public static @NotNull String describe(@NotNull Throwable error) {
        final var cause = unwrap(error);
        if (cause instanceof CollaboratorException collaboratorException)
            return collaboratorException.describe();
        if (cause instanceof TimeoutException)
            return ResultCodes.nameOf(ResultCodes.TIMEOUT);

        final var message = cause.getMessage();
        return ResultCodes.nameOf(ResultCodes.INTERNAL_ERROR) + ": "
                + (message == null ? cause.getClass().getSimpleName() : message);
    }

    /**
     * Runs a blocking task on the executor. Unlike {@link CompletableFuture#supplyAsync}, cancelling
     * the returned future, directly or through {@link CompletableFuture#orTimeout}, interrupts the thread
     * running the task.
     *
     * @param executor The executor to submit the task to.
     * @param task     The blocking task; its exception completes the returned future exceptionally.
     * @return A future completed with the task's result.
     */
    public static <T> @NotNull CompletableFuture<T> submit(@NotNull ExecutorService executor,
                                                           @NotNull Callable<T> task) {
        final var result = new CompletableFuture<T>();
        final Future<?> handle = executor.submit(() -> {
            try {
                result.complete(task.call());
            } catch (Exception e) {
                result.completeExceptionally(e);
            }
        });
        result.whenComplete((value, error) -> {
            if (error instanceof CancellationException || error instanceof TimeoutException)
                handle.cancel(true);
        });
        return result;
    }

    /**
     * Cancels all futures that have not completed yet.
     */
    public static void cancelAll(@NotNull Collection<? extends CompletableFuture<?>> futures) {
        for (var future : futures) {
            if (!future.isDone())
                future.cancel(true);
        }
    }
}
