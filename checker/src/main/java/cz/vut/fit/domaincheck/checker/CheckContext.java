package cz.vut.fit.domaincheck.checker;

import cz.vut.fit.domaincheck.models.ResultCodes;
import org.jetbrains.annotations.NotNull;

import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;

/**
 * The state of a single running check: its current stage and the provider calls in flight.
 * Once the check has ended, no further stage may start and the calls still in flight are cancelled.
 */
final class CheckContext {
    private final String _domain;
    private final Set<CompletableFuture<?>> _inFlight = ConcurrentHashMap.newKeySet();
    private volatile CheckStage _stage = CheckStage.RESOLVING;
    private volatile boolean _closed;

    CheckContext(@NotNull String domain) {
        _domain = domain;
    }

    CheckStage stage() {
        return _stage;
    }

    /**
     * Moves the check to the next stage.
     *
     * @throws CancellationException If the check has already ended.
     */
    void enter(@NotNull CheckStage stage) {
        if (_closed)
            throw new CancellationException("The check of " + _domain + " has already ended");

        _stage = stage;
    }

    /**
     * Registers a call so that it is cancelled if the check fails before the call completes.
     */
    <T> CompletableFuture<T> track(@NotNull CompletableFuture<T> future) {
        _inFlight.add(future);
        future.whenComplete((result, error) -> _inFlight.remove(future));

        if (_closed)
            future.cancel(true);

        return future;
    }

    void complete() {
        _closed = true;
        _stage = CheckStage.DONE;
    }

    void fail() {
        _closed = true;
        _stage = CheckStage.FAILED;

        for (var future : _inFlight) {
            future.cancel(true);
        }
        _inFlight.clear();
    }

    /**
     * Converts the failure of a stage to the exception reported to the caller, attributing it to the current stage.
     *
     * @param error The failure, possibly wrapped in a {@link java.util.concurrent.CompletionException}.
     * @return The check exception.
     */
    DomainCheckException toCheckException(@NotNull Throwable error) {
        final var cause = CompletableFutures.unwrap(error);
        final var stage = _stage;

        if (cause instanceof DomainCheckException checkException)
            return checkException;

        if (cause instanceof ProviderException providerException)
            return new DomainCheckException(_domain, stage, providerException.code(),
                    providerException.getMessage(), providerException);

        if (cause instanceof TimeoutException)
            return new DomainCheckException(_domain, stage, ResultCodes.TIMEOUT,
                    "the check did not finish before its deadline", cause);

        if (cause instanceof CancellationException)
            return new DomainCheckException(_domain, stage, ResultCodes.CANCELLED,
                    "the check was cancelled", cause);

        return new DomainCheckException(_domain, stage, ResultCodes.INTERNAL_ERROR,
                "unexpected error: " + cause, cause);
    }
}
