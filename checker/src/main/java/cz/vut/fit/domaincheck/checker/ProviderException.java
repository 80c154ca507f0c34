package cz.vut.fit.domaincheck.checker;

import cz.vut.fit.domaincheck.models.ResultCodes;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;

/**
 * Signals that a data provider could not be queried or returned an unusable response.
 */
public class ProviderException extends Exception {
    private final String _provider;
    private final int _code;
    private final int _httpStatus;

    public ProviderException(@NotNull String provider, int code, int httpStatus, @NotNull String message,
                             @Nullable Throwable cause) {
        super(message, cause);
        _provider = provider;
        _code = code;
        _httpStatus = httpStatus;
    }

    /**
     * Creates an exception for a response with an unexpected HTTP status code.
     *
     * @param provider   The provider name.
     * @param httpStatus The received status code.
     * @return The exception.
     */
    public static ProviderException ofStatusCode(@NotNull String provider, int httpStatus) {
        final var code = httpStatus == 429 ? ResultCodes.RATE_LIMITED : ResultCodes.CANNOT_FETCH;
        return new ProviderException(provider, code, httpStatus,
                "Impossible to get the %s data, check your credential (HTTP %d)".formatted(provider, httpStatus),
                null);
    }

    /**
     * Creates an exception for a request that failed before a response was received.
     *
     * @param provider The provider name.
     * @param cause    The transport error.
     * @return The exception.
     */
    public static ProviderException ofTransportError(@NotNull String provider, @NotNull Throwable cause) {
        if (cause instanceof ProviderException providerException)
            return providerException;

        final var code = (cause instanceof HttpTimeoutException || cause instanceof SocketTimeoutException)
                ? ResultCodes.TIMEOUT : ResultCodes.CANNOT_FETCH;
        return new ProviderException(provider, code, -1,
                "%s request error: %s".formatted(provider, cause), cause);
    }

    /**
     * Creates an exception for a response body that cannot be interpreted.
     *
     * @param provider The provider name.
     * @param detail   What is wrong with the response.
     * @param cause    The parsing error, if any.
     * @return The exception.
     */
    public static ProviderException ofInvalidFormat(@NotNull String provider, @NotNull String detail,
                                                    @Nullable Throwable cause) {
        return new ProviderException(provider, ResultCodes.INVALID_FORMAT, 200,
                "Invalid %s response: %s".formatted(provider, detail), cause);
    }

    public @NotNull String provider() {
        return _provider;
    }

    /**
     * @return One of the {@link ResultCodes} constants.
     */
    public int code() {
        return _code;
    }

    /**
     * @return The HTTP status code of the response, or -1 if no response was received.
     */
    public int httpStatus() {
        return _httpStatus;
    }
}
