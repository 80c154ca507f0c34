package cz.vut.fit.domaincheck.models;

public final class ResultCodes {
    /**
     * A generic error caused inside the checker (e.g. invalid state).
     */
    public static final int INTERNAL_ERROR = 20;

    /**
     * Invalid format of remote source's response.
     */
    public static final int INVALID_FORMAT = 40;

    /**
     * Error fetching from remote source.
     */
    public static final int CANNOT_FETCH = 50;

    /**
     * We are rate limited at the remote source.
     */
    public static final int RATE_LIMITED = 51;

    /**
     * The operation did not finish in time.
     */
    public static final int TIMEOUT = 52;

    /**
     * The caller cancelled the operation.
     */
    public static final int CANCELLED = 53;

    private ResultCodes() {
    }
}
