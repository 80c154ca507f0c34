package cz.vut.fit.domaincheck.checker;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Signals that a domain check failed as a whole. Only failures of the authority, traffic and index lookups,
 * timeouts and cancellations end a check this way; the other lookups fall back to default values.
 */
public class DomainCheckException extends Exception {
    private final String _domain;
    private final CheckStage _stage;
    private final int _code;

    public DomainCheckException(@NotNull String domain, @NotNull CheckStage stage, int code,
                                @NotNull String message, @Nullable Throwable cause) {
        super("Error when checking domain %s (%s): %s".formatted(domain, stage, message), cause);
        _domain = domain;
        _stage = stage;
        _code = code;
    }

    public @NotNull String domain() {
        return _domain;
    }

    /**
     * @return The stage the check was in when it failed.
     */
    public @NotNull CheckStage stage() {
        return _stage;
    }

    /**
     * @return One of the {@link cz.vut.fit.domaincheck.models.ResultCodes} constants.
     */
    public int code() {
        return _code;
    }
}
