package cz.vut.fit.domaincheck.models.dns;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The resolved address of a domain name together with the result of probing it.
 *
 * @param domain        The checked domain name.
 * @param usedWwwPrefix True if the address was obtained for the "www." variant of the name.
 * @param resolved      True if the name resolved.
 * @param ip            The resolved address, null if not resolved.
 * @param isAlive       True if the address answered the probe; always false for unresolved names.
 */
public record LivenessInfo(
        @NotNull String domain,
        boolean usedWwwPrefix,
        @JsonProperty("isDNSFound") boolean resolved,
        @Nullable String ip,
        @JsonProperty("isAlive") boolean isAlive
) {
    public LivenessInfo {
        if (!resolved && isAlive)
            throw new IllegalArgumentException("An unresolved address cannot be alive");
    }

    public static LivenessInfo of(@NotNull AddressInfo address, boolean isAlive) {
        return new LivenessInfo(address.domain(), address.usedWwwPrefix(), address.resolved(), address.ip(),
                isAlive);
    }
}
