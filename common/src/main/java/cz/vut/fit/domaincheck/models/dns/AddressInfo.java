package cz.vut.fit.domaincheck.models.dns;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The outcome of resolving a domain name to an IP address.
 *
 * @param domain        The checked domain name (without the "www." prefix).
 * @param usedWwwPrefix True if the address was obtained for the "www." variant of the name.
 * @param resolved      True if the name (or its "www." variant) resolved.
 * @param ip            The resolved address, null if not resolved.
 */
public record AddressInfo(
        @NotNull String domain,
        boolean usedWwwPrefix,
        @JsonProperty("isDNSFound") boolean resolved,
        @Nullable String ip
) {
    public static AddressInfo resolved(@NotNull String domain, boolean usedWwwPrefix, @NotNull String ip) {
        return new AddressInfo(domain, usedWwwPrefix, true, ip);
    }

    public static AddressInfo unresolved(@NotNull String domain, boolean usedWwwPrefix) {
        return new AddressInfo(domain, usedWwwPrefix, false, null);
    }
}
