package cz.vut.fit.domaincheck.models.results;

import com.fasterxml.jackson.annotation.JsonProperty;
import cz.vut.fit.domaincheck.models.providers.AuthorityData;
import cz.vut.fit.domaincheck.models.providers.RegistrationData;
import cz.vut.fit.domaincheck.models.providers.TrafficData;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The merged result of checking a domain name.
 *
 * @param domain              The checked domain name.
 * @param isDNSFound          True if the name or its "www." variant resolved.
 * @param usedWwwPrefix       True if the address was obtained for the "www." variant.
 * @param ip                  The resolved address, null if not resolved.
 * @param isAlive             True if the resolved address answered the reachability probe.
 * @param authority           The Majestic data or a sentinel.
 * @param registration        The WhoisXML API data or a sentinel.
 * @param traffic             The SEMrush data or the default record.
 * @param isAvailable         True if the domain does not resolve and the registry reports it as available.
 * @param primaryIndexCount   The number of pages in the primary search index.
 * @param googleIndexCount    The number of pages in the full search index.
 * @param secondaryIndexCount The difference of the full and the primary count; null if either is unknown.
 * @param tld                 The registry suffix of the domain name.
 */
public record CompositeResult(
        @NotNull String domain,
        @JsonProperty("isDNSFound") boolean isDNSFound,
        boolean usedWwwPrefix,
        @Nullable String ip,
        @JsonProperty("isAlive") boolean isAlive,
        @NotNull AuthorityData authority,
        @NotNull RegistrationData registration,
        @NotNull TrafficData traffic,
        @JsonProperty("isAvailable") boolean isAvailable,
        @Nullable Long primaryIndexCount,
        @Nullable Long googleIndexCount,
        @Nullable Long secondaryIndexCount,
        @NotNull String tld
) {
    /**
     * Computes the number of pages that are only in the secondary index.
     *
     * @param primaryIndexCount The number of pages in the primary index.
     * @param googleIndexCount  The number of pages in the full index.
     * @return The difference, or null if either of the counts is unknown.
     */
    public static @Nullable Long secondaryIndexCount(@Nullable Long primaryIndexCount,
                                                     @Nullable Long googleIndexCount) {
        if (primaryIndexCount == null || googleIndexCount == null)
            return null;

        return googleIndexCount - primaryIndexCount;
    }

    /**
     * Derives whether a domain is available for registration. A resolving domain is never available;
     * otherwise the registry status must be exactly "AVAILABLE".
     *
     * @param isDNSFound   True if the domain resolved.
     * @param registration The registration data.
     * @return True if the domain is available.
     */
    public static boolean isAvailable(boolean isDNSFound, @NotNull RegistrationData registration) {
        if (isDNSFound || !registration.hasStatus())
            return false;

        return "AVAILABLE".equals(registration.status());
    }
}
