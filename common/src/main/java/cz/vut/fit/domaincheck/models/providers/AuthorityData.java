package cz.vut.fit.domaincheck.models.providers;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A record that represents the authority metrics retrieved from Majestic about a domain name.
 *
 * @param trustFlow  The Trust Flow of the domain; zero when the data were not fetched.
 * @param resultCode The Majestic result code of the item, or a sentinel code when the data were not fetched.
 * @param raw        The first item of the GetIndexItemInfo result table as returned by the API,
 *                   null when the data were not fetched.
 */
public record AuthorityData(
        int trustFlow,
        @NotNull String resultCode,
        @Nullable JsonNode raw
) {
    /**
     * The result code used when no Majestic API key is configured.
     */
    public static final String NO_KEY = "NO-KEY";

    /**
     * The result code used when the fetch was skipped because the domain resolves in the DNS.
     */
    public static final String NO_CHECK_DNS_RESOLVED = "NO-CHECK-DNS-RESOLVED";

    public static AuthorityData noKey() {
        return new AuthorityData(0, NO_KEY, null);
    }

    public static AuthorityData skippedResolved() {
        return new AuthorityData(0, NO_CHECK_DNS_RESOLVED, null);
    }

    /**
     * @return True if this record holds data returned by the provider rather than a sentinel.
     */
    @JsonIgnore
    public boolean isFetched() {
        return raw != null;
    }
}
