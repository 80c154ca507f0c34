package cz.vut.fit.domaincheck.models.requests;

import cz.vut.fit.domaincheck.CheckerConfig;
import cz.vut.fit.domaincheck.Common;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * A request to check a single domain name. The optional credentials decide which providers are queried;
 * a provider without its credential is skipped and its data are replaced by a sentinel.
 *
 * @param domain                     The domain name to check.
 * @param authorityKey               The Majestic API key.
 * @param registrationCredential     The WhoisXML API credentials.
 * @param trafficKey                 The SEMrush API key.
 * @param trafficDatabase            The SEMrush regional database, "us" if not set.
 * @param skipDeepChecksIfResolvable If true, the authority, registration and traffic data are not fetched
 *                                   for domains that resolve in the DNS.
 * @param minAuthorityScore          The minimum Trust Flow required to fetch the registration and traffic data.
 * @param indexSearchHost            The search engine host to count indexed pages at; the configured default
 *                                   is used if not set.
 * @param proxyList                  The host:port proxies to route the search queries through.
 */
public record CheckRequest(
        @NotNull String domain,
        @Nullable String authorityKey,
        @Nullable RegistrationCredential registrationCredential,
        @Nullable String trafficKey,
        @NotNull String trafficDatabase,
        boolean skipDeepChecksIfResolvable,
        @Nullable Integer minAuthorityScore,
        @Nullable String indexSearchHost,
        @NotNull List<String> proxyList
) {
    public CheckRequest {
        Objects.requireNonNull(domain, "domain");
        if (domain.isBlank())
            throw new IllegalArgumentException("The domain name must not be blank");

        domain = domain.trim();
        if (Common.isNullOrBlank(trafficDatabase))
            trafficDatabase = CheckerConfig.TRAFFIC_DATABASE_DEFAULT;
        proxyList = proxyList == null ? List.of() : List.copyOf(proxyList);
    }

    /**
     * Creates a request for a domain with no credentials and no gating.
     *
     * @param domain The domain name to check.
     * @return The request.
     */
    public static CheckRequest of(@NotNull String domain) {
        return builder(domain).build();
    }

    public static Builder builder(@NotNull String domain) {
        return new Builder(domain);
    }

    public boolean hasAuthorityKey() {
        return !Common.isNullOrBlank(authorityKey);
    }

    public boolean hasRegistrationCredential() {
        return registrationCredential != null && registrationCredential.isComplete();
    }

    public boolean hasTrafficKey() {
        return !Common.isNullOrBlank(trafficKey);
    }

    @Override
    public String toString() {
        return "CheckRequest[domain=" + domain
                + ", authorityKey=" + (hasAuthorityKey() ? "***" : "none")
                + ", registrationCredential=" + registrationCredential
                + ", trafficKey=" + (hasTrafficKey() ? "***" : "none")
                + ", trafficDatabase=" + trafficDatabase
                + ", skipDeepChecksIfResolvable=" + skipDeepChecksIfResolvable
                + ", minAuthorityScore=" + minAuthorityScore
                + ", indexSearchHost=" + indexSearchHost
                + ", proxyList=" + proxyList + "]";
    }

    public static final class Builder {
        private final String _domain;
        private String _authorityKey;
        private RegistrationCredential _registrationCredential;
        private String _trafficKey;
        private String _trafficDatabase;
        private boolean _skipDeepChecksIfResolvable;
        private Integer _minAuthorityScore;
        private String _indexSearchHost;
        private List<String> _proxyList = List.of();

        private Builder(String domain) {
            _domain = domain;
        }

        public Builder authorityKey(@Nullable String authorityKey) {
            _authorityKey = authorityKey;
            return this;
        }

        public Builder registrationCredential(@Nullable String user, @Nullable String password) {
            _registrationCredential = new RegistrationCredential(user, password);
            return this;
        }

        public Builder trafficKey(@Nullable String trafficKey) {
            _trafficKey = trafficKey;
            return this;
        }

        public Builder trafficDatabase(@Nullable String trafficDatabase) {
            _trafficDatabase = trafficDatabase;
            return this;
        }

        public Builder skipDeepChecksIfResolvable(boolean skip) {
            _skipDeepChecksIfResolvable = skip;
            return this;
        }

        public Builder minAuthorityScore(@Nullable Integer minAuthorityScore) {
            _minAuthorityScore = minAuthorityScore;
            return this;
        }

        public Builder indexSearchHost(@Nullable String indexSearchHost) {
            _indexSearchHost = indexSearchHost;
            return this;
        }

        public Builder proxyList(@Nullable List<String> proxyList) {
            _proxyList = proxyList;
            return this;
        }

        public CheckRequest build() {
            return new CheckRequest(_domain, _authorityKey, _registrationCredential, _trafficKey, _trafficDatabase,
                    _skipDeepChecksIfResolvable, _minAuthorityScore, _indexSearchHost, _proxyList);
        }
    }
}
