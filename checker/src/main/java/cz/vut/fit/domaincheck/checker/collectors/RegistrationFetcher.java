package cz.vut.fit.domaincheck.checker.collectors;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import cz.vut.fit.domaincheck.Common;
import cz.vut.fit.domaincheck.checker.CompletableFutures;
import cz.vut.fit.domaincheck.checker.ProviderClient;
import cz.vut.fit.domaincheck.models.dns.LivenessInfo;
import cz.vut.fit.domaincheck.models.providers.AuthorityData;
import cz.vut.fit.domaincheck.models.providers.RegistrationData;
import cz.vut.fit.domaincheck.models.requests.CheckRequest;
import org.jetbrains.annotations.NotNull;

import java.util.LinkedHashMap;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;

/**
 * Fetches the whois record and the registry status of a domain from the WhoisXML API.
 * <p>
 * The registration data are best-effort: every failure is logged and replaced by
 * {@link RegistrationData#empty()}.
 */
public class RegistrationFetcher {
    public static final String NAME = "whoisxmlapi";
    public static final String COMPONENT_NAME = "fetcher-" + NAME;
    private static final org.slf4j.Logger Logger = Common.getComponentLogger(RegistrationFetcher.class);

    private final ProviderClient _client;
    private final ObjectMapper _jsonMapper;
    private final RegistrationNormalizer _normalizer;
    private final String _url;

    public RegistrationFetcher(@NotNull ProviderClient client, @NotNull ObjectMapper jsonMapper,
                               @NotNull RegistrationNormalizer normalizer, @NotNull String url) {
        _client = client;
        _jsonMapper = jsonMapper;
        _normalizer = normalizer;
        _url = url;
    }

    /**
     * Fetches the registration data, or returns the empty record if the domain resolves and the request asks
     * to skip resolving domains, if its Trust Flow is below the requested minimum, or if no credentials are set.
     *
     * @param request   The check request.
     * @param liveness  The resolution and probing outcome.
     * @param authority The authority data.
     * @return A future that completes normally unless it is cancelled.
     */
    public CompletableFuture<RegistrationData> fetch(@NotNull CheckRequest request,
                                                     @NotNull LivenessInfo liveness,
                                                     @NotNull AuthorityData authority) {
        final var domain = request.domain();

        if (DeepCheckGate.skipBecauseResolved(request, liveness)) {
            Logger.debug("{}: resolves in DNS, skipping whois", domain);
            return CompletableFuture.completedFuture(RegistrationData.empty());
        }

        if (DeepCheckGate.skipBecauseLowAuthority(request, authority)) {
            Logger.debug("{}: Trust Flow {} below {}, skipping whois", domain, authority.trustFlow(),
                    request.minAuthorityScore());
            return CompletableFuture.completedFuture(RegistrationData.empty());
        }

        if (!request.hasRegistrationCredential()) {
            Logger.debug("{}: no whoisxmlapi credentials", domain);
            return CompletableFuture.completedFuture(RegistrationData.empty());
        }

        //noinspection DataFlowIssue
        final var credential = request.registrationCredential();
        final var query = new LinkedHashMap<String, String>();
        query.put("username", credential.user());
        query.put("password", credential.password());
        query.put("domainName", domain);
        query.put("outputFormat", "JSON");
        query.put("getMode", "DNS_AND_WHOIS");

        final var send = _client.get(_url, query, "application/json");
        final var mapped = send.handle((response, error) -> {
            if (error != null) {
                final var cause = CompletableFutures.unwrap(error);
                if (cause instanceof CancellationException cancellation)
                    throw cancellation;

                Logger.warn("{}: whoisxmlapi request error, using empty whois data", domain, cause);
                return RegistrationData.empty();
            }

            if (response.statusCode() != 200) {
                Logger.warn("{}: whoisxmlapi HTTP request error: {}, check the credentials; using empty whois data",
                        domain, response.statusCode());
                return RegistrationData.empty();
            }

            try {
                return _normalizer.normalize(_jsonMapper.readTree(response.body()));
            } catch (JsonProcessingException e) {
                Logger.warn("{}: invalid whoisxmlapi response, using empty whois data", domain, e);
                return RegistrationData.empty();
            }
        });

        return CompletableFutures.propagateCancellation(mapped, send);
    }
}
