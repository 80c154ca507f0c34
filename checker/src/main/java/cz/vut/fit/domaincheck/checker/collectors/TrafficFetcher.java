package cz.vut.fit.domaincheck.checker.collectors;

import cz.vut.fit.domaincheck.Common;
import cz.vut.fit.domaincheck.checker.CompletableFutures;
import cz.vut.fit.domaincheck.checker.ProviderClient;
import cz.vut.fit.domaincheck.checker.ProviderException;
import cz.vut.fit.domaincheck.models.dns.LivenessInfo;
import cz.vut.fit.domaincheck.models.providers.AuthorityData;
import cz.vut.fit.domaincheck.models.providers.TrafficData;
import cz.vut.fit.domaincheck.models.requests.CheckRequest;
import org.jetbrains.annotations.NotNull;

import java.util.LinkedHashMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Fetches the organic and paid search traffic estimates of a domain from the SEMrush API.
 */
public class TrafficFetcher {
    public static final String NAME = "semrush";
    public static final String COMPONENT_NAME = "fetcher-" + NAME;
    private static final org.slf4j.Logger Logger = Common.getComponentLogger(TrafficFetcher.class);

    static final String EXPORT_COLUMNS = "Dn,Rk,Or,Ot,Oc,Ad,At,Ac";

    private final ProviderClient _client;
    private final String _url;

    public TrafficFetcher(@NotNull ProviderClient client, @NotNull String url) {
        _client = client;
        _url = url;
    }

    /**
     * Fetches the traffic data, or returns the default record if no API key is set, if the domain resolves and
     * the request asks to skip resolving domains, or if its Trust Flow is below the requested minimum.
     *
     * @param request   The check request.
     * @param liveness  The resolution and probing outcome.
     * @param authority The authority data.
     * @return A future completed with the data, or failed with a {@link ProviderException}.
     */
    public CompletableFuture<TrafficData> fetch(@NotNull CheckRequest request,
                                                @NotNull LivenessInfo liveness,
                                                @NotNull AuthorityData authority) {
        final var domain = request.domain();

        if (!request.hasTrafficKey()) {
            Logger.debug("{}: no SEMrush key", domain);
            return CompletableFuture.completedFuture(TrafficData.empty());
        }

        if (DeepCheckGate.skipBecauseResolved(request, liveness)) {
            Logger.debug("{}: resolves in DNS, skipping SEMrush", domain);
            return CompletableFuture.completedFuture(TrafficData.empty());
        }

        if (DeepCheckGate.skipBecauseLowAuthority(request, authority)) {
            Logger.debug("{}: Trust Flow {} below {}, skipping SEMrush", domain, authority.trustFlow(),
                    request.minAuthorityScore());
            return CompletableFuture.completedFuture(TrafficData.empty());
        }

        final var query = new LinkedHashMap<String, String>();
        query.put("type", "domain_rank");
        query.put("key", request.trafficKey());
        query.put("export_columns", EXPORT_COLUMNS);
        query.put("domain", domain);
        query.put("database", request.trafficDatabase());

        final var send = _client.get(_url, query, "text/plain");
        final var mapped = send.handle((response, error) -> {
            if (error != null) {
                final var cause = CompletableFutures.unwrap(error);
                Logger.warn("{}: SEMrush request error", domain, cause);
                throw new CompletionException(ProviderException.ofTransportError(NAME, cause));
            }

            if (response.statusCode() != 200) {
                Logger.warn("{}: SEMrush HTTP request error: {}", domain, response.statusCode());
                throw new CompletionException(ProviderException.ofStatusCode(NAME, response.statusCode()));
            }

            return TrafficResponseParser.parse(response.body());
        });

        return CompletableFutures.propagateCancellation(mapped, send);
    }
}
