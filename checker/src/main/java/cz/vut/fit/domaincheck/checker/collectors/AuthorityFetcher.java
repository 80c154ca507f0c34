package cz.vut.fit.domaincheck.checker.collectors;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import cz.vut.fit.domaincheck.Common;
import cz.vut.fit.domaincheck.checker.CompletableFutures;
import cz.vut.fit.domaincheck.checker.ProviderClient;
import cz.vut.fit.domaincheck.checker.ProviderException;
import cz.vut.fit.domaincheck.models.dns.LivenessInfo;
import cz.vut.fit.domaincheck.models.providers.AuthorityData;
import cz.vut.fit.domaincheck.models.requests.CheckRequest;
import org.jetbrains.annotations.NotNull;

import java.util.LinkedHashMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Fetches the Trust Flow and the other index item metrics of a domain from the Majestic API.
 * <p>
 * A failure of this fetcher is fatal for the check: the registration and traffic lookups are gated on the
 * Trust Flow it provides.
 */
public class AuthorityFetcher {
    public static final String NAME = "majestic";
    public static final String COMPONENT_NAME = "fetcher-" + NAME;
    private static final org.slf4j.Logger Logger = Common.getComponentLogger(AuthorityFetcher.class);

    private final ProviderClient _client;
    private final ObjectMapper _jsonMapper;
    private final String _url;

    public AuthorityFetcher(@NotNull ProviderClient client, @NotNull ObjectMapper jsonMapper, @NotNull String url) {
        _client = client;
        _jsonMapper = jsonMapper;
        _url = url;
    }

    /**
     * Fetches the authority data, or returns a sentinel if no API key is set or the domain resolves and the
     * request asks to skip resolving domains.
     *
     * @param request  The check request.
     * @param liveness The resolution and probing outcome.
     * @return A future completed with the data, or failed with a {@link ProviderException}.
     */
    public CompletableFuture<AuthorityData> fetch(@NotNull CheckRequest request, @NotNull LivenessInfo liveness) {
        final var domain = request.domain();

        if (!request.hasAuthorityKey()) {
            Logger.debug("{}: no Majestic key", domain);
            return CompletableFuture.completedFuture(AuthorityData.noKey());
        }

        if (DeepCheckGate.skipBecauseResolved(request, liveness)) {
            Logger.debug("{}: resolves in DNS, skipping Majestic", domain);
            return CompletableFuture.completedFuture(AuthorityData.skippedResolved());
        }

        final var query = new LinkedHashMap<String, String>();
        query.put("cmd", "GetIndexItemInfo");
        query.put("datasource", "fresh");
        query.put("app_api_key", request.authorityKey());
        query.put("items", "1");
        query.put("item0", domain);

        final var send = _client.get(_url, query, "application/json");
        final var mapped = send.handle((response, error) -> {
            if (error != null) {
                final var cause = CompletableFutures.unwrap(error);
                Logger.warn("{}: Majestic request error", domain, cause);
                throw new CompletionException(ProviderException.ofTransportError(NAME, cause));
            }

            if (response.statusCode() != 200) {
                Logger.warn("{}: Majestic HTTP request error: {}", domain, response.statusCode());
                throw new CompletionException(ProviderException.ofStatusCode(NAME, response.statusCode()));
            }

            try {
                return parse(response.body());
            } catch (ProviderException e) {
                Logger.warn("{}: {}", domain, e.getMessage());
                throw new CompletionException(e);
            }
        });

        return CompletableFutures.propagateCancellation(mapped, send);
    }

    /**
     * Extracts the first item of the GetIndexItemInfo result table.
     *
     * @param body The response body.
     * @return The authority data.
     * @throws ProviderException If the body is not JSON or does not contain the result table.
     */
    AuthorityData parse(String body) throws ProviderException {
        final JsonNode root;
        try {
            root = _jsonMapper.readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            throw ProviderException.ofInvalidFormat(NAME, "not a JSON document", e);
        }

        final var item = root.path("DataTables").path("Results").path("Data").path(0);
        if (!item.isObject()) {
            final var code = root.path("Code").asText("unknown");
            throw ProviderException.ofInvalidFormat(NAME, "no result item (response code " + code + ")", null);
        }

        return new AuthorityData(
                item.path("TrustFlow").asInt(0),
                item.path("ResultCode").asText("OK"),
                item.deepCopy());
    }
}
