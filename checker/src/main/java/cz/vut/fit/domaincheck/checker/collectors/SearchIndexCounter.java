package cz.vut.fit.domaincheck.checker.collectors;

import com.google.common.net.HostAndPort;
import cz.vut.fit.domaincheck.Common;
import cz.vut.fit.domaincheck.checker.CompletableFutures;
import cz.vut.fit.domaincheck.checker.ProviderException;
import cz.vut.fit.domaincheck.models.requests.CheckRequest;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.jsoup.HttpStatusException;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Counts the indexed pages by scraping the result statistics of a {@code site:} query
 * from a search engine's results page.
 */
public class SearchIndexCounter implements IndexCounter {
    public static final String NAME = "search-index";
    public static final String COMPONENT_NAME = "counter-" + NAME;
    private static final org.slf4j.Logger Logger = Common.getComponentLogger(SearchIndexCounter.class);

    static final int DEFAULT_PROXY_PORT = 8080;

    private final String _defaultHost;
    private final int _timeoutMs;
    private final String _userAgent;
    private final ExecutorService _executor;

    public SearchIndexCounter(@NotNull String defaultHost, int timeoutMs, @NotNull String userAgent,
                              @NotNull ExecutorService executor) {
        _defaultHost = defaultHost;
        _timeoutMs = timeoutMs;
        _userAgent = userAgent;
        _executor = executor;
    }

    @Override
    public CompletableFuture<Long> count(@NotNull CheckRequest request, boolean primaryIndex) {
        final var host = Common.isNullOrBlank(request.indexSearchHost())
                ? _defaultHost : request.indexSearchHost();
        final var url = buildSearchUrl(host, buildQuery(request.domain(), primaryIndex));

        return CompletableFutures.supplyCancellable(() -> {
            final var proxy = pickProxy(request.proxyList());
            try {
                final var count = parseResultCount(fetchDocument(url, proxy));
                Logger.trace("{}: {} pages ({})", request.domain(), count, primaryIndex ? "primary" : "all");
                return count;
            } catch (HttpStatusException e) {
                Logger.warn("{}: search HTTP request error: {}", request.domain(), e.getStatusCode());
                throw ProviderException.ofStatusCode(NAME, e.getStatusCode());
            } catch (IOException e) {
                Logger.warn("{}: search request error", request.domain(), e);
                throw ProviderException.ofTransportError(NAME, e);
            }
        }, _executor);
    }

    /**
     * Fetches and parses a results page.
     *
     * @param url   The results page URL.
     * @param proxy The HTTP proxy to use, or null to connect directly.
     * @return The parsed page.
     * @throws IOException If the page cannot be fetched or the response status is not successful.
     */
    protected Document fetchDocument(@NotNull String url, @Nullable HostAndPort proxy) throws IOException {
        var connection = Jsoup.connect(url)
                .userAgent(_userAgent)
                .timeout(_timeoutMs);
        if (proxy != null)
            connection = connection.proxy(proxy.getHost(), proxy.getPortOrDefault(DEFAULT_PROXY_PORT));

        return connection.get();
    }

    /**
     * Reads the number of results from the {@code #result-stats} element, e.g.
     * "About 1,230 results (0.25 seconds)". The digits before the parenthesised timing make up the count.
     *
     * @param document The results page.
     * @return The count; zero if the page has no result statistics.
     */
    static long parseResultCount(@NotNull Document document) {
        final var stats = document.getElementById("result-stats");
        if (stats == null)
            return 0;

        var text = stats.text();
        final var timingStart = text.indexOf('(');
        if (timingStart >= 0)
            text = text.substring(0, timingStart);

        final var digits = text.replaceAll("\\D", "");
        return digits.isEmpty() ? 0 : Long.parseLong(digits);
    }

    static String buildQuery(@NotNull String domain, boolean primaryIndex) {
        return "site:" + domain + (primaryIndex ? " /&" : "");
    }

    static String buildSearchUrl(@NotNull String host, @NotNull String query) {
        return "https://" + host + "/search?q=" + URLEncoder.encode(query, StandardCharsets.UTF_8);
    }

    private static @Nullable HostAndPort pickProxy(List<String> proxyList) {
        if (proxyList.isEmpty())
            return null;

        final var proxy = proxyList.get(ThreadLocalRandom.current().nextInt(proxyList.size()));
        try {
            return HostAndPort.fromString(proxy.trim()).requireBracketsForIPv6();
        } catch (IllegalArgumentException e) {
            Logger.warn("Invalid proxy {}, connecting directly", proxy);
            return null;
        }
    }
}
