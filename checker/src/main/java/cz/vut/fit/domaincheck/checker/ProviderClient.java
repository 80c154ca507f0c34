package cz.vut.fit.domaincheck.checker;

import org.jetbrains.annotations.NotNull;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Sends GET requests with query parameters to a provider's HTTP API.
 * The status code and body of the response are left to the caller to interpret.
 */
public class ProviderClient {
    private final HttpClient _client;
    private final Duration _httpTimeout;

    public ProviderClient(@NotNull HttpClient client, @NotNull Duration httpTimeout) {
        _client = client;
        _httpTimeout = httpTimeout;
    }

    /**
     * Creates an HTTP client suitable for the provider APIs.
     *
     * @param connectTimeout The connection timeout.
     * @param executor       The executor used for the asynchronous requests.
     * @return The HTTP client.
     */
    public static HttpClient buildHttpClient(@NotNull Duration connectTimeout, @NotNull Executor executor) {
        return HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .executor(executor)
                .build();
    }

    /**
     * Builds a request URL from a base URL and query parameters. The parameters are encoded as UTF-8
     * and appended in the iteration order of the map.
     *
     * @param baseUrl The base URL.
     * @param query   The query parameters.
     * @return The request URL.
     */
    public static String buildUrl(@NotNull String baseUrl, @NotNull Map<String, String> query) {
        if (query.isEmpty())
            return baseUrl;

        final var queryString = query.entrySet().stream()
                .map(entry -> encode(entry.getKey()) + "=" + encode(entry.getValue()))
                .collect(Collectors.joining("&"));

        return baseUrl + (baseUrl.contains("?") ? "&" : "?") + queryString;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }

    /**
     * Sends an asynchronous GET request. Cancelling the returned future aborts the request.
     *
     * @param baseUrl The base URL of the API.
     * @param query   The query parameters, in the order they should be sent in.
     * @param accept  The value of the Accept header.
     * @return A future completed with the response, or failed with the transport error.
     */
    public CompletableFuture<HttpResponse<String>> get(@NotNull String baseUrl, @NotNull Map<String, String> query,
                                                       @NotNull String accept) {
        final HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                    .uri(URI.create(buildUrl(baseUrl, query)))
                    .timeout(_httpTimeout)
                    .header("Accept", accept)
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(e);
        }

        return _client.sendAsync(request, HttpResponse.BodyHandlers.ofString());
    }
}
