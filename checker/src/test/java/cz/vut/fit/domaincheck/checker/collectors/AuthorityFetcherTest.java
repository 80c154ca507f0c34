package cz.vut.fit.domaincheck.checker.collectors;

import cz.vut.fit.domaincheck.Common;
import cz.vut.fit.domaincheck.checker.ProviderClient;
import cz.vut.fit.domaincheck.checker.ProviderException;
import cz.vut.fit.domaincheck.models.ResultCodes;
import cz.vut.fit.domaincheck.models.dns.LivenessInfo;
import cz.vut.fit.domaincheck.models.providers.AuthorityData;
import cz.vut.fit.domaincheck.models.requests.CheckRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class AuthorityFetcherTest {
    static final String URL = "http://api.majestic.com/api/json";
    static final String MAJESTIC_BODY = """
            {"Code": "OK", "ErrorMessage": "",
             "DataTables": {"Results": {"Headers": {}, "Data": [
               {"Item": "example.com", "ResultCode": "OK", "TrustFlow": 35, "CitationFlow": 41}
             ]}}}""";

    private static final LivenessInfo RESOLVED = new LivenessInfo("example.com", false, true, "192.0.2.10", true);
    private static final LivenessInfo UNRESOLVED = new LivenessInfo("example.com", false, false, null, false);

    private HttpClient mockHttpClient;
    private HttpResponse<Object> mockResponse;
    private AuthorityFetcher fetcher;

    @BeforeEach
    void setUp() {
        mockHttpClient = mock(HttpClient.class);
        //noinspection unchecked
        mockResponse = mock(HttpResponse.class);
        fetcher = new AuthorityFetcher(new ProviderClient(mockHttpClient, Duration.ofSeconds(5)),
                Common.makeMapper().build(), URL);
    }

    private static CheckRequest.Builder withKey() {
        return CheckRequest.builder("example.com").authorityKey("KEY");
    }

    private ProviderException failure(CompletableFuture<?> future) {
        var e = assertThrows(ExecutionException.class, () -> future.get(1, TimeUnit.SECONDS));
        return assertInstanceOf(ProviderException.class, e.getCause());
    }

    @Test
    void fetch_withoutKeyReturnsSentinel() throws Exception {
        var data = fetcher.fetch(CheckRequest.of("example.com"), RESOLVED).get(1, TimeUnit.SECONDS);

        assertEquals(AuthorityData.noKey(), data);
        verifyNoInteractions(mockHttpClient);
    }

    @Test
    void fetch_keyIsCheckedBeforeResolution() throws Exception {
        var request = CheckRequest.builder("example.com").skipDeepChecksIfResolvable(true).build();

        assertEquals("NO-KEY", fetcher.fetch(request, RESOLVED).get(1, TimeUnit.SECONDS).resultCode());
    }

    @Test
    void fetch_skipsResolvedDomains() throws Exception {
        var data = fetcher.fetch(withKey().skipDeepChecksIfResolvable(true).build(), RESOLVED)
                .get(1, TimeUnit.SECONDS);

        assertEquals(AuthorityData.skippedResolved(), data);
        verifyNoInteractions(mockHttpClient);
    }

    @Test
    void fetch_success() throws Exception {
        when(mockResponse.statusCode()).thenReturn(200);
        when(mockResponse.body()).thenReturn(MAJESTIC_BODY);
        when(mockHttpClient.sendAsync(any(), any()))
                .thenReturn(CompletableFuture.completedFuture(mockResponse));

        var data = fetcher.fetch(withKey().skipDeepChecksIfResolvable(true).build(), UNRESOLVED)
                .get(1, TimeUnit.SECONDS);

        assertEquals(35, data.trustFlow());
        assertEquals("OK", data.resultCode());
        assertTrue(data.isFetched());
        assertEquals(41, data.raw().path("CitationFlow").asInt());

        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(mockHttpClient).sendAsync(captor.capture(), any());
        assertEquals(URI.create(URL + "?cmd=GetIndexItemInfo&datasource=fresh&app_api_key=KEY&items=1"
                + "&item0=example.com"), captor.getValue().uri());
        assertEquals("GET", captor.getValue().method());
    }

    @Test
    void fetch_non200IsFatal() {
        when(mockResponse.statusCode()).thenReturn(403);
        when(mockHttpClient.sendAsync(any(), any()))
                .thenReturn(CompletableFuture.completedFuture(mockResponse));

        var e = failure(fetcher.fetch(withKey().build(), RESOLVED));

        assertEquals(ResultCodes.CANNOT_FETCH, e.code());
        assertEquals(403, e.httpStatus());
        assertEquals(AuthorityFetcher.NAME, e.provider());
        assertTrue(e.getMessage().contains("majestic"));
    }

    @Test
    void fetch_rateLimited() {
        when(mockResponse.statusCode()).thenReturn(429);
        when(mockHttpClient.sendAsync(any(), any()))
                .thenReturn(CompletableFuture.completedFuture(mockResponse));

        assertEquals(ResultCodes.RATE_LIMITED, failure(fetcher.fetch(withKey().build(), RESOLVED)).code());
    }

    @Test
    void fetch_missingResultTableIsFatal() {
        when(mockResponse.statusCode()).thenReturn(200);
        when(mockResponse.body()).thenReturn("{\"Code\": \"InvalidAPIKey\", \"DataTables\": {}}");
        when(mockHttpClient.sendAsync(any(), any()))
                .thenReturn(CompletableFuture.completedFuture(mockResponse));

        var e = failure(fetcher.fetch(withKey().build(), RESOLVED));

        assertEquals(ResultCodes.INVALID_FORMAT, e.code());
        assertTrue(e.getMessage().contains("InvalidAPIKey"));
    }

    @Test
    void fetch_invalidJsonIsFatal() {
        when(mockResponse.statusCode()).thenReturn(200);
        when(mockResponse.body()).thenReturn("<html>maintenance</html>");
        when(mockHttpClient.sendAsync(any(), any()))
                .thenReturn(CompletableFuture.completedFuture(mockResponse));

        assertEquals(ResultCodes.INVALID_FORMAT, failure(fetcher.fetch(withKey().build(), RESOLVED)).code());
    }

    @Test
    void fetch_transportErrors() {
        when(mockHttpClient.sendAsync(any(), any()))
                .thenReturn(CompletableFuture.failedFuture(new ConnectException("refused")))
                .thenReturn(CompletableFuture.failedFuture(new HttpTimeoutException("request timed out")));

        assertEquals(ResultCodes.CANNOT_FETCH, failure(fetcher.fetch(withKey().build(), RESOLVED)).code());
        assertEquals(ResultCodes.TIMEOUT, failure(fetcher.fetch(withKey().build(), RESOLVED)).code());
    }

    @Test
    void fetch_cancellationAbortsRequest() {
        var pending = new CompletableFuture<HttpResponse<Object>>();
        when(mockHttpClient.sendAsync(any(), any())).thenReturn(pending);

        var future = fetcher.fetch(withKey().build(), RESOLVED);
        future.cancel(true);

        assertTrue(pending.isCancelled());
    }
}
