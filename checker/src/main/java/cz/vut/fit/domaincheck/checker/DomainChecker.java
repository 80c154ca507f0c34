package cz.vut.fit.domaincheck.checker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import cz.vut.fit.domaincheck.CheckerConfig;
import cz.vut.fit.domaincheck.Common;
import cz.vut.fit.domaincheck.checker.collectors.AddressResolver;
import cz.vut.fit.domaincheck.checker.collectors.AuthorityFetcher;
import cz.vut.fit.domaincheck.checker.collectors.DnsJavaHostLookup;
import cz.vut.fit.domaincheck.checker.collectors.IndexCounter;
import cz.vut.fit.domaincheck.checker.collectors.LivenessProber;
import cz.vut.fit.domaincheck.checker.collectors.ReachabilityProbe;
import cz.vut.fit.domaincheck.checker.collectors.RegistrationFetcher;
import cz.vut.fit.domaincheck.checker.collectors.RegistrationNormalizer;
import cz.vut.fit.domaincheck.checker.collectors.SearchIndexCounter;
import cz.vut.fit.domaincheck.checker.collectors.TrafficFetcher;
import cz.vut.fit.domaincheck.models.dns.LivenessInfo;
import cz.vut.fit.domaincheck.models.providers.AuthorityData;
import cz.vut.fit.domaincheck.models.providers.RegistrationData;
import cz.vut.fit.domaincheck.models.providers.TrafficData;
import cz.vut.fit.domaincheck.models.requests.CheckRequest;
import cz.vut.fit.domaincheck.models.results.CompositeResult;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.io.Closeable;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Duration;
import java.util.Properties;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Checks domain names: resolves the name, probes the address, fetches the authority data, then fetches the
 * registration data, the traffic data and both index counts concurrently, and merges everything into
 * a {@link CompositeResult}.
 * <p>
 * A failure of the authority fetch, the traffic fetch or either index count fails the whole check with
 * a {@link DomainCheckException}; the other lookups fall back to their default values.
 * Cancelling the future returned by {@link #check(CheckRequest)} cancels the calls in flight.
 */
public class DomainChecker implements Closeable {
    public static final String COMPONENT_NAME = "orchestrator";
    private static final org.slf4j.Logger Logger = Common.getComponentLogger(DomainChecker.class);

    private final AddressResolver _resolver;
    private final LivenessProber _prober;
    private final AuthorityFetcher _authorityFetcher;
    private final RegistrationFetcher _registrationFetcher;
    private final TrafficFetcher _trafficFetcher;
    private final IndexCounter _indexCounter;
    private final Duration _defaultDeadline;
    private final ExecutorService _ownedExecutor;

    /**
     * @param defaultDeadline The deadline of a check when none is given; null or zero for no deadline.
     * @param ownedExecutor   An executor shut down when this checker is closed, or null.
     */
    public DomainChecker(@NotNull AddressResolver resolver,
                         @NotNull LivenessProber prober,
                         @NotNull AuthorityFetcher authorityFetcher,
                         @NotNull RegistrationFetcher registrationFetcher,
                         @NotNull TrafficFetcher trafficFetcher,
                         @NotNull IndexCounter indexCounter,
                         @Nullable Duration defaultDeadline,
                         @Nullable ExecutorService ownedExecutor) {
        _resolver = resolver;
        _prober = prober;
        _authorityFetcher = authorityFetcher;
        _registrationFetcher = registrationFetcher;
        _trafficFetcher = trafficFetcher;
        _indexCounter = indexCounter;
        _defaultDeadline = defaultDeadline;
        _ownedExecutor = ownedExecutor;
    }

    /**
     * Creates a checker with the production components configured from the properties.
     *
     * @param properties The configuration, see {@link CheckerConfig}.
     * @param jsonMapper The mapper used to read the provider responses.
     * @return The checker. It must be closed to release its threads.
     * @throws UnknownHostException If a configured DNS resolver address is invalid.
     */
    public static DomainChecker create(@NotNull Properties properties, @NotNull ObjectMapper jsonMapper)
            throws UnknownHostException {
        final var executor = Executors.newCachedThreadPool(new ThreadFactoryBuilder()
                .setNameFormat("domain-checker-%d")
                .setDaemon(true)
                .build());

        try {
            final var resolver = new AddressResolver(
                    new DnsJavaHostLookup(DnsJavaHostLookup.makeResolver(properties), executor));
            final var prober = new LivenessProber(ReachabilityProbe.system(),
                    intProperty(properties, CheckerConfig.PING_TIMEOUT_MS_CONFIG,
                            CheckerConfig.PING_TIMEOUT_MS_DEFAULT),
                    executor);

            final var httpClient = ProviderClient.buildHttpClient(Duration.ofSeconds(10), executor);
            final var authorityFetcher = new AuthorityFetcher(
                    new ProviderClient(httpClient, secondsProperty(properties,
                            CheckerConfig.AUTHORITY_HTTP_TIMEOUT_CONFIG, CheckerConfig.AUTHORITY_HTTP_TIMEOUT_DEFAULT)),
                    jsonMapper,
                    properties.getProperty(CheckerConfig.AUTHORITY_URL_CONFIG, CheckerConfig.AUTHORITY_URL_DEFAULT));
            final var registrationFetcher = new RegistrationFetcher(
                    new ProviderClient(httpClient, secondsProperty(properties,
                            CheckerConfig.REGISTRATION_HTTP_TIMEOUT_CONFIG,
                            CheckerConfig.REGISTRATION_HTTP_TIMEOUT_DEFAULT)),
                    jsonMapper,
                    new RegistrationNormalizer(Clock.systemUTC()),
                    properties.getProperty(CheckerConfig.REGISTRATION_URL_CONFIG,
                            CheckerConfig.REGISTRATION_URL_DEFAULT));
            final var trafficFetcher = new TrafficFetcher(
                    new ProviderClient(httpClient, secondsProperty(properties,
                            CheckerConfig.TRAFFIC_HTTP_TIMEOUT_CONFIG, CheckerConfig.TRAFFIC_HTTP_TIMEOUT_DEFAULT)),
                    properties.getProperty(CheckerConfig.TRAFFIC_URL_CONFIG, CheckerConfig.TRAFFIC_URL_DEFAULT));
            final var indexCounter = new SearchIndexCounter(
                    properties.getProperty(CheckerConfig.INDEX_HOST_CONFIG, CheckerConfig.INDEX_HOST_DEFAULT),
                    intProperty(properties, CheckerConfig.INDEX_TIMEOUT_MS_CONFIG,
                            CheckerConfig.INDEX_TIMEOUT_MS_DEFAULT),
                    properties.getProperty(CheckerConfig.INDEX_USER_AGENT_CONFIG,
                            CheckerConfig.INDEX_USER_AGENT_DEFAULT),
                    executor);

            final var deadline = Duration.ofMillis(Long.parseLong(properties.getProperty(
                    CheckerConfig.CHECK_TIMEOUT_MS_CONFIG, CheckerConfig.CHECK_TIMEOUT_MS_DEFAULT)));

            return new DomainChecker(resolver, prober, authorityFetcher, registrationFetcher, trafficFetcher,
                    indexCounter, deadline, executor);
        } catch (UnknownHostException | RuntimeException e) {
            executor.shutdownNow();
            throw e;
        }
    }

    private static int intProperty(Properties properties, String key, String defaultValue) {
        return Integer.parseInt(properties.getProperty(key, defaultValue).trim());
    }

    private static Duration secondsProperty(Properties properties, String key, String defaultValue) {
        return Duration.ofSeconds(intProperty(properties, key, defaultValue));
    }

    /**
     * Checks a domain with the default deadline.
     *
     * @param request The check request.
     * @return A future completed with the merged result, or failed with a {@link DomainCheckException}.
     */
    public CompletableFuture<CompositeResult> check(@NotNull CheckRequest request) {
        return check(request, _defaultDeadline);
    }

    /**
     * Checks a domain.
     *
     * @param request  The check request.
     * @param deadline The time after which the check fails with {@link cz.vut.fit.domaincheck.models.ResultCodes#TIMEOUT};
     *                 null or zero for no deadline.
     * @return A future completed with the merged result, or failed with a {@link DomainCheckException}.
     */
    public CompletableFuture<CompositeResult> check(@NotNull CheckRequest request, @Nullable Duration deadline) {
        final var domain = request.domain();
        final var context = new CheckContext(domain);
        final var result = new CompletableFuture<CompositeResult>();
        final var startedAt = System.nanoTime();

        Logger.info("{}: check started", domain);
        Logger.debug("{}: {}", domain, request);

        var pipeline = CompletableFuture.completedFuture(domain)
                .thenCompose(name -> {
                    context.enter(CheckStage.RESOLVING);
                    return context.track(_resolver.resolve(name));
                })
                .thenCompose(address -> {
                    context.enter(CheckStage.PROBING);
                    return context.track(_prober.probe(address));
                })
                .thenCompose(liveness -> {
                    context.enter(CheckStage.FETCHING_AUTHORITY);
                    return context.track(_authorityFetcher.fetch(request, liveness))
                            .thenCompose(authority -> fetchParallelGroup(context, request, liveness, authority));
                });

        if (deadline != null && !deadline.isZero() && !deadline.isNegative())
            pipeline = pipeline.orTimeout(deadline.toMillis(), TimeUnit.MILLISECONDS);

        final var finalPipeline = pipeline;
        finalPipeline.whenComplete((composite, error) -> {
            final var elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);
            if (error == null) {
                context.complete();
                Logger.info("{}: check finished in {} ms: {}", domain, elapsedMs, composite);
                result.complete(composite);
                return;
            }

            final var checkException = context.toCheckException(error);
            context.fail();
            if (!result.isDone())
                Logger.error("{}: check failed after {} ms", domain, elapsedMs, checkException);
            result.completeExceptionally(checkException);
        });

        result.whenComplete((composite, error) -> {
            if (result.isCancelled()) {
                Logger.info("{}: check cancelled in stage {}", domain, context.stage());
                context.fail();
                finalPipeline.cancel(true);
            }
        });

        return result;
    }

    private CompletableFuture<CompositeResult> fetchParallelGroup(CheckContext context, CheckRequest request,
                                                                  LivenessInfo liveness, AuthorityData authority) {
        context.enter(CheckStage.FETCHING_PARALLEL_GROUP);

        final var registration = context.track(_registrationFetcher.fetch(request, liveness, authority));
        final var traffic = context.track(_trafficFetcher.fetch(request, liveness, authority));
        final var primaryIndexCount = context.track(_indexCounter.count(request, true));
        final var googleIndexCount = context.track(_indexCounter.count(request, false));

        return CompletableFutures.allOrFirstFailure(registration, traffic, primaryIndexCount, googleIndexCount)
                .thenApply(ignored -> {
                    context.enter(CheckStage.MERGING);
                    return merge(request, liveness, authority, registration.join(), traffic.join(),
                            primaryIndexCount.join(), googleIndexCount.join());
                });
    }

    static CompositeResult merge(CheckRequest request, LivenessInfo liveness, AuthorityData authority,
                                 RegistrationData registration, TrafficData traffic,
                                 @Nullable Long primaryIndexCount, @Nullable Long googleIndexCount) {
        return new CompositeResult(
                request.domain(),
                liveness.resolved(),
                liveness.usedWwwPrefix(),
                liveness.ip(),
                liveness.isAlive(),
                authority,
                registration,
                traffic,
                CompositeResult.isAvailable(liveness.resolved(), registration),
                primaryIndexCount,
                googleIndexCount,
                CompositeResult.secondaryIndexCount(primaryIndexCount, googleIndexCount),
                Common.getTld(request.domain()));
    }

    @Override
    public void close() {
        if (_ownedExecutor != null)
            _ownedExecutor.shutdownNow();
    }
}
