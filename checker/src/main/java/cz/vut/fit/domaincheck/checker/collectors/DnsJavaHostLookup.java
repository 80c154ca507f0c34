package cz.vut.fit.domaincheck.checker.collectors;

import cz.vut.fit.domaincheck.CheckerConfig;
import org.jetbrains.annotations.NotNull;
import org.xbill.DNS.AAAARecord;
import org.xbill.DNS.ARecord;
import org.xbill.DNS.ExtendedResolver;
import org.xbill.DNS.Name;
import org.xbill.DNS.Record;
import org.xbill.DNS.Resolver;
import org.xbill.DNS.TextParseException;
import org.xbill.DNS.Type;
import org.xbill.DNS.lookup.LookupResult;
import org.xbill.DNS.lookup.LookupSession;
import org.xbill.DNS.lookup.NoSuchRRSetException;

import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Arrays;
import java.util.Properties;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;

/**
 * A {@link HostLookup} that queries the A records of a name and, if there are none, its AAAA records,
 * using a dnsjava {@link LookupSession}. CNAME chains are followed by the session.
 */
public class DnsJavaHostLookup implements HostLookup {
    private final LookupSession _session;

    public DnsJavaHostLookup(@NotNull Resolver resolver, @NotNull Executor executor) {
        _session = LookupSession.builder()
                .resolver(resolver)
                .executor(executor)
                .build();
    }

    /**
     * Creates the resolver to use for the lookups. If no resolver IPs are configured, the system resolvers are used.
     *
     * @param properties The configuration.
     * @return The resolver.
     * @throws UnknownHostException If a configured resolver address is invalid.
     */
    public static Resolver makeResolver(@NotNull Properties properties) throws UnknownHostException {
        final var servers = Arrays.stream(properties.getProperty(CheckerConfig.DNS_RESOLVERS_CONFIG,
                        CheckerConfig.DNS_RESOLVERS_DEFAULT).split(","))
                .map(String::trim)
                .filter(server -> !server.isEmpty())
                .toArray(String[]::new);
        final var timeout = Duration.ofMillis(Long.parseLong(properties.getProperty(
                CheckerConfig.DNS_TIMEOUT_MS_CONFIG, CheckerConfig.DNS_TIMEOUT_MS_DEFAULT)));

        final var resolver = servers.length == 0 ? new ExtendedResolver() : new ExtendedResolver(servers);
        for (var inResolver : resolver.getResolvers()) {
            inResolver.setTimeout(timeout);
        }
        resolver.setTimeout(timeout.multipliedBy(Math.max(1, resolver.getResolvers().length)));
        return resolver;
    }

    @Override
    public CompletionStage<String> lookup(@NotNull String hostName) {
        final Name name;
        try {
            name = Name.fromString(hostName, Name.root);
        } catch (TextParseException e) {
            return CompletableFuture.failedFuture(e);
        }

        return lookup(name, Type.A)
                .thenCompose(address -> address != null
                        ? CompletableFuture.completedFuture(address)
                        : lookup(name, Type.AAAA));
    }

    private CompletableFuture<String> lookup(Name name, int type) {
        return _session.lookupAsync(name, type)
                .toCompletableFuture()
                .handle((result, error) -> {
                    if (error != null) {
                        var cause = error.getCause() != null ? error.getCause() : error;
                        // The name exists but has no records of this type
                        if (cause instanceof NoSuchRRSetException)
                            return null;

                        throw new CompletionException(cause);
                    }

                    return firstAddress(result);
                });
    }

    private static String firstAddress(LookupResult result) {
        if (result == null)
            return null;

        for (Record record : result.getRecords()) {
            if (record instanceof ARecord aRecord)
                return aRecord.getAddress().getHostAddress();
            if (record instanceof AAAARecord aaaaRecord)
                return aaaaRecord.getAddress().getHostAddress();
        }
        return null;
    }
}
