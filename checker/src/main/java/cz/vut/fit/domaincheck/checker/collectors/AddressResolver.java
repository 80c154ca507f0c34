package cz.vut.fit.domaincheck.checker.collectors;

import cz.vut.fit.domaincheck.Common;
import cz.vut.fit.domaincheck.checker.CompletableFutures;
import cz.vut.fit.domaincheck.models.dns.AddressInfo;
import org.jetbrains.annotations.NotNull;

import java.util.concurrent.CompletableFuture;

/**
 * Resolves a domain name to an IP address. If the bare name does not resolve, its "www." variant is tried.
 * A name that resolves in neither form is a regular outcome, not an error.
 */
public class AddressResolver {
    public static final String NAME = "dns";
    public static final String COMPONENT_NAME = "resolver-" + NAME;
    private static final org.slf4j.Logger Logger = Common.getComponentLogger(AddressResolver.class);

    static final String WWW_PREFIX = "www.";

    private final HostLookup _lookup;

    public AddressResolver(@NotNull HostLookup lookup) {
        _lookup = lookup;
    }

    /**
     * Resolves the domain name, falling back to its "www." variant.
     *
     * @param domain The domain name.
     * @return A future that always completes normally with the resolution outcome.
     */
    public CompletableFuture<AddressInfo> resolve(@NotNull String domain) {
        return lookup(domain)
                .thenCompose(ip -> {
                    if (ip != null) {
                        Logger.trace("{}: resolved to {}", domain, ip);
                        return CompletableFuture.completedFuture(AddressInfo.resolved(domain, false, ip));
                    }

                    return lookup(WWW_PREFIX + domain)
                            .thenApply(wwwIp -> {
                                if (wwwIp == null) {
                                    Logger.debug("{}: the name does not resolve (neither with www)", domain);
                                    return AddressInfo.unresolved(domain, false);
                                }

                                Logger.trace("{}: resolved to {} with www", domain, wwwIp);
                                return AddressInfo.resolved(domain, true, wwwIp);
                            });
                });
    }

    private CompletableFuture<String> lookup(String hostName) {
        final CompletableFuture<String> lookupFuture;
        try {
            lookupFuture = _lookup.lookup(hostName).toCompletableFuture();
        } catch (RuntimeException e) {
            Logger.debug("{}: DNS lookup error: {}", hostName, e.toString());
            return CompletableFuture.completedFuture(null);
        }

        return lookupFuture.exceptionally(e -> {
            Logger.debug("{}: DNS lookup failed: {}", hostName, CompletableFutures.unwrap(e).toString());
            return null;
        });
    }
}
