package cz.vut.fit.domaincheck.checker.collectors;

import org.jetbrains.annotations.NotNull;

import java.util.concurrent.CompletionStage;

/**
 * Looks up an IP address of a host name.
 */
@FunctionalInterface
public interface HostLookup {
    /**
     * Resolves a host name.
     *
     * @param hostName The host name to resolve.
     * @return A stage completed with the textual form of one of the host's addresses, with null if the name
     * exists but has no address, or failed if the lookup failed.
     */
    CompletionStage<String> lookup(@NotNull String hostName);
}
