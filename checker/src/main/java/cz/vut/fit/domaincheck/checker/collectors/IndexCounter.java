package cz.vut.fit.domaincheck.checker.collectors;

import cz.vut.fit.domaincheck.models.requests.CheckRequest;
import org.jetbrains.annotations.NotNull;

import java.util.concurrent.CompletableFuture;

/**
 * Counts the pages of a domain known to a search engine.
 */
public interface IndexCounter {
    /**
     * Counts the indexed pages of the requested domain.
     *
     * @param request      The check request.
     * @param primaryIndex If true, only the pages in the primary index are counted.
     * @return A future completed with the count, or failed with a
     * {@link cz.vut.fit.domaincheck.checker.ProviderException}.
     */
    CompletableFuture<Long> count(@NotNull CheckRequest request, boolean primaryIndex);
}
