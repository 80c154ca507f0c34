package cz.vut.fit.domaincheck.checker.collectors;

import cz.vut.fit.domaincheck.models.dns.LivenessInfo;
import cz.vut.fit.domaincheck.models.providers.AuthorityData;
import cz.vut.fit.domaincheck.models.requests.CheckRequest;
import org.jetbrains.annotations.NotNull;

/**
 * The conditions under which the paid provider lookups are skipped.
 */
final class DeepCheckGate {
    private DeepCheckGate() {
    }

    /**
     * The caller does not want deep data for domains that resolve, and this one does.
     * Keyed on the DNS resolution, not on the liveness of the host.
     */
    static boolean skipBecauseResolved(@NotNull CheckRequest request, @NotNull LivenessInfo liveness) {
        return request.skipDeepChecksIfResolvable() && liveness.resolved();
    }

    /**
     * A minimum Trust Flow is configured and the domain's Trust Flow is below it.
     */
    static boolean skipBecauseLowAuthority(@NotNull CheckRequest request, @NotNull AuthorityData authority) {
        final var minAuthorityScore = request.minAuthorityScore();
        return minAuthorityScore != null && authority.trustFlow() < minAuthorityScore;
    }
}
