package cz.vut.fit.domaincheck.checker.collectors;

import com.google.common.net.InetAddresses;
import cz.vut.fit.domaincheck.Common;
import cz.vut.fit.domaincheck.checker.CompletableFutures;
import cz.vut.fit.domaincheck.models.dns.AddressInfo;
import cz.vut.fit.domaincheck.models.dns.LivenessInfo;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Probes whether a resolved address is reachable. Unresolved addresses are never probed.
 */
public class LivenessProber {
    public static final String NAME = "ping";
    public static final String COMPONENT_NAME = "prober-" + NAME;
    private static final org.slf4j.Logger Logger = Common.getComponentLogger(LivenessProber.class);

    private final ReachabilityProbe _probe;
    private final int _timeoutMs;
    private final ExecutorService _executor;

    public LivenessProber(@NotNull ReachabilityProbe probe, int timeoutMs, @NotNull ExecutorService executor) {
        _probe = probe;
        _timeoutMs = timeoutMs;
        _executor = executor;
    }

    /**
     * Probes the address.
     *
     * @param address The resolution outcome.
     * @return A future that always completes normally; {@code isAlive} is false if the address was not
     * resolved or the probe failed.
     */
    public CompletableFuture<LivenessInfo> probe(@NotNull AddressInfo address) {
        if (!address.resolved() || address.ip() == null) {
            return CompletableFuture.completedFuture(LivenessInfo.of(address, false));
        }

        return CompletableFutures.supplyCancellable(() -> LivenessInfo.of(address, isReachable(address)),
                _executor);
    }

    private boolean isReachable(AddressInfo address) {
        try {
            final var inetAddress = InetAddresses.forString(address.ip());
            final var reachable = _probe.isReachable(inetAddress, _timeoutMs);
            Logger.trace("{}: {} reachable: {}", address.domain(), address.ip(), reachable);
            return reachable;
        } catch (IllegalArgumentException e) {
            Logger.debug("{}: invalid address {}", address.domain(), address.ip());
            return false;
        } catch (IOException e) {
            Logger.debug("{}: probing {} failed: {}", address.domain(), address.ip(), e.toString());
            return false;
        }
    }
}
