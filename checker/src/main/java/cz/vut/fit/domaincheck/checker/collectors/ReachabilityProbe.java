package cz.vut.fit.domaincheck.checker.collectors;

import java.io.IOException;
import java.net.InetAddress;

/**
 * Tests whether a host answers on the network.
 */
@FunctionalInterface
public interface ReachabilityProbe {
    boolean isReachable(InetAddress address, int timeoutMs) throws IOException;

    /**
     * @return A probe backed by {@link InetAddress#isReachable(int)}, which uses ICMP echo requests where
     * the process is privileged to send them, and a TCP connection attempt to port 7 otherwise.
     */
    static ReachabilityProbe system() {
        return InetAddress::isReachable;
    }
}
