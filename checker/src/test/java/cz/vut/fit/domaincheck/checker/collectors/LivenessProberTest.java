package cz.vut.fit.domaincheck.checker.collectors;

import cz.vut.fit.domaincheck.models.dns.AddressInfo;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetAddress;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class LivenessProberTest {
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void probe_unresolvedIsNeverProbed() throws Exception {
        var prober = new LivenessProber((address, timeout) -> fail("must not probe"), 100, executor);

        var info = prober.probe(AddressInfo.unresolved("example.com", false)).get(1, TimeUnit.SECONDS);

        assertFalse(info.resolved());
        assertFalse(info.isAlive());
    }

    @Test
    void probe_reachable() throws Exception {
        var probed = new AtomicReference<InetAddress>();
        var prober = new LivenessProber((address, timeout) -> {
            probed.set(address);
            assertEquals(250, timeout);
            return true;
        }, 250, executor);

        var info = prober.probe(AddressInfo.resolved("example.com", true, "192.0.2.10"))
                .get(1, TimeUnit.SECONDS);

        assertTrue(info.isAlive());
        assertTrue(info.usedWwwPrefix());
        assertEquals("192.0.2.10", info.ip());
        assertEquals("192.0.2.10", probed.get().getHostAddress());
    }

    @Test
    void probe_unreachable() throws Exception {
        var prober = new LivenessProber((address, timeout) -> false, 100, executor);

        var info = prober.probe(AddressInfo.resolved("example.com", false, "192.0.2.10"))
                .get(1, TimeUnit.SECONDS);

        assertTrue(info.resolved());
        assertFalse(info.isAlive());
    }

    @Test
    void probe_errorsYieldNotAlive() throws Exception {
        var failing = new LivenessProber((address, timeout) -> {
            throw new IOException("Network is unreachable");
        }, 100, executor);
        var neverCalled = new LivenessProber((address, timeout) -> true, 100, executor);

        assertFalse(failing.probe(AddressInfo.resolved("example.com", false, "192.0.2.10"))
                .get(1, TimeUnit.SECONDS).isAlive());
        assertFalse(neverCalled.probe(AddressInfo.resolved("example.com", false, "not-an-ip"))
                .get(1, TimeUnit.SECONDS).isAlive());
    }
}
