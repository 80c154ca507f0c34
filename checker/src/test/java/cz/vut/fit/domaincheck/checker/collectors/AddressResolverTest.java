package cz.vut.fit.domaincheck.checker.collectors;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class AddressResolverTest {

    private static HostLookup fakeLookup(Map<String, String> records, List<String> queried) {
        return hostName -> {
            queried.add(hostName);
            return CompletableFuture.completedFuture(records.get(hostName));
        };
    }

    @Test
    void resolve_bareName() throws Exception {
        var queried = new ArrayList<String>();
        var resolver = new AddressResolver(fakeLookup(Map.of("example.com", "93.184.216.34"), queried));

        var info = resolver.resolve("example.com").get(1, TimeUnit.SECONDS);

        assertTrue(info.resolved());
        assertFalse(info.usedWwwPrefix());
        assertEquals("93.184.216.34", info.ip());
        assertEquals(List.of("example.com"), queried);
    }

    @Test
    void resolve_fallsBackToWww() throws Exception {
        var queried = new ArrayList<String>();
        var resolver = new AddressResolver(fakeLookup(Map.of("www.example.com", "2001:db8::1"), queried));

        var info = resolver.resolve("example.com").get(1, TimeUnit.SECONDS);

        assertTrue(info.resolved());
        assertTrue(info.usedWwwPrefix());
        assertEquals("2001:db8::1", info.ip());
        assertEquals(List.of("example.com", "www.example.com"), queried);
    }

    @Test
    void resolve_unresolvedIsNotAnError() throws Exception {
        var resolver = new AddressResolver(fakeLookup(Map.of(), new ArrayList<>()));

        var info = resolver.resolve("example-test123.com").get(1, TimeUnit.SECONDS);

        assertFalse(info.resolved());
        assertFalse(info.usedWwwPrefix());
        assertNull(info.ip());
        assertEquals("example-test123.com", info.domain());
    }

    @Test
    void resolve_lookupErrorsCountAsNotResolved() throws Exception {
        HostLookup lookup = hostName -> {
            if (hostName.startsWith("www."))
                throw new IllegalStateException("resolver unavailable");
            return CompletableFuture.failedFuture(new IOException("SERVFAIL"));
        };
        var resolver = new AddressResolver(lookup);

        var info = resolver.resolve("example.com").get(1, TimeUnit.SECONDS);

        assertFalse(info.resolved());
    }
}
