package cz.vut.fit.domaincheck.checker;

import cz.vut.fit.domaincheck.CheckerConfig;
import org.apache.commons.cli.DefaultParser;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class DomainCheckRunnerTest {

    private static int run(String... args) {
        var out = new ByteArrayOutputStream();
        var code = DomainCheckRunner.run(args, new PrintStream(out, true, StandardCharsets.UTF_8));
        assertEquals("", out.toString(StandardCharsets.UTF_8), "nothing should be printed to stdout");
        return code;
    }

    @Test
    void run_help() {
        assertEquals(DomainCheckRunner.EXIT_OK, run("-h"));
    }

    @Test
    void run_missingDomainIsUsageError() {
        assertEquals(DomainCheckRunner.EXIT_USAGE, run());
        assertEquals(DomainCheckRunner.EXIT_USAGE, run("--unknown-option"));
    }

    @Test
    void run_unreadablePropertiesFile() {
        assertEquals(DomainCheckRunner.EXIT_PROPERTIES,
                run("-d", "example.com", "-p", "/nonexistent/domain-check.properties"));
    }

    @Test
    void run_invalidMinTrustFlow() {
        assertEquals(DomainCheckRunner.EXIT_USAGE, run("-d", "example.com", "--min-trust-flow", "high"));
    }

    @Test
    void buildRequest_fromProperties() throws Exception {
        var properties = new Properties();
        properties.setProperty(CheckerConfig.AUTHORITY_KEY_CONFIG, "MAJESTIC");
        properties.setProperty(CheckerConfig.REGISTRATION_USER_CONFIG, "user");
        properties.setProperty(CheckerConfig.REGISTRATION_PASSWORD_CONFIG, "password");
        properties.setProperty(CheckerConfig.TRAFFIC_KEY_CONFIG, "SEMRUSH");
        properties.setProperty(CheckerConfig.TRAFFIC_DATABASE_CONFIG, "de");
        properties.setProperty(CheckerConfig.INDEX_PROXIES_CONFIG, "10.0.0.1:3128, 10.0.0.2:3128,");
        properties.setProperty(CheckerConfig.MIN_TRUST_FLOW_CONFIG, "10");

        var cmd = new DefaultParser().parse(DomainCheckRunner.makeOptions(),
                new String[]{"-d", "example.com", "--skip-if-resolvable"});
        var request = DomainCheckRunner.buildRequest(cmd, properties);

        assertEquals("example.com", request.domain());
        assertEquals("MAJESTIC", request.authorityKey());
        assertTrue(request.hasRegistrationCredential());
        assertEquals("SEMRUSH", request.trafficKey());
        assertEquals("de", request.trafficDatabase());
        assertTrue(request.skipDeepChecksIfResolvable());
        assertEquals(10, request.minAuthorityScore());
        assertEquals("www.google.com", request.indexSearchHost());
        assertEquals(List.of("10.0.0.1:3128", "10.0.0.2:3128"), request.proxyList());
    }

    @Test
    void buildRequest_commandLineOverridesProperties() throws Exception {
        var properties = new Properties();
        properties.setProperty(CheckerConfig.MIN_TRUST_FLOW_CONFIG, "10");

        var cmd = new DefaultParser().parse(DomainCheckRunner.makeOptions(),
                new String[]{"--domain", "example.com", "--min-trust-flow", "25"});
        var request = DomainCheckRunner.buildRequest(cmd, properties);

        assertEquals(25, request.minAuthorityScore());
        assertFalse(request.skipDeepChecksIfResolvable());
        assertFalse(request.hasAuthorityKey());
        assertEquals("us", request.trafficDatabase());
        assertTrue(request.proxyList().isEmpty());
    }
}
