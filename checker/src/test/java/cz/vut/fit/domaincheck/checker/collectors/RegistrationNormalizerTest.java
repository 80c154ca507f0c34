package cz.vut.fit.domaincheck.checker.collectors;

import com.fasterxml.jackson.databind.ObjectMapper;
import cz.vut.fit.domaincheck.Common;
import cz.vut.fit.domaincheck.models.Flag;
import cz.vut.fit.domaincheck.models.providers.RegistrationData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class RegistrationNormalizerTest {
    private final ObjectMapper mapper = Common.makeMapper().build();
    private RegistrationNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new RegistrationNormalizer(Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC));
    }

    private RegistrationData normalize(String json) throws Exception {
        return normalizer.normalize(mapper.readTree(json));
    }

    @Test
    void normalize_registeredDomain() throws Exception {
        var data = normalize("""
                {"WhoisRecord": {
                  "domainName": "example.com",
                  "createdDate": "2010-01-01T00:00:00Z",
                  "expiresDate": "2024-04-01T00:00:00Z",
                  "estimatedDomainAge": 5113,
                  "registryData": {"status": "clientTransferProhibited pendingDelete"}
                }}""");

        assertEquals(Flag.TRUE, data.isValidDomain());
        assertEquals(Flag.FALSE, data.missingData());
        assertEquals("clientTransferProhibited pendingDelete", data.status());
        assertEquals(Flag.TRUE, data.isPendingDelete());
        assertEquals(Flag.FALSE, data.isRedemptionPeriod());
        assertEquals("2010-01-01T00:00:00Z", data.createdDate());
        assertEquals("2024-04-01T00:00:00Z", data.expiresDate());
        assertEquals("in 3 months", data.expiredWaitingTime());
        assertEquals("14.01", data.estimatedDomainAge());
        assertEquals("example.com", data.raw().path("WhoisRecord").path("domainName").asText());
    }

    @Test
    void normalize_invalidDomain() throws Exception {
        var data = normalize("""
                {"ErrorMessage": {"errorCode": "WHOIS_01",
                  "msg": "Unable to retrieve whois record for invalid..domain"}}""");

        assertEquals(Flag.FALSE, data.isValidDomain());
        assertEquals(Flag.FALSE, data.missingData());
        assertEquals("no-data", data.status());
        assertEquals(Flag.NO_DATA, data.isPendingDelete());
        assertEquals(Flag.NO_DATA, data.isRedemptionPeriod());
        assertEquals("no-data", data.createdDate());
        assertEquals("no-data", data.expiresDate());
        assertEquals("no-data", data.expiredWaitingTime());
        assertEquals("no-data", data.estimatedDomainAge());
    }

    @Test
    void normalize_otherErrorKeepsDomainValid() throws Exception {
        var data = normalize("{\"ErrorMessage\": {\"msg\": \"Rate limit exceeded\"}}");

        assertEquals(Flag.TRUE, data.isValidDomain());
    }

    @Test
    void normalize_missingWhoisData() throws Exception {
        var data = normalize("{\"WhoisRecord\": {\"dataError\": \"MISSING_WHOIS_DATA\"}}");

        assertEquals(Flag.TRUE, data.missingData());
        assertFalse(data.hasStatus());
    }

    @Test
    void normalize_statusList() throws Exception {
        var data = normalize("""
                {"WhoisRecord": {"registryData": {"status": ["redemptionPeriod", "serverHold"]},
                  "expiresDate": "2019-01-01"}}""");

        assertEquals("redemptionPeriod serverHold", data.status());
        assertEquals(Flag.FALSE, data.isPendingDelete());
        assertEquals(Flag.TRUE, data.isRedemptionPeriod());
        assertEquals("5 years ago", data.expiredWaitingTime());
    }

    @Test
    void normalize_availableDomain() throws Exception {
        var data = normalize("{\"WhoisRecord\": {\"registryData\": {\"status\": \"AVAILABLE\"}}}");

        assertEquals("AVAILABLE", data.status());
        assertEquals(Flag.FALSE, data.isPendingDelete());
    }

    @Test
    void normalize_unparseableExpirationAndZeroAge() throws Exception {
        var data = normalize("""
                {"WhoisRecord": {"expiresDate": "sometime next year", "estimatedDomainAge": 0}}""");

        assertEquals("sometime next year", data.expiresDate());
        assertEquals("no-data", data.expiredWaitingTime());
        assertEquals("no-data", data.estimatedDomainAge());
    }
}
