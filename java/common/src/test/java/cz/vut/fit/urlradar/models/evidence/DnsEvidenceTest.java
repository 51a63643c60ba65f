package cz.vut.fit.urlradar.models.evidence;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DnsEvidenceTest {

    @Test
    void fullyHealthyDomain() {
        var dns = DnsEvidence.of(List.of("93.184.216.34"), List.of(), List.of("10 mx.example.com."),
                List.of("ns1.example.com."), List.of("\"v=spf1 -all\""), List.of(),
                List.of("\"v=DMARC1; p=reject; rua=mailto:a@example.com\""));

        assertTrue(dns.spfPresent());
        assertTrue(dns.dmarcPresent());
        assertEquals("reject", dns.dmarcPolicy());
        assertEquals(100, dns.healthScore());
    }

    @Test
    void missingEverything() {
        var dns = DnsEvidence.of(List.of(), List.of(), List.of(), List.of(), List.of(), List.of(), List.of());

        assertFalse(dns.spfPresent());
        assertFalse(dns.dmarcPresent());
        assertNull(dns.dmarcPolicy());
        assertEquals(0, dns.healthScore());
    }

    @Test
    void ipv6OnlyCountsAsAddress() {
        var dns = DnsEvidence.of(List.of(), List.of("2001:db8::1"), List.of(), List.of(), List.of(), List.of(),
                List.of());

        assertEquals(40, dns.healthScore());
    }
}
