package cz.vut.fit.urlradar.engine.risk;

import cz.vut.fit.urlradar.engine.config.ConfigSnapshot;
import cz.vut.fit.urlradar.models.ReachabilityStatus;
import cz.vut.fit.urlradar.models.RiskLevel;
import cz.vut.fit.urlradar.models.ml.CalibratedVerdict;
import cz.vut.fit.urlradar.models.policy.PolicyDecision;
import cz.vut.fit.urlradar.models.results.RiskSource;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RiskBandMapperTest {
    private final RiskBandMapper mapper = new RiskBandMapper();
    private final ConfigSnapshot config = ConfigSnapshot.defaults();

    private static CalibratedVerdict verdict(double p) {
        return new CalibratedVerdict(p, Math.max(0, p - 0.05), Math.min(1, p + 0.05), 0.9, 0.1,
                "split-conformal", List.of());
    }

    @ParameterizedTest
    @CsvSource({
            "0.0, ONLINE, A",
            "0.149, ONLINE, A",
            "0.15, ONLINE, B",
            "0.45, ONLINE, C",
            "0.6, ONLINE, D",
            "0.8, ONLINE, E",
            "0.9, ONLINE, F",
            "0.25, PARKED, A",
            "0.45, PARKED, B",
            "0.72, OFFLINE, E",
            "0.10, SINKHOLE, B",
            "0.70, SINKHOLE, F",
    })
    void mapsThroughBranchThresholds(double probability, ReachabilityStatus branch, RiskLevel expected) {
        assertEquals(expected, mapper.map(probability, branch, config));
    }

    @Test
    void mappingIsMonotonic() {
        for (var branch : ReachabilityStatus.values()) {
            var previous = RiskLevel.A;
            for (int i = 0; i <= 100; i++) {
                var level = mapper.map(i / 100.0, branch, config);
                assertFalse(previous.isMoreSevereThan(level), branch + " at " + i);
                previous = level;
            }
        }
    }

    @Test
    void policyOverrideIsUsedVerbatim() {
        var outcome = mapper.resolve(PolicyDecision.override("DUAL_TIER1_HITS", RiskLevel.F, "two sources"),
                verdict(0.01), ReachabilityStatus.ONLINE, config);

        assertEquals(RiskLevel.F, outcome.level());
        assertEquals(RiskSource.POLICY, outcome.source());
    }

    @Test
    void calibratedWithoutOverride() {
        var outcome = mapper.resolve(PolicyDecision.none(), verdict(0.55), ReachabilityStatus.ONLINE, config);

        assertEquals(RiskLevel.D, outcome.level());
        assertEquals(RiskSource.CALIBRATED, outcome.source());
    }

    @Test
    void verdictRequiredWithoutOverride() {
        assertThrows(IllegalArgumentException.class,
                () -> mapper.resolve(PolicyDecision.none(), null, ReachabilityStatus.ONLINE, config));
    }

    @Test
    void thresholdsMustAscend() {
        assertThrows(IllegalArgumentException.class, () -> new BranchThresholds(0.2, 0.1, 0.5, 0.7, 0.9));
        assertThrows(IllegalArgumentException.class, () -> BranchThresholds.parse("0.1,0.2,x,0.4,0.5"));
        assertEquals(new BranchThresholds(0.1, 0.2, 0.3, 0.4, 0.5), BranchThresholds.parse("0.1, 0.2, 0.3, 0.4, 0.5"));
    }
}
