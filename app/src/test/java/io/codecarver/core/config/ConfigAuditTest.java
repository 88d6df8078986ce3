package io.codecarver.core.config;

import io.codecarver.core.protocol.CodeAddress;
import io.codecarver.core.protocol.HostRules;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfigAuditTest {

    @TempDir
    Path tempDir;

    @Test
    void defaultConfigOnDiskHasNoErrors() {
        List<ConfigAudit.Finding> findings = ConfigAudit.audit(CarverConfig.defaultLocal(), tempDir);
        assertFalse(ConfigAudit.hasErrors(findings));
        assertTrue(findings.stream().anyMatch(f -> f.message().contains(CarverConfig.DEFAULT_ENGINE.toChecksumHex())));
        assertTrue(findings.stream().noneMatch(f -> f.severity() == ConfigAudit.Severity.WARNING));
    }

    @Test
    void zeroEngineIsAnError() {
        List<ConfigAudit.Finding> findings = ConfigAudit.audit(CarverConfig.defaultLocal().withEngine(CodeAddress.ZERO), tempDir);
        assertTrue(ConfigAudit.hasErrors(findings));
    }

    @Test
    void initCodeLimitMustHoldPrefixedCode() {
        CarverConfig config = CarverConfig.defaultLocal().withHostRules(new HostRules(0xef, 100, 110));
        List<ConfigAudit.Finding> findings = ConfigAudit.audit(config, tempDir);
        assertTrue(ConfigAudit.hasErrors(findings));
        assertTrue(findings.stream().anyMatch(f -> f.message().startsWith("Non-default host rules")));

        CarverConfig roomy = CarverConfig.defaultLocal().withHostRules(new HostRules(0xef, 100, 111));
        assertFalse(ConfigAudit.hasErrors(ConfigAudit.audit(roomy, tempDir)));
    }

    @Test
    void inMemoryLedgerIsAWarning() {
        List<ConfigAudit.Finding> findings = ConfigAudit.audit(CarverConfig.defaultLocal(), null);
        assertFalse(ConfigAudit.hasErrors(findings));
        assertTrue(findings.stream().anyMatch(f -> f.severity() == ConfigAudit.Severity.WARNING));
    }
}
