package io.codecarver.core.config;

import io.codecarver.core.protocol.BootstrapPrefix;
import io.codecarver.core.protocol.HostRules;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Checks an effective configuration before the carver is put to work.
 */
public final class ConfigAudit {
    private static final Logger LOG = Logger.getLogger(ConfigAudit.class.getName());

    public enum Severity { INFO, WARNING, ERROR }

    public record Finding(Severity severity, String message) {
        @Override
        public String toString() {
            return severity + ": " + message;
        }
    }

    private ConfigAudit() {}

    /**
     * @param dataDir ledger directory, or {@code null} for an in-memory ledger
     */
    public static List<Finding> audit(CarverConfig config, Path dataDir) {
        List<Finding> findings = new ArrayList<>();
        if (config.engineAddress.isZero()) {
            findings.add(new Finding(Severity.ERROR, "Engine address is zero; every derivation would share it with unconfigured engines"));
        } else {
            findings.add(new Finding(Severity.INFO, "Engine address " + config.engineAddress.toChecksumHex()));
        }
        HostRules rules = config.hostRules;
        if (!rules.isDefault()) {
            findings.add(new Finding(Severity.INFO, "Non-default host rules: " + rules));
        }
        if (rules.maxCodeSize + BootstrapPrefix.LENGTH > rules.maxInitCodeSize) {
            findings.add(new Finding(Severity.ERROR, "maxInitCodeSize " + rules.maxInitCodeSize
                    + " cannot hold prefixed code of maxCodeSize " + rules.maxCodeSize));
        }
        if (dataDir == null) {
            findings.add(new Finding(Severity.WARNING, "In-memory ledger: carved code is lost on exit"));
        } else if (Files.exists(dataDir) && !Files.isWritable(dataDir)) {
            findings.add(new Finding(Severity.WARNING, "Data directory " + dataDir + " is not writable"));
        }
        for (Finding f : findings) {
            Level level = switch (f.severity()) {
                case ERROR -> Level.SEVERE;
                case WARNING -> Level.WARNING;
                case INFO -> Level.INFO;
            };
            LOG.log(level, f.message());
        }
        return findings;
    }

    public static boolean hasErrors(List<Finding> findings) {
        return findings.stream().anyMatch(f -> f.severity() == Severity.ERROR);
    }
}
