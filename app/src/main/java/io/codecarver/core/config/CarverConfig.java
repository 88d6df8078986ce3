package io.codecarver.core.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.codecarver.core.protocol.CodeAddress;
import io.codecarver.core.protocol.Hex;
import io.codecarver.core.protocol.HostRules;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

/** Engine identity and host limits for a carver instance. */
public final class CarverConfig {
    private static final Logger LOG = Logger.getLogger(CarverConfig.class.getName());
    private static final ObjectMapper JSON = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /** Local development engine address. */
    public static final CodeAddress DEFAULT_ENGINE = CodeAddress.fromHex("0x5fbdb2315678afecb367f032d93f642f64180aa3");

    public final CodeAddress engineAddress;
    public final HostRules hostRules;

    public CarverConfig(CodeAddress engineAddress, HostRules hostRules) {
        if (engineAddress == null) {
            throw new IllegalArgumentException("Engine address required");
        }
        this.engineAddress = engineAddress;
        this.hostRules = hostRules == null ? HostRules.defaults() : hostRules;
    }

    public static CarverConfig defaultLocal() {
        return new CarverConfig(DEFAULT_ENGINE, HostRules.defaults());
    }

    public CarverConfig withEngine(CodeAddress engineAddress) {
        return new CarverConfig(engineAddress, this.hostRules);
    }

    public CarverConfig withHostRules(HostRules hostRules) {
        return new CarverConfig(this.engineAddress, hostRules);
    }

    /**
     * Reads a JSON config file. Missing fields keep their defaults; {@code anchor} takes
     * precedence over {@code engineAddress} when both are present.
     */
    public static CarverConfig load(Path path) {
        ConfigFile file;
        try {
            file = JSON.readValue(path.toFile(), ConfigFile.class);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read carver config from " + path, e);
        }
        try {
            return fromFile(file);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid carver config in " + path + ": " + e.getMessage(), e);
        }
    }

    /** Loads {@code path} if it exists, otherwise returns {@link #defaultLocal()}. */
    public static CarverConfig loadOrDefault(Path path) {
        if (path == null || !Files.exists(path)) {
            return defaultLocal();
        }
        LOG.info("Loading carver config from " + path);
        return load(path);
    }

    public void save(Path path) {
        ConfigFile file = new ConfigFile();
        file.engineAddress = engineAddress.hex();
        file.reservedFirstByte = hostRules.reservedFirstByte;
        file.maxCodeSize = hostRules.maxCodeSize;
        file.maxInitCodeSize = hostRules.maxInitCodeSize;
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            JSON.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), file);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to persist carver config to " + path, e);
        }
    }

    private static CarverConfig fromFile(ConfigFile file) {
        if (file == null) {
            return defaultLocal();
        }
        CodeAddress engine = DEFAULT_ENGINE;
        if (file.anchor != null) {
            CodeAddress factory = file.anchor.factory == null || file.anchor.factory.isBlank()
                    ? EngineAnchor.DEFAULT_FACTORY
                    : CodeAddress.fromHex(file.anchor.factory);
            byte[] salt = file.anchor.salt == null || file.anchor.salt.isBlank()
                    ? new byte[32]
                    : Hex.parse(file.anchor.salt);
            engine = new EngineAnchor(factory, salt, Hex.parse(file.anchor.initCodeHex)).engineAddress();
        } else if (file.engineAddress != null && !file.engineAddress.isBlank()) {
            engine = CodeAddress.fromHex(file.engineAddress);
        }
        HostRules rules = new HostRules(
                file.reservedFirstByte != null ? file.reservedFirstByte : HostRules.DEFAULT_RESERVED_FIRST_BYTE,
                file.maxCodeSize != null ? file.maxCodeSize : HostRules.DEFAULT_MAX_CODE_SIZE,
                file.maxInitCodeSize != null ? file.maxInitCodeSize : HostRules.DEFAULT_MAX_INIT_CODE_SIZE
        );
        return new CarverConfig(engine, rules);
    }

    @Override
    public String toString() {
        return "CarverConfig(engine=" + engineAddress + ", " + hostRules + ")";
    }

    public static class ConfigFile {
        public String engineAddress;
        public Integer reservedFirstByte;
        public Integer maxCodeSize;
        public Integer maxInitCodeSize;
        public AnchorFile anchor;
    }

    public static class AnchorFile {
        public String factory;
        public String salt;
        public String initCodeHex;
    }
}
