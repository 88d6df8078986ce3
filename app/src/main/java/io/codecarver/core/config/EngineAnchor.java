package io.codecarver.core.config;

import io.codecarver.core.protocol.AddressDerivation;
import io.codecarver.core.protocol.CodeAddress;

/**
 * Derives the engine's own address the way a deterministic deployment factory places it,
 * so independent ledgers that deploy the engine through the same factory agree on it.
 */
public final class EngineAnchor {
    /** Widely deployed deterministic deployment proxy. */
    public static final CodeAddress DEFAULT_FACTORY = CodeAddress.fromHex("0x4e59b44847b379578588920ca78fbf26c0b4956c");

    public final CodeAddress factory;
    private final byte[] salt;
    private final byte[] engineInitCode;

    public EngineAnchor(CodeAddress factory, byte[] salt, byte[] engineInitCode) {
        if (factory == null) {
            throw new IllegalArgumentException("Factory address required");
        }
        if (salt == null || salt.length != AddressDerivation.SALT_LENGTH) {
            throw new IllegalArgumentException("Anchor salt must be 32 bytes");
        }
        if (engineInitCode == null || engineInitCode.length == 0) {
            throw new IllegalArgumentException("Engine init code required");
        }
        this.factory = factory;
        this.salt = salt.clone();
        this.engineInitCode = engineInitCode.clone();
    }

    public byte[] salt() { return salt.clone(); }

    public CodeAddress engineAddress() {
        return AddressDerivation.create2(factory, salt, engineInitCode);
    }
}
