package io.codecarver.core.protocol;

/**
 * Content-derived code addresses.
 *
 * <p>{@code address = keccak256(0xff || deployer || salt || keccak256(initCode))[12..32]}.
 * Carved code always uses {@link #zeroSalt() the zero salt} and the {@link BootstrapPrefix}, so the only
 * variable input is the runtime code itself.
 */
public final class AddressDerivation {
    public static final int SALT_LENGTH = 32;
    private static final byte[] ZERO_SALT_BYTES = new byte[SALT_LENGTH];
    private static final byte[] MARKER = {(byte) 0xff};

    private AddressDerivation() {}

    public static byte[] zeroSalt() {
        return ZERO_SALT_BYTES.clone();
    }

    public static CodeAddress create2(CodeAddress deployer, byte[] salt, byte[] initCode) {
        if (deployer == null) {
            throw new IllegalArgumentException("Deployer address required");
        }
        if (salt == null || salt.length != SALT_LENGTH) {
            throw new IllegalArgumentException("Salt must be 32 bytes");
        }
        if (initCode == null) {
            throw new IllegalArgumentException("Init code required");
        }
        return create2WithHash(deployer, salt, Hashes.keccak256(initCode));
    }

    public static CodeAddress create2WithHash(CodeAddress deployer, byte[] salt, byte[] initCodeHash) {
        if (initCodeHash == null || initCodeHash.length != Hashes.KECCAK_256_LENGTH) {
            throw new IllegalArgumentException("Init code hash must be 32 bytes");
        }
        byte[] word = Hashes.keccak256(MARKER, deployer.bytes(), salt, initCodeHash);
        return CodeAddress.fromWord(word);
    }

    /** Address at which {@code engine} carves {@code runtimeCode}. Defined for empty code. */
    public static CodeAddress addressOf(CodeAddress engine, byte[] runtimeCode) {
        return create2(engine, ZERO_SALT_BYTES, BootstrapPrefix.compose(runtimeCode));
    }
}
