package io.codecarver.core.protocol;

/**
 * Limits imposed by the host ledger, not by the carving engine.
 * Defaults follow EIP-170 (code size), EIP-3860 (init code size) and EIP-3541 (0xEF marker).
 */
public final class HostRules {
    public static final int DEFAULT_RESERVED_FIRST_BYTE = 0xef;
    public static final int DEFAULT_MAX_CODE_SIZE = 24_576;
    public static final int DEFAULT_MAX_INIT_CODE_SIZE = 49_152;

    public final int reservedFirstByte;
    public final int maxCodeSize;
    public final int maxInitCodeSize;

    public HostRules(int reservedFirstByte, int maxCodeSize, int maxInitCodeSize) {
        if (reservedFirstByte < 0 || reservedFirstByte > 0xff) {
            throw new IllegalArgumentException("Reserved first byte must be in 0..255");
        }
        if (maxCodeSize <= 0 || maxInitCodeSize <= 0) {
            throw new IllegalArgumentException("Size limits must be positive");
        }
        this.reservedFirstByte = reservedFirstByte;
        this.maxCodeSize = maxCodeSize;
        this.maxInitCodeSize = maxInitCodeSize;
    }

    public static HostRules defaults() {
        return new HostRules(DEFAULT_RESERVED_FIRST_BYTE, DEFAULT_MAX_CODE_SIZE, DEFAULT_MAX_INIT_CODE_SIZE);
    }

    public boolean startsWithReservedByte(byte[] code) {
        return code != null && code.length > 0 && (code[0] & 0xff) == reservedFirstByte;
    }

    public boolean isDefault() {
        return reservedFirstByte == DEFAULT_RESERVED_FIRST_BYTE
                && maxCodeSize == DEFAULT_MAX_CODE_SIZE
                && maxInitCodeSize == DEFAULT_MAX_INIT_CODE_SIZE;
    }

    @Override
    public String toString() {
        return "HostRules(reservedFirstByte=0x" + Integer.toHexString(reservedFirstByte)
                + ", maxCodeSize=" + maxCodeSize + ", maxInitCodeSize=" + maxInitCodeSize + ")";
    }
}
