package io.codecarver.core.protocol;

/**
 * Initialization code that returns everything after itself as the code to store.
 *
 * <pre>
 * 60 0b   PUSH1 0x0b      [11]
 * 59      MSIZE           [0, 11]
 * 81      DUP2            [11, 0, 11]
 * 38      CODESIZE        [size, 11, 0, 11]
 * 03      SUB             [size-11, 0, 11]
 * 80      DUP1            [n, n, 0, 11]
 * 92      SWAP3           [11, n, 0, n]
 * 59      MSIZE           [0, 11, n, 0, n]
 * 39      CODECOPY        memory[0..n) = code[11..11+n)
 * f3      RETURN          return memory[0..n)
 * </pre>
 *
 * No storage writes, calls or value transfer, so the prefix contributes a fixed
 * quantity to every init code hash.
 */
public final class BootstrapPrefix {
    private static final byte[] PREFIX = {
            0x60, 0x0b, 0x59, (byte) 0x81, 0x38, 0x03, (byte) 0x80, (byte) 0x92, 0x59, 0x39, (byte) 0xf3
    };

    public static final int LENGTH = PREFIX.length;

    private BootstrapPrefix() {}

    public static byte[] bytes() {
        return PREFIX.clone();
    }

    /** Returns {@code prefix || runtimeCode}. */
    public static byte[] compose(byte[] runtimeCode) {
        if (runtimeCode == null) {
            throw new IllegalArgumentException("Runtime code required");
        }
        byte[] out = new byte[LENGTH + runtimeCode.length];
        System.arraycopy(PREFIX, 0, out, 0, LENGTH);
        System.arraycopy(runtimeCode, 0, out, LENGTH, runtimeCode.length);
        return out;
    }
}
