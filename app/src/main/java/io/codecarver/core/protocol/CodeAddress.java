package io.codecarver.core.protocol;

import java.util.Arrays;

/**
 * A 20-byte code address: the handle under which a ledger stores an artifact.
 */
public final class CodeAddress {
    public static final int LENGTH = 20;
    public static final CodeAddress ZERO = new CodeAddress(new byte[LENGTH]);

    private final byte[] bytes;

    public CodeAddress(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("Address must be 20 bytes");
        }
        this.bytes = bytes.clone();
    }

    public static CodeAddress fromHex(String hex) {
        if (hex == null) {
            throw new IllegalArgumentException("Address required");
        }
        String trimmed = hex.trim();
        String digits = trimmed.startsWith("0x") || trimmed.startsWith("0X") ? trimmed.substring(2) : trimmed;
        if (digits.length() != LENGTH * 2) {
            throw new IllegalArgumentException("Address must be 40 hex digits: " + hex);
        }
        return new CodeAddress(Hex.parse(digits));
    }

    /** Takes the low-order 20 bytes of a 32-byte word. */
    public static CodeAddress fromWord(byte[] word) {
        if (word == null || word.length != Hashes.KECCAK_256_LENGTH) {
            throw new IllegalArgumentException("Word must be 32 bytes");
        }
        return new CodeAddress(Arrays.copyOfRange(word, word.length - LENGTH, word.length));
    }

    public byte[] bytes() { return bytes.clone(); }

    public boolean isZero() {
        for (byte b : bytes) {
            if (b != 0) return false;
        }
        return true;
    }

    public String hex() { return Hex.toPrefixedHex(bytes); }

    /** EIP-55 mixed-case rendering. */
    public String toChecksumHex() {
        String lower = Hex.toHex(bytes);
        String hash = Hex.toHex(Hashes.keccak256(lower.getBytes(java.nio.charset.StandardCharsets.US_ASCII)));
        StringBuilder sb = new StringBuilder("0x");
        for (int i = 0; i < lower.length(); i++) {
            char c = lower.charAt(i);
            if (Character.isLetter(c) && Character.digit(hash.charAt(i), 16) >= 8) {
                sb.append(Character.toUpperCase(c));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    @Override public boolean equals(Object o){ return o instanceof CodeAddress && Arrays.equals(bytes, ((CodeAddress)o).bytes); }
    @Override public int hashCode(){ return Arrays.hashCode(bytes); }
    @Override public String toString(){ return hex(); }
}
