package io.codecarver.core.protocol;

import org.bouncycastle.crypto.digests.KeccakDigest;

public final class Hashes {
    public static final int KECCAK_256_LENGTH = 32;

    private Hashes(){}

    /** Keccak-256 with the original Keccak padding (not FIPS-202 SHA3-256). */
    public static byte[] keccak256(byte[] in){
        if (in == null) {
            throw new IllegalArgumentException("Hash input required");
        }
        KeccakDigest digest = new KeccakDigest(256);
        digest.update(in, 0, in.length);
        byte[] out = new byte[KECCAK_256_LENGTH];
        digest.doFinal(out, 0);
        return out;
    }

    public static byte[] keccak256(byte[]... parts){
        KeccakDigest digest = new KeccakDigest(256);
        if (parts == null) {
            throw new IllegalArgumentException("Hash input required");
        }
        for (byte[] part : parts) {
            if (part == null) {
                throw new IllegalArgumentException("Hash input required");
            }
            digest.update(part, 0, part.length);
        }
        byte[] out = new byte[KECCAK_256_LENGTH];
        digest.doFinal(out, 0);
        return out;
    }
}
