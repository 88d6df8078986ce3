package io.codecarver.core.protocol;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CodeAddressTest {

    @Test
    void parsesWithAndWithoutPrefix() {
        CodeAddress a = CodeAddress.fromHex("0x5fbdb2315678afecb367f032d93f642f64180aa3");
        CodeAddress b = CodeAddress.fromHex("5FBDB2315678AFECB367F032D93F642F64180AA3");
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertEquals("0x5fbdb2315678afecb367f032d93f642f64180aa3", a.hex());
    }

    @Test
    void rendersEip55Checksum() {
        assertEquals("0x5FbDB2315678afecb367f032d93F642f64180aa3",
                CodeAddress.fromHex("0x5fbdb2315678afecb367f032d93f642f64180aa3").toChecksumHex());
        assertEquals("0x1948446719E5292888e2f8a66f4d71a340E86F3a",
                CodeAddress.fromHex("0x1948446719e5292888e2f8a66f4d71a340e86f3a").toChecksumHex());
    }

    @Test
    void rejectsWrongLengths() {
        assertThrows(IllegalArgumentException.class, () -> new CodeAddress(new byte[19]));
        assertThrows(IllegalArgumentException.class, () -> CodeAddress.fromHex("0x1234"));
        assertThrows(IllegalArgumentException.class, () -> CodeAddress.fromHex("zz" + "00".repeat(19)));
        assertThrows(IllegalArgumentException.class, () -> CodeAddress.fromWord(new byte[20]));
    }

    @Test
    void wordKeepsLowOrderBytes() {
        byte[] word = new byte[32];
        for (int i = 0; i < word.length; i++) {
            word[i] = (byte) i;
        }
        byte[] expected = new byte[20];
        for (int i = 0; i < expected.length; i++) {
            expected[i] = (byte) (i + 12);
        }
        assertArrayEquals(expected, CodeAddress.fromWord(word).bytes());
    }

    @Test
    void zeroIsZero() {
        assertTrue(CodeAddress.ZERO.isZero());
        assertFalse(CodeAddress.fromHex("0x0000000000000000000000000000000000000001").isZero());
    }

    @Test
    void bytesAreDefensivelyCopied() {
        byte[] raw = new byte[20];
        CodeAddress address = new CodeAddress(raw);
        raw[0] = 1;
        address.bytes()[1] = 1;
        assertTrue(address.isZero());
    }
}
