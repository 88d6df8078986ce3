package io.codecarver.core.ledger;

import io.codecarver.core.protocol.Hex;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class InitCodeInterpreterTest {

    private final InitCodeInterpreter interpreter = new InitCodeInterpreter();

    @Test
    void returnsStoredWord() {
        // PUSH1 0x2a PUSH1 0 MSTORE PUSH1 0x20 PUSH1 0 RETURN
        byte[] out = interpreter.execute(Hex.parse("602a60005260206000f3"));
        assertEquals(32, out.length);
        assertEquals(0x2a, out[31]);
        for (int i = 0; i < 31; i++) {
            assertEquals(0, out[i]);
        }
    }

    @Test
    void storesSingleByte() {
        assertArrayEquals(new byte[] {(byte) 0xab}, interpreter.execute(Hex.parse("60ab60005360016000f3")));
    }

    @Test
    void msizeTracksWordAlignedMemory() {
        byte[] out = interpreter.execute(Hex.parse("60016000525960005260206000f3"));
        assertEquals(0x20, out[31]);
    }

    @Test
    void subtractionWrapsModulo256Bits() {
        byte[] out = interpreter.execute(Hex.parse("600160000360005260206000f3"));
        byte[] ones = new byte[32];
        Arrays.fill(ones, (byte) 0xff);
        assertArrayEquals(ones, out);
    }

    @Test
    void codeCopyPadsPastEndWithZeros() {
        byte[] out = interpreter.execute(Hex.parse("6004600060003960086000f3"));
        assertEquals("6004600000000000", Hex.toHex(out));
    }

    @Test
    void stopAndEmptyCodeReturnNothing() {
        assertEquals(0, interpreter.execute(new byte[0]).length);
        assertEquals(0, interpreter.execute(Hex.parse("00")).length);
        assertEquals(0, interpreter.execute(Hex.parse("602a50")).length);
    }

    @Test
    void revertAndInvalidFail() {
        assertThrows(PlacementException.class, () -> interpreter.execute(Hex.parse("60006000fd")));
        assertThrows(PlacementException.class, () -> interpreter.execute(Hex.parse("fe")));
    }

    @Test
    void unsupportedOpcodeFails() {
        // JUMP
        PlacementException e = assertThrows(PlacementException.class, () -> interpreter.execute(Hex.parse("600056")));
        assertTrue(e.getMessage().contains("0x56"));
    }

    @Test
    void stackFaultsFail() {
        assertThrows(PlacementException.class, () -> interpreter.execute(Hex.parse("01")));
        assertThrows(PlacementException.class, () -> interpreter.execute(Hex.parse("80")));
        assertThrows(PlacementException.class, () -> interpreter.execute(Hex.parse("600190")));
        byte[] overflow = new byte[InitCodeInterpreter.MAX_STACK + 1];
        Arrays.fill(overflow, (byte) 0x5f);
        assertThrows(PlacementException.class, () -> interpreter.execute(overflow));
    }

    @Test
    void memoryBeyondLimitFails() {
        assertThrows(PlacementException.class, () -> interpreter.execute(Hex.parse("60016301000000" + "52")));
    }
}
