package io.codecarver.core.protocol;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AddressDerivationTest {

    static final CodeAddress ENGINE = CodeAddress.fromHex("0x5fbdb2315678afecb367f032d93f642f64180aa3");
    static final byte[] RETURN_42_CODE = Hex.parse("0x602a60005260206000f3");

    @Test
    void create2MatchesEip1014Vectors() {
        assertEquals(CodeAddress.fromHex("0x4d1a2e2bb4f88f0250f26ffff098b0b30b26bf38"),
                AddressDerivation.create2(CodeAddress.ZERO, new byte[32], Hex.parse("00")));
        assertEquals(CodeAddress.fromHex("0xd04116cdd17bebe565eb2422f2497e06cc1c9833"),
                AddressDerivation.create2(
                        CodeAddress.fromHex("0xdeadbeef00000000000000000000000000000000"),
                        Hex.parse("000000000000000000000000feed000000000000000000000000000000000000"),
                        Hex.parse("00")));
        assertEquals(CodeAddress.fromHex("0x60f3f640a8508fc6a86d45df051962668e1e8ac7"),
                AddressDerivation.create2(
                        CodeAddress.fromHex("0x00000000000000000000000000000000deadbeef"),
                        Hex.parse("00000000000000000000000000000000000000000000000000000000cafebabe"),
                        Hex.parse("deadbeef")));
    }

    @Test
    void addressOfPrefixesRuntimeCodeAndUsesZeroSalt() {
        CodeAddress expected = CodeAddress.fromHex("0x1948446719e5292888e2f8a66f4d71a340e86f3a");
        assertEquals(expected, AddressDerivation.addressOf(ENGINE, RETURN_42_CODE));
        assertEquals(expected, AddressDerivation.create2(ENGINE, new byte[32], BootstrapPrefix.compose(RETURN_42_CODE)));
    }

    @Test
    void addressOfIsDefinedForEmptyCode() {
        assertEquals(CodeAddress.fromHex("0x6bc72233d9386e3148fdca1796efd8bd13ab4daa"),
                AddressDerivation.addressOf(ENGINE, new byte[0]));
    }

    @Test
    void engineIdentityChangesEveryAddress() {
        assertEquals(CodeAddress.fromHex("0x0c420e28b39aea220288dd6aa974fb22f09bcaae"),
                AddressDerivation.addressOf(CodeAddress.ZERO, RETURN_42_CODE));
        assertNotEquals(AddressDerivation.addressOf(CodeAddress.ZERO, RETURN_42_CODE),
                AddressDerivation.addressOf(ENGINE, RETURN_42_CODE));
    }

    @Test
    void rejectsMalformedInputs() {
        assertThrows(IllegalArgumentException.class, () -> AddressDerivation.create2(ENGINE, new byte[31], new byte[0]));
        assertThrows(IllegalArgumentException.class, () -> AddressDerivation.create2(null, new byte[32], new byte[0]));
        assertThrows(IllegalArgumentException.class, () -> AddressDerivation.create2WithHash(ENGINE, new byte[32], new byte[20]));
    }

    @Test
    void zeroSaltIsACopy() {
        byte[] salt = AddressDerivation.zeroSalt();
        salt[0] = 1;
        assertEquals(0, AddressDerivation.zeroSalt()[0]);
    }
}
