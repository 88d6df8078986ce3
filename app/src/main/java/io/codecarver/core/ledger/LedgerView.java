package io.codecarver.core.ledger;

import io.codecarver.core.protocol.CodeAddress;

/**
 * Read/place operations of a code ledger.
 */
public interface LedgerView {

    /**
     * Runs {@code initCode} and stores whatever it returns at
     * {@code create2(deployer, salt, initCode)}.
     *
     * @return the address the code was stored at
     * @throws PlacementException if the address is occupied or a host rule is broken
     */
    CodeAddress place(CodeAddress deployer, byte[] salt, byte[] initCode);

    /** Byte length of the code stored at {@code address}, 0 if unoccupied. */
    int sizeOf(CodeAddress address);

    /** Code stored at {@code address}, empty if unoccupied. */
    byte[] readCode(CodeAddress address);

    /** True once anything, even empty code, was placed at {@code address}. */
    boolean isOccupied(CodeAddress address);
}
