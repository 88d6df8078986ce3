package io.codecarver.core.ledger;

import io.codecarver.core.protocol.CodeAddress;

import java.util.function.Function;

/**
 * Create-once code store. Placements are committed in units: either every placement of a
 * unit persists or none does.
 *
 * Notes:
 * - Implementations serialize units; two units placing at the same address cannot both commit.
 * - Stored code is immutable and there is no delete.
 */
public interface PlacementLedger extends LedgerView {

    /**
     * Runs {@code work} against a staged view of this ledger. Placements made through the view
     * are committed when {@code work} returns and discarded when it throws; the exception is
     * rethrown unchanged.
     */
    <T> T atomically(Function<LedgerView, T> work);

    /** A single placement committed as its own unit. */
    @Override
    default CodeAddress place(CodeAddress deployer, byte[] salt, byte[] initCode) {
        return atomically(view -> view.place(deployer, salt, initCode));
    }

    /** Number of occupied addresses (debug/metrics). */
    long size();
}
