package io.codecarver.core.ledger;

import io.codecarver.core.protocol.CodeAddress;
import io.codecarver.core.protocol.HostRules;

import java.util.Map;
import java.util.function.Function;

/**
 * Unit-of-work plumbing shared by ledger backends. The ledger monitor is the
 * serialization point for units and their commits. Reads take no lock and see
 * committed state only, so backends must tolerate a read racing a commit.
 */
public abstract class AbstractPlacementLedger implements PlacementLedger {

    private final HostRules rules;
    private final InitCodeInterpreter interpreter;

    protected AbstractPlacementLedger(HostRules rules) {
        this.rules = rules == null ? HostRules.defaults() : rules;
        this.interpreter = new InitCodeInterpreter();
    }

    @Override
    public synchronized <T> T atomically(Function<LedgerView, T> work) {
        if (work == null) {
            throw new IllegalArgumentException("Work required");
        }
        StagedLedgerView view = new StagedLedgerView(this::loadCode, rules, interpreter);
        T result = work.apply(view);
        Map<CodeAddress, byte[]> staged = view.staged();
        if (!staged.isEmpty()) {
            commit(staged);
        }
        return result;
    }

    @Override
    public int sizeOf(CodeAddress address) {
        byte[] code = address == null ? null : loadCode(address);
        return code == null ? 0 : code.length;
    }

    @Override
    public byte[] readCode(CodeAddress address) {
        byte[] code = address == null ? null : loadCode(address);
        return code == null ? new byte[0] : code.clone();
    }

    @Override
    public boolean isOccupied(CodeAddress address) {
        return address != null && loadCode(address) != null;
    }

    /** Committed code at {@code address}, or {@code null} if unoccupied. Called without the monitor. */
    protected abstract byte[] loadCode(CodeAddress address);

    /** Persists every staged placement at once. Called with the ledger monitor held. */
    protected abstract void commit(Map<CodeAddress, byte[]> placements);
}
