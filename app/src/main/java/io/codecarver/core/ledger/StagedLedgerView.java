package io.codecarver.core.ledger;

import io.codecarver.core.protocol.AddressDerivation;
import io.codecarver.core.protocol.CodeAddress;
import io.codecarver.core.protocol.HostRules;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Overlay used by {@link AbstractPlacementLedger#atomically}: reads fall through to committed
 * state, placements land in a private map that is only published on commit.
 */
final class StagedLedgerView implements LedgerView {

    private final Function<CodeAddress, byte[]> committed;
    private final HostRules rules;
    private final InitCodeInterpreter interpreter;
    private final Map<CodeAddress, byte[]> staged = new LinkedHashMap<>();

    StagedLedgerView(Function<CodeAddress, byte[]> committed, HostRules rules, InitCodeInterpreter interpreter) {
        this.committed = committed;
        this.rules = rules;
        this.interpreter = interpreter;
    }

    @Override
    public CodeAddress place(CodeAddress deployer, byte[] salt, byte[] initCode) {
        if (initCode == null) {
            throw new PlacementException("Init code required");
        }
        if (initCode.length > rules.maxInitCodeSize) {
            throw new PlacementException("Init code of " + initCode.length + " bytes exceeds limit " + rules.maxInitCodeSize);
        }
        CodeAddress target = AddressDerivation.create2(deployer, salt, initCode);
        if (isOccupied(target)) {
            throw new PlacementException("Address collision at " + target);
        }
        byte[] code = interpreter.execute(initCode);
        if (rules.startsWithReservedByte(code)) {
            throw new PlacementException("Returned code starts with reserved byte 0x" + Integer.toHexString(rules.reservedFirstByte));
        }
        if (code.length > rules.maxCodeSize) {
            throw new PlacementException("Returned code of " + code.length + " bytes exceeds limit " + rules.maxCodeSize);
        }
        staged.put(target, code);
        return target;
    }

    @Override
    public int sizeOf(CodeAddress address) {
        byte[] code = lookup(address);
        return code == null ? 0 : code.length;
    }

    @Override
    public byte[] readCode(CodeAddress address) {
        byte[] code = lookup(address);
        return code == null ? new byte[0] : code.clone();
    }

    @Override
    public boolean isOccupied(CodeAddress address) {
        return lookup(address) != null;
    }

    Map<CodeAddress, byte[]> staged() {
        return Collections.unmodifiableMap(staged);
    }

    private byte[] lookup(CodeAddress address) {
        if (address == null) {
            return null;
        }
        byte[] code = staged.get(address);
        return code != null ? code : committed.apply(address);
    }
}
