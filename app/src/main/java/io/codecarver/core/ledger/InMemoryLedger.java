package io.codecarver.core.ledger;

import io.codecarver.core.protocol.CodeAddress;
import io.codecarver.core.protocol.HostRules;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory ledger. Not persistent; resets every process run.
 */
public final class InMemoryLedger extends AbstractPlacementLedger {

    private final Map<CodeAddress, byte[]> code = new ConcurrentHashMap<>();

    public InMemoryLedger() {
        this(HostRules.defaults());
    }

    public InMemoryLedger(HostRules rules) {
        super(rules);
    }

    @Override
    protected byte[] loadCode(CodeAddress address) {
        return code.get(address);
    }

    @Override
    protected void commit(Map<CodeAddress, byte[]> placements) {
        for (Map.Entry<CodeAddress, byte[]> e : placements.entrySet()) {
            code.put(e.getKey(), e.getValue().clone());
        }
    }

    @Override
    public long size() {
        return code.size();
    }
}
