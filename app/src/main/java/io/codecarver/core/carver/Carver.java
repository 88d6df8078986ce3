package io.codecarver.core.carver;

import io.codecarver.core.config.CarverConfig;
import io.codecarver.core.ledger.LedgerView;
import io.codecarver.core.ledger.PlacementException;
import io.codecarver.core.ledger.PlacementLedger;
import io.codecarver.core.metrics.CarveMetrics;
import io.codecarver.core.protocol.AddressDerivation;
import io.codecarver.core.protocol.BootstrapPrefix;
import io.codecarver.core.protocol.CodeAddress;
import io.codecarver.core.protocol.HostRules;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Stores runtime code at an address derived only from the code itself.
 *
 * <p>The carver keeps no mutable state. The engine address and host rules are fixed at
 * construction; everything persistent lives in the {@link PlacementLedger}.
 *
 * <ul>
 *   <li>{@link #addressOf(byte[])} predicts the address of any code, empty code included.</li>
 *   <li>{@link #carve(byte[])} places code once; repeating it for the same bytes collides.</li>
 *   <li>{@link #isCarved(CodeAddress)} checks that stored code re-derives to its address.</li>
 * </ul>
 */
public final class Carver {
    private static final Logger LOG = Logger.getLogger(Carver.class.getName());

    private final PlacementLedger ledger;
    private final CodeAddress engine;
    private final HostRules rules;

    public Carver(PlacementLedger ledger, CodeAddress engine, HostRules rules) {
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.rules = rules == null ? HostRules.defaults() : rules;
    }

    public Carver(PlacementLedger ledger, CarverConfig config) {
        this(ledger, config.engineAddress, config.hostRules);
    }

    public PlacementLedger ledger() { return ledger; }

    /** Address {@code runtimeCode} is (or would be) carved at. Pure, total. */
    public CodeAddress addressOf(byte[] runtimeCode) {
        return AddressDerivation.addressOf(engine, runtimeCode == null ? new byte[0] : runtimeCode);
    }

    /**
     * Places {@code runtimeCode} behind the bootstrap prefix and checks the result.
     *
     * @return the address, always equal to {@link #addressOf(byte[])} for the same bytes
     * @throws DeploymentFailedException for empty or reserved-byte input, oversize input,
     *         an occupied address, a stored size that differs from the input, or any
     *         other ledger fault
     */
    public CodeAddress carve(byte[] runtimeCode) {
        if (runtimeCode == null || runtimeCode.length == 0) {
            throw fail("empty", "Runtime code must not be empty");
        }
        if (rules.startsWithReservedByte(runtimeCode)) {
            throw fail("reserved_byte", "Runtime code starts with reserved byte 0x" + Integer.toHexString(rules.reservedFirstByte));
        }
        if (runtimeCode.length > rules.maxCodeSize) {
            throw fail("too_large", "Runtime code of " + runtimeCode.length + " bytes exceeds limit " + rules.maxCodeSize);
        }
        byte[] code = runtimeCode.clone();
        CodeAddress expected = addressOf(code);
        byte[] initCode = BootstrapPrefix.compose(code);
        try {
            CodeAddress carved = CarveMetrics.recordCarve(() -> ledger.atomically(view -> placeAndCheck(view, initCode, code.length, expected)));
            CarveMetrics.recordSuccess(code.length);
            LOG.info(() -> "Carved " + code.length + " bytes at " + carved);
            return carved;
        } catch (DeploymentFailedException e) {
            throw e;
        } catch (PlacementException e) {
            LOG.log(Level.FINE, "Placement refused for " + expected, e);
            throw fail("placement_refused", "Placement at " + expected + " refused: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Ledger failed while carving " + expected, e);
            throw fail("anomaly", "Ledger failed at " + expected + ": " + e.getMessage(), e);
        }
    }

    // Runs inside the ledger unit: throwing here discards the placement.
    private CodeAddress placeAndCheck(LedgerView view, byte[] initCode, int expectedSize, CodeAddress expected) {
        CodeAddress carved = view.place(engine, AddressDerivation.zeroSalt(), initCode);
        if (carved == null || carved.isZero()) {
            throw fail("anomaly", "Ledger returned no address");
        }
        if (!carved.equals(expected)) {
            throw fail("anomaly", "Ledger placed at " + carved + " but " + expected + " was derived");
        }
        int size = view.sizeOf(carved);
        if (size == 0) {
            throw fail("anomaly", "Nothing stored at " + carved);
        }
        if (size != expectedSize) {
            throw fail("anomaly", "Stored " + size + " bytes at " + carved + ", expected " + expectedSize);
        }
        return carved;
    }

    /**
     * True iff the code currently stored at {@code address} re-derives to {@code address}.
     * An unoccupied address is checked as if it held empty code.
     */
    public boolean isCarved(CodeAddress address) {
        if (address == null) {
            return false;
        }
        byte[] observed = ledger.readCode(address);
        boolean carved = addressOf(observed).equals(address);
        CarveMetrics.recordVerification(carved);
        return carved;
    }

    /** Stored code at {@code address}, present only when {@link #isCarved(CodeAddress)} holds. */
    public Optional<byte[]> readCarved(CodeAddress address) {
        if (address == null) {
            return Optional.empty();
        }
        byte[] observed = ledger.readCode(address);
        if (!addressOf(observed).equals(address)) {
            return Optional.empty();
        }
        return Optional.of(Arrays.copyOf(observed, observed.length));
    }

    private static DeploymentFailedException fail(String reason, String message) {
        return fail(reason, message, null);
    }

    private static DeploymentFailedException fail(String reason, String message, Throwable cause) {
        CarveMetrics.recordFailure(reason);
        LOG.fine(() -> "Carve failed (" + reason + "): " + message);
        return cause == null ? new DeploymentFailedException(message) : new DeploymentFailedException(message, cause);
    }
}
