package io.codecarver.core.ledger;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Executes initialization code and returns the code it asks the ledger to store.
 *
 * Supports the straight-line subset a ledger needs to run deployment preambles:
 * arithmetic (ADD, SUB), stack (POP, PUSH0..PUSH32, DUP1..DUP16, SWAP1..SWAP16),
 * memory (MLOAD, MSTORE, MSTORE8, MSIZE), code access (CODESIZE, CODECOPY) and
 * halting (STOP, RETURN, REVERT, INVALID). There are no jumps, so every run terminates
 * within {@code code.length} steps. Anything else fails the placement.
 */
public final class InitCodeInterpreter {
    public static final int MAX_STACK = 1024;
    public static final int DEFAULT_MEMORY_LIMIT = 1 << 20;

    private static final BigInteger WORD_MASK = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);
    private static final int WORD = 32;

    private final int memoryLimit;

    public InitCodeInterpreter() {
        this(DEFAULT_MEMORY_LIMIT);
    }

    public InitCodeInterpreter(int memoryLimit) {
        if (memoryLimit <= 0) {
            throw new IllegalArgumentException("Memory limit must be positive");
        }
        this.memoryLimit = memoryLimit;
    }

    /**
     * @return the returned code; empty when execution stops or runs off the end
     * @throws PlacementException on REVERT, INVALID, unsupported opcodes or stack/memory faults
     */
    public byte[] execute(byte[] code) {
        if (code == null) {
            throw new IllegalArgumentException("Init code required");
        }
        Frame frame = new Frame(code);
        int pc = 0;
        while (pc < code.length) {
            int op = code[pc] & 0xff;
            if (op >= 0x60 && op <= 0x7f) {
                int n = op - 0x5f;
                byte[] imm = new byte[n];
                int available = Math.max(0, Math.min(n, code.length - pc - 1));
                System.arraycopy(code, pc + 1, imm, 0, available);
                frame.push(new BigInteger(1, imm));
                pc += 1 + n;
                continue;
            }
            if (op >= 0x80 && op <= 0x8f) {
                frame.dup(op - 0x7f);
                pc++;
                continue;
            }
            if (op >= 0x90 && op <= 0x9f) {
                frame.swap(op - 0x8f);
                pc++;
                continue;
            }
            switch (op) {
                case 0x00: // STOP
                    return new byte[0];
                case 0x01: { // ADD
                    BigInteger a = frame.pop();
                    BigInteger b = frame.pop();
                    frame.push(a.add(b).and(WORD_MASK));
                    break;
                }
                case 0x03: { // SUB
                    BigInteger a = frame.pop();
                    BigInteger b = frame.pop();
                    frame.push(a.subtract(b).and(WORD_MASK));
                    break;
                }
                case 0x38: // CODESIZE
                    frame.push(BigInteger.valueOf(code.length));
                    break;
                case 0x39: { // CODECOPY
                    BigInteger dest = frame.pop();
                    BigInteger offset = frame.pop();
                    BigInteger size = frame.pop();
                    frame.codeCopy(dest, offset, size);
                    break;
                }
                case 0x50: // POP
                    frame.pop();
                    break;
                case 0x51: { // MLOAD
                    BigInteger offset = frame.pop();
                    frame.push(new BigInteger(1, frame.read(offset, BigInteger.valueOf(WORD))));
                    break;
                }
                case 0x52: { // MSTORE
                    BigInteger offset = frame.pop();
                    BigInteger value = frame.pop();
                    frame.write(offset, toWord(value));
                    break;
                }
                case 0x53: { // MSTORE8
                    BigInteger offset = frame.pop();
                    BigInteger value = frame.pop();
                    frame.write(offset, new byte[] {value.byteValue()});
                    break;
                }
                case 0x59: // MSIZE
                    frame.push(BigInteger.valueOf(frame.msize));
                    break;
                case 0x5f: // PUSH0
                    frame.push(BigInteger.ZERO);
                    break;
                case 0xf3: { // RETURN
                    BigInteger offset = frame.pop();
                    BigInteger size = frame.pop();
                    return frame.read(offset, size);
                }
                case 0xfd: // REVERT
                    throw new PlacementException("Init code reverted");
                case 0xfe:
                    throw new PlacementException("Init code hit INVALID at pc " + pc);
                default:
                    throw new PlacementException(String.format("Unsupported opcode 0x%02x at pc %d", op, pc));
            }
            pc++;
        }
        return new byte[0];
    }

    private static byte[] toWord(BigInteger value) {
        byte[] raw = value.toByteArray();
        byte[] out = new byte[WORD];
        int copy = Math.min(raw.length, WORD);
        System.arraycopy(raw, raw.length - copy, out, WORD - copy, copy);
        return out;
    }

    private final class Frame {
        private final byte[] code;
        private final List<BigInteger> stack = new ArrayList<>();
        private byte[] memory = new byte[0];
        private int msize;

        Frame(byte[] code) {
            this.code = code;
        }

        void push(BigInteger value) {
            if (stack.size() >= MAX_STACK) {
                throw new PlacementException("Stack overflow");
            }
            stack.add(value);
        }

        BigInteger pop() {
            if (stack.isEmpty()) {
                throw new PlacementException("Stack underflow");
            }
            return stack.remove(stack.size() - 1);
        }

        void dup(int n) {
            if (stack.size() < n) {
                throw new PlacementException("Stack underflow on DUP" + n);
            }
            push(stack.get(stack.size() - n));
        }

        void swap(int n) {
            if (stack.size() < n + 1) {
                throw new PlacementException("Stack underflow on SWAP" + n);
            }
            int top = stack.size() - 1;
            BigInteger tmp = stack.get(top);
            stack.set(top, stack.get(top - n));
            stack.set(top - n, tmp);
        }

        byte[] read(BigInteger offset, BigInteger size) {
            int len = toLength(size);
            if (len == 0) {
                return new byte[0];
            }
            int start = expand(offset, len);
            return Arrays.copyOfRange(memory, start, start + len);
        }

        void write(BigInteger offset, byte[] data) {
            int start = expand(offset, data.length);
            System.arraycopy(data, 0, memory, start, data.length);
        }

        void codeCopy(BigInteger dest, BigInteger offset, BigInteger size) {
            int len = toLength(size);
            if (len == 0) {
                return;
            }
            int start = expand(dest, len);
            Arrays.fill(memory, start, start + len, (byte) 0);
            if (offset.compareTo(BigInteger.valueOf(code.length)) < 0) {
                int from = offset.intValueExact();
                int copy = Math.min(len, code.length - from);
                System.arraycopy(code, from, memory, start, copy);
            }
        }

        private int toLength(BigInteger size) {
            if (size.compareTo(BigInteger.valueOf(memoryLimit)) > 0) {
                throw new PlacementException("Memory access exceeds limit of " + memoryLimit + " bytes");
            }
            return size.intValueExact();
        }

        /** Grows memory to cover {@code [offset, offset + len)} in whole words and returns the offset. */
        private int expand(BigInteger offset, int len) {
            if (offset.compareTo(BigInteger.valueOf(memoryLimit - len)) > 0) {
                throw new PlacementException("Memory access exceeds limit of " + memoryLimit + " bytes");
            }
            int start = offset.intValueExact();
            int end = start + len;
            int rounded = ((end + WORD - 1) / WORD) * WORD;
            if (rounded > memory.length) {
                memory = Arrays.copyOf(memory, rounded);
            }
            msize = Math.max(msize, rounded);
            return start;
        }
    }
}
