package ir.value.instructions;

import ir.value.Opcode;
import ir.value.Value;

/**
 * Hint that the value lies in {@code [base + low, base + high)}; the bound
 * was proven elsewhere and is trusted as is.
 */
public class RangeAssumptionInst extends Instruction {
    private final int low;
    private final int high;

    public RangeAssumptionInst(String name, Value base, int low, int high) {
        super(base.getType(), name);
        if (low >= high) {
            throw new IllegalArgumentException("empty range [" + low + ", " + high + ")");
        }
        this.low = low;
        this.high = high;
        addOperand(base);
    }

    public Value getBase() {
        return getOperand(0);
    }

    public int getLow() {
        return low;
    }

    public int getHigh() {
        return high;
    }

    @Override
    public Opcode opCode() {
        return Opcode.RANGE_ASSUMPTION;
    }

    @Override
    public String toNLVM() {
        return "%" + getName() + " = assume " + getBase().getReference()
                + ", [" + low + ", " + high + ")";
    }
}
