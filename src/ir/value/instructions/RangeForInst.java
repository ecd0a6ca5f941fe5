package ir.value.instructions;

import ir.value.Opcode;
import ir.value.Value;
import ir.value.constants.ConstantInt;

/**
 * Counting loop over {@code [begin, end)} with a single index.
 * A reversed loop visits the same range from {@code end - 1} down to {@code begin}.
 */
public class RangeForInst extends LoopInst {
    private final boolean reversed;

    public RangeForInst(String name, Value begin, Value end, boolean reversed) {
        super(name, 1);
        this.reversed = reversed;
        addOperand(begin);
        addOperand(end);
    }

    public Value getBegin() {
        return getOperand(0);
    }

    public Value getEnd() {
        return getOperand(1);
    }

    public boolean isReversed() {
        return reversed;
    }

    /**
     * Both bounds are i32 literals, so they can be used as 32-bit offsets.
     */
    public boolean hasI32Bounds() {
        return getBegin() instanceof ConstantInt begin && begin.isI32()
                && getEnd() instanceof ConstantInt end && end.isI32();
    }

    @Override
    public Opcode opCode() {
        return Opcode.RANGE_FOR;
    }

    @Override
    public String toNLVM() {
        return "%" + getName() + " = range_for " + getBegin().getReference()
                + ", " + getEnd().getReference() + (reversed ? " reversed" : "");
    }
}
