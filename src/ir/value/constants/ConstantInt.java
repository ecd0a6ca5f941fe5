package ir.value.constants;

import ir.type.IntegerType;

public class ConstantInt extends Constant {
    private final long value;

    public ConstantInt(IntegerType type, long value) {
        super(type);
        this.value = value;
    }

    // factory method for i32 literals
    public static ConstantInt i32(int value) {
        return new ConstantInt(IntegerType.getI32(), value);
    }

    public long getValue() { return value; }

    /**
     * The literal as an int; only exact when {@link #isI32()} holds.
     */
    public int getIntValue() { return (int) value; }

    /**
     * Only 32-bit signed literals take part in offset arithmetic.
     */
    public boolean isI32() {
        return getType().isI32();
    }

    @Override
    public String toNLVM() {
        return getType().toNLVM() + " " + value;
    }
}
