package ir.value.constants;

import ir.type.FloatType;

public class ConstantFloat extends Constant {
    private final float value;

    public ConstantFloat(FloatType type, float value) {
        super(type);
        this.value = value;
    }

    public float getValue() {
        return value;
    }

    @Override
    public String toNLVM() {
        return getType().toNLVM() + " " + value;
    }
}
