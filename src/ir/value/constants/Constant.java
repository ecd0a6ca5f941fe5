package ir.value.constants;

import ir.type.Type;
import ir.value.User;

public abstract class Constant extends User {
    public Constant(Type type) {
        super(type, "");
    }

    @Override public boolean isConstant() { return true; }

    /**
     * The literal seen by the given lane. A scalar constant is broadcast,
     * so it answers every lane with itself.
     */
    public Constant getLane(int lane) {
        return this;
    }

    public abstract String toNLVM();
}
