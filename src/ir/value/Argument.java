package ir.value;

import ir.type.Type;

/**
 * Opaque kernel parameter. Its value is unknown at compile time.
 */
public class Argument extends Value {
    private final int index;

    public Argument(Type type, String name, int index) {
        super(type, name);
        this.index = index;
    }

    public int getIndex() { return index; }

    @Override
    public String toNLVM() {
        return "%" + getName() + " = arg " + getType().toNLVM();
    }
}
