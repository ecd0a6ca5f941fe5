package ir.value.instructions;

import ir.type.VoidType;

/**
 * A loop statement. Each loop exposes one or more induction indices,
 * numbered from 0, that {@link LoopIndexInst} nodes refer to.
 */
public abstract class LoopInst extends Instruction {
    private final int numIndices;

    protected LoopInst(String name, int numIndices) {
        super(VoidType.getVoid(), name);
        if (numIndices < 1) {
            throw new IllegalArgumentException("loop " + name + " needs at least one index");
        }
        this.numIndices = numIndices;
    }

    public int getNumIndices() {
        return numIndices;
    }
}
