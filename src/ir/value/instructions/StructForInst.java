package ir.value.instructions;

import ir.value.Opcode;

/**
 * Parallel loop over the active cells of a sparse data structure,
 * one index per dimension.
 */
public class StructForInst extends LoopInst {

    public StructForInst(String name, int numIndices) {
        super(name, numIndices);
    }

    @Override
    public Opcode opCode() {
        return Opcode.STRUCT_FOR;
    }

    @Override
    public String toNLVM() {
        return "%" + getName() + " = struct_for " + getNumIndices();
    }
}
