package ir.value.instructions;

import exception.CompileException;
import ir.type.IntegerType;
import ir.value.Opcode;

/**
 * Reads one induction index of a loop. The loop is referenced, not used
 * as an operand, so the data-flow graph stays free of loop statements.
 */
public class LoopIndexInst extends Instruction {
    private final LoopInst loop;
    private final int index;

    public LoopIndexInst(String name, LoopInst loop, int index) {
        super(IntegerType.getI32(), name);
        if (index < 0 || index >= loop.getNumIndices()) {
            throw CompileException.illegalOperand("loop %" + loop.getName()
                    + " has no index " + index);
        }
        this.loop = loop;
        this.index = index;
    }

    public LoopInst getLoop() {
        return loop;
    }

    public int getIndex() {
        return index;
    }

    public boolean isIndexOf(LoopInst loop, int index) {
        return this.loop == loop && this.index == index;
    }

    @Override
    public Opcode opCode() {
        return Opcode.LOOP_INDEX;
    }

    @Override
    public String toNLVM() {
        return "%" + getName() + " = loop_index %" + loop.getName() + ", " + index;
    }
}
