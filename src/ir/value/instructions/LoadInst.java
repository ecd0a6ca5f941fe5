package ir.value.instructions;

import exception.CompileException;
import ir.type.PointerType;
import ir.type.Type;
import ir.value.Opcode;
import ir.value.Value;

/**
 * Load from global memory. Its result is never known at compile time.
 */
public class LoadInst extends Instruction {

    public LoadInst(Value pointer, String name) {
        super(pointeeOf(pointer), name);
        addOperand(pointer);
    }

    private static Type pointeeOf(Value pointer) {
        if (!(pointer.getType() instanceof PointerType ptrType)) {
            throw CompileException.illegalOperand("load from non-pointer " + pointer.getReference());
        }
        return ptrType.getPointeeType();
    }

    public Value getPointer() {
        return getOperand(0);
    }

    @Override
    public String toNLVM() {
        Value pointer = getPointer();
        return "%" + getName() + " = load " + getType().toNLVM() +
                ", " + pointer.getType().toNLVM() + " " + pointer.getReference();
    }

    @Override
    public Opcode opCode() {
        return Opcode.LOAD;
    }
}
