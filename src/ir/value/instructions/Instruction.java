package ir.value.instructions;

import ir.type.Type;
import ir.value.*;

public abstract class Instruction extends User {

    public Instruction(Type type, String name) {
        super(type, name);
    }

    public abstract Opcode opCode();

    public boolean isBinary() {
        return opCode().isBinary();
    }

    public boolean isLoop() {
        return opCode().isLoop();
    }

    public abstract String toNLVM();
}
