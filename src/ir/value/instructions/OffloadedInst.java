package ir.value.instructions;

import ir.value.Opcode;

/**
 * A top level task after offloading. Its task type tells which kind of
 * iteration the task body performs.
 */
public class OffloadedInst extends LoopInst {

    public enum TaskType {
        SERIAL,
        RANGE_FOR,
        STRUCT_FOR,
        LISTGEN,
        GC;

        public static TaskType fromName(String name) {
            for (TaskType type : values()) {
                if (type.name().equalsIgnoreCase(name)) {
                    return type;
                }
            }
            return null;
        }
    }

    private final TaskType taskType;

    public OffloadedInst(String name, TaskType taskType, int numIndices) {
        super(name, numIndices);
        this.taskType = taskType;
    }

    public TaskType getTaskType() {
        return taskType;
    }

    @Override
    public Opcode opCode() {
        return Opcode.OFFLOADED;
    }

    @Override
    public String toNLVM() {
        return "%" + getName() + " = offloaded " + taskType.name().toLowerCase() + " " + getNumIndices();
    }
}
