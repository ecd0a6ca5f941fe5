package ir.value;

public enum Opcode {
    // 二元运算指令
    ADD, // 加法
    SUB, // 减法
    MUL, // 乘法
    SDIV, // 有符号除法
    UDIV, // 无符号除法
    SREM, // 有符号取余
    UREM, // 无符号取余
    SHL, // 左移
    LSHR, // 逻辑右移
    ASHR, // 算术右移
    AND, // 按位与
    OR, // 按位或
    XOR, // 按位异或

    FADD, // 浮点加法
    FSUB, // 浮点减法
    FMUL, // 浮点乘法
    FDIV, // 浮点除法

    // 内存操作指令
    LOAD, // 全局加载

    // 循环
    RANGE_FOR, // 计数循环 [begin, end)
    STRUCT_FOR, // 结构化循环
    OFFLOADED, // 卸载任务
    LOOP_INDEX, // 循环索引

    // 其他指令
    RANGE_ASSUMPTION, // 外部证明的范围 [low, high)
    ELEMENT_SHUFFLE, // 按 lane 选择元素
    ;

    public boolean isBinary() {
        return switch (this) {
            case ADD, SUB, MUL, SDIV, UDIV, SREM, UREM,
                    SHL, LSHR, ASHR, AND, OR, XOR,
                    FADD, FSUB, FMUL, FDIV -> true;
            default -> false;
        };
    }

    public boolean isLoop() {
        return this == RANGE_FOR || this == STRUCT_FOR || this == OFFLOADED;
    }

    /**
     * Looks up a binary opcode by its textual (lower case) name.
     *
     * @return the opcode, or null if the name is not a binary operator
     */
    public static Opcode binaryFromName(String name) {
        for (Opcode op : values()) {
            if (op.isBinary() && op.name().equalsIgnoreCase(name)) {
                return op;
            }
        }
        return null;
    }
}
