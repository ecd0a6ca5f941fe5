package ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import ir.type.FloatType;
import ir.type.IntegerType;
import ir.type.Type;
import ir.type.VectorType;
import ir.value.Argument;
import ir.value.Opcode;
import ir.value.Value;
import ir.value.constants.Constant;
import ir.value.constants.ConstantFloat;
import ir.value.constants.ConstantInt;
import ir.value.constants.ConstantVector;
import ir.value.instructions.BinOperator;
import ir.value.instructions.ElementShuffleInst;
import ir.value.instructions.ElementShuffleInst.VectorElement;
import ir.value.instructions.LoadInst;
import ir.value.instructions.LoopIndexInst;
import ir.value.instructions.LoopInst;
import ir.value.instructions.OffloadedInst;
import ir.value.instructions.RangeAssumptionInst;
import ir.value.instructions.RangeForInst;
import ir.value.instructions.StructForInst;

/**
 * Creates IR nodes for one kernel. Nodes are never placed in blocks, the
 * builder only keeps them in creation order so callers can walk the graph.
 */
public class Builder {
    private final List<Value> nodes = new ArrayList<>();
    private int nextTemp = 0;
    private int nextArg = 0;

    // 命名前缀，用于区分不同 kernel 的节点
    private final String namePrefix;

    public Builder() {
        this("");
    }

    public Builder(String namePrefix) {
        this.namePrefix = namePrefix != null ? namePrefix : "";
    }

    /**
     * All nodes created so far, in creation order.
     */
    public List<Value> getNodes() {
        return Collections.unmodifiableList(nodes);
    }

    private String nameOf(String name) {
        if (name == null || name.isEmpty()) {
            name = "t" + nextTemp++;
        }
        return namePrefix.isEmpty() ? name : namePrefix + "." + name;
    }

    private <T extends Value> T record(T value) {
        nodes.add(value);
        return value;
    }

    // --- 常量 ---
    public ConstantInt getInt32(int value) {
        return record(ConstantInt.i32(value));
    }

    public ConstantInt getInt(IntegerType type, long value) {
        return record(new ConstantInt(type, value));
    }

    public ConstantFloat getFloat(float value) {
        return record(new ConstantFloat(FloatType.getFloat(), value));
    }

    public ConstantVector getVector(Type elementType, List<? extends Constant> lanes) {
        return record(new ConstantVector(new VectorType(elementType, lanes.size()), lanes));
    }

    public Argument buildArg(Type type, String name) {
        return record(new Argument(type, nameOf(name), nextArg++));
    }

    // --- 算术指令 ---
    public BinOperator buildBinary(Opcode opcode, Value lhs, Value rhs, String name) {
        assert lhs.getType().equals(rhs.getType())
                : "lhs and rhs should have the same type in bin instruction";
        return record(new BinOperator(nameOf(name), opcode, lhs.getType(), lhs, rhs));
    }

    public BinOperator buildAdd(Value lhs, Value rhs, String name) {
        return buildBinary(Opcode.ADD, lhs, rhs, name);
    }

    public BinOperator buildSub(Value lhs, Value rhs, String name) {
        return buildBinary(Opcode.SUB, lhs, rhs, name);
    }

    public BinOperator buildMul(Value lhs, Value rhs, String name) {
        return buildBinary(Opcode.MUL, lhs, rhs, name);
    }

    public BinOperator buildSDiv(Value lhs, Value rhs, String name) {
        return buildBinary(Opcode.SDIV, lhs, rhs, name);
    }

    // --- 内存 ---
    public LoadInst buildLoad(Value pointer, String name) {
        return record(new LoadInst(pointer, nameOf(name)));
    }

    // --- 循环 ---
    public RangeForInst buildRangeFor(Value begin, Value end, boolean reversed, String name) {
        return record(new RangeForInst(nameOf(name), begin, end, reversed));
    }

    public StructForInst buildStructFor(int numIndices, String name) {
        return record(new StructForInst(nameOf(name), numIndices));
    }

    public OffloadedInst buildOffloaded(OffloadedInst.TaskType taskType, int numIndices, String name) {
        return record(new OffloadedInst(nameOf(name), taskType, numIndices));
    }

    public LoopIndexInst buildLoopIndex(LoopInst loop, int index, String name) {
        return record(new LoopIndexInst(nameOf(name), loop, index));
    }

    // --- 其他 ---
    public RangeAssumptionInst buildRangeAssumption(Value base, int low, int high, String name) {
        return record(new RangeAssumptionInst(nameOf(name), base, low, high));
    }

    public ElementShuffleInst buildShuffle(List<VectorElement> elements, String name) {
        return record(new ElementShuffleInst(nameOf(name), elements));
    }

    /**
     * Shuffle producing a single lane: lane {@code index} of {@code source}.
     */
    public ElementShuffleInst buildExtract(Value source, int index, String name) {
        return buildShuffle(List.of(new VectorElement(source, index)), name);
    }
}
