package pass.IRPass.analysis;

import exception.CompileException;
import ir.value.Opcode;
import ir.value.Value;
import ir.value.constants.Constant;
import ir.value.constants.ConstantInt;
import ir.value.instructions.BinOperator;
import ir.value.instructions.ElementShuffleInst;
import ir.value.instructions.ElementShuffleInst.VectorElement;
import ir.value.instructions.Instruction;
import ir.value.instructions.LoopIndexInst;
import ir.value.instructions.LoopInst;
import ir.value.instructions.OffloadedInst;
import ir.value.instructions.RangeAssumptionInst;
import ir.value.instructions.RangeForInst;
import util.LoggingManager;
import util.logging.Logger;

import java.util.HashMap;
import java.util.Map;

/**
 * Compile-time offsets between values.
 *
 * <ul>
 * <li>{@link #valueDiffLoopIndex} describes a value as
 * {@code coeff * index + [low, high)} relative to one index of a loop.</li>
 * <li>{@link #valueDiffPtrIndex} proves that two values differ by a constant.</li>
 * </ul>
 *
 * Both queries are read-only and keep no state between calls.
 */
public final class ValueDiffAnalysis {
    private static final Logger log = LoggingManager.getLogger(ValueDiffAnalysis.class);

    private ValueDiffAnalysis() {
    }

    /**
     * Relates {@code value} to index {@code indexId} of {@code loop}.
     *
     * @param value   the value to describe, must be scalar unless it is the index itself
     * @param loop    a range-for, a struct-for, or a struct-for offloaded task
     * @param indexId which index of the loop
     * @return the descriptor, unrelated when nothing could be proven
     * @throws CompileException if the loop kind or the value width is not supported
     */
    public static DiffRange valueDiffLoopIndex(Value value, LoopInst loop, int indexId) {
        checkLoop(loop);
        log.debug("value diff of {} against index {} of %{}", value, indexId, loop.getName());

        if (value instanceof LoopIndexInst loopIndex && loopIndex.isIndexOf(loop, indexId)) {
            return new DiffRange(true, 1, 0);
        }
        if (value.getWidth() != 1) {
            throw CompileException.internal("value diff on " + value.getWidth()
                    + "-lane value " + value.getReference());
        }

        DiffRange result = new LoopIndexDiff(loop, indexId).run(value, 0);
        log.debug("value diff of {} is {}", value, result);
        return result;
    }

    private static void checkLoop(LoopInst loop) {
        switch (loop.opCode()) {
            case RANGE_FOR, STRUCT_FOR -> {
            }
            case OFFLOADED -> {
                OffloadedInst.TaskType taskType = ((OffloadedInst) loop).getTaskType();
                if (taskType != OffloadedInst.TaskType.STRUCT_FOR) {
                    throw CompileException.internal("value diff inside offloaded "
                            + taskType.name().toLowerCase() + " task %" + loop.getName());
                }
            }
            default -> throw CompileException.internal("value diff on non-loop " + loop.toNLVM());
        }
    }

    /**
     * Proves {@code val1 - val2} constant when both are the same base plus
     * constant offsets.
     */
    public static DiffPtrResult valueDiffPtrIndex(Value val1, Value val2) {
        if (val1 == val2) {
            return DiffPtrResult.certain(0);
        }
        BaseOffset v1 = findBaseAndOffset(val1);
        BaseOffset v2 = findBaseAndOffset(val2);
        DiffPtrResult result;
        if (!v1.isFound() || !v2.isFound() || !v1.sameBaseAs(v2)) {
            result = DiffPtrResult.uncertain();
        } else {
            long diff = (long) v1.getOffset() - v2.getOffset();
            result = diff == (int) diff ? DiffPtrResult.certain((int) diff) : DiffPtrResult.uncertain();
        }
        log.debug("ptr diff {} - {}: {} vs {} -> {}", val1, val2, v1, v2, result);
        return result;
    }

    /**
     * Splits {@code value} into {@code base + offset}, looking through at
     * most one add or sub with a constant right operand.
     */
    public static BaseOffset findBaseAndOffset(Value value) {
        if (value instanceof Constant constant) {
            return constantOffset(constant);
        }
        if (value instanceof BinOperator binary) {
            switch (binary.opCode()) {
                case ADD, SUB -> {
                    if (!(binary.getRhs() instanceof Constant rhs)) {
                        return BaseOffset.notFound();
                    }
                    BaseOffset offset = constantOffset(rhs);
                    // -MIN_VALUE is not an int
                    if (!offset.isFound()
                            || (binary.opCode() == Opcode.SUB && offset.getOffset() == Integer.MIN_VALUE)) {
                        return BaseOffset.notFound();
                    }
                    int delta = binary.opCode() == Opcode.SUB ? -offset.getOffset() : offset.getOffset();
                    return BaseOffset.of(binary.getLhs(), delta);
                }
                default -> {
                    return BaseOffset.notFound();
                }
            }
        }
        return BaseOffset.notFound();
    }

    private static BaseOffset constantOffset(Constant constant) {
        if (constant.getWidth() != 1) {
            throw CompileException.internal("offset of " + constant.getWidth()
                    + "-lane constant " + constant.getReference());
        }
        if (constant instanceof ConstantInt literal && literal.isI32()) {
            return BaseOffset.constant(literal.getIntValue());
        }
        return BaseOffset.notFound();
    }

    /**
     * One query of {@link #valueDiffLoopIndex}. Results are cached per
     * (node, lane) so shared operands are analyzed once.
     */
    private static final class LoopIndexDiff {
        private record VisitKey(int id, int lane) {
        }

        private final LoopInst loop;
        private final int loopIndex;
        private final Map<VisitKey, DiffRange> results = new HashMap<>();

        LoopIndexDiff(LoopInst loop, int loopIndex) {
            this.loop = loop;
            this.loopIndex = loopIndex;
        }

        DiffRange run(Value value, int lane) {
            VisitKey key = new VisitKey(value.getId(), lane);
            DiffRange cached = results.get(key);
            if (cached != null) {
                return cached;
            }
            DiffRange result = visit(value, lane);
            results.put(key, result);
            log.trace("{} lane {} -> {}", value, lane, result);
            return result;
        }

        private DiffRange visit(Value value, int lane) {
            if (value instanceof Constant constant) {
                return visitConstant(constant, lane);
            }
            if (!(value instanceof Instruction inst)) {
                return DiffRange.unrelated();
            }
            switch (inst.opCode()) {
                case LOOP_INDEX:
                    return visitLoopIndex((LoopIndexInst) inst);
                case RANGE_ASSUMPTION: {
                    RangeAssumptionInst assumption = (RangeAssumptionInst) inst;
                    return run(assumption.getBase(), lane)
                            .add(new DiffRange(true, 0, assumption.getLow(), assumption.getHigh()));
                }
                case ADD:
                case SUB: {
                    BinOperator binary = (BinOperator) inst;
                    DiffRange lhs = run(binary.getLhs(), lane);
                    DiffRange rhs = run(binary.getRhs(), lane);
                    if (!lhs.isRelated() || !rhs.isRelated()) {
                        return DiffRange.unrelated();
                    }
                    return binary.opCode() == Opcode.ADD ? lhs.add(rhs) : lhs.sub(rhs);
                }
                case ELEMENT_SHUFFLE:
                    return visitShuffle((ElementShuffleInst) inst, lane);
                default:
                    return DiffRange.unrelated();
            }
        }

        private DiffRange visitLoopIndex(LoopIndexInst index) {
            if (index.isIndexOf(loop, loopIndex)) {
                return new DiffRange(true, 1, 0);
            }
            // reversed loops walk the same range backwards, bounds stay ascending
            if (index.getLoop() instanceof RangeForInst rangeFor && rangeFor.hasI32Bounds()) {
                int begin = ((ConstantInt) rangeFor.getBegin()).getIntValue();
                int end = ((ConstantInt) rangeFor.getEnd()).getIntValue();
                return new DiffRange(true, 0, Math.min(begin, end), Math.max(begin, end));
            }
            return DiffRange.unrelated();
        }

        private DiffRange visitConstant(Constant constant, int lane) {
            if (lane >= constant.getWidth() && constant.getWidth() != 1) {
                throw CompileException.internal("lane " + lane + " of "
                        + constant.getWidth() + "-lane constant " + constant.getReference());
            }
            // [MAX_VALUE, MAX_VALUE + 1) has no int upper bound
            if (constant.getLane(lane) instanceof ConstantInt literal && literal.isI32()
                    && literal.getIntValue() != Integer.MAX_VALUE) {
                return new DiffRange(true, 0, literal.getIntValue());
            }
            return DiffRange.unrelated();
        }

        private DiffRange visitShuffle(ElementShuffleInst shuffle, int lane) {
            if (shuffle.getWidth() != 1 || lane >= shuffle.getElements().size()) {
                throw CompileException.internal("cannot resolve lane " + lane + " of "
                        + shuffle.getWidth() + "-lane shuffle %" + shuffle.getName());
            }
            VectorElement element = shuffle.getElement(lane);
            return run(element.getValue(), element.getIndex());
        }
    }
}
