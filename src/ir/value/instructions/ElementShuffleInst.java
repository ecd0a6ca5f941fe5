package ir.value.instructions;

import ir.type.Type;
import ir.type.VectorType;
import ir.value.Opcode;
import ir.value.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds a value lane by lane: output lane {@code k} is lane
 * {@code elements[k].index} of {@code elements[k].value}.
 */
public class ElementShuffleInst extends Instruction {

    /**
     * One selected lane of a source value.
     */
    public static class VectorElement {
        private final Value value;
        private final int index;

        public VectorElement(Value value, int index) {
            if (index < 0 || index >= value.getWidth()) {
                throw new IllegalArgumentException("lane " + index + " out of range for "
                        + value.getReference());
            }
            this.value = value;
            this.index = index;
        }

        public Value getValue() {
            return value;
        }

        public int getIndex() {
            return index;
        }

        @Override
        public String toString() {
            return value.getReference() + ":" + index;
        }
    }

    private final List<VectorElement> elements;

    public ElementShuffleInst(String name, List<VectorElement> elements) {
        super(resultType(elements), name);
        this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
        for (VectorElement element : elements) {
            if (!usesValue(element.getValue())) {
                addOperand(element.getValue());
            }
        }
    }

    private static Type resultType(List<VectorElement> elements) {
        if (elements.isEmpty()) {
            throw new IllegalArgumentException("shuffle without elements");
        }
        Type laneType = elements.get(0).getValue().getType().getLaneType();
        return elements.size() == 1 ? laneType : new VectorType(laneType, elements.size());
    }

    public List<VectorElement> getElements() {
        return elements;
    }

    public VectorElement getElement(int lane) {
        return elements.get(lane);
    }

    @Override
    public Opcode opCode() {
        return Opcode.ELEMENT_SHUFFLE;
    }

    @Override
    public String toNLVM() {
        return "%" + getName() + " = shuffle ["
                + elements.stream().map(VectorElement::toString).collect(Collectors.joining(", "))
                + "]";
    }
}
