package ir.value.constants;

import ir.type.VectorType;
import ir.value.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * One literal per lane, e.g. {@code <2 x i32> [1, 2]}.
 */
public class ConstantVector extends Constant {
    public ConstantVector(VectorType type, List<? extends Constant> elements) {
        super(type);
        if (elements.size() != type.getNumElements()) {
            throw new IllegalArgumentException("Expected " + type.getNumElements()
                    + " lanes but got " + elements.size());
        }

        for (Constant element : elements) {
            if (!element.getType().equals(type.getElementType())) {
                throw new IllegalArgumentException("Lane " + element.toNLVM() + " is not of type "
                        + type.getElementType());
            }
            addOperand(element);
        }
    }

    public List<Constant> getElements() {
        return this.getOperands()
            .stream()
            .map(operand -> (Constant) operand)
            .collect(Collectors.toList());
    }

    @Override
    public Constant getLane(int lane) {
        return (Constant) getOperand(lane);
    }

    @Override
    public String toNLVM() {
        String elementList = getOperands().stream()
            .map(Value::getReference)
            .collect(Collectors.joining(", "));

        return getType().toNLVM() + " [" + elementList + "]";
    }
}
