package ir.type;

import exception.CompileException;

public class VectorType extends Type {
    private final Type elementType;
    private final int numElements;

    public VectorType(Type elementType, int numElements) {
        super(NLVMKind.VECTOR);
        if (elementType.isVector() || elementType.isVoid()) {
            throw CompileException.unSupported("vector of " + elementType);
        }
        if (numElements < 1) {
            throw CompileException.unSupported("vector with " + numElements + " lanes");
        }
        this.elementType = elementType;
        this.numElements = numElements;
    }

    public Type getElementType() {
        return elementType;
    }

    public int getNumElements() {
        return numElements;
    }

    @Override
    public int getLanes() {
        return numElements;
    }

    @Override
    public Type getLaneType() {
        return elementType;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof VectorType))
            return false;
        VectorType other = (VectorType) obj;
        return this.elementType.equals(other.elementType) &&
                this.numElements == other.numElements;
    }

    @Override
    public int hashCode() {
        return 31 * elementType.hashCode() + numElements;
    }

    @Override
    public String toNLVM() {
        StringBuilder sb = new StringBuilder();
        sb.append("<").append(numElements).append(" x ").append(elementType.toNLVM()).append(">");
        return sb.toString();
    }
}
