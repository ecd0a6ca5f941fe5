package ir.type;

public abstract class Type {
    private final NLVMKind kind;

    protected Type(NLVMKind kind) {
        this.kind = kind;
    }

    public NLVMKind getKind() {
        return this.kind;
    }

    public abstract String toNLVM();

    /* classification helpers */
    public boolean is(NLVMKind k) { return kind == k; }
    public boolean isI1() { return is(NLVMKind.I1); }
    public boolean isI32() { return is(NLVMKind.I32); }
    public boolean isI64() { return is(NLVMKind.I64); }
    public boolean isFloat() { return is(NLVMKind.FLOAT); }
    public boolean isVoid() { return is(NLVMKind.VOID); }
    public boolean isPointer() { return is(NLVMKind.POINTER); }
    public boolean isVector() { return is(NLVMKind.VECTOR); }
    public boolean isInteger() {
        return isI1() || is(NLVMKind.I8) || is(NLVMKind.I16) || isI32() || isI64();
    }

    /**
     * Number of SIMD lanes a value of this type carries.
     * Scalars have a single lane.
     */
    public int getLanes() {
        return 1;
    }

    /**
     * Type of a single lane; scalars are their own lane type.
     */
    public Type getLaneType() {
        return this;
    }

    @Override public String toString() { return toNLVM(); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Type other = (Type) o;
        return kind == other.kind;
    }

    @Override
    public int hashCode() {
        return kind.hashCode();
    }
}
