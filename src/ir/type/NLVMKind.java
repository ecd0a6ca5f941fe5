package ir.type;

public enum NLVMKind {
    // integer
    I1,
    I8,
    I16,
    I32,
    I64,
    // others
    FLOAT,
    VOID,
    POINTER,
    VECTOR
}
