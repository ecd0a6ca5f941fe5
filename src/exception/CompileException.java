package exception;

public class CompileException extends RuntimeException {
    public CompileException(String message) {
        super(message);
    }

    public CompileException(String message, Throwable cause) {
        super(message, cause);
    }

    public static CompileException unSupported(String msg) {
        return new CompileException("UnSupported: " + msg);
    }

    public static CompileException illegalOperand(String msg) {
        return new CompileException("Illegal operand: " + msg);
    }

    public static CompileException illegalInstruction(String msg) {
        return new CompileException("Illegal instruction: " + msg);
    }

    /**
     * A broken precondition inside the compiler itself, never a user error.
     */
    public static CompileException internal(String msg) {
        return new CompileException("Internal error: " + msg);
    }
}
