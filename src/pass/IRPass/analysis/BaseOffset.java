package pass.IRPass.analysis;

import ir.value.Value;

/**
 * One-level decomposition {@code value = base + offset}. A found
 * decomposition without a base is a plain constant.
 */
public final class BaseOffset {
    private static final BaseOffset NOT_FOUND = new BaseOffset(false, null, 0);

    private final boolean found;
    private final Value base;
    private final int offset;

    private BaseOffset(boolean found, Value base, int offset) {
        this.found = found;
        this.base = base;
        this.offset = offset;
    }

    public static BaseOffset notFound() {
        return NOT_FOUND;
    }

    public static BaseOffset constant(int value) {
        return new BaseOffset(true, null, value);
    }

    public static BaseOffset of(Value base, int offset) {
        return new BaseOffset(true, base, offset);
    }

    public boolean isFound() {
        return found;
    }

    /**
     * @return the base node, or null for a plain constant
     */
    public Value getBase() {
        return base;
    }

    public boolean hasBase() {
        return base != null;
    }

    public int getOffset() {
        return offset;
    }

    /**
     * Bases match only if they are the same node; two constants share the null base.
     */
    public boolean sameBaseAs(BaseOffset other) {
        return base == other.base;
    }

    @Override
    public String toString() {
        if (!found) {
            return "BaseOffset(not found)";
        }
        return "BaseOffset(" + (base == null ? "none" : base.getReference()) + " + " + offset + ")";
    }
}
