package pass.IRPass.analysis;

/**
 * Result of comparing two values: either {@code value1 - value2} is a
 * known constant, or nothing is known.
 */
public final class DiffPtrResult {
    private static final DiffPtrResult UNCERTAIN = new DiffPtrResult(false, 0);

    private final boolean diffCertain;
    private final int diffRange;

    private DiffPtrResult(boolean diffCertain, int diffRange) {
        this.diffCertain = diffCertain;
        this.diffRange = diffRange;
    }

    public static DiffPtrResult certain(int diff) {
        return new DiffPtrResult(true, diff);
    }

    public static DiffPtrResult uncertain() {
        return UNCERTAIN;
    }

    public boolean isDiffCertain() {
        return diffCertain;
    }

    /**
     * @return the proven difference; only meaningful when {@link #isDiffCertain()}
     */
    public int getDiffRange() {
        return diffRange;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DiffPtrResult other)) return false;
        return diffCertain == other.diffCertain && (!diffCertain || diffRange == other.diffRange);
    }

    @Override
    public int hashCode() {
        return diffCertain ? 31 + diffRange : 0;
    }

    @Override
    public String toString() {
        return diffCertain ? "Certain(" + diffRange + ")" : "Uncertain";
    }
}
