package pass.IRPass.analysis;

/**
 * Affine description of a value relative to one loop index:
 * {@code value = coeff * index + offset} with {@code offset} in {@code [low, high)}.
 * When {@code related} is false nothing is known and the other fields mean nothing.
 */
public final class DiffRange {
    private static final DiffRange UNRELATED = new DiffRange(false, 0, 0, 0);

    private final boolean related;
    private final int coeff;
    private final int low;
    private final int high;

    public DiffRange(boolean related, int coeff, int low, int high) {
        this.related = related;
        this.coeff = coeff;
        this.low = low;
        this.high = high;
    }

    /**
     * A single known offset, i.e. {@code [low, low + 1)}. {@code low} must be
     * below {@link Integer#MAX_VALUE}.
     */
    public DiffRange(boolean related, int coeff, int low) {
        this(related, coeff, low, low + 1);
    }

    public static DiffRange unrelated() {
        return UNRELATED;
    }

    public boolean isRelated() {
        return related;
    }

    public int getCoeff() {
        return coeff;
    }

    public int getLow() {
        return low;
    }

    public int getHigh() {
        return high;
    }

    /**
     * @return true if the offset is a single known value
     */
    public boolean isCertain() {
        return related && high == low + 1;
    }

    // The -1 / +1 terms follow the half-open convention shared with the range
    // analysis; keep them as they are.
    public DiffRange add(DiffRange other) {
        return checked(related && other.related, (long) coeff + other.coeff,
                (long) low + other.low, (long) high + other.high - 1);
    }

    public DiffRange sub(DiffRange other) {
        return checked(related && other.related, (long) coeff - other.coeff,
                (long) low - other.high + 1, (long) high - other.low);
    }

    // a bound that leaves the int range is not known any more
    private static DiffRange checked(boolean related, long coeff, long low, long high) {
        if (!related || !fitsInt(coeff) || !fitsInt(low) || !fitsInt(high)) {
            return UNRELATED;
        }
        return new DiffRange(true, (int) coeff, (int) low, (int) high);
    }

    private static boolean fitsInt(long value) {
        return value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DiffRange other)) return false;
        if (!related || !other.related) {
            return related == other.related;
        }
        return coeff == other.coeff && low == other.low && high == other.high;
    }

    @Override
    public int hashCode() {
        if (!related) {
            return 0;
        }
        int h = coeff;
        h = 31 * h + low;
        h = 31 * h + high;
        return h;
    }

    @Override
    public String toString() {
        if (!related) {
            return "DiffRange(unrelated)";
        }
        return "DiffRange(" + coeff + " * i + [" + low + ", " + high + "))";
    }
}
