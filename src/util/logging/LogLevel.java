package util.logging;

/**
 * Severity levels, ordered from the most verbose to the most severe.
 */
public enum LogLevel {
    TRACE(0),
    DEBUG(1),
    INFO(2),
    WARN(3),
    ERROR(4),
    FATAL(5),
    OFF(6);

    private final int value;

    LogLevel(int value) {
        this.value = value;
    }

    public int getValue() {
        return value;
    }

    /**
     * @return true if this level is below (more verbose than) the given threshold
     */
    public boolean isLessSpecificThan(LogLevel threshold) {
        return this.value < threshold.value;
    }
}
