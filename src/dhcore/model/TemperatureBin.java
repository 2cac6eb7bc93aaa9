package dhcore.model;

import java.util.Objects;

/**
 * Температурный бин (lower, upper].
 * overflow = true для двух крайних бинов, ограниченных значениями ±100.
 */
public final class TemperatureBin implements Comparable<TemperatureBin> {

    private final int index;
    private final double lower;
    private final double upper;
    private final boolean overflow;

    public TemperatureBin(int index, double lower, double upper, boolean overflow) {
        this.index = index;
        this.lower = lower;
        this.upper = upper;
        this.overflow = overflow;
    }

    public int getIndex() {
        return index;
    }

    public double getLower() {
        return lower;
    }

    public double getUpper() {
        return upper;
    }

    public boolean isOverflow() {
        return overflow;
    }

    /** Подпись в интервальной записи, например "(-29.2, -26.4]". */
    public String label() {
        return "(" + lower + ", " + upper + "]";
    }

    @Override
    public int compareTo(TemperatureBin o) {
        return Integer.compare(index, o.index);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TemperatureBin that)) return false;
        return index == that.index
                && Double.compare(lower, that.lower) == 0
                && Double.compare(upper, that.upper) == 0
                && overflow == that.overflow;
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, lower, upper, overflow);
    }

    @Override
    public String toString() {
        return label();
    }
}
