package polyalgebra;

/**
 * Degree of the zero polynomial; smaller than every number.
 */
public final class NegativeInfinity extends Expression {
    static final NegativeInfinity INSTANCE = new NegativeInfinity();

    private NegativeInfinity() {
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof NegativeInfinity;
    }

    @Override
    public int hashCode() {
        return -0x7fd0;
    }

    @Override
    public String toString() {
        return "-Infinity";
    }
}
