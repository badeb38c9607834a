package polyalgebra;

/**
 * Result of an ill-defined computation. Absorbs every operator it takes part in.
 */
public final class Undefined extends Expression {
    static final Undefined INSTANCE = new Undefined();

    private Undefined() {
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Undefined;
    }

    @Override
    public int hashCode() {
        return 0x7fd0;
    }

    @Override
    public String toString() {
        return "Undefined";
    }
}
