package polyalgebra;

/**
 * One entry of a coefficient collection: {@code coefficient * symbol^exponent}.
 */
public class ExponentCoefficient {
    private final int exponent;
    private final Expression coefficient;

    public ExponentCoefficient(int exponent, Expression coefficient) {
        this.exponent = exponent;
        this.coefficient = coefficient;
    }

    public int getExponent() {
        return exponent;
    }

    public Expression getCoefficient() {
        return coefficient;
    }

    public ExponentCoefficient combine(ExponentCoefficient other) {
        return new ExponentCoefficient(exponent + other.exponent, coefficient.times(other.coefficient));
    }
}
