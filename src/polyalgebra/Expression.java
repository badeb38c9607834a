package polyalgebra;

/**
 * Immutable symbolic expression. The set of variants is closed: only classes
 * of this package can extend it, and every instance is built through
 * {@link Operators}, which keeps it in canonical form.
 */
public abstract class Expression {

    Expression() {
    }

    public Expression plus(Expression other) {
        return Operators.add(this, other);
    }

    public Expression minus(Expression other) {
        return Operators.subtract(this, other);
    }

    public Expression times(Expression other) {
        return Operators.multiply(this, other);
    }

    public Expression dividedBy(Expression other) {
        return Operators.divide(this, other);
    }

    public Expression pow(Expression exponent) {
        return Operators.pow(this, exponent);
    }

    public Expression negate() {
        return Operators.negate(this);
    }

    public boolean isUndefined() {
        return this instanceof Undefined;
    }

    public boolean isZero() {
        return this instanceof Number && ((Number) this).isZeroValue();
    }

    /**
     * True for a power whose exponent is a literal integer greater than zero.
     */
    public boolean isPositiveIntegerPower() {
        if (!(this instanceof Power)) {
            return false;
        }
        Expression exponent = ((Power) this).getExponent();
        return exponent instanceof Number && ((Number) exponent).isPositiveInteger();
    }

    @Override
    public abstract boolean equals(Object o);

    @Override
    public abstract int hashCode();
}
