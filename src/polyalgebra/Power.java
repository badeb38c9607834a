package polyalgebra;

public final class Power extends Expression {
    private final Expression base;
    private final Expression exponent;

    Power(Expression base, Expression exponent) {
        this.base = base;
        this.exponent = exponent;
    }

    public Expression getBase() {
        return base;
    }

    public Expression getExponent() {
        return exponent;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Power)) {
            return false;
        }
        Power power = (Power) o;
        return base.equals(power.base) && exponent.equals(power.exponent);
    }

    @Override
    public int hashCode() {
        return 31 * base.hashCode() + exponent.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        boolean plainBase = base instanceof Symbol || base instanceof Function
            || (base instanceof Number && ((Number) base).isPositiveInteger());
        if (plainBase) {
            sb.append(base);
        }
        else {
            sb.append("(").append(base).append(")");
        }
        sb.append("^");
        boolean plainExponent = exponent instanceof Symbol
            || (exponent instanceof Number && ((Number) exponent).isInteger() && ((Number) exponent).signum() >= 0);
        if (plainExponent) {
            sb.append(exponent);
        }
        else {
            sb.append("(").append(exponent).append(")");
        }
        return sb.toString();
    }
}
