package polyalgebra;

/**
 * Coefficient and degree of a monomial, or of the leading term of a polynomial.
 */
public class CoefficientDegree {
    public static final CoefficientDegree UNDEFINED =
        new CoefficientDegree(Operators.UNDEFINED, Operators.UNDEFINED);

    private final Expression coefficient;
    private final Expression degree;

    public CoefficientDegree(Expression coefficient, Expression degree) {
        this.coefficient = coefficient;
        this.degree = degree;
    }

    public Expression getCoefficient() {
        return coefficient;
    }

    public Expression getDegree() {
        return degree;
    }

    public boolean isUndefined() {
        return coefficient.isUndefined() || degree.isUndefined();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CoefficientDegree)) {
            return false;
        }
        CoefficientDegree that = (CoefficientDegree) o;
        return coefficient.equals(that.coefficient) && degree.equals(that.degree);
    }

    @Override
    public int hashCode() {
        return 31 * coefficient.hashCode() + degree.hashCode();
    }

    @Override
    public String toString() {
        return "(" + coefficient + ", " + degree + ")";
    }
}
