package polyalgebra;

/**
 * A monomial split into its coefficient and its variable part.
 */
public class CoefficientTerm {
    public static final CoefficientTerm UNDEFINED =
        new CoefficientTerm(Operators.UNDEFINED, Operators.UNDEFINED);

    private final Expression coefficient;
    private final Expression variablePart;

    public CoefficientTerm(Expression coefficient, Expression variablePart) {
        this.coefficient = coefficient;
        this.variablePart = variablePart;
    }

    public Expression getCoefficient() {
        return coefficient;
    }

    public Expression getVariablePart() {
        return variablePart;
    }

    public CoefficientTerm mul(CoefficientTerm other) {
        return new CoefficientTerm(coefficient.times(other.coefficient), variablePart.times(other.variablePart));
    }

    public Expression toExpression() {
        return coefficient.times(variablePart);
    }
}
