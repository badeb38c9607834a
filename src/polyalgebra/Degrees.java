package polyalgebra;

import java.util.List;

/**
 * Order on degree values: numbers, {@code NegativeInfinity} below every number,
 * and {@code Undefined}, which is not comparable.
 */
public final class Degrees {

    private Degrees() {
    }

    /**
     * @throws IllegalArgumentException if either value is undefined or not a degree
     */
    public static int compare(Expression a, Expression b) {
        if (a.isUndefined() || b.isUndefined()) {
            throw new IllegalArgumentException("undefined degree is not comparable");
        }
        if (a instanceof NegativeInfinity) {
            return b instanceof NegativeInfinity ? 0 : -1;
        }
        if (b instanceof NegativeInfinity) {
            return 1;
        }
        if (a instanceof Number && b instanceof Number) {
            return ((Number) a).compareTo((Number) b);
        }
        throw new IllegalArgumentException("not a degree: " + a + ", " + b);
    }

    /**
     * Maximum of the given degrees. One undefined degree makes the result undefined;
     * the maximum of no degrees is {@code NegativeInfinity}.
     */
    public static Expression max(List<Expression> degrees) {
        Expression max = Operators.NEGATIVE_INFINITY;
        for (Expression degree : degrees) {
            if (degree.isUndefined()) {
                return Operators.UNDEFINED;
            }
            if (compare(degree, max) > 0) {
                max = degree;
            }
        }
        return max;
    }
}
