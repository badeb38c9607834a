package polyalgebra;

import java.util.ArrayList;
import java.util.List;

/**
 * Polynomials in exactly one symbol with numeric coefficients, such as
 * {@code 2*x + 3*x^2}. Unlike {@link Polynomial}, any other symbol makes the
 * expression a non-polynomial.
 */
public final class SingleVariablePolynomial {

    private SingleVariablePolynomial() {
    }

    private static boolean isPowerOf(Expression symbol, Expression x) {
        return x.isPositiveIntegerPower() && ((Power) x).getBase().equals(symbol);
    }

    public static boolean isMonomialSV(Expression symbol, Expression x) {
        if (x.equals(symbol) || x instanceof Number || isPowerOf(symbol, x)) {
            return true;
        }
        if (x instanceof Product) {
            for (Expression factor : ((Product) x).getFactors()) {
                if (!isMonomialSV(symbol, factor)) {
                    return false;
                }
            }
            return true;
        }
        return false;
    }

    public static boolean isPolynomialSV(Expression symbol, Expression x) {
        if (x instanceof Sum) {
            for (Expression term : ((Sum) x).getTerms()) {
                if (!isMonomialSV(symbol, term)) {
                    return false;
                }
            }
            return true;
        }
        return isMonomialSV(symbol, x);
    }

    public static Expression degreeMonomialSV(Expression symbol, Expression x) {
        return coefficientDegreeMonomialSV(symbol, x).getDegree();
    }

    public static Expression degreeSV(Expression symbol, Expression x) {
        Expression d = degreeMonomialSV(symbol, x);
        if (!d.isUndefined()) {
            return d;
        }
        if (x instanceof Sum) {
            List<Expression> degrees = new ArrayList<>();
            for (Expression term : ((Sum) x).getTerms()) {
                degrees.add(degreeMonomialSV(symbol, term));
            }
            return Degrees.max(degrees);
        }
        return Operators.UNDEFINED;
    }

    public static Expression coefficientMonomialSV(Expression symbol, Expression x) {
        return coefficientDegreeMonomialSV(symbol, x).getCoefficient();
    }

    public static CoefficientDegree coefficientDegreeMonomialSV(Expression symbol, Expression x) {
        if (x.isZero()) {
            return new CoefficientDegree(x, Operators.NEGATIVE_INFINITY);
        }
        if (x.equals(symbol)) {
            return new CoefficientDegree(Operators.ONE, Operators.ONE);
        }
        if (x instanceof Number) {
            return new CoefficientDegree(x, Operators.ZERO);
        }
        if (isPowerOf(symbol, x)) {
            return new CoefficientDegree(Operators.ONE, ((Power) x).getExponent());
        }
        if (x instanceof Product) {
            List<Expression> coefficients = new ArrayList<>();
            List<Expression> degrees = new ArrayList<>();
            for (Expression factor : ((Product) x).getFactors()) {
                CoefficientDegree cd = coefficientDegreeMonomialSV(symbol, factor);
                coefficients.add(cd.getCoefficient());
                degrees.add(cd.getDegree());
            }
            return new CoefficientDegree(Operators.product(coefficients), Operators.sum(degrees));
        }
        return CoefficientDegree.UNDEFINED;
    }

    public static Expression coefficientSV(Expression symbol, int k, Expression x) {
        Expression ke = Operators.number(k);
        CoefficientDegree cd = coefficientDegreeMonomialSV(symbol, x);
        if (cd.getDegree().equals(ke)) {
            return cd.getCoefficient();
        }
        if (x instanceof Sum) {
            List<Expression> matching = new ArrayList<>();
            for (Expression term : ((Sum) x).getTerms()) {
                CoefficientDegree termCd = coefficientDegreeMonomialSV(symbol, term);
                if (termCd.getDegree().equals(ke)) {
                    matching.add(termCd.getCoefficient());
                }
            }
            return Operators.sum(matching);
        }
        return Operators.UNDEFINED;
    }

    public static CoefficientDegree leadingCoefficientDegreeSV(Expression symbol, Expression x) {
        CoefficientDegree cd = coefficientDegreeMonomialSV(symbol, x);
        if (!cd.getDegree().isUndefined()) {
            return cd;
        }
        if (!(x instanceof Sum)) {
            return CoefficientDegree.UNDEFINED;
        }
        List<CoefficientDegree> cds = new ArrayList<>();
        List<Expression> degrees = new ArrayList<>();
        for (Expression term : ((Sum) x).getTerms()) {
            CoefficientDegree termCd = coefficientDegreeMonomialSV(symbol, term);
            cds.add(termCd);
            degrees.add(termCd.getDegree());
        }
        Expression degree = Degrees.max(degrees);
        if (degree.isUndefined()) {
            return CoefficientDegree.UNDEFINED;
        }
        List<Expression> leading = new ArrayList<>();
        for (CoefficientDegree termCd : cds) {
            if (termCd.getDegree().equals(degree)) {
                leading.add(termCd.getCoefficient());
            }
        }
        return new CoefficientDegree(Operators.sum(leading), degree);
    }

    public static Expression leadingCoefficientSV(Expression symbol, Expression x) {
        return leadingCoefficientDegreeSV(symbol, x).getCoefficient();
    }

    /**
     * @throws IllegalArgumentException if no term of {@code x} is a monomial in {@code symbol}
     */
    public static List<Expression> coefficientsSV(Expression symbol, Expression x) {
        return Polynomial.toDense(Polynomial.collectCoefficients(symbol, x, false), x);
    }
}
