package polyalgebra;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structural polynomial queries over one symbol or a set of symbols:
 * classification, degrees, coefficients and like-term collection.
 * Ill-defined queries answer {@link Operators#UNDEFINED}.
 */
public final class Polynomial {
    private static final Logger log = LogManager.getLogger(Polynomial.class);

    private Polynomial() {
    }

    public static Set<Expression> symbols(Expression... xs) {
        return new LinkedHashSet<>(Arrays.asList(xs));
    }

    /**
     * Atomic sub-expressions of {@code x}. Bases of positive integer powers are
     * kept whole, as are other powers and sums appearing as product factors.
     */
    public static Set<Expression> variables(Expression x) {
        Set<Expression> keep = new LinkedHashSet<>();
        collectVariables(x, keep);
        return keep;
    }

    private static void collectVariables(Expression x, Set<Expression> keep) {
        if (x instanceof Number) {
            return;
        }
        if (x.isPositiveIntegerPower()) {
            keep.add(((Power) x).getBase());
        }
        else if (x instanceof Power) {
            keep.add(x);
        }
        else if (x instanceof Sum) {
            for (Expression term : ((Sum) x).getTerms()) {
                collectVariables(term, keep);
            }
        }
        else if (x instanceof Product) {
            for (Expression factor : ((Product) x).getFactors()) {
                if (factor instanceof Sum) {
                    keep.add(factor);
                }
                else {
                    collectVariables(factor, keep);
                }
            }
        }
        else {
            keep.add(x);
        }
    }

    private static boolean isPowerOf(Expression symbol, Expression x) {
        return x.isPositiveIntegerPower() && ((Power) x).getBase().equals(symbol);
    }

    private static boolean isPowerOf(Set<Expression> symbols, Expression x) {
        return x.isPositiveIntegerPower() && symbols.contains(((Power) x).getBase());
    }

    public static boolean isMonomial(Expression symbol, Expression x) {
        if (x.equals(symbol) || x instanceof Number || isPowerOf(symbol, x)) {
            return true;
        }
        if (x instanceof Product) {
            for (Expression factor : ((Product) x).getFactors()) {
                if (!isMonomial(symbol, factor)) {
                    return false;
                }
            }
            return true;
        }
        return Structure.freeOf(symbol, x);
    }

    public static boolean isMonomialMV(Set<Expression> symbols, Expression x) {
        if (symbols.contains(x) || x instanceof Number || isPowerOf(symbols, x)) {
            return true;
        }
        if (x instanceof Product) {
            for (Expression factor : ((Product) x).getFactors()) {
                if (!isMonomialMV(symbols, factor)) {
                    return false;
                }
            }
            return true;
        }
        return Structure.freeOfSet(symbols, x);
    }

    public static boolean isPolynomial(Expression symbol, Expression x) {
        if (x instanceof Sum) {
            for (Expression term : ((Sum) x).getTerms()) {
                if (!isMonomial(symbol, term)) {
                    return false;
                }
            }
            return true;
        }
        return isMonomial(symbol, x);
    }

    public static boolean isPolynomialMV(Set<Expression> symbols, Expression x) {
        if (x instanceof Sum) {
            for (Expression term : ((Sum) x).getTerms()) {
                if (!isMonomialMV(symbols, term)) {
                    return false;
                }
            }
            return true;
        }
        return isMonomialMV(symbols, x);
    }

    public static Expression degreeMonomial(Expression symbol, Expression x) {
        if (x.isZero()) {
            return Operators.NEGATIVE_INFINITY;
        }
        if (x.equals(symbol)) {
            return Operators.ONE;
        }
        if (x instanceof Number) {
            return Operators.ZERO;
        }
        if (isPowerOf(symbol, x)) {
            return ((Power) x).getExponent();
        }
        if (x instanceof Product) {
            List<Expression> degrees = new ArrayList<>();
            for (Expression factor : ((Product) x).getFactors()) {
                degrees.add(degreeMonomial(symbol, factor));
            }
            return Operators.sum(degrees);
        }
        return Structure.freeOf(symbol, x) ? Operators.ZERO : Operators.UNDEFINED;
    }

    public static Expression degreeMonomialMV(Set<Expression> symbols, Expression x) {
        if (x.isZero()) {
            return Operators.NEGATIVE_INFINITY;
        }
        if (symbols.contains(x)) {
            return Operators.ONE;
        }
        if (x instanceof Number) {
            return Operators.ZERO;
        }
        if (isPowerOf(symbols, x)) {
            return ((Power) x).getExponent();
        }
        if (x instanceof Product) {
            List<Expression> degrees = new ArrayList<>();
            for (Expression factor : ((Product) x).getFactors()) {
                degrees.add(degreeMonomialMV(symbols, factor));
            }
            return Operators.sum(degrees);
        }
        return Structure.freeOfSet(symbols, x) ? Operators.ZERO : Operators.UNDEFINED;
    }

    public static Expression degree(Expression symbol, Expression x) {
        Expression d = degreeMonomial(symbol, x);
        if (!d.isUndefined()) {
            return d;
        }
        if (x instanceof Sum) {
            List<Expression> degrees = new ArrayList<>();
            for (Expression term : ((Sum) x).getTerms()) {
                degrees.add(degreeMonomial(symbol, term));
            }
            return Degrees.max(degrees);
        }
        return Operators.UNDEFINED;
    }

    public static Expression degreeMV(Set<Expression> symbols, Expression x) {
        Expression d = degreeMonomialMV(symbols, x);
        if (!d.isUndefined()) {
            return d;
        }
        if (x instanceof Sum) {
            List<Expression> degrees = new ArrayList<>();
            for (Expression term : ((Sum) x).getTerms()) {
                degrees.add(degreeMonomialMV(symbols, term));
            }
            return Degrees.max(degrees);
        }
        return Operators.UNDEFINED;
    }

    public static Expression totalDegree(Expression x) {
        return degreeMV(variables(x), x);
    }

    public static CoefficientDegree coefficientDegreeMonomial(Expression symbol, Expression x) {
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
                CoefficientDegree cd = coefficientDegreeMonomial(symbol, factor);
                coefficients.add(cd.getCoefficient());
                degrees.add(cd.getDegree());
            }
            return new CoefficientDegree(Operators.product(coefficients), Operators.sum(degrees));
        }
        if (Structure.freeOf(symbol, x)) {
            return new CoefficientDegree(x, Operators.ZERO);
        }
        return CoefficientDegree.UNDEFINED;
    }

    /**
     * Coefficient of {@code symbol^k} in {@code x}. Terms of other degrees are ignored.
     */
    public static Expression coefficient(Expression symbol, int k, Expression x) {
        Expression ke = Operators.number(k);
        CoefficientDegree cd = coefficientDegreeMonomial(symbol, x);
        if (cd.getDegree().equals(ke)) {
            return cd.getCoefficient();
        }
        if (x instanceof Sum) {
            List<Expression> matching = new ArrayList<>();
            for (Expression term : ((Sum) x).getTerms()) {
                CoefficientDegree termCd = coefficientDegreeMonomial(symbol, term);
                if (termCd.getDegree().equals(ke)) {
                    matching.add(termCd.getCoefficient());
                }
            }
            return Operators.sum(matching);
        }
        return Operators.UNDEFINED;
    }

    public static CoefficientDegree leadingCoefficientDegree(Expression symbol, Expression x) {
        CoefficientDegree cd = coefficientDegreeMonomial(symbol, x);
        if (!cd.getDegree().isUndefined()) {
            return cd;
        }
        if (x instanceof Sum) {
            return leadingOf(symbol, ((Sum) x).getTerms());
        }
        return CoefficientDegree.UNDEFINED;
    }

    private static CoefficientDegree leadingOf(Expression symbol, List<Expression> terms) {
        List<CoefficientDegree> cds = new ArrayList<>();
        List<Expression> degrees = new ArrayList<>();
        for (Expression term : terms) {
            CoefficientDegree cd = coefficientDegreeMonomial(symbol, term);
            cds.add(cd);
            degrees.add(cd.getDegree());
        }
        Expression degree = Degrees.max(degrees);
        if (degree.isUndefined()) {
            return CoefficientDegree.UNDEFINED;
        }
        List<Expression> leading = new ArrayList<>();
        for (CoefficientDegree cd : cds) {
            if (cd.getDegree().equals(degree)) {
                leading.add(cd.getCoefficient());
            }
        }
        return new CoefficientDegree(Operators.sum(leading), degree);
    }

    public static Expression leadingCoefficient(Expression symbol, Expression x) {
        return leadingCoefficientDegree(symbol, x).getCoefficient();
    }

    /**
     * Dense coefficient vector of {@code x} in {@code symbol}: entry k is the
     * coefficient of {@code symbol^k}, zero where no term has that degree.
     *
     * @throws IllegalArgumentException if no term of {@code x} is a monomial in {@code symbol}
     */
    public static List<Expression> coefficients(Expression symbol, Expression x) {
        return toDense(collectCoefficients(symbol, x, true), x);
    }

    static List<ExponentCoefficient> collectCoefficients(Expression symbol, Expression x, boolean freeOfFallback) {
        List<ExponentCoefficient> collected = new ArrayList<>();
        if (x.equals(symbol)) {
            collected.add(new ExponentCoefficient(1, Operators.ONE));
        }
        else if (x instanceof Number) {
            collected.add(new ExponentCoefficient(0, x));
        }
        else if (isPowerOf(symbol, x)) {
            collected.add(new ExponentCoefficient(((Number) ((Power) x).getExponent()).intValueExact(), Operators.ONE));
        }
        else if (x instanceof Sum) {
            for (Expression term : ((Sum) x).getTerms()) {
                collected.addAll(collectCoefficients(symbol, term, freeOfFallback));
            }
        }
        else if (x instanceof Product) {
            List<Expression> factors = ((Product) x).getFactors();
            collected = collectCoefficients(symbol, factors.get(0), freeOfFallback);
            for (int i = 1; i < factors.size(); i++) {
                collected = convolve(collected, collectCoefficients(symbol, factors.get(i), freeOfFallback));
            }
        }
        else if (freeOfFallback && Structure.freeOf(symbol, x)) {
            collected.add(new ExponentCoefficient(0, x));
        }
        else {
            log.debug("dropping {}: not a monomial in {}", x, symbol);
        }
        return collected;
    }

    private static List<ExponentCoefficient> convolve(List<ExponentCoefficient> a, List<ExponentCoefficient> b) {
        List<ExponentCoefficient> result = new ArrayList<>();
        for (ExponentCoefficient ea : a) {
            for (ExponentCoefficient eb : b) {
                result.add(ea.combine(eb));
            }
        }
        return result;
    }

    static List<Expression> toDense(List<ExponentCoefficient> collected, Expression x) {
        if (collected.isEmpty()) {
            throw new IllegalArgumentException("no coefficients can be collected from " + x);
        }
        int degree = 0;
        for (ExponentCoefficient ec : collected) {
            degree = Math.max(degree, ec.getExponent());
        }
        Expression[] buckets = new Expression[degree + 1];
        Arrays.fill(buckets, Operators.ZERO);
        for (ExponentCoefficient ec : collected) {
            buckets[ec.getExponent()] = buckets[ec.getExponent()].plus(ec.getCoefficient());
        }
        return Collections.unmodifiableList(Arrays.asList(buckets));
    }

    public static CoefficientTerm collectTermsMonomial(Expression symbol, Expression x) {
        if (x.equals(symbol) || isPowerOf(symbol, x)) {
            return new CoefficientTerm(Operators.ONE, x);
        }
        if (x instanceof Number) {
            return new CoefficientTerm(x, Operators.ONE);
        }
        if (x instanceof Product) {
            CoefficientTerm result = null;
            for (Expression factor : ((Product) x).getFactors()) {
                CoefficientTerm ct = collectTermsMonomial(symbol, factor);
                result = result == null ? ct : result.mul(ct);
            }
            return result;
        }
        if (Structure.freeOf(symbol, x)) {
            return new CoefficientTerm(x, Operators.ONE);
        }
        return CoefficientTerm.UNDEFINED;
    }

    public static CoefficientTerm collectTermsMonomialMV(Set<Expression> symbols, Expression x) {
        if (symbols.contains(x) || isPowerOf(symbols, x)) {
            return new CoefficientTerm(Operators.ONE, x);
        }
        if (x instanceof Number) {
            return new CoefficientTerm(x, Operators.ONE);
        }
        if (x instanceof Product) {
            CoefficientTerm result = null;
            for (Expression factor : ((Product) x).getFactors()) {
                CoefficientTerm ct = collectTermsMonomialMV(symbols, factor);
                result = result == null ? ct : result.mul(ct);
            }
            return result;
        }
        if (Structure.freeOfSet(symbols, x)) {
            return new CoefficientTerm(x, Operators.ONE);
        }
        return CoefficientTerm.UNDEFINED;
    }

    /**
     * Merges the terms of {@code x} that share a variable part in {@code symbol},
     * e.g. {@code a*x + b*x} becomes {@code (a + b)*x}.
     */
    public static Expression collectTerms(Expression symbol, Expression x) {
        if (x instanceof Sum) {
            List<CoefficientTerm> terms = new ArrayList<>();
            for (Expression term : ((Sum) x).getTerms()) {
                terms.add(collectTermsMonomial(symbol, term));
            }
            return groupByVariablePart(terms);
        }
        CoefficientTerm ct = collectTermsMonomial(symbol, x);
        return ct.getCoefficient().isUndefined() ? Operators.UNDEFINED : ct.toExpression();
    }

    public static Expression collectTermsMV(Set<Expression> symbols, Expression x) {
        if (x instanceof Sum) {
            List<CoefficientTerm> terms = new ArrayList<>();
            for (Expression term : ((Sum) x).getTerms()) {
                terms.add(collectTermsMonomialMV(symbols, term));
            }
            return groupByVariablePart(terms);
        }
        CoefficientTerm ct = collectTermsMonomialMV(symbols, x);
        return ct.getCoefficient().isUndefined() ? Operators.UNDEFINED : ct.toExpression();
    }

    private static Expression groupByVariablePart(List<CoefficientTerm> terms) {
        Map<Expression, List<Expression>> groups = new LinkedHashMap<>();
        for (CoefficientTerm term : terms) {
            List<Expression> group = groups.get(term.getVariablePart());
            if (group == null) {
                group = new ArrayList<>();
                groups.put(term.getVariablePart(), group);
            }
            group.add(term.getCoefficient());
        }
        List<Expression> result = new ArrayList<>();
        for (Map.Entry<Expression, List<Expression>> entry : groups.entrySet()) {
            result.add(Operators.sum(entry.getValue()).times(entry.getKey()));
        }
        return Operators.sum(result);
    }
}
