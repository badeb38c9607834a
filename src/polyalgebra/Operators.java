package polyalgebra;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Constructors and arithmetic for {@link Expression}. Every result is
 * automatically simplified: nested sums and products are flattened, numbers
 * are folded, like terms and like bases are merged and operands are sorted
 * by {@link ExpressionOrder}, so structurally equal values mean equal
 * canonical forms.
 */
public final class Operators {
    public static final Number ZERO = Number.of(0);
    public static final Number ONE = Number.of(1);
    public static final Number MINUS_ONE = Number.of(-1);
    public static final Expression UNDEFINED = Undefined.INSTANCE;
    public static final Expression NEGATIVE_INFINITY = NegativeInfinity.INSTANCE;

    private Operators() {
    }

    public static Number number(long val) {
        return Number.of(val);
    }

    public static Number number(BigInteger numerator, BigInteger denominator) {
        return new Number(numerator, denominator);
    }

    public static Symbol symbol(String name) {
        return new Symbol(name);
    }

    public static Expression apply(String functionName, Expression argument) {
        if (argument.isUndefined()) {
            return UNDEFINED;
        }
        return new Function(functionName, argument);
    }

    public static Expression add(Expression a, Expression b) {
        return sum(Arrays.asList(a, b));
    }

    public static Expression subtract(Expression a, Expression b) {
        return sum(Arrays.asList(a, negate(b)));
    }

    public static Expression multiply(Expression a, Expression b) {
        return product(Arrays.asList(a, b));
    }

    public static Expression divide(Expression a, Expression b) {
        return product(Arrays.asList(a, pow(b, MINUS_ONE)));
    }

    public static Expression negate(Expression a) {
        return product(Arrays.asList(MINUS_ONE, a));
    }

    public static Expression sum(List<? extends Expression> terms) {
        ArrayList<Expression> flat = new ArrayList<>();
        for (Expression term : terms) {
            if (term.isUndefined()) {
                return UNDEFINED;
            }
            if (term instanceof Sum) {
                flat.addAll(((Sum) term).getTerms());
            }
            else {
                flat.add(term);
            }
        }
        Number constant = ZERO;
        boolean negativeInfinity = false;
        Map<Expression, Number> coefficients = new LinkedHashMap<>();
        for (Expression term : flat) {
            if (term instanceof NegativeInfinity) {
                negativeInfinity = true;
            }
            else if (term instanceof Number) {
                constant = constant.add((Number) term);
            }
            else {
                Number coefficient = coefficientOf(term);
                Expression rest = withoutCoefficient(term);
                Number current = coefficients.get(rest);
                coefficients.put(rest, current == null ? coefficient : current.add(coefficient));
            }
        }
        if (negativeInfinity) {
            return coefficients.isEmpty() ? NEGATIVE_INFINITY : UNDEFINED;
        }
        ArrayList<Expression> result = new ArrayList<>();
        for (Map.Entry<Expression, Number> entry : coefficients.entrySet()) {
            if (!entry.getValue().isZeroValue()) {
                result.add(withCoefficient(entry.getValue(), entry.getKey()));
            }
        }
        Collections.sort(result, ExpressionOrder.INSTANCE);
        if (!constant.isZeroValue()) {
            result.add(0, constant);
        }
        if (result.isEmpty()) {
            return ZERO;
        }
        if (result.size() == 1) {
            return result.get(0);
        }
        return new Sum(result);
    }

    public static Expression product(List<? extends Expression> factors) {
        ArrayList<Expression> flat = new ArrayList<>();
        for (Expression factor : factors) {
            if (factor.isUndefined()) {
                return UNDEFINED;
            }
            if (factor instanceof Product) {
                flat.addAll(((Product) factor).getFactors());
            }
            else {
                flat.add(factor);
            }
        }
        Number coefficient = ONE;
        boolean negativeInfinity = false;
        Map<Expression, Expression> exponents = new LinkedHashMap<>();
        for (Expression factor : flat) {
            if (factor instanceof Number) {
                coefficient = coefficient.multiply((Number) factor);
            }
            else if (factor instanceof NegativeInfinity) {
                negativeInfinity = true;
            }
            else {
                Expression base = factor instanceof Power ? ((Power) factor).getBase() : factor;
                Expression exponent = factor instanceof Power ? ((Power) factor).getExponent() : ONE;
                Expression current = exponents.get(base);
                exponents.put(base, current == null ? exponent : add(current, exponent));
            }
        }
        if (negativeInfinity) {
            return exponents.isEmpty() && coefficient.signum() > 0 ? NEGATIVE_INFINITY : UNDEFINED;
        }
        if (coefficient.isZeroValue()) {
            return ZERO;
        }
        ArrayList<Expression> result = new ArrayList<>();
        boolean merged = false;
        for (Map.Entry<Expression, Expression> entry : exponents.entrySet()) {
            Expression power = pow(entry.getKey(), entry.getValue());
            if (power.isUndefined()) {
                return UNDEFINED;
            }
            if (power instanceof Number || power instanceof Product) {
                merged = true;
            }
            result.add(power);
        }
        if (merged) {
            // a merged power collapsed into a number or a product, fold it again
            result.add(coefficient);
            return product(result);
        }
        Collections.sort(result, ExpressionOrder.INSTANCE);
        if (!coefficient.isOne()) {
            result.add(0, coefficient);
        }
        if (result.isEmpty()) {
            return ONE;
        }
        if (result.size() == 1) {
            return result.get(0);
        }
        return new Product(result);
    }

    public static Expression pow(Expression base, Expression exponent) {
        if (base.isUndefined() || exponent.isUndefined()
            || base instanceof NegativeInfinity || exponent instanceof NegativeInfinity) {
            return UNDEFINED;
        }
        if (!(exponent instanceof Number)) {
            if (base.equals(ONE)) {
                return ONE;
            }
            return new Power(base, exponent);
        }
        Number e = (Number) exponent;
        if (e.isZeroValue()) {
            return base.isZero() ? UNDEFINED : ONE;
        }
        if (e.isOne()) {
            return base;
        }
        if (base instanceof Number) {
            Number b = (Number) base;
            if (e.isInteger()) {
                if (b.isZeroValue() && e.signum() < 0) {
                    return UNDEFINED;
                }
                return b.pow(e.intValueExact());
            }
            if (b.isZeroValue()) {
                return e.signum() > 0 ? ZERO : UNDEFINED;
            }
            if (b.isOne()) {
                return ONE;
            }
            return new Power(b, e);
        }
        if (base instanceof Power && e.isInteger()) {
            Power p = (Power) base;
            return pow(p.getBase(), multiply(p.getExponent(), e));
        }
        if (base instanceof Product && e.isInteger()) {
            ArrayList<Expression> powers = new ArrayList<>();
            for (Expression factor : ((Product) base).getFactors()) {
                powers.add(pow(factor, e));
            }
            return product(powers);
        }
        return new Power(base, e);
    }

    static Number coefficientOf(Expression term) {
        if (term instanceof Number) {
            return (Number) term;
        }
        if (term instanceof Product) {
            Expression first = ((Product) term).getFactors().get(0);
            if (first instanceof Number) {
                return (Number) first;
            }
        }
        return ONE;
    }

    static Expression withoutCoefficient(Expression term) {
        if (term instanceof Number) {
            return ONE;
        }
        if (term instanceof Product) {
            List<Expression> factors = ((Product) term).getFactors();
            if (factors.get(0) instanceof Number) {
                if (factors.size() == 2) {
                    return factors.get(1);
                }
                return new Product(factors.subList(1, factors.size()));
            }
        }
        return term;
    }

    private static Expression withCoefficient(Number coefficient, Expression rest) {
        if (coefficient.isOne()) {
            return rest;
        }
        ArrayList<Expression> factors = new ArrayList<>();
        factors.add(coefficient);
        if (rest instanceof Product) {
            factors.addAll(((Product) rest).getFactors());
        }
        else {
            factors.add(rest);
        }
        return new Product(factors);
    }
}
