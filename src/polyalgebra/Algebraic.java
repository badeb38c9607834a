package polyalgebra;

import java.util.ArrayList;

/**
 * Canonicalizer: distributes products over sums and expands positive integer
 * powers of sums, leaving a flat sum of products.
 */
public final class Algebraic {

    private Algebraic() {
    }

    public static Expression expand(Expression x) {
        if (x instanceof Sum) {
            ArrayList<Expression> terms = new ArrayList<>();
            for (Expression term : ((Sum) x).getTerms()) {
                terms.add(expand(term));
            }
            return Operators.sum(terms);
        }
        if (x instanceof Product) {
            Expression result = Operators.ONE;
            for (Expression factor : ((Product) x).getFactors()) {
                result = expandProduct(result, expand(factor));
            }
            return result;
        }
        if (x instanceof Power) {
            Expression base = expand(((Power) x).getBase());
            Expression exponent = expand(((Power) x).getExponent());
            if (base instanceof Sum && exponent instanceof Number && ((Number) exponent).isPositiveInteger()) {
                int n = ((Number) exponent).intValueExact();
                Expression result = base;
                for (int i = 1; i < n; i++) {
                    result = expandProduct(result, base);
                }
                return result;
            }
            return Operators.pow(base, exponent);
        }
        if (x instanceof Function) {
            Function function = (Function) x;
            return Operators.apply(function.getFunctionName(), expand(function.getArgument()));
        }
        return x;
    }

    private static Expression expandProduct(Expression a, Expression b) {
        if (a instanceof Sum) {
            ArrayList<Expression> terms = new ArrayList<>();
            for (Expression term : ((Sum) a).getTerms()) {
                terms.add(expandProduct(term, b));
            }
            return Operators.sum(terms);
        }
        if (b instanceof Sum) {
            return expandProduct(b, a);
        }
        return Operators.multiply(a, b);
    }
}
