package polyalgebra;

import java.util.Set;

/**
 * Free-of predicates over the expression tree. {@code Undefined} is never
 * free of anything, so it cannot pass for a constant coefficient.
 */
public final class Structure {

    private Structure() {
    }

    public static boolean freeOf(Expression symbol, Expression x) {
        if (x.equals(symbol) || x.isUndefined()) {
            return false;
        }
        if (x instanceof Sum) {
            for (Expression term : ((Sum) x).getTerms()) {
                if (!freeOf(symbol, term)) {
                    return false;
                }
            }
            return true;
        }
        if (x instanceof Product) {
            for (Expression factor : ((Product) x).getFactors()) {
                if (!freeOf(symbol, factor)) {
                    return false;
                }
            }
            return true;
        }
        if (x instanceof Power) {
            return freeOf(symbol, ((Power) x).getBase()) && freeOf(symbol, ((Power) x).getExponent());
        }
        if (x instanceof Function) {
            return freeOf(symbol, ((Function) x).getArgument());
        }
        return true;
    }

    public static boolean freeOfSet(Set<Expression> symbols, Expression x) {
        if (x.isUndefined()) {
            return false;
        }
        for (Expression symbol : symbols) {
            if (!freeOf(symbol, x)) {
                return false;
            }
        }
        return true;
    }
}
