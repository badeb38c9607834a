package polyalgebra;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Canonical operand order. A term is keyed by its non-numeric factors,
 * compared from the last factor backwards (base first, then exponent),
 * and then by its numeric coefficient, so {@code 1 < x < 2*x < x^2 < y}.
 */
final class ExpressionOrder implements Comparator<Expression> {
    static final ExpressionOrder INSTANCE = new ExpressionOrder();

    private ExpressionOrder() {
    }

    @Override
    public int compare(Expression a, Expression b) {
        if (a.equals(b)) {
            return 0;
        }
        if (a instanceof Number && b instanceof Number) {
            return ((Number) a).compareTo((Number) b);
        }
        int c = compareFactorLists(factorsOf(a), factorsOf(b));
        if (c != 0) {
            return c;
        }
        return Operators.coefficientOf(a).compareTo(Operators.coefficientOf(b));
    }

    private static List<Expression> factorsOf(Expression x) {
        if (x instanceof Number) {
            return Collections.emptyList();
        }
        Expression rest = Operators.withoutCoefficient(x);
        if (rest instanceof Product) {
            return ((Product) rest).getFactors();
        }
        List<Expression> single = new ArrayList<>();
        single.add(rest);
        return single;
    }

    private int compareFactorLists(List<Expression> fa, List<Expression> fb) {
        int i = fa.size() - 1;
        int j = fb.size() - 1;
        while (i >= 0 && j >= 0) {
            int c = compareFactors(fa.get(i), fb.get(j));
            if (c != 0) {
                return c;
            }
            --i;
            --j;
        }
        return Integer.compare(fa.size(), fb.size());
    }

    private int compareFactors(Expression a, Expression b) {
        Expression baseA = a instanceof Power ? ((Power) a).getBase() : a;
        Expression baseB = b instanceof Power ? ((Power) b).getBase() : b;
        int c = compareBases(baseA, baseB);
        if (c != 0) {
            return c;
        }
        Expression exponentA = a instanceof Power ? ((Power) a).getExponent() : Operators.ONE;
        Expression exponentB = b instanceof Power ? ((Power) b).getExponent() : Operators.ONE;
        return compare(exponentA, exponentB);
    }

    private int compareBases(Expression a, Expression b) {
        int rankA = rank(a);
        int rankB = rank(b);
        if (rankA != rankB) {
            return Integer.compare(rankA, rankB);
        }
        if (a instanceof Number) {
            return ((Number) a).compareTo((Number) b);
        }
        if (a instanceof Symbol) {
            return ((Symbol) a).getName().compareTo(((Symbol) b).getName());
        }
        if (a instanceof Function) {
            Function fa = (Function) a;
            Function fb = (Function) b;
            int c = fa.getFunctionName().compareTo(fb.getFunctionName());
            return c != 0 ? c : compare(fa.getArgument(), fb.getArgument());
        }
        if (a instanceof Sum) {
            return compareOperands(((Sum) a).getTerms(), ((Sum) b).getTerms());
        }
        if (a instanceof Product) {
            return compareOperands(((Product) a).getFactors(), ((Product) b).getFactors());
        }
        if (a instanceof Power) {
            return compareFactors(a, b);
        }
        return 0;
    }

    private int compareOperands(List<Expression> la, List<Expression> lb) {
        int i = la.size() - 1;
        int j = lb.size() - 1;
        while (i >= 0 && j >= 0) {
            int c = compare(la.get(i), lb.get(j));
            if (c != 0) {
                return c;
            }
            --i;
            --j;
        }
        return Integer.compare(la.size(), lb.size());
    }

    private static int rank(Expression x) {
        if (x instanceof Number) {
            return 0;
        }
        if (x instanceof Symbol) {
            return 1;
        }
        if (x instanceof Function) {
            return 2;
        }
        if (x instanceof Sum) {
            return 3;
        }
        if (x instanceof Product) {
            return 4;
        }
        if (x instanceof Power) {
            return 5;
        }
        return x instanceof NegativeInfinity ? 6 : 7;
    }
}
