package polyalgebra;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class Product extends Expression {
    private final List<Expression> factors;

    Product(List<Expression> factors) {
        this.factors = Collections.unmodifiableList(new ArrayList<>(factors));
    }

    public List<Expression> getFactors() {
        return factors;
    }

    static boolean isNegativeTerm(Expression term) {
        if (term instanceof Number) {
            return ((Number) term).signum() < 0;
        }
        if (term instanceof Product) {
            Expression first = ((Product) term).factors.get(0);
            return first instanceof Number && ((Number) first).signum() < 0;
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Product && factors.equals(((Product) o).factors));
    }

    @Override
    public int hashCode() {
        return 37 + factors.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        int start = 0;
        Expression first = factors.get(0);
        if (first instanceof Number) {
            Number coefficient = (Number) first;
            if (coefficient.equals(Operators.MINUS_ONE)) {
                sb.append("-");
            }
            else {
                sb.append(coefficient).append("*");
            }
            start = 1;
        }
        for (int i = start; i < factors.size(); i++) {
            if (i > start) {
                sb.append("*");
            }
            Expression factor = factors.get(i);
            if (factor instanceof Sum) {
                sb.append("(").append(factor).append(")");
            }
            else {
                sb.append(factor);
            }
        }
        return sb.toString();
    }
}
