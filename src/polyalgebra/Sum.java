package polyalgebra;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class Sum extends Expression {
    private final List<Expression> terms;

    Sum(List<Expression> terms) {
        this.terms = Collections.unmodifiableList(new ArrayList<>(terms));
    }

    public List<Expression> getTerms() {
        return terms;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Sum && terms.equals(((Sum) o).terms));
    }

    @Override
    public int hashCode() {
        return 17 + terms.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(terms.get(0));
        for (int i = 1; i < terms.size(); i++) {
            Expression term = terms.get(i);
            if (Product.isNegativeTerm(term)) {
                sb.append(" - ");
                sb.append(term.negate());
            }
            else {
                sb.append(" + ");
                sb.append(term);
            }
        }
        return sb.toString();
    }
}
