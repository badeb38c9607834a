package polyalgebra;

public class QuotientRemainder {
    public static final QuotientRemainder UNDEFINED =
        new QuotientRemainder(Operators.UNDEFINED, Operators.UNDEFINED);

    private final Expression quotient;
    private final Expression remainder;

    public QuotientRemainder(Expression quotient, Expression remainder) {
        this.quotient = quotient;
        this.remainder = remainder;
    }

    public Expression getQuotient() {
        return quotient;
    }

    public Expression getRemainder() {
        return remainder;
    }

    public boolean isUndefined() {
        return quotient.isUndefined() || remainder.isUndefined();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof QuotientRemainder)) {
            return false;
        }
        QuotientRemainder that = (QuotientRemainder) o;
        return quotient.equals(that.quotient) && remainder.equals(that.remainder);
    }

    @Override
    public int hashCode() {
        return 31 * quotient.hashCode() + remainder.hashCode();
    }

    @Override
    public String toString() {
        return "(" + quotient + ", " + remainder + ")";
    }
}
