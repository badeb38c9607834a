package polyalgebra;

/**
 * Greatest common divisor {@code g} of {@code u} and {@code v} together with
 * Bezout coefficients satisfying {@code a*u + b*v = g}.
 */
public class GcdResult {
    public static final GcdResult UNDEFINED =
        new GcdResult(Operators.UNDEFINED, Operators.UNDEFINED, Operators.UNDEFINED);

    private final Expression gcd;
    private final Expression a;
    private final Expression b;

    public GcdResult(Expression gcd, Expression a, Expression b) {
        this.gcd = gcd;
        this.a = a;
        this.b = b;
    }

    public Expression getGcd() {
        return gcd;
    }

    public Expression getA() {
        return a;
    }

    public Expression getB() {
        return b;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GcdResult)) {
            return false;
        }
        GcdResult that = (GcdResult) o;
        return gcd.equals(that.gcd) && a.equals(that.a) && b.equals(that.b);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * gcd.hashCode() + a.hashCode()) + b.hashCode();
    }

    @Override
    public String toString() {
        return "(" + gcd + ", " + a + ", " + b + ")";
    }
}
