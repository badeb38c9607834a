package polyalgebra;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Univariate polynomial algorithms: long division, re-expansion in a
 * polynomial base and (extended) Euclidean GCD.
 */
public final class PolynomialDivision {
    private static final Logger log = LogManager.getLogger(PolynomialDivision.class);

    private PolynomialDivision() {
    }

    /**
     * Long division of {@code u} by {@code v} in {@code symbol}. When {@code v}
     * has degree below one it is treated as a scalar: the result is
     * {@code (expand(u/v), 0)}.
     */
    public static QuotientRemainder divide(Expression symbol, Expression u, Expression v) {
        Expression n = Polynomial.degree(symbol, v);
        if (n.isUndefined()) {
            log.debug("divisor {} is not a polynomial in {}", v, symbol);
            return QuotientRemainder.UNDEFINED;
        }
        if (Degrees.compare(n, Operators.ONE) < 0) {
            return new QuotientRemainder(Algebraic.expand(u.dividedBy(v)), Operators.ZERO);
        }
        Expression lcv = Polynomial.leadingCoefficient(symbol, v);
        Expression w = Algebraic.expand(v.minus(lcv.times(symbol.pow(n))));
        Expression q = Operators.ZERO;
        Expression r = u;
        while (true) {
            Expression m = Polynomial.degree(symbol, r);
            if (m.isUndefined()) {
                log.debug("dividend {} is not a polynomial in {}", r, symbol);
                return QuotientRemainder.UNDEFINED;
            }
            if (Degrees.compare(m, n) < 0) {
                break;
            }
            Expression lcr = Polynomial.leadingCoefficient(symbol, r);
            Expression s = lcr.dividedBy(lcv);
            Expression z = symbol.pow(m.minus(n));
            q = q.plus(s.times(z));
            r = Algebraic.expand(r.minus(lcr.times(symbol.pow(m))).minus(w.times(s).times(z)));
            log.trace("divide step: degree {} quotient {} remainder {}", m, q, r);
        }
        return new QuotientRemainder(q, r);
    }

    public static Expression quot(Expression symbol, Expression u, Expression v) {
        return divide(symbol, u, v).getQuotient();
    }

    public static Expression remainder(Expression symbol, Expression u, Expression v) {
        return divide(symbol, u, v).getRemainder();
    }

    /**
     * Rewrites {@code u} as a polynomial in {@code t} whose coefficients are
     * remainders modulo {@code v}, so that substituting {@code v} for {@code t}
     * gives back {@code u}. {@code v} must have degree at least one in {@code symbol}.
     */
    public static Expression polynomialExpansion(Expression symbol, Expression t, Expression u, Expression v) {
        Expression n = Polynomial.degree(symbol, v);
        if (n.isUndefined() || Degrees.compare(n, Operators.ONE) < 0) {
            return Operators.UNDEFINED;
        }
        Expression expansion = expandInBase(symbol, t, u, v);
        if (expansion.isUndefined()) {
            return Operators.UNDEFINED;
        }
        return Polynomial.collectTerms(t, expansion);
    }

    private static Expression expandInBase(Expression symbol, Expression t, Expression x, Expression v) {
        if (x.isZero()) {
            return Operators.ZERO;
        }
        QuotientRemainder qr = divide(symbol, x, v);
        if (qr.isUndefined()) {
            return Operators.UNDEFINED;
        }
        Expression digits = expandInBase(symbol, t, qr.getQuotient(), v);
        return Algebraic.expand(t.times(digits).plus(qr.getRemainder()));
    }

    /**
     * Monic greatest common divisor of {@code u} and {@code v} in {@code symbol}.
     */
    public static Expression gcd(Expression symbol, Expression u, Expression v) {
        if (u.isZero() && v.isZero()) {
            return Operators.ZERO;
        }
        Expression x = u;
        Expression y = v;
        while (!y.isZero()) {
            Expression r = remainder(symbol, x, y);
            if (r.isUndefined()) {
                return Operators.UNDEFINED;
            }
            log.debug("gcd step: {} mod {} = {}", x, y, r);
            x = y;
            y = r;
        }
        return Algebraic.expand(x.dividedBy(Polynomial.leadingCoefficient(symbol, x)));
    }

    /**
     * Monic GCD {@code g} with Bezout coefficients {@code a}, {@code b} such that
     * {@code expand(a*u + b*v) = g}.
     */
    public static GcdResult extendedGcd(Expression symbol, Expression u, Expression v) {
        if (u.isZero() && v.isZero()) {
            return new GcdResult(Operators.ZERO, Operators.ZERO, Operators.ZERO);
        }
        // x = ax*u + bx*v and y = ay*u + by*v hold on every pass
        Expression x = u;
        Expression y = v;
        Expression ax = Operators.ONE;
        Expression bx = Operators.ZERO;
        Expression ay = Operators.ZERO;
        Expression by = Operators.ONE;
        while (!y.isZero()) {
            QuotientRemainder qr = divide(symbol, x, y);
            if (qr.isUndefined()) {
                return GcdResult.UNDEFINED;
            }
            Expression q = qr.getQuotient();
            Expression nextAy = Algebraic.expand(ax.minus(q.times(ay)));
            Expression nextBy = Algebraic.expand(bx.minus(q.times(by)));
            log.debug("extended gcd step: quotient {} remainder {}", q, qr.getRemainder());
            x = y;
            y = qr.getRemainder();
            ax = ay;
            ay = nextAy;
            bx = by;
            by = nextBy;
        }
        Expression c = Polynomial.leadingCoefficient(symbol, x);
        return new GcdResult(Algebraic.expand(x.dividedBy(c)), Algebraic.expand(ax.dividedBy(c)),
            Algebraic.expand(bx.dividedBy(c)));
    }
}
