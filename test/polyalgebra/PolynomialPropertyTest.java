package polyalgebra;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Random;

@RunWith(Parameterized.class)
public class PolynomialPropertyTest {
    private static final Symbol X = Operators.symbol("x");
    private static final Symbol Y = Operators.symbol("y");

    private final Expression u;
    private final Expression v;
    private final Expression mixed;
    private final int degree;

    public PolynomialPropertyTest(Expression u, Expression v, Expression mixed, int degree) {
        this.u = u;
        this.v = v;
        this.mixed = mixed;
        this.degree = degree;
    }

    @Parameters
    public static Collection<Object[]> prepareData() {
        Random random = new Random(20240611L);
        int testNum = 60;
        Object[][] object = new Object[testNum][];
        for (int i = 0; i < testNum; i++) {
            int degree = 1 + random.nextInt(4);
            Expression u = randomPolynomial(random, degree, 5);
            Expression v = randomPolynomial(random, 1 + random.nextInt(3), 3);
            int position = random.nextInt(degree);
            Expression mixed = u.plus(Y.times(X.pow(Operators.number(position))));
            object[i] = new Object[]{u, v, mixed, degree};
        }
        return Arrays.asList(object);
    }

    // nonzero constant and leading terms keep the result a sum of the requested degree
    private static Expression randomPolynomial(Random random, int degree, int bound) {
        List<Expression> terms = new ArrayList<>();
        for (int k = 0; k <= degree; k++) {
            int c = random.nextInt(2 * bound + 1) - bound;
            if ((k == 0 || k == degree) && c == 0) {
                c = 1;
            }
            terms.add(Operators.number(c).times(X.pow(Operators.number(k))));
        }
        return Operators.sum(terms);
    }

    @Test
    public void polynomialsHaveDefinedDegree() {
        assertTrue(Polynomial.isPolynomial(X, u));
        assertEquals(Operators.number(degree), Polynomial.degree(X, u));
        assertTrue(Polynomial.isPolynomial(X, mixed));
        assertFalse(Polynomial.degree(X, mixed).isUndefined());
        assertTrue(SingleVariablePolynomial.isPolynomialSV(X, u));
        assertFalse(SingleVariablePolynomial.isPolynomialSV(X, mixed));
    }

    @Test
    public void coefficientsReconstructPolynomial() {
        for (Expression w : Arrays.asList(u, mixed)) {
            List<Expression> terms = new ArrayList<>();
            for (int k = 0; k <= degree; k++) {
                terms.add(Polynomial.coefficient(X, k, w).times(X.pow(Operators.number(k))));
            }
            assertEquals(Algebraic.expand(w), Algebraic.expand(Operators.sum(terms)));
        }
    }

    @Test
    public void denseCoefficientsMatchCoefficientByDegree() {
        for (Expression w : Arrays.asList(u, mixed)) {
            List<Expression> dense = Polynomial.coefficients(X, w);
            assertEquals(degree + 1, dense.size());
            for (int k = 0; k <= degree; k++) {
                assertEquals(Polynomial.coefficient(X, k, w), dense.get(k));
            }
        }
        assertEquals(Polynomial.coefficients(X, u), SingleVariablePolynomial.coefficientsSV(X, u));
    }

    @Test
    public void divisionIdentity() {
        for (Expression w : Arrays.asList(u, mixed)) {
            QuotientRemainder qr = PolynomialDivision.divide(X, w, v);
            assertEquals(Algebraic.expand(w), Algebraic.expand(qr.getQuotient().times(v).plus(qr.getRemainder())));
            Expression r = qr.getRemainder();
            assertTrue(r.isZero() || Degrees.compare(Polynomial.degree(X, r), Polynomial.degree(X, v)) < 0);
        }
    }

    @Test
    public void gcdWithZeroIsMonicInput() {
        Expression expected = Algebraic.expand(u.dividedBy(Polynomial.leadingCoefficient(X, u)));
        assertEquals(expected, PolynomialDivision.gcd(X, u, Operators.ZERO));
    }

    @Test
    public void bezoutIdentity() {
        GcdResult result = PolynomialDivision.extendedGcd(X, u, v);
        assertEquals(result.getGcd(), Algebraic.expand(result.getA().times(u).plus(result.getB().times(v))));
        assertEquals(PolynomialDivision.gcd(X, u, v), result.getGcd());
        assertEquals(Operators.ONE, Polynomial.leadingCoefficient(X, result.getGcd()));
    }
}
