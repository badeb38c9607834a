package polyalgebra;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

public class PolynomialTest {
    private final Expression x = Operators.symbol("x");
    private final Expression y = Operators.symbol("y");

    private static Expression p(String s) {
        return Parser.parse(s);
    }

    private static Set<Expression> setOf(Expression... xs) {
        return new HashSet<>(Arrays.asList(xs));
    }

    @Test
    public void variablesKeepCompositeIndeterminatesWhole() {
        assertEquals(setOf(x, y, p("sin(z)")), Polynomial.variables(p("x^2 + 2*x*y + sin(z)")));
        assertEquals(setOf(p("x + 1"), y), Polynomial.variables(p("(x + 1)*y")));
        assertEquals(setOf(p("x^(1/2)"), p("y + 1")), Polynomial.variables(p("x^(1/2) + (y + 1)^3")));
        assertTrue(Polynomial.variables(p("42")).isEmpty());
    }

    @Test
    public void classifiesPolynomials() {
        assertTrue(Polynomial.isPolynomial(x, p("x^2 + 2*x + 1")));
        assertFalse(Polynomial.isPolynomial(x, p("1/x")));
        assertTrue(Polynomial.isPolynomial(x, p("a*x^2 + sin(y)")));
        assertFalse(Polynomial.isPolynomial(x, p("x^2 + sin(x)")));
        assertTrue(Polynomial.isMonomial(x, p("3*a*x^4")));
        assertFalse(Polynomial.isMonomial(x, p("x + 1")));
        assertTrue(Polynomial.isMonomial(x, p("y + 1")));
        assertFalse(Polynomial.isPolynomial(x, Operators.UNDEFINED));
    }

    @Test
    public void classifiesMultivariatePolynomials() {
        Set<Expression> xy = Polynomial.symbols(x, y);
        assertTrue(Polynomial.isPolynomialMV(xy, p("x^2*y + y^3 + 3")));
        assertTrue(Polynomial.isMonomialMV(xy, p("a*x*y^2")));
        assertFalse(Polynomial.isPolynomialMV(xy, p("x/y")));
        assertFalse(Polynomial.isMonomialMV(xy, p("x + y")));
    }

    @Test
    public void degrees() {
        assertEquals(Operators.number(4), Polynomial.degree(x, p("3*x^4 + a*x + 1")));
        assertEquals(Operators.NEGATIVE_INFINITY, Polynomial.degree(x, Operators.ZERO));
        assertEquals(Operators.ZERO, Polynomial.degree(x, y));
        assertEquals(Operators.ONE, Polynomial.degree(x, p("x*y")));
        assertEquals(Operators.UNDEFINED, Polynomial.degree(x, p("1/x + x")));
        assertEquals(Operators.UNDEFINED, Polynomial.degree(x, p("sin(x)")));
        assertEquals(Operators.UNDEFINED, Polynomial.degree(x, Operators.UNDEFINED));
    }

    @Test
    public void multivariateDegrees() {
        assertEquals(Operators.number(5), Polynomial.degreeMV(Polynomial.symbols(x, y), p("x^2*y^3 + x*y")));
        assertEquals(Operators.number(3), Polynomial.totalDegree(p("x^2*y + y^2 + z")));
        assertEquals(Operators.number(2), Polynomial.degreeMonomialMV(Polynomial.symbols(x, y), p("5*x*y")));
    }

    @Test
    public void coefficientByDegree() {
        Expression u = p("3*x^2 + a*x + b*x + 5");
        assertEquals(p("a + b"), Polynomial.coefficient(x, 1, u));
        assertEquals(Operators.number(3), Polynomial.coefficient(x, 2, u));
        assertEquals(Operators.number(5), Polynomial.coefficient(x, 0, u));
        assertEquals(Operators.ZERO, Polynomial.coefficient(x, 3, u));
        assertEquals(Operators.UNDEFINED, Polynomial.coefficient(x, 0, p("sin(x)")));
    }

    @Test
    public void leadingCoefficientSumsTiedTerms() {
        CoefficientDegree cd = Polynomial.leadingCoefficientDegree(x, p("2*x^3 + y*x^3 + x"));
        assertEquals(p("2 + y"), cd.getCoefficient());
        assertEquals(Operators.number(3), cd.getDegree());
        assertEquals(Operators.number(5), Polynomial.leadingCoefficient(x, p("5")));
        assertTrue(Polynomial.leadingCoefficientDegree(x, p("x + 1/x")).isUndefined());
    }

    @Test
    public void coefficientDegreeOfMonomial() {
        assertEquals(new CoefficientDegree(p("3*a"), Operators.number(2)),
            Polynomial.coefficientDegreeMonomial(x, p("3*a*x^2")));
        assertTrue(Polynomial.coefficientDegreeMonomial(x, p("x^(1/2)")).isUndefined());
    }

    @Test
    public void denseCoefficients() {
        assertEquals(Arrays.asList(Operators.number(5), Operators.number(2), Operators.ZERO, Operators.ONE),
            Polynomial.coefficients(x, p("x^3 + 2*x + 5")));
        assertEquals(Arrays.asList(p("b"), Operators.ZERO, p("a + 1")),
            Polynomial.coefficients(x, p("(a + 1)*x^2 + b")));
        assertEquals(Arrays.asList(Operators.ZERO), Polynomial.coefficients(x, Operators.ZERO));
    }

    @Test(expected = IllegalArgumentException.class)
    public void denseCoefficientsOfNonPolynomialFail() {
        Polynomial.coefficients(x, p("1/x"));
    }

    @Test(expected = UnsupportedOperationException.class)
    public void denseCoefficientsAreReadOnly() {
        Polynomial.coefficients(x, p("x + 1")).set(0, Operators.ONE);
    }

    @Test
    public void collectsLikeTerms() {
        assertEquals(p("3*x*y"), Polynomial.collectTerms(x, p("x*y + 2*x*y")));
        assertEquals(p("(a + b)*x + c"), Polynomial.collectTerms(x, p("a*x + b*x + c")));
        assertEquals(p("(a - 1)*x^2"), Polynomial.collectTerms(x, p("a*x^2 - x^2")));
        assertEquals(Operators.UNDEFINED, Polynomial.collectTerms(x, p("1/x")));
    }

    @Test
    public void collectsLikeTermsOverSymbolSet() {
        Set<Expression> xy = Polynomial.symbols(x, y);
        assertEquals(p("(a + b)*x*y + x"), Polynomial.collectTermsMV(xy, p("a*x*y + b*x*y + x")));
        CoefficientTerm ct = Polynomial.collectTermsMonomialMV(xy, p("4*c*x*y^2"));
        assertEquals(p("4*c"), ct.getCoefficient());
        assertEquals(p("x*y^2"), ct.getVariablePart());
    }
}
