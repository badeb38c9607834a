package polyalgebra;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import java.util.Arrays;

public class SingleVariablePolynomialTest {
    private final Expression x = Operators.symbol("x");

    private static Expression p(String s) {
        return Parser.parse(s);
    }

    @Test
    public void acceptsOnlyNumericCoefficients() {
        assertTrue(SingleVariablePolynomial.isPolynomialSV(x, p("3*x^2 + x + 1")));
        assertTrue(SingleVariablePolynomial.isMonomialSV(x, p("-2*x^5")));
        assertFalse(SingleVariablePolynomial.isPolynomialSV(x, p("a*x")));
        assertFalse(SingleVariablePolynomial.isMonomialSV(x, p("y")));
        assertTrue(Polynomial.isMonomial(x, p("y")));
    }

    @Test
    public void degrees() {
        assertEquals(Operators.number(2), SingleVariablePolynomial.degreeSV(x, p("3*x^2 + x + 1")));
        assertEquals(Operators.NEGATIVE_INFINITY, SingleVariablePolynomial.degreeSV(x, Operators.ZERO));
        assertEquals(Operators.UNDEFINED, SingleVariablePolynomial.degreeSV(x, p("x + y")));
        assertEquals(Operators.number(3), SingleVariablePolynomial.degreeMonomialSV(x, p("7*x^3")));
    }

    @Test
    public void coefficients() {
        Expression u = p("3*x^2 + x + 1");
        assertEquals(new CoefficientDegree(Operators.ZERO, Operators.NEGATIVE_INFINITY),
            SingleVariablePolynomial.coefficientDegreeMonomialSV(x, Operators.ZERO));
        assertEquals(Operators.number(3), SingleVariablePolynomial.coefficientSV(x, 2, u));
        assertEquals(Operators.ONE, SingleVariablePolynomial.coefficientSV(x, 1, u));
        assertEquals(Operators.number(3), SingleVariablePolynomial.leadingCoefficientSV(x, u));
        assertEquals(Operators.number(4), SingleVariablePolynomial.coefficientMonomialSV(x, p("4*x^3")));
        assertEquals(Operators.UNDEFINED, SingleVariablePolynomial.coefficientMonomialSV(x, p("4*y")));
        assertTrue(SingleVariablePolynomial.leadingCoefficientDegreeSV(x, p("x + y")).isUndefined());
    }

    @Test
    public void denseCoefficients() {
        assertEquals(Arrays.asList(Operators.number(5), Operators.number(2), Operators.ZERO, Operators.ONE),
            SingleVariablePolynomial.coefficientsSV(x, p("x^3 + 2*x + 5")));
    }

    @Test(expected = IllegalArgumentException.class)
    public void denseCoefficientsRejectSymbolicCoefficients() {
        SingleVariablePolynomial.coefficientsSV(x, p("a*x"));
    }
}
