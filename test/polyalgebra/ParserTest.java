package polyalgebra;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class ParserTest {
    private final Symbol x = Operators.symbol("x");

    @Test
    public void readsProductsAndPowers() {
        assertEquals(Operators.multiply(Operators.number(2), x), Parser.parse("2*x"));
        assertEquals(Operators.negate(Operators.pow(x, Operators.number(2))), Parser.parse("-x^2"));
        assertEquals(Operators.pow(x, Operators.MINUS_ONE), Parser.parse("1/x"));
        assertEquals(Parser.parse("x"), Parser.parse("  ( x ) "));
    }

    @Test
    public void readsFunctionCalls() {
        Expression e = Parser.parse("sin(x + 1)");
        assertTrue(e instanceof Function);
        assertEquals("sin", ((Function) e).getFunctionName());
        assertEquals(Parser.parse("1 + x"), ((Function) e).getArgument());
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsDanglingOperator() {
        Parser.parse("x +");
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsUnbalancedParenthesis() {
        Parser.parse("(x");
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsUnknownCharacter() {
        Parser.parse("x $ 1");
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsTrailingInput() {
        Parser.parse("x y");
    }
}
