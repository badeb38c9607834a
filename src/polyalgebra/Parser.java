package polyalgebra;

import java.math.BigInteger;

/**
 * Reads infix text such as {@code x^2 - 3*x*y + sin(x)/2} into a canonical expression.
 */
public class Parser {
    private final Lexer lexer;

    public Parser(Lexer lexer) {
        this.lexer = lexer;
    }

    public static Expression parse(String input) {
        Parser parser = new Parser(new Lexer(input));
        Expression expr = parser.parseExpr();
        if (!parser.lexer.atEnd()) {
            throw new IllegalArgumentException("unexpected '" + parser.lexer.peek() + "' in " + input);
        }
        return expr;
    }

    public Number parseNumber() {
        BigInteger val = new BigInteger(lexer.peek());
        lexer.next();
        return Operators.number(val, BigInteger.ONE);
    }

    public Expression parseExpr() {
        Expression expr = parseTerm();
        while (lexer.peek().equals("+") || lexer.peek().equals("-")) {
            boolean negative = lexer.peek().equals("-");
            lexer.next();
            Expression term = parseTerm();
            expr = negative ? Operators.subtract(expr, term) : Operators.add(expr, term);
        }
        return expr;
    }

    private Expression parseTerm() {
        Expression term = parseFactor();
        while (lexer.peek().equals("*") || lexer.peek().equals("/")) {
            boolean division = lexer.peek().equals("/");
            lexer.next();
            Expression factor = parseFactor();
            term = division ? Operators.divide(term, factor) : Operators.multiply(term, factor);
        }
        return term;
    }

    public Expression parseFactor() {
        while (lexer.peek().equals("+")) {
            lexer.next();
        }
        if (lexer.peek().equals("-")) {
            lexer.next();
            return Operators.negate(parseFactor());
        }
        Expression base = parsePrimary();
        if (lexer.peek().equals("^")) {
            lexer.next();
            // right associative, binds tighter than a leading sign: -x^2 = -(x^2)
            return Operators.pow(base, parseFactor());
        }
        return base;
    }

    private Expression parsePrimary() {
        String token = lexer.peek();
        if (token.isEmpty()) {
            throw new IllegalArgumentException("unexpected end of input");
        }
        if (token.equals("(")) {
            lexer.next();
            Expression expr = parseExpr();
            expect(")");
            return expr;
        }
        if (Character.isDigit(token.charAt(0))) {
            return parseNumber();
        }
        if (Character.isLetter(token.charAt(0))) {
            lexer.next();
            if (lexer.peek().equals("(")) {
                lexer.next();
                Expression argument = parseExpr();
                expect(")");
                return Operators.apply(token, argument);
            }
            return Operators.symbol(token);
        }
        throw new IllegalArgumentException("unexpected '" + token + "'");
    }

    private void expect(String token) {
        if (!lexer.peek().equals(token)) {
            throw new IllegalArgumentException("expected '" + token + "' but found '" + lexer.peek() + "'");
        }
        lexer.next();
    }
}
