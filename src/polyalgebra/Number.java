package polyalgebra;

import java.math.BigInteger;

/**
 * Exact rational number, always stored in lowest terms with a positive denominator.
 */
public final class Number extends Expression implements Comparable<Number> {
    private final BigInteger numerator;
    private final BigInteger denominator;

    Number(BigInteger numerator, BigInteger denominator) {
        if (denominator.signum() == 0) {
            throw new ArithmeticException("zero denominator");
        }
        if (denominator.signum() < 0) {
            numerator = numerator.negate();
            denominator = denominator.negate();
        }
        BigInteger gcd = numerator.gcd(denominator);
        if (!gcd.equals(BigInteger.ONE) && gcd.signum() != 0) {
            numerator = numerator.divide(gcd);
            denominator = denominator.divide(gcd);
        }
        this.numerator = numerator;
        this.denominator = denominator;
    }

    static Number of(long val) {
        return new Number(BigInteger.valueOf(val), BigInteger.ONE);
    }

    public BigInteger getNumerator() {
        return numerator;
    }

    public BigInteger getDenominator() {
        return denominator;
    }

    public boolean isInteger() {
        return denominator.equals(BigInteger.ONE);
    }

    public boolean isPositiveInteger() {
        return isInteger() && numerator.signum() > 0;
    }

    boolean isZeroValue() {
        return numerator.signum() == 0;
    }

    public boolean isOne() {
        return numerator.equals(BigInteger.ONE) && isInteger();
    }

    public int signum() {
        return numerator.signum();
    }

    /**
     * @throws ArithmeticException if the value is not an integer that fits an {@code int}
     */
    public int intValueExact() {
        if (!isInteger()) {
            throw new ArithmeticException("not an integer: " + this);
        }
        return numerator.intValueExact();
    }

    Number add(Number other) {
        return new Number(numerator.multiply(other.denominator).add(other.numerator.multiply(denominator)),
            denominator.multiply(other.denominator));
    }

    Number multiply(Number other) {
        return new Number(numerator.multiply(other.numerator), denominator.multiply(other.denominator));
    }

    Number negateValue() {
        return new Number(numerator.negate(), denominator);
    }

    Number pow(int exponent) {
        if (exponent >= 0) {
            return new Number(numerator.pow(exponent), denominator.pow(exponent));
        }
        return new Number(denominator.pow(-exponent), numerator.pow(-exponent));
    }

    @Override
    public int compareTo(Number other) {
        return numerator.multiply(other.denominator).compareTo(other.numerator.multiply(denominator));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Number)) {
            return false;
        }
        Number number = (Number) o;
        return numerator.equals(number.numerator) && denominator.equals(number.denominator);
    }

    @Override
    public int hashCode() {
        return 31 * numerator.hashCode() + denominator.hashCode();
    }

    @Override
    public String toString() {
        if (isInteger()) {
            return numerator.toString();
        }
        return numerator + "/" + denominator;
    }
}
