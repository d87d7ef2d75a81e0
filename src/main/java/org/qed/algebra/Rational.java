package org.qed.algebra;

import com.google.common.base.Verify;
import kala.control.Result;

import java.math.BigInteger;

/**
 * A fraction in lowest terms with a denominator greater than one; the sign lives on the numerator.
 */
public final class Rational extends Numeric {
    private final BigInteger numerator;
    private final BigInteger denominator;

    private Rational(BigInteger numerator, BigInteger denominator) {
        Verify.verify(isCanonical(numerator, denominator), "Non-canonical rational %s/%s", numerator, denominator);
        this.numerator = numerator;
        this.denominator = denominator;
    }

    static boolean isCanonical(BigInteger numerator, BigInteger denominator) {
        return denominator.compareTo(BigInteger.ONE) > 0 && numerator.gcd(denominator).equals(BigInteger.ONE);
    }

    /**
     * Reduce the fraction, yielding an {@link Int} when the reduced denominator is one.
     *
     * @throws SymbolicException if the denominator is zero
     */
    public static Numeric of(BigInteger numerator, BigInteger denominator) {
        if (denominator.signum() == 0) {
            throw new SymbolicException(String.format("Rational %s/0 has a zero denominator", numerator));
        }
        var gcd = numerator.gcd(denominator);
        var num = numerator.divide(gcd);
        var den = denominator.divide(gcd);
        if (den.signum() < 0) {
            num = num.negate();
            den = den.negate();
        }
        if (den.equals(BigInteger.ONE)) {
            return Int.of(num);
        }
        return new Rational(num, den);
    }

    public static Numeric of(long numerator, long denominator) {
        return of(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
    }

    /**
     * Build a fraction from two expressions, which must both be integers.
     *
     * @return the reduced number, or the reason why the operands do not form one
     */
    public static Result<Numeric, String> from(Basic numerator, Basic denominator) {
        if (!(numerator instanceof Int num) || !(denominator instanceof Int den)) {
            return Result.err(String.format("Cannot form a rational from %s and %s", numerator, denominator));
        }
        if (den.isZero()) {
            return Result.err(String.format("Rational %s/0 has a zero denominator", num));
        }
        return Result.ok(of(num.getValue(), den.getValue()));
    }

    @Override
    public BigInteger getNumerator() {
        return numerator;
    }

    @Override
    public BigInteger getDenominator() {
        return denominator;
    }

    @Override
    public TypeID getTypeID() {
        return TypeID.RATIONAL;
    }

    @Override
    protected int computeHash() {
        return hashOf(TypeID.RATIONAL, numerator, denominator);
    }

    @Override
    protected boolean equalsSameKind(Basic other) {
        var r = sameKind(other, Rational.class);
        return numerator.equals(r.numerator) && denominator.equals(r.denominator);
    }

    @Override
    protected int compareSameKind(Basic other) {
        var r = sameKind(other, Rational.class);
        return sign(numerator.multiply(r.denominator).compareTo(r.numerator.multiply(denominator)));
    }

    @Override
    public String toString() {
        return numerator + "/" + denominator;
    }
}
