package org.qed.algebra;

import kala.collection.immutable.ImmutableSeq;

import java.math.BigInteger;
import java.util.Map;

/**
 * An exact number leaf. Every arithmetic result goes through {@link Int#of} or {@link Rational#of}, so a rational
 * with denominator one never exists and the shared singletons are reused for zero and plus or minus one.
 */
public abstract sealed class Numeric extends Basic permits Int, Rational {

    public abstract BigInteger getNumerator();

    public abstract BigInteger getDenominator();

    public int signum() {
        return getNumerator().signum();
    }

    public boolean isZero() {
        return this == Int.ZERO;
    }

    public boolean isOne() {
        return this == Int.ONE;
    }

    public boolean isMinusOne() {
        return this == Int.MINUS_ONE;
    }

    public boolean isPositive() {
        return signum() > 0;
    }

    public boolean isNegative() {
        return signum() < 0;
    }

    public Numeric add(Numeric other) {
        if (isZero()) {
            return other;
        }
        if (other.isZero()) {
            return this;
        }
        return Rational.of(
                getNumerator().multiply(other.getDenominator()).add(other.getNumerator().multiply(getDenominator())),
                getDenominator().multiply(other.getDenominator()));
    }

    public Numeric sub(Numeric other) {
        return add(other.neg());
    }

    public Numeric mul(Numeric other) {
        if (isOne()) {
            return other;
        }
        if (other.isOne()) {
            return this;
        }
        return Rational.of(getNumerator().multiply(other.getNumerator()),
                getDenominator().multiply(other.getDenominator()));
    }

    public Numeric div(Numeric other) {
        if (other.isZero()) {
            throw new SymbolicException(String.format("Division of %s by zero", this));
        }
        return Rational.of(getNumerator().multiply(other.getDenominator()),
                getDenominator().multiply(other.getNumerator()));
    }

    public Numeric neg() {
        return Rational.of(getNumerator().negate(), getDenominator());
    }

    public Numeric abs() {
        return isNegative() ? neg() : this;
    }

    /**
     * Raise to an integer power. Zero raised to a non-positive power is rejected.
     */
    public Numeric pow(Int exponent) {
        int n;
        try {
            n = exponent.getValue().intValueExact();
        } catch (ArithmeticException e) {
            throw new SymbolicException(String.format("Exponent %s is out of range", exponent));
        }
        // no positive counterpart
        if (n == Integer.MIN_VALUE) {
            throw new SymbolicException(String.format("Exponent %s is out of range", exponent));
        }
        if (isZero()) {
            if (n <= 0) {
                throw new SymbolicException(String.format("0**%d is undefined", n));
            }
            return Int.ZERO;
        }
        var num = getNumerator().pow(Math.abs(n));
        var den = getDenominator().pow(Math.abs(n));
        return n >= 0 ? Rational.of(num, den) : Rational.of(den, num);
    }

    @Override
    public ImmutableSeq<Basic> getArgs() {
        return ImmutableSeq.empty();
    }

    @Override
    public Basic diff(Symbol x) {
        return Int.ZERO;
    }

    @Override
    protected Basic subsArgs(Map<Basic, Basic> mapping) {
        return this;
    }
}
