package org.qed.algebra;

import java.math.BigInteger;

import static java.util.Objects.requireNonNull;

/**
 * An arbitrary precision integer.
 */
public final class Int extends Numeric {
    public static final Int ZERO = new Int(BigInteger.ZERO);
    public static final Int ONE = new Int(BigInteger.ONE);
    public static final Int MINUS_ONE = new Int(BigInteger.ONE.negate());

    private final BigInteger value;

    private Int(BigInteger value) {
        this.value = value;
    }

    public static Int of(BigInteger value) {
        requireNonNull(value);
        if (value.signum() == 0) {
            return ZERO;
        }
        if (value.equals(BigInteger.ONE)) {
            return ONE;
        }
        if (value.equals(MINUS_ONE.value)) {
            return MINUS_ONE;
        }
        return new Int(value);
    }

    public static Int of(long value) {
        return of(BigInteger.valueOf(value));
    }

    /**
     * Parse a base-10 integer.
     *
     * @throws NumberFormatException if the text is not an integer
     */
    public static Int parse(String text) {
        return of(new BigInteger(text.trim(), 10));
    }

    public BigInteger getValue() {
        return value;
    }

    @Override
    public BigInteger getNumerator() {
        return value;
    }

    @Override
    public BigInteger getDenominator() {
        return BigInteger.ONE;
    }

    @Override
    public Numeric add(Numeric other) {
        if (other instanceof Int i) {
            return of(value.add(i.value));
        }
        return super.add(other);
    }

    @Override
    public Numeric mul(Numeric other) {
        if (other instanceof Int i) {
            return of(value.multiply(i.value));
        }
        return super.mul(other);
    }

    @Override
    public Numeric neg() {
        return of(value.negate());
    }

    @Override
    public TypeID getTypeID() {
        return TypeID.INTEGER;
    }

    @Override
    protected int computeHash() {
        return hashOf(TypeID.INTEGER, value);
    }

    @Override
    protected boolean equalsSameKind(Basic other) {
        return value.equals(sameKind(other, Int.class).value);
    }

    @Override
    protected int compareSameKind(Basic other) {
        return sign(value.compareTo(sameKind(other, Int.class).value));
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
