package org.qed.algebra;

import com.google.common.base.Verify;
import kala.collection.immutable.ImmutableSeq;

import java.util.Map;

/**
 * A canonical power. Trivial exponents and bases are folded away by {@link #of}, numbers raised to integers are
 * evaluated, and integer powers of products and powers are distributed.
 */
public final class Pow extends Basic {
    private final Basic base;
    private final Basic exponent;

    private Pow(Basic base, Basic exponent) {
        Verify.verify(isCanonical(base, exponent), "Non-canonical power %s ** %s", base, exponent);
        this.base = base;
        this.exponent = exponent;
    }

    static boolean isCanonical(Basic base, Basic exponent) {
        if (exponent instanceof Numeric e && (e.isZero() || e.isOne())) {
            return false;
        }
        if (base instanceof Numeric b) {
            if (b.isOne() || exponent instanceof Int || b.isZero() && exponent instanceof Numeric) {
                return false;
            }
        }
        return !(exponent instanceof Int && (base instanceof Mul || base instanceof Pow));
    }

    /**
     * Raise base to exponent.
     *
     * @throws SymbolicException when base is zero and exponent a non-positive number
     */
    public static Basic of(Basic base, Basic exponent) {
        if (exponent instanceof Numeric e) {
            if (base instanceof Numeric b && b.isZero()) {
                if (e.isPositive()) {
                    return Int.ZERO;
                }
                throw new SymbolicException(String.format("0**%s is undefined", e));
            }
            if (e.isZero()) {
                return Int.ONE;
            }
            if (e.isOne()) {
                return base;
            }
        }
        if (base instanceof Numeric b) {
            if (b.isOne()) {
                return Int.ONE;
            }
            if (exponent instanceof Int power) {
                return b.pow(power);
            }
        }
        if (exponent instanceof Int power) {
            if (base instanceof Mul mul) {
                return mul.power(power);
            }
            if (base instanceof Pow pow) {
                return of(pow.base, Mul.of(pow.exponent, power));
            }
        }
        return new Pow(base, exponent);
    }

    public Basic getBase() {
        return base;
    }

    public Basic getExponent() {
        return exponent;
    }

    @Override
    public TypeID getTypeID() {
        return TypeID.POW;
    }

    @Override
    public ImmutableSeq<Basic> getArgs() {
        return ImmutableSeq.of(base, exponent);
    }

    /**
     * Power rule when the exponent does not depend on x. A variable exponent would need a logarithm, so the result is
     * then left as a formal derivative.
     */
    @Override
    public Basic diff(Symbol x) {
        if (exponent.diff(x) == Int.ZERO) {
            return Mul.of(ImmutableSeq.of(exponent, of(base, Add.of(exponent, Int.MINUS_ONE)), base.diff(x)));
        }
        return Derivative.of(this, ImmutableSeq.of(x));
    }

    @Override
    protected Basic subsArgs(Map<Basic, Basic> mapping) {
        var newBase = base.subs(mapping);
        var newExponent = exponent.subs(mapping);
        if (newBase == base && newExponent == exponent) {
            return this;
        }
        return of(newBase, newExponent);
    }

    @Override
    protected int computeHash() {
        return hashOf(TypeID.POW, base, exponent);
    }

    @Override
    protected boolean equalsSameKind(Basic other) {
        var pow = sameKind(other, Pow.class);
        return base.equals(pow.base) && exponent.equals(pow.exponent);
    }

    @Override
    protected int compareSameKind(Basic other) {
        var pow = sameKind(other, Pow.class);
        var cmp = base.compareTo(pow.base);
        return cmp != 0 ? cmp : exponent.compareTo(pow.exponent);
    }

    static String render(Basic base, Basic exponent) {
        return parenthesized(base) + "**" + parenthesized(exponent);
    }

    private static String parenthesized(Basic node) {
        var compound = node instanceof Add || node instanceof Mul || node instanceof Pow || node instanceof Rational ||
                node instanceof Numeric n && n.isNegative();
        return compound ? "(" + node + ")" : node.toString();
    }

    @Override
    public String toString() {
        return render(base, exponent);
    }
}
