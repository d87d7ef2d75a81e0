package org.qed.algebra;

import com.google.common.base.Verify;
import com.google.common.collect.ImmutableSortedMap;
import kala.collection.immutable.ImmutableSeq;

import java.util.ArrayList;
import java.util.Map;
import java.util.TreeMap;

/**
 * A canonical product: a non-zero numeric coefficient times distinct bases, each raised to a non-zero exponent.
 * A base is never a product; a power is kept as a base only when it is a non-integer power of a product or of
 * another power, which cannot be distributed.
 */
public final class Mul extends Basic {
    private final Numeric coefficient;
    private final ImmutableSortedMap<Basic, Basic> factors;

    private Mul(Numeric coefficient, ImmutableSortedMap<Basic, Basic> factors) {
        Verify.verify(isCanonical(coefficient, factors), "Non-canonical product %s * %s", coefficient, factors);
        this.coefficient = coefficient;
        this.factors = factors;
    }

    static boolean isCanonical(Numeric coefficient, Map<Basic, Basic> factors) {
        if (coefficient.isZero() || factors.isEmpty()) {
            return false;
        }
        if (factors.size() == 1) {
            var entry = factors.entrySet().iterator().next();
            if (coefficient.isOne() || entry.getKey() instanceof Add && isOne(entry.getValue())) {
                return false;
            }
        }
        for (var entry : factors.entrySet()) {
            var base = entry.getKey();
            var exponent = entry.getValue();
            if (exponent instanceof Numeric e && e.isZero() || base instanceof Mul) {
                return false;
            }
            if (base instanceof Numeric b && (b.isOne() || exponent instanceof Int)) {
                return false;
            }
            if (base instanceof Pow pow && (!keptWhole(pow) || exponent instanceof Int && !isOne(exponent))) {
                return false;
            }
        }
        return true;
    }

    /**
     * A non-integer power of a product or of a power cannot be split into its base and exponent, so it is stored as a
     * base of its own.
     */
    private static boolean keptWhole(Pow pow) {
        return pow.getBase() instanceof Mul || pow.getBase() instanceof Pow;
    }

    private static boolean isOne(Basic node) {
        return node == Int.ONE;
    }

    public static Basic of(Basic left, Basic right) {
        return of(ImmutableSeq.of(left, right));
    }

    /**
     * Multiply the operands, flattening nested products, folding numbers into the coefficient and adding up the
     * exponents of equal bases.
     *
     * @param args the operands, in any order
     * @return the canonical product, which is a plain number or a single power when nothing else remains
     */
    public static Basic of(Iterable<? extends Basic> args) {
        var collector = new Collector();
        for (var arg : args) {
            collector.absorb(arg);
        }
        return collector.build();
    }

    private static final class Collector {
        private Numeric coefficient = Int.ONE;
        private final TreeMap<Basic, Basic> factors = new TreeMap<>();

        void absorb(Basic arg) {
            if (arg instanceof Numeric number) {
                coefficient = coefficient.mul(number);
            } else if (arg instanceof Mul mul) {
                coefficient = coefficient.mul(mul.coefficient);
                mul.factors.forEach(this::collect);
            } else if (arg instanceof Pow pow && !keptWhole(pow)) {
                collect(pow.getBase(), pow.getExponent());
            } else {
                collect(arg, Int.ONE);
            }
        }

        private void collect(Basic base, Basic exponent) {
            factors.merge(base, exponent, Add::of);
        }

        Basic build() {
            boolean again;
            do {
                again = false;
                for (var base : new ArrayList<>(factors.keySet())) {
                    var exponent = factors.get(base);
                    if (exponent == null) {
                        continue;
                    }
                    if (exponent instanceof Numeric e && e.isZero()) {
                        factors.remove(base);
                    } else if (base instanceof Numeric number && exponent instanceof Int power) {
                        factors.remove(base);
                        coefficient = coefficient.mul(number.pow(power));
                    } else if (base instanceof Pow pow && exponent instanceof Int power && !power.isOne()) {
                        factors.remove(base);
                        absorb(Pow.of(pow, power));
                        again = true;
                    }
                }
            } while (again);
            if (coefficient.isZero()) {
                return Int.ZERO;
            }
            if (factors.isEmpty()) {
                return coefficient;
            }
            if (factors.size() == 1) {
                var entry = factors.firstEntry();
                if (coefficient.isOne()) {
                    return Pow.of(entry.getKey(), entry.getValue());
                }
                if (entry.getKey() instanceof Add add && isOne(entry.getValue())) {
                    return add.scale(coefficient);
                }
            }
            return new Mul(coefficient, ImmutableSortedMap.copyOfSorted(factors));
        }
    }

    /**
     * The product of the factors alone, as a sum stores it next to its multiplicity.
     */
    Basic withoutCoefficient() {
        if (factors.size() == 1) {
            var entry = factors.firstEntry();
            return Pow.of(entry.getKey(), entry.getValue());
        }
        return coefficient.isOne() ? this : new Mul(Int.ONE, factors);
    }

    /**
     * Raise every factor to an integer power.
     */
    Basic power(Int exponent) {
        var args = new ArrayList<Basic>(factors.size() + 1);
        args.add(coefficient.pow(exponent));
        factors.forEach((base, e) -> args.add(Pow.of(base, of(e, exponent))));
        return of(args);
    }

    public Numeric getCoefficient() {
        return coefficient;
    }

    public ImmutableSortedMap<Basic, Basic> getFactors() {
        return factors;
    }

    private ImmutableSeq<Basic> powers() {
        return ImmutableSeq.from(factors.entrySet()).map(entry -> Pow.of(entry.getKey(), entry.getValue()));
    }

    @Override
    public TypeID getTypeID() {
        return TypeID.MUL;
    }

    @Override
    public ImmutableSeq<Basic> getArgs() {
        return coefficient.isOne() ? powers() : powers().prepended(coefficient);
    }

    /**
     * Product rule over the factors, each factor being the power of a base.
     */
    @Override
    public Basic diff(Symbol x) {
        var powers = powers();
        var terms = new ArrayList<Basic>(powers.size());
        for (int i = 0; i < powers.size(); i++) {
            var derivative = powers.get(i).diff(x);
            if (derivative == Int.ZERO) {
                continue;
            }
            var product = new ArrayList<Basic>(powers.size() + 1);
            product.add(coefficient);
            product.add(derivative);
            for (int j = 0; j < powers.size(); j++) {
                if (j != i) {
                    product.add(powers.get(j));
                }
            }
            terms.add(of(product));
        }
        return Add.of(terms);
    }

    @Override
    protected Basic subsArgs(Map<Basic, Basic> mapping) {
        var changed = false;
        var args = new ArrayList<Basic>(factors.size() + 1);
        args.add(coefficient);
        for (var factor : powers()) {
            var replaced = factor.subs(mapping);
            changed |= replaced != factor;
            args.add(replaced);
        }
        return changed ? of(args) : this;
    }

    @Override
    protected int computeHash() {
        return hashOf(TypeID.MUL, coefficient, factors);
    }

    @Override
    protected boolean equalsSameKind(Basic other) {
        var mul = sameKind(other, Mul.class);
        return coefficient.equals(mul.coefficient) && factors.equals(mul.factors);
    }

    @Override
    protected int compareSameKind(Basic other) {
        var mul = sameKind(other, Mul.class);
        var cmp = coefficient.compareTo(mul.coefficient);
        return cmp != 0 ? cmp : compareEntries(factors, mul.factors);
    }

    @Override
    public String toString() {
        var sb = new StringBuilder();
        if (coefficient.isMinusOne()) {
            sb.append('-');
        } else if (!coefficient.isOne()) {
            sb.append(coefficient).append('*');
        }
        var first = true;
        for (var entry : factors.entrySet()) {
            if (!first) {
                sb.append('*');
            }
            first = false;
            var base = entry.getKey();
            if (isOne(entry.getValue())) {
                sb.append(base instanceof Add ? "(" + base + ")" : base.toString());
            } else {
                sb.append(Pow.render(base, entry.getValue()));
            }
        }
        return sb.toString();
    }
}
