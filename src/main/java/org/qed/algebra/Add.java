package org.qed.algebra;

import com.google.common.base.Verify;
import com.google.common.collect.ImmutableSortedMap;
import kala.collection.immutable.ImmutableSeq;

import java.util.ArrayList;
import java.util.Map;
import java.util.TreeMap;

/**
 * A canonical sum: a numeric coefficient plus distinct non-numeric terms, each with a non-zero numeric multiplicity.
 * A term is never a sum itself, and never a product carrying a coefficient other than one.
 */
public final class Add extends Basic {
    private final Numeric coefficient;
    private final ImmutableSortedMap<Basic, Numeric> terms;

    private Add(Numeric coefficient, ImmutableSortedMap<Basic, Numeric> terms) {
        Verify.verify(isCanonical(coefficient, terms), "Non-canonical sum %s + %s", coefficient, terms);
        this.coefficient = coefficient;
        this.terms = terms;
    }

    static boolean isCanonical(Numeric coefficient, Map<Basic, Numeric> terms) {
        if (terms.isEmpty() || terms.size() == 1 && coefficient.isZero()) {
            return false;
        }
        for (var entry : terms.entrySet()) {
            var term = entry.getKey();
            if (entry.getValue().isZero() || term instanceof Numeric || term instanceof Add) {
                return false;
            }
            if (term instanceof Mul mul && !mul.getCoefficient().isOne()) {
                return false;
            }
        }
        return true;
    }

    public static Basic of(Basic left, Basic right) {
        return of(ImmutableSeq.of(left, right));
    }

    /**
     * Sum the operands, flattening nested sums, folding numbers into the coefficient and collecting equal terms.
     *
     * @param args the operands, in any order
     * @return the canonical sum, which is a plain number or a single term when nothing else remains
     */
    public static Basic of(Iterable<? extends Basic> args) {
        Numeric coefficient = Int.ZERO;
        var terms = new TreeMap<Basic, Numeric>();
        for (var arg : args) {
            if (arg instanceof Numeric number) {
                coefficient = coefficient.add(number);
            } else if (arg instanceof Add add) {
                coefficient = coefficient.add(add.coefficient);
                add.terms.forEach((term, multiplicity) -> collect(terms, term, multiplicity));
            } else if (arg instanceof Mul mul && !mul.getCoefficient().isOne()) {
                collect(terms, mul.withoutCoefficient(), mul.getCoefficient());
            } else {
                collect(terms, arg, Int.ONE);
            }
        }
        return fromTerms(coefficient, terms);
    }

    private static void collect(TreeMap<Basic, Numeric> terms, Basic term, Numeric multiplicity) {
        terms.merge(term, multiplicity, Numeric::add);
    }

    private static Basic fromTerms(Numeric coefficient, TreeMap<Basic, Numeric> terms) {
        terms.values().removeIf(Numeric::isZero);
        if (terms.isEmpty()) {
            return coefficient;
        }
        if (terms.size() == 1 && coefficient.isZero()) {
            var entry = terms.firstEntry();
            return Mul.of(entry.getValue(), entry.getKey());
        }
        return new Add(coefficient, ImmutableSortedMap.copyOfSorted(terms));
    }

    /**
     * Multiply every term and the coefficient by a non-zero number.
     */
    Basic scale(Numeric factor) {
        var scaled = new TreeMap<Basic, Numeric>();
        terms.forEach((term, multiplicity) -> scaled.put(term, multiplicity.mul(factor)));
        return fromTerms(coefficient.mul(factor), scaled);
    }

    public Numeric getCoefficient() {
        return coefficient;
    }

    public ImmutableSortedMap<Basic, Numeric> getTerms() {
        return terms;
    }

    @Override
    public TypeID getTypeID() {
        return TypeID.ADD;
    }

    @Override
    public ImmutableSeq<Basic> getArgs() {
        var args = ImmutableSeq.<Basic>empty();
        if (!coefficient.isZero()) {
            args = args.appended(coefficient);
        }
        for (var entry : terms.entrySet()) {
            args = args.appended(Mul.of(entry.getValue(), entry.getKey()));
        }
        return args;
    }

    @Override
    public Basic diff(Symbol x) {
        var derivatives = new ArrayList<Basic>(terms.size());
        terms.forEach((term, multiplicity) -> derivatives.add(Mul.of(multiplicity, term.diff(x))));
        return of(derivatives);
    }

    @Override
    protected Basic subsArgs(Map<Basic, Basic> mapping) {
        var changed = false;
        var args = new ArrayList<Basic>(terms.size() + 1);
        args.add(coefficient);
        for (var entry : terms.entrySet()) {
            var term = Mul.of(entry.getValue(), entry.getKey());
            var replaced = term.subs(mapping);
            changed |= replaced != term;
            args.add(replaced);
        }
        return changed ? of(args) : this;
    }

    @Override
    protected int computeHash() {
        return hashOf(TypeID.ADD, coefficient, terms);
    }

    @Override
    protected boolean equalsSameKind(Basic other) {
        var add = sameKind(other, Add.class);
        return coefficient.equals(add.coefficient) && terms.equals(add.terms);
    }

    @Override
    protected int compareSameKind(Basic other) {
        var add = sameKind(other, Add.class);
        var cmp = coefficient.compareTo(add.coefficient);
        return cmp != 0 ? cmp : compareEntries(terms, add.terms);
    }

    @Override
    public String toString() {
        var parts = new ArrayList<String>(terms.size() + 1);
        if (!coefficient.isZero()) {
            parts.add(coefficient.toString());
        }
        terms.forEach((term, multiplicity) -> parts.add(Mul.of(multiplicity, term).toString()));
        var sb = new StringBuilder(parts.get(0));
        for (var part : parts.subList(1, parts.size())) {
            if (part.startsWith("-")) {
                sb.append(" - ").append(part, 1, part.length());
            } else {
                sb.append(" + ").append(part);
            }
        }
        return sb.toString();
    }
}
