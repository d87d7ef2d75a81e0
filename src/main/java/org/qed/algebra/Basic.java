package org.qed.algebra;

import com.google.common.base.Verify;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.hash.HashCode;
import com.google.common.hash.Hashing;
import kala.collection.immutable.ImmutableSeq;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Map;

/**
 * The contract shared by every expression node: structural hashing, structural equality, a total order, symbolic
 * differentiation, substitution and a canonical string form.
 * <p>
 * Nodes are immutable and only obtained through the static factories of their classes, which canonicalize their
 * operands before a node is allocated. The constructors verify the canonical form as a contract check.
 */
public abstract sealed class Basic implements Comparable<Basic>
        permits Numeric, Symbol, Add, Mul, Pow, TrigFunction, FunctionSymbol, Derivative {

    // 0 means not computed yet, as for String
    private int hash;

    public abstract TypeID getTypeID();

    /**
     * The operands of this node, such that passing them back to the factory of the same kind rebuilds an equal node.
     */
    public abstract ImmutableSeq<Basic> getArgs();

    /**
     * Differentiate with respect to a single symbol.
     *
     * @param x the symbol to differentiate with respect to
     * @return the canonical derivative, {@link Int#ZERO} when this node does not depend on x
     */
    public abstract Basic diff(Symbol x);

    protected abstract int computeHash();

    /**
     * Structural equality against a node already known to have the same type id.
     */
    protected abstract boolean equalsSameKind(Basic other);

    /**
     * Order against a node of the same type id, returning -1, 0 or 1.
     */
    protected abstract int compareSameKind(Basic other);

    /**
     * Substitute inside the operands of this node, after the node itself did not match.
     *
     * @return this very instance when no operand changed
     */
    protected abstract Basic subsArgs(Map<Basic, Basic> mapping);

    /**
     * Replace every subtree that is a key of the mapping by its value. A matching node is replaced as a whole without
     * looking into its operands; an unchanged tree is returned by identity.
     *
     * @param mapping the replacements, keys compared by structural equality
     * @return the rewritten expression, rebuilt through the canonicalizing factories
     */
    public final Basic subs(Map<Basic, Basic> mapping) {
        var replacement = mapping.get(this);
        if (replacement != null) {
            return replacement;
        }
        return subsArgs(mapping);
    }

    public boolean has(Basic sub) {
        return equals(sub) || getArgs().anyMatch(arg -> arg.has(sub));
    }

    public ImmutableSortedSet<Symbol> freeSymbols() {
        var builder = ImmutableSortedSet.<Symbol>naturalOrder();
        collectSymbols(this, builder);
        return builder.build();
    }

    private static void collectSymbols(Basic node, ImmutableSortedSet.Builder<Symbol> builder) {
        if (node instanceof Symbol symbol) {
            builder.add(symbol);
        }
        for (var arg : node.getArgs()) {
            collectSymbols(arg, builder);
        }
    }

    @Override
    public final int hashCode() {
        var h = hash;
        if (h == 0) {
            h = computeHash();
            hash = h;
        }
        return h;
    }

    @Override
    public final boolean equals(@Nullable Object obj) {
        if (this == obj) {
            return true;
        }
        return obj instanceof Basic other && getTypeID() == other.getTypeID() && hashCode() == other.hashCode() &&
                equalsSameKind(other);
    }

    @Override
    public final int compareTo(Basic other) {
        if (this == other) {
            return 0;
        }
        var kind = getTypeID().compareTo(other.getTypeID());
        if (kind != 0) {
            return kind < 0 ? -1 : 1;
        }
        return compareSameKind(other);
    }

    /**
     * Cast a node handed to {@link #compareSameKind} or {@link #equalsSameKind}, failing hard on a foreign kind.
     */
    protected static <T extends Basic> T sameKind(Basic other, Class<T> kind) {
        Verify.verify(kind.isInstance(other), "Comparing %s with a %s", kind.getSimpleName(), other.getTypeID());
        return kind.cast(other);
    }

    protected static int sign(int cmp) {
        return Integer.signum(cmp);
    }

    /**
     * Order two sorted maps by size, then entry by entry on keys and values.
     */
    protected static int compareEntries(Map<Basic, ? extends Basic> left, Map<Basic, ? extends Basic> right) {
        var cmp = sign(Integer.compare(left.size(), right.size()));
        if (cmp != 0) {
            return cmp;
        }
        var others = right.entrySet().iterator();
        for (var entry : left.entrySet()) {
            var other = others.next();
            cmp = entry.getKey().compareTo(other.getKey());
            if (cmp == 0) {
                cmp = entry.getValue().compareTo(other.getValue());
            }
            if (cmp != 0) {
                return cmp;
            }
        }
        return 0;
    }

    /**
     * Combine the kind with the given parts in order. Commutative nodes pass their operands in canonical order, so an
     * ordered combination is enough for them as well.
     */
    protected static int hashOf(TypeID kind, Object... parts) {
        return hashOfAll(kind, Arrays.asList(parts));
    }

    protected static int hashOfAll(TypeID kind, Iterable<?> parts) {
        var codes = new ArrayList<HashCode>();
        codes.add(HashCode.fromInt(kind.ordinal() + 1));
        for (var part : parts) {
            codes.add(HashCode.fromInt(part.hashCode()));
        }
        return Hashing.combineOrdered(codes).asInt();
    }
}
