package org.qed.algebra;

import com.google.common.base.Verify;
import kala.collection.Seq;
import kala.collection.immutable.ImmutableSeq;

import java.util.Map;

/**
 * An unevaluated derivative of an expression with respect to a sequence of symbols, one entry per differentiation.
 * The sequence is kept as given: order and repetitions are significant for equality, so D[x, y] and D[y, x] are
 * distinct nodes.
 */
public final class Derivative extends Basic {
    private final Basic arg;
    private final ImmutableSeq<Symbol> symbols;

    private Derivative(Basic arg, ImmutableSeq<Symbol> symbols) {
        Verify.verify(!symbols.isEmpty(), "Derivative of %s without symbols", arg);
        this.arg = arg;
        this.symbols = symbols;
    }

    // TODO: sort the symbol sequence so that mixed partials in different order compare equal
    public static Derivative of(Basic arg, Seq<Symbol> symbols) {
        if (symbols.isEmpty()) {
            throw new SymbolicException(String.format("No differentiation symbol given for %s", arg));
        }
        return new Derivative(arg, symbols.toImmutableSeq());
    }

    public Basic getArg() {
        return arg;
    }

    public ImmutableSeq<Symbol> getSymbols() {
        return symbols;
    }

    @Override
    public TypeID getTypeID() {
        return TypeID.DERIVATIVE;
    }

    @Override
    public ImmutableSeq<Basic> getArgs() {
        return symbols.<Basic>map(s -> s).prepended(arg);
    }

    @Override
    public Basic diff(Symbol x) {
        return new Derivative(arg, symbols.appended(x));
    }

    /**
     * The differentiation symbols are renamed along with the target when they are mapped to other symbols.
     *
     * @throws SymbolicException when a differentiation symbol is mapped to something else than a symbol
     */
    @Override
    protected Basic subsArgs(Map<Basic, Basic> mapping) {
        var renamed = symbols.map(symbol -> {
            var replacement = mapping.get(symbol);
            if (replacement == null) {
                return symbol;
            }
            if (replacement instanceof Symbol other) {
                return other;
            }
            throw new SymbolicException(
                    String.format("Cannot replace differentiation symbol %s by %s in %s", symbol, replacement, this));
        });
        var newArg = arg.subs(mapping);
        if (newArg == arg && renamed.sameElements(symbols)) {
            return this;
        }
        return of(newArg, renamed);
    }

    @Override
    protected int computeHash() {
        return hashOfAll(TypeID.DERIVATIVE, symbols.<Basic>map(s -> s).prepended(arg));
    }

    @Override
    protected boolean equalsSameKind(Basic other) {
        var derivative = sameKind(other, Derivative.class);
        return arg.equals(derivative.arg) && symbols.sameElements(derivative.symbols);
    }

    @Override
    protected int compareSameKind(Basic other) {
        var derivative = sameKind(other, Derivative.class);
        var cmp = arg.compareTo(derivative.arg);
        if (cmp != 0) {
            return cmp;
        }
        var common = Math.min(symbols.size(), derivative.symbols.size());
        for (int i = 0; i < common; i++) {
            cmp = symbols.get(i).compareTo(derivative.symbols.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return sign(Integer.compare(symbols.size(), derivative.symbols.size()));
    }

    @Override
    public String toString() {
        return "D" + symbols.joinToString(", ", "[", "]") + "(" + arg + ")";
    }
}
