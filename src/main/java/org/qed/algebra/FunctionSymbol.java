package org.qed.algebra;

import kala.collection.immutable.ImmutableSeq;

import java.util.Map;

/**
 * An application of an unknown function to one argument, kept unevaluated.
 */
public final class FunctionSymbol extends Basic {
    private final String name;
    private final Basic arg;

    private FunctionSymbol(String name, Basic arg) {
        this.name = name;
        this.arg = arg;
    }

    public static FunctionSymbol of(String name, Basic arg) {
        if (name.isEmpty()) {
            throw new SymbolicException("A function needs a non-empty name");
        }
        return new FunctionSymbol(name, arg);
    }

    public String getName() {
        return name;
    }

    public Basic getArg() {
        return arg;
    }

    @Override
    public TypeID getTypeID() {
        return TypeID.FUNCTION_SYMBOL;
    }

    @Override
    public ImmutableSeq<Basic> getArgs() {
        return ImmutableSeq.of(arg);
    }

    /**
     * No closed form is known, so the result is a formal derivative unless the argument does not depend on x.
     */
    @Override
    public Basic diff(Symbol x) {
        if (arg.diff(x) == Int.ZERO) {
            return Int.ZERO;
        }
        return Derivative.of(this, ImmutableSeq.of(x));
    }

    @Override
    protected Basic subsArgs(Map<Basic, Basic> mapping) {
        var newArg = arg.subs(mapping);
        return newArg == arg ? this : of(name, newArg);
    }

    @Override
    protected int computeHash() {
        return hashOf(TypeID.FUNCTION_SYMBOL, arg, name);
    }

    @Override
    protected boolean equalsSameKind(Basic other) {
        var function = sameKind(other, FunctionSymbol.class);
        return name.equals(function.name) && arg.equals(function.arg);
    }

    @Override
    protected int compareSameKind(Basic other) {
        var function = sameKind(other, FunctionSymbol.class);
        if (name.equals(function.name)) {
            return arg.compareTo(function.arg);
        }
        return sign(name.compareTo(function.name));
    }

    @Override
    public String toString() {
        return name + "(" + arg + ")";
    }
}
