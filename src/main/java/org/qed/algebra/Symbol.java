package org.qed.algebra;

import com.google.common.base.Verify;
import kala.collection.immutable.ImmutableSeq;

import java.util.Map;

public final class Symbol extends Basic {
    private final String name;

    private Symbol(String name) {
        Verify.verify(!name.isEmpty(), "Symbol without a name");
        this.name = name;
    }

    public static Symbol of(String name) {
        if (name.isEmpty()) {
            throw new SymbolicException("A symbol needs a non-empty name");
        }
        return new Symbol(name);
    }

    public String getName() {
        return name;
    }

    @Override
    public TypeID getTypeID() {
        return TypeID.SYMBOL;
    }

    @Override
    public ImmutableSeq<Basic> getArgs() {
        return ImmutableSeq.empty();
    }

    @Override
    public Basic diff(Symbol x) {
        return equals(x) ? Int.ONE : Int.ZERO;
    }

    @Override
    protected Basic subsArgs(Map<Basic, Basic> mapping) {
        return this;
    }

    @Override
    protected int computeHash() {
        return hashOf(TypeID.SYMBOL, name);
    }

    @Override
    protected boolean equalsSameKind(Basic other) {
        return name.equals(sameKind(other, Symbol.class).name);
    }

    @Override
    protected int compareSameKind(Basic other) {
        return sign(name.compareTo(sameKind(other, Symbol.class).name));
    }

    @Override
    public String toString() {
        return name;
    }
}
