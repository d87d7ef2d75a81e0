package org.qed.algebra;

import kala.collection.immutable.ImmutableSeq;

import java.util.Map;

/**
 * A trigonometric function of one argument.
 */
public abstract sealed class TrigFunction extends Basic permits Sin, Cos {
    protected final Basic arg;

    protected TrigFunction(Basic arg) {
        this.arg = arg;
    }

    public Basic getArg() {
        return arg;
    }

    public abstract String getName();

    /**
     * The same function applied to another argument, through the canonicalizing factory.
     */
    protected abstract Basic rebuild(Basic newArg);

    @Override
    public ImmutableSeq<Basic> getArgs() {
        return ImmutableSeq.of(arg);
    }

    @Override
    protected Basic subsArgs(Map<Basic, Basic> mapping) {
        var newArg = arg.subs(mapping);
        return newArg == arg ? this : rebuild(newArg);
    }

    @Override
    protected int computeHash() {
        return hashOf(getTypeID(), arg);
    }

    @Override
    protected boolean equalsSameKind(Basic other) {
        return arg.equals(sameKind(other, getClass()).arg);
    }

    @Override
    protected int compareSameKind(Basic other) {
        return arg.compareTo(sameKind(other, getClass()).arg);
    }

    @Override
    public String toString() {
        return getName() + "(" + arg + ")";
    }
}
