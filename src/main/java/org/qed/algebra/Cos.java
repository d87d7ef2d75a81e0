package org.qed.algebra;

import com.google.common.base.Verify;
import kala.collection.immutable.ImmutableSeq;

public final class Cos extends TrigFunction {
    private Cos(Basic arg) {
        super(arg);
        Verify.verify(isCanonical(arg), "Non-canonical cos(%s)", arg);
    }

    static boolean isCanonical(Basic arg) {
        return arg != Int.ZERO;
    }

    public static Basic of(Basic arg) {
        if (arg == Int.ZERO) {
            return Int.ONE;
        }
        return new Cos(arg);
    }

    @Override
    public String getName() {
        return "cos";
    }

    @Override
    protected Basic rebuild(Basic newArg) {
        return of(newArg);
    }

    @Override
    public TypeID getTypeID() {
        return TypeID.COS;
    }

    @Override
    public Basic diff(Symbol x) {
        return Mul.of(ImmutableSeq.of(Int.MINUS_ONE, Sin.of(arg), arg.diff(x)));
    }
}
