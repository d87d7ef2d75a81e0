package org.qed.algebra;

import com.google.common.base.Verify;

public final class Sin extends TrigFunction {
    private Sin(Basic arg) {
        super(arg);
        Verify.verify(isCanonical(arg), "Non-canonical sin(%s)", arg);
    }

    // TODO: fold sin(k*pi) once pi exists as a constant
    static boolean isCanonical(Basic arg) {
        return arg != Int.ZERO;
    }

    public static Basic of(Basic arg) {
        if (arg == Int.ZERO) {
            return Int.ZERO;
        }
        return new Sin(arg);
    }

    @Override
    public String getName() {
        return "sin";
    }

    @Override
    protected Basic rebuild(Basic newArg) {
        return of(newArg);
    }

    @Override
    public TypeID getTypeID() {
        return TypeID.SIN;
    }

    @Override
    public Basic diff(Symbol x) {
        return Mul.of(Cos.of(arg), arg.diff(x));
    }
}
