package org.qed.algebra;

import kala.control.Result;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/**
 * Static entry points for building and transforming expressions. Every result is canonical.
 */
public final class Expr {
    private Expr() {
    }

    public static Symbol symbol(String name) {
        return Symbol.of(name);
    }

    public static Int integer(long value) {
        return Int.of(value);
    }

    public static Int integer(BigInteger value) {
        return Int.of(value);
    }

    public static Numeric rational(long numerator, long denominator) {
        return Rational.of(numerator, denominator);
    }

    public static Result<Numeric, String> rational(Basic numerator, Basic denominator) {
        return Rational.from(numerator, denominator);
    }

    public static Basic add(Basic... args) {
        return Add.of(List.of(args));
    }

    public static Basic sub(Basic left, Basic right) {
        return Add.of(left, neg(right));
    }

    public static Basic mul(Basic... args) {
        return Mul.of(List.of(args));
    }

    /**
     * @throws SymbolicException when the divisor is zero
     */
    public static Basic div(Basic left, Basic right) {
        return Mul.of(left, Pow.of(right, Int.MINUS_ONE));
    }

    public static Basic pow(Basic base, Basic exponent) {
        return Pow.of(base, exponent);
    }

    public static Basic neg(Basic arg) {
        return Mul.of(Int.MINUS_ONE, arg);
    }

    /**
     * Absolute value, which only numbers have in closed form.
     */
    public static Result<Basic, String> abs(Basic arg) {
        if (arg instanceof Numeric number) {
            return Result.ok(number.abs());
        }
        return Result.err(String.format("No absolute value for %s", arg));
    }

    public static Basic sin(Basic arg) {
        return Sin.of(arg);
    }

    public static Basic cos(Basic arg) {
        return Cos.of(arg);
    }

    public static FunctionSymbol function(String name, Basic arg) {
        return FunctionSymbol.of(name, arg);
    }

    /**
     * Differentiate with respect to an expression that has to be a symbol.
     */
    public static Result<Basic, String> diff(Basic expr, Basic symbol) {
        if (symbol instanceof Symbol x) {
            return Result.ok(expr.diff(x));
        }
        return Result.err(String.format("Cannot differentiate with respect to %s, which is not a symbol", symbol));
    }

    public static Basic expand(Basic expr) {
        return Expander.expand(expr);
    }

    public static Basic subs(Basic expr, Map<Basic, Basic> mapping) {
        return expr.subs(mapping);
    }
}
